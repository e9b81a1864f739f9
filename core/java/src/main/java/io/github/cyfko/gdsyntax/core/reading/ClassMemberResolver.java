package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassMember;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassNameAttribute;
import io.github.cyfko.gdsyntax.core.syntax.declarations.CustomAttribute;
import io.github.cyfko.gdsyntax.core.syntax.declarations.EnumDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ExtendsAttribute;
import io.github.cyfko.gdsyntax.core.syntax.declarations.InnerClassDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.MethodDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.SignalDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ToolAttribute;
import io.github.cyfko.gdsyntax.core.syntax.declarations.VariableDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;

import java.util.Objects;
import java.util.Optional;

/**
 * Selects the class member starting at the current position from its leading words.
 *
 * <h2>Resolution</h2>
 * <ul>
 *   <li>{@code @} starts a {@link CustomAttribute}</li>
 *   <li>{@code static} is followed by {@code func} or {@code var}/{@code const}</li>
 *   <li>{@code var}, {@code const}, {@code func}, {@code signal}, {@code enum}, {@code class},
 *       {@code class_name}, {@code extends} and {@code tool} select their member</li>
 *   <li>any other word is reported as a skip</li>
 * </ul>
 * <p>
 * The created member is handed to the owner unread; the resolver then passes it the words it
 * examined followed by the character that ended them. On a skip those same characters go back
 * to the owner.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ClassMemberResolver extends Reader {

    private static final int EOF = -1;

    private enum Mode { START, WORD, STATIC_GAP, SECOND_WORD }

    private final TokenReceiver<ClassMember> owner;
    private final int lineIndentation;
    private final StringBuilder raw = new StringBuilder();
    private final StringBuilder word = new StringBuilder();
    private Mode mode = Mode.START;

    public ClassMemberResolver(TokenReceiver<ClassMember> owner, int lineIndentation) {
        this.owner = Objects.requireNonNull(owner, "Class member owner cannot be null");
        this.lineIndentation = lineIndentation;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        step(c, state);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        step('\n', state);
    }

    @Override
    public void forceComplete(ReadingState state) {
        step(EOF, state);
    }

    private void step(int c, ReadingState state) {
        char ch = (char) c;
        switch (mode) {
            case START -> {
                if (c == '@') {
                    finish(new CustomAttribute(lineIndentation), c, state);
                } else if (c != EOF && ResolvingHelper.isIdentifierStartChar(ch)) {
                    append(ch);
                    mode = Mode.WORD;
                } else {
                    finish(null, c, state);
                }
            }
            case WORD -> {
                if (c != EOF && ResolvingHelper.isIdentifierChar(ch)) {
                    append(ch);
                } else if (KeywordType.STATIC.getText().equals(word.toString()) && c != EOF && ResolvingHelper.isSpace(ch)) {
                    raw.append(ch);
                    word.setLength(0);
                    mode = Mode.STATIC_GAP;
                } else {
                    finish(createMember(word.toString()), c, state);
                }
            }
            case STATIC_GAP -> {
                if (c != EOF && ResolvingHelper.isSpace(ch)) {
                    raw.append(ch);
                } else if (c != EOF && ResolvingHelper.isIdentifierStartChar(ch)) {
                    append(ch);
                    mode = Mode.SECOND_WORD;
                } else {
                    finish(null, c, state);
                }
            }
            case SECOND_WORD -> {
                if (c != EOF && ResolvingHelper.isIdentifierChar(ch)) {
                    append(ch);
                } else {
                    finish(createStaticMember(word.toString()), c, state);
                }
            }
        }
    }

    private void append(char c) {
        raw.append(c);
        word.append(c);
    }

    private ClassMember createMember(String text) {
        Optional<KeywordType> type = KeywordType.fromText(text);
        if (type.isEmpty()) {
            return null;
        }
        return switch (type.get()) {
            case VAR, CONST -> new VariableDeclaration(lineIndentation);
            case FUNC -> new MethodDeclaration(lineIndentation);
            case SIGNAL -> new SignalDeclaration(lineIndentation);
            case ENUM -> new EnumDeclaration(lineIndentation);
            case CLASS -> new InnerClassDeclaration(lineIndentation);
            case CLASS_NAME -> new ClassNameAttribute(lineIndentation);
            case EXTENDS -> new ExtendsAttribute(lineIndentation);
            case TOOL -> new ToolAttribute(lineIndentation);
            default -> null;
        };
    }

    private ClassMember createStaticMember(String text) {
        Optional<KeywordType> type = KeywordType.fromText(text);
        if (type.isEmpty()) {
            return null;
        }
        return switch (type.get()) {
            case VAR, CONST -> new VariableDeclaration(lineIndentation);
            case FUNC -> new MethodDeclaration(lineIndentation);
            default -> null;
        };
    }

    private void finish(ClassMember member, int c, ReadingState state) {
        state.pop();
        if (member == null) {
            owner.handleReceivedTokenSkip();
        } else {
            owner.handleReceivedToken(member);
        }
        state.passString(raw);
        if (c != EOF) {
            state.passChar((char) c);
        }
    }
}
