package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;
import io.github.cyfko.gdsyntax.core.syntax.types.ArrayTypeNode;
import io.github.cyfko.gdsyntax.core.syntax.types.DictionaryTypeNode;
import io.github.cyfko.gdsyntax.core.syntax.types.StringTypeNode;
import io.github.cyfko.gdsyntax.core.syntax.types.SingleTypeNode;
import io.github.cyfko.gdsyntax.core.syntax.types.SubTypeNode;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

import java.util.Objects;

/**
 * Reads a type annotation and hands it to its owner.
 * <p>
 * A name followed by {@code [} reads a typed collection when the name is {@code Array} or
 * {@code Dictionary}; each {@code .} after a type wraps it in a {@link SubTypeNode}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeResolver extends Reader {

    private static final int EOF = -1;

    private enum Mode { START, NAME, AFTER_TYPE, SUB_NAME }

    private final TokenReceiver<TypeNode> owner;
    private final StringBuilder word = new StringBuilder();
    private Mode mode = Mode.START;
    private TypeNode type;

    public TypeResolver(TokenReceiver<TypeNode> owner) {
        this.owner = Objects.requireNonNull(owner, "Type owner cannot be null");
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
        switch (mode) {
            case START -> {
                if (c != EOF && ResolvingHelper.isIdentifierStartChar((char) c)) {
                    word.append((char) c);
                    mode = Mode.NAME;
                } else if (c != EOF && ResolvingHelper.isQuote((char) c)) {
                    StringToken path = new StringToken();
                    type = new StringTypeNode(path);
                    mode = Mode.AFTER_TYPE;
                    state.pushAndPass(path, (char) c);
                } else {
                    finish(state, c);
                }
            }
            case NAME -> {
                if (c != EOF && ResolvingHelper.isIdentifierChar((char) c)) {
                    word.append((char) c);
                    return;
                }
                String name = takeWord();
                mode = Mode.AFTER_TYPE;
                if (c == '[' && name.equals("Array")) {
                    type = new ArrayTypeNode(Identifier.of(name));
                    state.pushAndPass(type, '[');
                } else if (c == '[' && name.equals("Dictionary")) {
                    type = new DictionaryTypeNode(Identifier.of(name));
                    state.pushAndPass(type, '[');
                } else {
                    type = new SingleTypeNode(Identifier.of(name));
                    step(c, state);
                }
            }
            case AFTER_TYPE -> {
                if (c == '.') {
                    type = new SubTypeNode(type);
                    mode = Mode.SUB_NAME;
                } else {
                    finish(state, c);
                }
            }
            case SUB_NAME -> {
                boolean accepted = c != EOF && (word.length() == 0
                        ? ResolvingHelper.isIdentifierStartChar((char) c)
                        : ResolvingHelper.isIdentifierChar((char) c));
                if (accepted) {
                    word.append((char) c);
                    return;
                }
                if (word.length() > 0) {
                    ((SubTypeNode) type).setName(Identifier.of(takeWord()));
                }
                mode = Mode.AFTER_TYPE;
                step(c, state);
            }
        }
    }

    private void finish(ReadingState state, int c) {
        state.pop();
        if (type == null) {
            owner.handleReceivedTokenSkip();
        } else {
            owner.handleReceivedToken(type);
        }
        if (c != EOF) {
            state.passChar((char) c);
        }
    }

    private String takeWord() {
        String text = word.toString();
        word.setLength(0);
        return text;
    }
}
