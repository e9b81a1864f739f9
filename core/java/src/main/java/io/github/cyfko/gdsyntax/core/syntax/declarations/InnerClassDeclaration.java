package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

import java.util.List;

/**
 * {@code class Name extends Base:} followed by an indented members block.
 */
public final class InnerClassDeclaration extends ClassMember implements MembersOwner {

    public enum State implements SlotState { CLASS, NAME, EXTENDS, BASE, COLON, MEMBERS, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 6, State.CLASS);

    public InnerClassDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    public Identifier getName() {
        return form.get(State.NAME.slot(), Identifier.class);
    }

    public TypeNode getBase() {
        return form.get(State.BASE.slot(), TypeNode.class);
    }

    @Override
    public List<ClassMember> getMembers() {
        ClassMembersList members = form.get(State.MEMBERS.slot(), ClassMembersList.class);
        return members == null ? List.of() : members.getElements();
    }

    @Override
    protected InnerClassDeclaration createEmptyInstance() {
        return new InnerClassDeclaration(getLineIndentation());
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    protected boolean acceptsTrivia() {
        return form.getState() != State.COMPLETED;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case CLASS -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.CLASS.slot(), keyword);
                form.setState(State.NAME);
            }, () -> form.setState(State.NAME))), c);
            case NAME -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier name = new Identifier();
                    form.set(State.NAME.slot(), name);
                    form.setState(State.EXTENDS);
                    state.pushAndPass(name, c);
                } else {
                    form.setState(State.EXTENDS);
                    handleChar(c, state);
                }
            }
            case EXTENDS -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                        if (keyword.is(KeywordType.EXTENDS)) {
                            form.set(State.EXTENDS.slot(), keyword);
                            form.setState(State.BASE);
                        } else {
                            form.addBeforeActiveToken(InvalidToken.of(keyword.toString()));
                        }
                    }, () -> form.setState(State.COLON))), c);
                } else {
                    form.setState(State.COLON);
                    handleChar(c, state);
                }
            }
            case BASE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isTypeStartChar(c)) {
                    state.pushAndPass(new TypeResolver(TokenReceiver.of(base -> {
                        form.set(State.BASE.slot(), base);
                        form.setState(State.COLON);
                    }, () -> form.setState(State.COLON))), c);
                } else {
                    form.setState(State.COLON);
                    handleChar(c, state);
                }
            }
            case COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    ClassMembersList members = new ClassMembersList(getLineIndentation());
                    form.set(State.MEMBERS.slot(), members);
                    form.setState(State.COMPLETED);
                    state.push(members);
                } else {
                    readInvalid(c, state, ch -> ch == ':' || ch == '\r');
                }
            }
            case MEMBERS, COMPLETED -> state.popAndPass(c);
        }
    }
}
