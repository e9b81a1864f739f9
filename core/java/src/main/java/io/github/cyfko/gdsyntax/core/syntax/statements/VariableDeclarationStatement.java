package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

/**
 * A local variable or constant: {@code var name: Type = value}, {@code const LIMIT := 10}.
 */
public final class VariableDeclarationStatement extends Statement {

    public enum State implements SlotState { KEYWORD, IDENTIFIER, TYPE_COLON, TYPE, ASSIGN, INITIALIZER, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 6, State.KEYWORD);

    public VariableDeclarationStatement(int lineIndentation) {
        super(lineIndentation);
    }

    public boolean isConstant() {
        Keyword keyword = form.get(State.KEYWORD.slot(), Keyword.class);
        return keyword != null && keyword.is(KeywordType.CONST);
    }

    public Identifier getIdentifier() {
        return form.get(State.IDENTIFIER.slot(), Identifier.class);
    }

    public TypeNode getType() {
        return form.get(State.TYPE.slot(), TypeNode.class);
    }

    /**
     * @return whether the type is inferred with {@code :=}
     */
    public boolean isTypeInferred() {
        return form.get(State.TYPE_COLON.slot()) != null && getType() == null && getInitializer() != null;
    }

    public Expression getInitializer() {
        return form.get(State.INITIALIZER.slot(), Expression.class);
    }

    @Override
    protected VariableDeclarationStatement createEmptyInstance() {
        return new VariableDeclarationStatement(getLineIndentation());
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case KEYWORD -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.KEYWORD.slot(), keyword);
                form.setState(State.IDENTIFIER);
            }, () -> form.setState(State.IDENTIFIER))), c);
            case IDENTIFIER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier identifier = new Identifier();
                    form.set(State.IDENTIFIER.slot(), identifier);
                    form.setState(State.TYPE_COLON);
                    state.pushAndPass(identifier, c);
                } else {
                    form.setState(State.TYPE_COLON);
                    handleChar(c, state);
                }
            }
            case TYPE_COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.TYPE_COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    form.setState(State.TYPE);
                } else {
                    form.setState(State.ASSIGN);
                    handleChar(c, state);
                }
            }
            case TYPE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isTypeStartChar(c)) {
                    state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                        form.set(State.TYPE.slot(), type);
                        form.setState(State.ASSIGN);
                    }, () -> form.setState(State.ASSIGN))), c);
                } else {
                    form.setState(State.ASSIGN);
                    handleChar(c, state);
                }
            }
            case ASSIGN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '=') {
                    form.set(State.ASSIGN.slot(), Punctuation.of(PunctuationType.ASSIGN));
                    form.setState(State.INITIALIZER);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case INITIALIZER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(initializer -> {
                    form.set(State.INITIALIZER.slot(), initializer);
                    form.setState(State.COMPLETED);
                }, () -> form.setState(State.COMPLETED)), ExpressionContext.of(getLineIndentation()));
                state.pushAndPass(resolver, c);
            }
            case COMPLETED -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else {
                    state.popAndPass(c);
                }
            }
        }
    }
}
