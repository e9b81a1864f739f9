package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

/**
 * A parameter: {@code name}, {@code name: Type}, {@code name := default},
 * {@code name: Type = default}.
 */
public final class ParameterDeclaration extends SyntaxNode {

    public enum State implements SlotState { IDENTIFIER, COLON, TYPE, ASSIGN, DEFAULT, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 5, State.IDENTIFIER);
    private final int lineIndentation;

    public ParameterDeclaration(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    public Identifier getIdentifier() {
        return form.get(State.IDENTIFIER.slot(), Identifier.class);
    }

    public TypeNode getType() {
        return form.get(State.TYPE.slot(), TypeNode.class);
    }

    public Expression getDefaultValue() {
        return form.get(State.DEFAULT.slot(), Expression.class);
    }

    @Override
    protected ParameterDeclaration createEmptyInstance() {
        return new ParameterDeclaration(lineIndentation);
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
            case IDENTIFIER -> {
                Identifier identifier = new Identifier();
                form.set(State.IDENTIFIER.slot(), identifier);
                form.setState(State.COLON);
                state.pushAndPass(identifier, c);
            }
            case COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.COLON.slot(), Punctuation.of(PunctuationType.COLON));
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
                    form.setState(State.DEFAULT);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case DEFAULT -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                state.pushAndPass(new ExpressionResolver(TokenReceiver.of(value -> {
                    form.set(State.DEFAULT.slot(), value);
                    form.setState(State.COMPLETED);
                }, () -> form.setState(State.COMPLETED)), ExpressionContext.of(lineIndentation).inArguments()), c);
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
