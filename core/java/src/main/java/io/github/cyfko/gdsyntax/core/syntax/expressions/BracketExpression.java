package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * A parenthesized expression. Inside, line breaks and comments are trivia.
 */
public final class BracketExpression extends Expression {

    public enum State implements SlotState { OPEN, EXPRESSION, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.OPEN);
    private final ExpressionContext context;

    public BracketExpression(ExpressionContext context) {
        this.context = context;
    }

    public Expression getExpression() {
        return form.get(State.EXPRESSION.slot(), Expression.class);
    }

    @Override
    protected BracketExpression createEmptyInstance() {
        return new BracketExpression(context);
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
            case OPEN -> {
                form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));
                form.setState(State.EXPRESSION);
            }
            case EXPRESSION -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ')') {
                    form.setState(State.CLOSE);
                    handleChar(c, state);
                } else {
                    ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(expression -> {
                        form.set(State.EXPRESSION.slot(), expression);
                        form.setState(State.CLOSE);
                    }, () -> form.setState(State.CLOSE)), context);
                    state.pushAndPass(resolver, c);
                }
            }
            case CLOSE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ')') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_BRACKET));
                    form.setState(State.COMPLETED);
                    state.pop();
                } else {
                    readInvalid(c, state, ch -> ch == ')' || ch == '\r' || ResolvingHelper.isSpace(ch));
                }
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        if (form.getState() == State.COMPLETED) {
            state.popAndPassNewLine();
        } else {
            readNewLine();
        }
    }
}
