package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;

/**
 * {@code return} with an optional result on the same line.
 */
public final class ReturnExpression extends Expression {

    public enum State implements SlotState { RETURN, RESULT, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 2, State.RETURN);
    private final ExpressionContext context;

    public ReturnExpression(ExpressionContext context) {
        this.context = context;
    }

    public Expression getResult() {
        return form.get(State.RESULT.slot(), Expression.class);
    }

    @Override
    protected ReturnExpression createEmptyInstance() {
        return new ReturnExpression(context);
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
            case RETURN -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.RETURN.slot(), keyword);
                form.setState(State.RESULT);
            }, () -> form.setState(State.RESULT))), c);
            case RESULT -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                state.pushAndPass(new ExpressionResolver(TokenReceiver.of(result -> {
                    form.set(State.RESULT.slot(), result);
                    form.setState(State.COMPLETED);
                }, () -> form.setState(State.COMPLETED)), context), c);
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
