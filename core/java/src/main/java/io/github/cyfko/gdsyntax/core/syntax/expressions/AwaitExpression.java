package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

import java.util.List;

/**
 * {@code await signal_or_call}. Binds tighter than every binary operator.
 */
public final class AwaitExpression extends Expression {

    public enum State implements SlotState { AWAIT, EXPRESSION, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 2, State.COMPLETED);

    public AwaitExpression(Keyword await, List<SyntaxToken> afterKeyword, Expression expression) {
        form.set(State.AWAIT.slot(), await);
        afterKeyword.forEach(t -> form.addBefore(State.EXPRESSION.slot(), t));
        form.set(State.EXPRESSION.slot(), expression);
    }

    private AwaitExpression() {
    }

    public Expression getExpression() {
        return form.get(State.EXPRESSION.slot(), Expression.class);
    }

    @Override
    protected AwaitExpression createEmptyInstance() {
        return new AwaitExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
