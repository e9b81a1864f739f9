package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.SingleOperator;
import io.github.cyfko.gdsyntax.core.syntax.tokens.SingleOperatorType;

import java.util.List;

/**
 * A prefix operation: {@code -x}, {@code +x}, {@code !x}, {@code not x}, {@code ~x}.
 */
public final class SingleOperatorExpression extends Expression {

    public enum State implements SlotState { OPERATOR, OPERAND, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 2, State.COMPLETED);

    public SingleOperatorExpression(SingleOperator operator, List<SyntaxToken> afterOperator, Expression operand) {
        form.set(State.OPERATOR.slot(), operator);
        afterOperator.forEach(t -> form.addBefore(State.OPERAND.slot(), t));
        form.set(State.OPERAND.slot(), operand);
    }

    private SingleOperatorExpression() {
    }

    public SingleOperator getOperator() {
        return form.get(State.OPERATOR.slot(), SingleOperator.class);
    }

    public SingleOperatorType getOperatorType() {
        return getOperator().getType();
    }

    public Expression getOperand() {
        return form.get(State.OPERAND.slot(), Expression.class);
    }

    @Override
    protected SingleOperatorExpression createEmptyInstance() {
        return new SingleOperatorExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
