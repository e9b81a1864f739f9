package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperator;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperatorType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

import java.util.List;

/**
 * A binary operation, assignments included.
 * <p>
 * The optional {@code NOT} slot holds the {@code not} of {@code a not in b}. A missing right
 * operand (text ending on an operator) leaves the {@code RIGHT} slot empty.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DualOperatorExpression extends Expression {

    public enum State implements SlotState { LEFT, NOT, OPERATOR, RIGHT, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.COMPLETED);

    public DualOperatorExpression(Expression left, List<SyntaxToken> beforeOperator, Keyword not,
                                  List<SyntaxToken> betweenNotAndOperator, DualOperator operator,
                                  List<SyntaxToken> afterOperator, Expression right) {
        form.set(State.LEFT.slot(), left);
        beforeOperator.forEach(t -> form.addBefore(State.NOT.slot(), t));
        form.set(State.NOT.slot(), not);
        betweenNotAndOperator.forEach(t -> form.addBefore(State.OPERATOR.slot(), t));
        form.set(State.OPERATOR.slot(), operator);
        afterOperator.forEach(t -> form.addBefore(State.RIGHT.slot(), t));
        form.set(State.RIGHT.slot(), right);
    }

    private DualOperatorExpression() {
    }

    public Expression getLeft() {
        return form.get(State.LEFT.slot(), Expression.class);
    }

    public Expression getRight() {
        return form.get(State.RIGHT.slot(), Expression.class);
    }

    public DualOperator getOperator() {
        return form.get(State.OPERATOR.slot(), DualOperator.class);
    }

    public DualOperatorType getOperatorType() {
        return getOperator().getType();
    }

    public boolean isNotIn() {
        return form.get(State.NOT.slot()) != null;
    }

    @Override
    protected DualOperatorExpression createEmptyInstance() {
        return new DualOperatorExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
