package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

import java.util.List;

/**
 * The conditional expression {@code a if condition else b}. Right associative.
 */
public final class IfExpression extends Expression {

    public enum State implements SlotState { TRUE_EXPRESSION, IF, CONDITION, ELSE, FALSE_EXPRESSION, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 5, State.COMPLETED);

    public IfExpression(Expression whenTrue, List<SyntaxToken> beforeIf, Keyword ifKeyword,
                        List<SyntaxToken> afterIf, Expression condition, List<SyntaxToken> beforeElse,
                        Keyword elseKeyword, List<SyntaxToken> afterElse, Expression whenFalse) {
        form.set(State.TRUE_EXPRESSION.slot(), whenTrue);
        beforeIf.forEach(t -> form.addBefore(State.IF.slot(), t));
        form.set(State.IF.slot(), ifKeyword);
        afterIf.forEach(t -> form.addBefore(State.CONDITION.slot(), t));
        form.set(State.CONDITION.slot(), condition);
        beforeElse.forEach(t -> form.addBefore(State.ELSE.slot(), t));
        form.set(State.ELSE.slot(), elseKeyword);
        afterElse.forEach(t -> form.addBefore(State.FALSE_EXPRESSION.slot(), t));
        form.set(State.FALSE_EXPRESSION.slot(), whenFalse);
    }

    private IfExpression() {
    }

    public Expression getTrueExpression() {
        return form.get(State.TRUE_EXPRESSION.slot(), Expression.class);
    }

    public Expression getCondition() {
        return form.get(State.CONDITION.slot(), Expression.class);
    }

    public Expression getFalseExpression() {
        return form.get(State.FALSE_EXPRESSION.slot(), Expression.class);
    }

    @Override
    protected IfExpression createEmptyInstance() {
        return new IfExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
