package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;

/**
 * An expression used as a statement: calls, assignments, {@code return}, {@code pass}...
 * <p>
 * Text that does not start an expression is kept as an invalid span up to the end of the line.
 * </p>
 */
public final class ExpressionStatement extends Statement {

    public enum State implements SlotState { EXPRESSION, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.EXPRESSION);
    private boolean skipped;

    public ExpressionStatement(int lineIndentation) {
        super(lineIndentation);
    }

    public Expression getExpression() {
        return form.get(State.EXPRESSION.slot(), Expression.class);
    }

    @Override
    protected ExpressionStatement createEmptyInstance() {
        return new ExpressionStatement(getLineIndentation());
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        if (form.getState() == State.EXPRESSION) {
            ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(expression -> {
                form.set(State.EXPRESSION.slot(), expression);
                form.setState(State.COMPLETED);
            }, () -> {
                skipped = true;
                form.setState(State.COMPLETED);
            }), ExpressionContext.of(getLineIndentation()));
            state.pushAndPass(resolver, c);
            return;
        }
        if (ResolvingHelper.isSpace(c)) {
            readSpace(c, state);
        } else if (skipped) {
            skipped = false;
            readInvalid(c, state, ResolvingHelper.LINE_END);
        } else {
            state.popAndPass(c);
        }
    }
}
