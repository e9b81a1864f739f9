package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NumberToken;

/**
 * A numeric literal.
 */
public final class NumberExpression extends Expression {

    public enum State implements SlotState { NUMBER, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public NumberExpression(NumberToken number) {
        form.set(State.NUMBER.slot(), number);
    }

    private NumberExpression() {
    }

    public NumberToken getNumber() {
        return form.get(State.NUMBER.slot(), NumberToken.class);
    }

    @Override
    protected NumberExpression createEmptyInstance() {
        return new NumberExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
