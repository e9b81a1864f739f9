package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * A string literal.
 */
public final class StringExpression extends Expression {

    public enum State implements SlotState { STRING, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public StringExpression(StringToken string) {
        form.set(State.STRING.slot(), string);
    }

    private StringExpression() {
    }

    public StringToken getString() {
        return form.get(State.STRING.slot(), StringToken.class);
    }

    public String getValue() {
        return getString().getValue();
    }

    @Override
    protected StringExpression createEmptyInstance() {
        return new StringExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
