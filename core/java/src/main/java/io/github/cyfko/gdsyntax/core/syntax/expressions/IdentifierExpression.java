package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;

/**
 * A name used as a value: {@code speed}, {@code self}, {@code Vector2}.
 */
public final class IdentifierExpression extends Expression {

    public enum State implements SlotState { IDENTIFIER, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public IdentifierExpression(Identifier identifier) {
        form.set(State.IDENTIFIER.slot(), identifier);
    }

    private IdentifierExpression() {
    }

    public Identifier getIdentifier() {
        return form.get(State.IDENTIFIER.slot(), Identifier.class);
    }

    public String getName() {
        return getIdentifier().getName();
    }

    @Override
    protected IdentifierExpression createEmptyInstance() {
        return new IdentifierExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
