package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;

/**
 * {@code true} or {@code false}.
 */
public final class BoolExpression extends Expression {

    public enum State implements SlotState { VALUE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public BoolExpression(Keyword value) {
        form.set(State.VALUE.slot(), value);
    }

    private BoolExpression() {
    }

    public boolean getValue() {
        return form.get(State.VALUE.slot(), Keyword.class).is(KeywordType.TRUE);
    }

    @Override
    protected BoolExpression createEmptyInstance() {
        return new BoolExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
