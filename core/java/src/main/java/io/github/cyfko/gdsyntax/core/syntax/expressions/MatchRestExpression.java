package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;

/**
 * Open-ended marker of array and dictionary patterns: {@code ..}.
 */
public final class MatchRestExpression extends Expression {

    public enum State implements SlotState { RANGE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public MatchRestExpression(Punctuation range) {
        form.set(State.RANGE.slot(), range);
    }

    private MatchRestExpression() {
    }

    @Override
    protected MatchRestExpression createEmptyInstance() {
        return new MatchRestExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
