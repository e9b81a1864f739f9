package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;

/**
 * Wildcard pattern of a match case: {@code _}.
 */
public final class MatchDefaultOperatorExpression extends Expression {

    public enum State implements SlotState { UNDERSCORE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public MatchDefaultOperatorExpression(Punctuation underscore) {
        form.set(State.UNDERSCORE.slot(), underscore);
    }

    private MatchDefaultOperatorExpression() {
    }

    @Override
    protected MatchDefaultOperatorExpression createEmptyInstance() {
        return new MatchDefaultOperatorExpression();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
