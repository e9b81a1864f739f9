package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

/**
 * Base of the expressions made of one keyword: {@code pass}, {@code break}, {@code continue},
 * {@code breakpoint}.
 */
public abstract class SingleKeywordExpression extends Expression {

    public enum State implements SlotState { KEYWORD, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    protected SingleKeywordExpression(Keyword keyword) {
        form.set(State.KEYWORD.slot(), keyword);
    }

    protected SingleKeywordExpression() {
    }

    public Keyword getKeyword() {
        return form.get(State.KEYWORD.slot(), Keyword.class);
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
