package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

/**
 * The {@code break} statement.
 */
public final class BreakExpression extends SingleKeywordExpression {

    public BreakExpression(Keyword keyword) {
        super(keyword);
    }

    private BreakExpression() {
    }

    @Override
    protected BreakExpression createEmptyInstance() {
        return new BreakExpression();
    }
}
