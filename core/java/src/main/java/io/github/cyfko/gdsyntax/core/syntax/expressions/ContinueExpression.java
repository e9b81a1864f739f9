package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

/**
 * The {@code continue} statement.
 */
public final class ContinueExpression extends SingleKeywordExpression {

    public ContinueExpression(Keyword keyword) {
        super(keyword);
    }

    private ContinueExpression() {
    }

    @Override
    protected ContinueExpression createEmptyInstance() {
        return new ContinueExpression();
    }
}
