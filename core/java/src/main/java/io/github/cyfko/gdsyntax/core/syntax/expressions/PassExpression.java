package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

/**
 * The {@code pass} statement.
 */
public final class PassExpression extends SingleKeywordExpression {

    public PassExpression(Keyword keyword) {
        super(keyword);
    }

    private PassExpression() {
    }

    @Override
    protected PassExpression createEmptyInstance() {
        return new PassExpression();
    }
}
