package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

/**
 * The {@code breakpoint} statement.
 */
public final class BreakPointExpression extends SingleKeywordExpression {

    public BreakPointExpression(Keyword keyword) {
        super(keyword);
    }

    private BreakPointExpression() {
    }

    @Override
    protected BreakPointExpression createEmptyInstance() {
        return new BreakPointExpression();
    }
}
