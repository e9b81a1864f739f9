package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * String name literal: {@code &"name"}.
 */
public final class StringNameExpression extends MarkedPathExpression {

    public StringNameExpression() {
        super(PunctuationType.AMPERSAND);
    }

    @Override
    protected SyntaxToken createPathToken(char c) {
        return ResolvingHelper.isQuote(c) ? new StringToken() : null;
    }

    @Override
    protected StringNameExpression createEmptyInstance() {
        return new StringNameExpression();
    }
}
