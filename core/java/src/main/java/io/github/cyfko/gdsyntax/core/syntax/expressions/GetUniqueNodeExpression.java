package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NodePathToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * Scene-unique node shorthand: {@code %HealthBar}.
 */
public final class GetUniqueNodeExpression extends MarkedPathExpression {

    public GetUniqueNodeExpression() {
        super(PunctuationType.PERCENT);
    }

    @Override
    protected SyntaxToken createPathToken(char c) {
        if (ResolvingHelper.isQuote(c)) {
            return new StringToken();
        }
        return ResolvingHelper.isIdentifierStartChar(c) ? new NodePathToken() : null;
    }

    @Override
    protected GetUniqueNodeExpression createEmptyInstance() {
        return new GetUniqueNodeExpression();
    }
}
