package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NodePathToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * Scene lookup shorthand: {@code $Player/Sprite} or {@code $"../Hud"}.
 */
public final class GetNodeExpression extends MarkedPathExpression {

    public GetNodeExpression() {
        super(PunctuationType.DOLLAR);
    }

    @Override
    protected SyntaxToken createPathToken(char c) {
        if (ResolvingHelper.isQuote(c)) {
            return new StringToken();
        }
        if (ResolvingHelper.isIdentifierStartChar(c) || c == '/' || c == '%') {
            return new NodePathToken();
        }
        return null;
    }

    @Override
    protected GetNodeExpression createEmptyInstance() {
        return new GetNodeExpression();
    }
}
