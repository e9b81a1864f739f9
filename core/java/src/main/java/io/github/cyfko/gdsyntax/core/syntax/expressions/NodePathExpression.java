package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * Node path literal: {@code ^"Path/To/Node"}.
 */
public final class NodePathExpression extends MarkedPathExpression {

    public NodePathExpression() {
        super(PunctuationType.CARET);
    }

    @Override
    protected SyntaxToken createPathToken(char c) {
        return ResolvingHelper.isQuote(c) ? new StringToken() : null;
    }

    @Override
    protected NodePathExpression createEmptyInstance() {
        return new NodePathExpression();
    }
}
