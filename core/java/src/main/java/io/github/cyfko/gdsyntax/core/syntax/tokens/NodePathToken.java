package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;

/**
 * Unquoted scene path after {@code $}, such as {@code Player/Sprite}.
 */
public final class NodePathToken extends CharSequenceToken {

    @Override
    protected boolean canAppendChar(char c) {
        return ResolvingHelper.isIdentifierChar(c) || c == '/' || c == '%';
    }

    public String getPath() {
        return sequence.toString();
    }

    @Override
    public NodePathToken clone() {
        NodePathToken copy = new NodePathToken();
        copy.sequence.append(sequence);
        return copy;
    }
}
