package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;

/**
 * A name: a letter or underscore followed by letters, digits and underscores.
 */
public final class Identifier extends CharSequenceToken {

    public Identifier() {}

    private Identifier(String text) {
        super(text);
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not an identifier
     */
    public static Identifier of(String text) {
        if (!ResolvingHelper.isIdentifier(text)) {
            throw new IllegalArgumentException("Not an identifier: '" + text + "'");
        }
        return new Identifier(text);
    }

    public String getName() {
        return sequence.toString();
    }

    @Override
    protected boolean canAppendChar(char c) {
        return ResolvingHelper.isIdentifierChar(c);
    }

    @Override
    public Identifier clone() {
        return new Identifier(getSequence());
    }
}
