package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;

/**
 * A run of spaces and tabs inside a line.
 */
public class Space extends CharSequenceToken {

    public Space() {}

    protected Space(String text) {
        super(text);
    }

    public static Space of(String text) {
        return new Space(text);
    }

    @Override
    protected boolean canAppendChar(char c) {
        return ResolvingHelper.isSpace(c);
    }

    @Override
    public Space clone() {
        return new Space(getSequence());
    }
}
