package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;

/**
 * The leading whitespace of a content line.
 */
public final class Indentation extends Space {

    private Indentation(String text) {
        super(text);
    }

    public static Indentation of(String text) {
        return new Indentation(text);
    }

    /**
     * @param tabWidth width of a tab character
     * @return the column width of this indentation
     */
    public int getWidth(int tabWidth) {
        return ResolvingHelper.computeIndentation(sequence, tabWidth);
    }

    @Override
    public Indentation clone() {
        return new Indentation(getSequence());
    }
}
