package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * A line feed.
 */
public final class NewLine extends FixedToken {

    public NewLine() {
        super("\n", true);
    }

    @Override
    public NewLine clone() {
        return new NewLine();
    }
}
