package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * A {@code #} comment, up to the end of the line. The line break itself is not part of it.
 */
public final class Comment extends CharSequenceToken {

    public Comment() {}

    private Comment(String text) {
        super(text);
    }

    /**
     * @throws IllegalArgumentException if {@code text} does not start with {@code #} or spans lines
     */
    public static Comment of(String text) {
        if (!text.startsWith("#") || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Not a comment: '" + text + "'");
        }
        return new Comment(text);
    }

    /**
     * @return the comment text without its leading {@code #}
     */
    public String getText() {
        return sequence.length() == 0 ? "" : sequence.substring(1);
    }

    @Override
    protected boolean canAppendChar(char c) {
        return c != '\r';
    }

    @Override
    public Comment clone() {
        return new Comment(getSequence());
    }
}
