package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;

/**
 * Leaf token with a known text. Either created complete, or pushed and read character by
 * character; a partially read token keeps the prefix it matched.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class FixedToken extends SyntaxToken {

    private final String text;
    private int read;

    protected FixedToken(String text, boolean complete) {
        this.text = text;
        this.read = complete ? text.length() : 0;
    }

    public boolean isComplete() {
        return read == text.length();
    }

    private void accept(char c, ReadingState state) {
        if (read < text.length() && text.charAt(read) == c) {
            read++;
            if (read == text.length()) {
                state.pop();
            }
            return;
        }
        state.popAndPass(c);
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        accept(c, state);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        accept('\n', state);
    }

    @Override
    public void forceComplete(ReadingState state) {
        state.pop();
    }

    @Override
    public String toString() {
        return text.substring(0, read);
    }

    /**
     * Gives {@code copy}, a fresh token of the same text, the reading progress of this one.
     */
    protected <T extends FixedToken> T copyProgressTo(T copy) {
        ((FixedToken) copy).read = read;
        return copy;
    }
}
