package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;

/**
 * Leaf token made of a run of characters accepted one by one.
 * <p>
 * The first character received is always kept, so a pushed token never passes back the
 * character it was pushed with. Reading stops at the first refused character or at a line feed;
 * the token then pops itself and passes that character on.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class CharSequenceToken extends SyntaxToken {

    protected final StringBuilder sequence = new StringBuilder();

    protected CharSequenceToken() {}

    protected CharSequenceToken(String text) {
        sequence.append(text);
    }

    public String getSequence() {
        return sequence.toString();
    }

    protected abstract boolean canAppendChar(char c);

    @Override
    public void handleChar(char c, ReadingState state) {
        if (sequence.length() == 0 || canAppendChar(c)) {
            sequence.append(c);
            return;
        }
        state.popAndPass(c);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        state.popAndPassNewLine();
    }

    @Override
    public void forceComplete(ReadingState state) {
        state.pop();
    }

    @Override
    public String toString() {
        return sequence.toString();
    }
}
