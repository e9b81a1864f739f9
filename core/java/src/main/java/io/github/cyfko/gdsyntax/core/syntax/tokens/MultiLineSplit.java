package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;

/**
 * A line continuation: a backslash, an optional carriage return and the line feed it escapes.
 * A backslash followed by anything else stays a lone backslash.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MultiLineSplit extends SyntaxToken {

    private final StringBuilder sequence = new StringBuilder();

    @Override
    public void handleChar(char c, ReadingState state) {
        if (sequence.length() == 0) {
            sequence.append(c);
            return;
        }
        if (c == '\r' && sequence.length() == 1) {
            sequence.append(c);
            return;
        }
        state.popAndPass(c);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        sequence.append('\n');
        state.pop();
    }

    @Override
    public void forceComplete(ReadingState state) {
        state.pop();
    }

    public boolean isComplete() {
        return sequence.length() > 0 && sequence.charAt(sequence.length() - 1) == '\n';
    }

    @Override
    public String toString() {
        return sequence.toString();
    }

    @Override
    public MultiLineSplit clone() {
        MultiLineSplit copy = new MultiLineSplit();
        copy.sequence.append(sequence);
        return copy;
    }
}
