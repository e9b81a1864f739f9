package io.github.cyfko.gdsyntax.core.reading;

/**
 * A participant of the reading stack.
 * <p>
 * Every token, node and resolver is a {@code Reader}: while it sits on top of the
 * {@link ReadingState} stack it receives each character of the source, one at a time, and
 * decides to keep it, to pass it on after popping itself, or to push a more specific reader.
 * </p>
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>{@code '\n'} goes to {@link #handleNewLineChar(ReadingState)}</li>
 *   <li>{@code '\r'}, {@code '#'} and {@code '\\'} go to their dedicated handlers, which fall back to
 *       {@link #handleChar(char, ReadingState)}</li>
 *   <li>every other character goes to {@link #handleChar(char, ReadingState)}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class Reader {

    /**
     * Receives an ordinary character.
     *
     * @param c     the character
     * @param state the reading state this reader is pushed on
     */
    public abstract void handleChar(char c, ReadingState state);

    /**
     * Receives a line feed.
     *
     * @param state the reading state this reader is pushed on
     */
    public abstract void handleNewLineChar(ReadingState state);

    public void handleCarriageReturnChar(ReadingState state) {
        handleChar('\r', state);
    }

    public void handleSharpChar(ReadingState state) {
        handleChar('#', state);
    }

    public void handleLeftSlashChar(ReadingState state) {
        handleChar('\\', state);
    }

    /**
     * Called at the end of the source while this reader is on top of the stack.
     * Implementations finish what they hold and pop themselves.
     *
     * @param state the reading state this reader is pushed on
     */
    public abstract void forceComplete(ReadingState state);
}
