package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;
import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;
import io.github.cyfko.gdsyntax.core.exception.ScriptReadingException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The stack of active {@link Reader}s and the character dispatcher driving them.
 * <p>
 * The source is fed character by character through {@link #passChar(char)}; the reader on top
 * of the stack receives it. Readers finish by popping themselves and, when the character that
 * ended them belongs to someone else, passing it again so that the new top receives it.
 * </p>
 *
 * <pre>{@code
 * ReadingState state = new ReadingState(ReaderPolicy.defaults());
 * state.push(declaration);
 * state.passString(source);
 * state.completeReading();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReadingState {

    private static final Logger log = Logger.getLogger(ReadingState.class.getName());

    private final Deque<Reader> readers = new ArrayDeque<>();
    private final ReaderPolicy policy;

    public ReadingState(ReaderPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Reader policy cannot be null");
    }

    public ReaderPolicy getPolicy() {
        return policy;
    }

    public Reader current() {
        return readers.peek();
    }

    public int depth() {
        return readers.size();
    }

    /**
     * Pushes a reader on top of the stack.
     *
     * @param reader the reader that receives the next characters
     * @throws ScriptReadingException if the stack would exceed {@link ReaderPolicy#maxReadingDepth()}
     */
    public void push(Reader reader) {
        Objects.requireNonNull(reader, "Reader cannot be null");
        if (readers.size() >= policy.maxReadingDepth()) {
            throw new ScriptReadingException(String.format(
                    "Nesting too deep: reading stack exceeds %d readers (policy %s)",
                    policy.maxReadingDepth(), policy.policyName()));
        }
        readers.push(reader);
    }

    public void pop() {
        if (readers.isEmpty()) {
            throw new InvalidStateException("Cannot pop: the reading stack is empty");
        }
        readers.pop();
    }

    public void pushAndPass(Reader reader, char c) {
        push(reader);
        passChar(c);
    }

    public void pushAndPass(Reader reader, CharSequence text) {
        push(reader);
        passString(text);
    }

    public void popAndPass(char c) {
        pop();
        passChar(c);
    }

    public void popAndPassNewLine() {
        popAndPass('\n');
    }

    /**
     * Dispatches one character to the reader on top of the stack.
     *
     * @param c the character
     * @throws InvalidStateException if no reader is active
     */
    public void passChar(char c) {
        Reader reader = readers.peek();
        if (reader == null) {
            throw new InvalidStateException("No active reader to receive character code " + (int) c);
        }
        switch (c) {
            case '\n' -> reader.handleNewLineChar(this);
            case '\r' -> reader.handleCarriageReturnChar(this);
            case '#' -> reader.handleSharpChar(this);
            case '\\' -> reader.handleLeftSlashChar(this);
            default -> reader.handleChar(c, this);
        }
    }

    public void passString(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            passChar(text.charAt(i));
        }
    }

    /**
     * Ends the reading: asks every remaining reader, from the top down, to complete itself.
     * A reader that does not pop itself is popped here.
     */
    public void completeReading() {
        while (!readers.isEmpty()) {
            Reader top = readers.peek();
            top.forceComplete(this);
            if (readers.peek() == top) {
                readers.pop();
            }
            log.finest(() -> String.format("End of source: %s completed, %d readers left",
                    top.getClass().getSimpleName(), readers.size()));
        }
    }
}
