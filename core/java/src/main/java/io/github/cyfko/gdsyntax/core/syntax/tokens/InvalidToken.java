package io.github.cyfko.gdsyntax.core.syntax.tokens;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Source text that could not be placed in the grammar.
 * <p>
 * It keeps the character it was pushed with and every following character up to (excluded) the
 * first one matching its terminator, or up to the end of the line. Nothing read is ever dropped:
 * an invalid span is serialized back verbatim.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class InvalidToken extends CharSequenceToken {

    private final Predicate<Character> terminator;

    public InvalidToken(Predicate<Character> terminator) {
        this.terminator = Objects.requireNonNull(terminator, "Terminator cannot be null");
    }

    private InvalidToken(String text) {
        super(text);
        this.terminator = c -> true;
    }

    /**
     * Wraps text already read elsewhere.
     */
    public static InvalidToken of(String text) {
        return new InvalidToken(text);
    }

    @Override
    protected boolean canAppendChar(char c) {
        return !terminator.test(c);
    }

    @Override
    public InvalidToken clone() {
        InvalidToken copy = new InvalidToken(terminator);
        copy.sequence.append(sequence);
        return copy;
    }
}
