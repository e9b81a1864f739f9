package io.github.cyfko.gdsyntax.core.exception;

/**
 * Exception thrown when the reading engine reaches a state its grammar wiring does not allow.
 * <p>
 * This exception signals a defect of the reader itself, such as a node receiving a token while
 * its form is already past the corresponding state, or a form copied into a form of another
 * shape. It is never raised because of the text being read: malformed
 * source is captured as {@link io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken}
 * spans and the parse completes.
 * </p>
 *
 * <p><strong>Typical triggers:</strong></p>
 * <ul>
 *   <li>moving a {@code TokensForm} back to an earlier state</li>
 *   <li>passing a character while no reader is active</li>
 *   <li>addressing a slot index outside the form</li>
 * </ul>
 *
 * <p>Callers are not expected to catch it; it should surface as a bug report.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidStateException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the violated invariant
     */
    public InvalidStateException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the violated invariant
     * @param cause   the original cause of this exception
     */
    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
