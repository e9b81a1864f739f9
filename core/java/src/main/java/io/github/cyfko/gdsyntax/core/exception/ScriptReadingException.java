package io.github.cyfko.gdsyntax.core.exception;

import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;

/**
 * Exception thrown when a source cannot be read under the active {@link ReaderPolicy}.
 * <p>
 * Syntax mistakes never raise this exception. It covers the conditions under which no tree is
 * produced at all:
 * </p>
 * <ul>
 *   <li><strong>Missing input:</strong> a {@code null} source</li>
 *   <li><strong>Oversized input:</strong> more characters than {@link ReaderPolicy#maxContentLength()}</li>
 *   <li><strong>Runaway nesting:</strong> a reading stack deeper than {@link ReaderPolicy#maxReadingDepth()}</li>
 *   <li><strong>Empty sub-grammar:</strong> an expression request whose text holds no expression</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     ClassDeclaration declaration = reader.parseFileContent(source);
 * } catch (ScriptReadingException e) {
 *     log.warning(() -> "Script rejected: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ScriptReadingException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing why the source was rejected
     */
    public ScriptReadingException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing why the source was rejected
     * @param cause   the original cause of this exception
     */
    public ScriptReadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
