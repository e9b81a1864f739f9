package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * Literal forms of a number.
 */
public enum NumberType {
    INT,
    HEX,
    BINARY,
    DOUBLE
}
