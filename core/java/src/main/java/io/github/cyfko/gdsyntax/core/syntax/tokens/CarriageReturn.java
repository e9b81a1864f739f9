package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * A carriage return, kept apart from the line feed that usually follows it.
 */
public final class CarriageReturn extends FixedToken {

    public CarriageReturn() {
        super("\r", true);
    }

    @Override
    public CarriageReturn clone() {
        return new CarriageReturn();
    }
}
