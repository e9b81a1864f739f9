package io.github.cyfko.gdsyntax.core.syntax.tokens;

import java.util.Objects;

/**
 * A punctuation mark. Multi-character marks ({@code ->}, {@code ..}) are pushed and read.
 */
public final class Punctuation extends FixedToken {

    private final PunctuationType type;

    public Punctuation(PunctuationType type) {
        this(type, false);
    }

    private Punctuation(PunctuationType type, boolean complete) {
        super(Objects.requireNonNull(type, "Punctuation type cannot be null").getSymbol(), complete);
        this.type = type;
    }

    public static Punctuation of(PunctuationType type) {
        return new Punctuation(type, true);
    }

    public PunctuationType getType() {
        return type;
    }

    @Override
    public Punctuation clone() {
        return copyProgressTo(new Punctuation(type));
    }
}
