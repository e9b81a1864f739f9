package io.github.cyfko.gdsyntax.core.syntax.tokens;

import java.util.Objects;

/**
 * Token of a binary operator.
 */
public final class DualOperator extends FixedToken {

    private final DualOperatorType type;

    private DualOperator(DualOperatorType type) {
        super(type.getSymbol(), true);
        this.type = type;
    }

    public static DualOperator of(DualOperatorType type) {
        return new DualOperator(Objects.requireNonNull(type, "Operator type cannot be null"));
    }

    public DualOperatorType getType() {
        return type;
    }

    @Override
    public DualOperator clone() {
        return new DualOperator(type);
    }
}
