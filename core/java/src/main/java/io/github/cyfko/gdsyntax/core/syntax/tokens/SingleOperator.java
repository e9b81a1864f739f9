package io.github.cyfko.gdsyntax.core.syntax.tokens;

import java.util.Objects;

/**
 * Token of a prefix operator.
 */
public final class SingleOperator extends FixedToken {

    private final SingleOperatorType type;

    private SingleOperator(SingleOperatorType type) {
        super(type.getSymbol(), true);
        this.type = type;
    }

    public static SingleOperator of(SingleOperatorType type) {
        return new SingleOperator(Objects.requireNonNull(type, "Operator type cannot be null"));
    }

    public SingleOperatorType getType() {
        return type;
    }

    @Override
    public SingleOperator clone() {
        return new SingleOperator(type);
    }
}
