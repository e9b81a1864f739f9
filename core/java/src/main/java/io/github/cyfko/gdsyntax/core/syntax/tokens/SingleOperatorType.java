package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * Prefix operators with their priority level.
 */
public enum SingleOperatorType {

    BITWISE_NEGATE("~", 8),
    NEGATE("-", 9),
    IDENTITY("+", 9),
    NOT("!", 18),
    NOT2("not", 18);

    private final String symbol;
    private final int level;

    SingleOperatorType(String symbol, int level) {
        this.symbol = symbol;
        this.level = level;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getLevel() {
        return level;
    }

    public static SingleOperatorType fromChar(char c) {
        return switch (c) {
            case '~' -> BITWISE_NEGATE;
            case '-' -> NEGATE;
            case '+' -> IDENTITY;
            case '!' -> NOT;
            default -> null;
        };
    }
}
