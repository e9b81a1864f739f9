package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * Quotes delimiting a string literal.
 */
public enum StringBoundingType {

    SINGLE_QUOTAS('\'', 1),
    DOUBLE_QUOTAS('"', 1),
    TRIPLE_SINGLE_QUOTAS('\'', 3),
    TRIPLE_DOUBLE_QUOTAS('"', 3);

    private final char quote;
    private final int count;

    StringBoundingType(char quote, int count) {
        this.quote = quote;
        this.count = count;
    }

    public char getQuote() {
        return quote;
    }

    public int getCount() {
        return count;
    }

    public String getBound() {
        return String.valueOf(quote).repeat(count);
    }

    public static StringBoundingType of(char quote, int count) {
        if (count == 3) {
            return quote == '"' ? TRIPLE_DOUBLE_QUOTAS : TRIPLE_SINGLE_QUOTAS;
        }
        return quote == '"' ? DOUBLE_QUOTAS : SINGLE_QUOTAS;
    }
}
