package io.github.cyfko.gdsyntax.core.syntax.tokens;

/**
 * Punctuation marks of the language.
 */
public enum PunctuationType {

    COLON(":"),
    COMMA(","),
    SEMICOLON(";"),
    POINT("."),
    ASSIGN("="),
    OPEN_BRACKET("("),
    CLOSE_BRACKET(")"),
    OPEN_SQUARE_BRACKET("["),
    CLOSE_SQUARE_BRACKET("]"),
    OPEN_FIGURE_BRACKET("{"),
    CLOSE_FIGURE_BRACKET("}"),
    ARROW("->"),
    RANGE(".."),
    AT("@"),
    DOLLAR("$"),
    PERCENT("%"),
    CARET("^"),
    AMPERSAND("&"),
    UNDERSCORE("_");

    private final String symbol;

    PunctuationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the single-character mark for {@code c}, or {@code null}
     */
    public static PunctuationType fromChar(char c) {
        for (PunctuationType type : values()) {
            if (type.symbol.length() == 1 && type.symbol.charAt(0) == c) {
                return type;
            }
        }
        return null;
    }
}
