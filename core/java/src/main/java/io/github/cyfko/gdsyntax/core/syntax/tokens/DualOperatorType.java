package io.github.cyfko.gdsyntax.core.syntax.tokens;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Binary operators, with their priority level (lower binds tighter) and associativity.
 *
 * <h2>Levels</h2>
 * <pre>
 *  6  is
 *  7  **
 * 10  * / %
 * 11  + -
 * 12  &lt;&lt; &gt;&gt;
 * 13  &amp;
 * 14  ^
 * 15  |
 * 16  comparisons
 * 17  in, not in
 * 19  and &amp;&amp;
 * 20  or ||
 * 22  as
 * 23  assignments (right associative)
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum DualOperatorType {

    IS("is", 6),
    POWER("**", 7),
    MULTIPLY("*", 10),
    DIVIDE("/", 10),
    MODULO("%", 10),
    ADD("+", 11),
    SUBTRACT("-", 11),
    SHIFT_LEFT("<<", 12),
    SHIFT_RIGHT(">>", 12),
    BITWISE_AND("&", 13),
    BITWISE_XOR("^", 14),
    BITWISE_OR("|", 15),
    EQUAL("==", 16),
    NOT_EQUAL("!=", 16),
    LESS("<", 16),
    LESS_OR_EQUAL("<=", 16),
    GREATER(">", 16),
    GREATER_OR_EQUAL(">=", 16),
    IN("in", 17),
    AND("and", 19),
    AND2("&&", 19),
    OR("or", 20),
    OR2("||", 20),
    AS("as", 22),
    ASSIGNMENT("=", 23, true),
    ADD_AND_ASSIGN("+=", 23, true),
    SUBTRACT_AND_ASSIGN("-=", 23, true),
    MULTIPLY_AND_ASSIGN("*=", 23, true),
    DIVIDE_AND_ASSIGN("/=", 23, true),
    MODULO_AND_ASSIGN("%=", 23, true),
    POWER_AND_ASSIGN("**=", 23, true),
    SHIFT_LEFT_AND_ASSIGN("<<=", 23, true),
    SHIFT_RIGHT_AND_ASSIGN(">>=", 23, true),
    BITWISE_AND_AND_ASSIGN("&=", 23, true),
    BITWISE_OR_AND_ASSIGN("|=", 23, true),
    BITWISE_XOR_AND_ASSIGN("^=", 23, true);

    private static final Set<String> SYMBOL_PREFIXES;

    static {
        Set<String> prefixes = new HashSet<>();
        for (DualOperatorType type : values()) {
            if (type.isSymbolic()) {
                for (int i = 1; i <= type.symbol.length(); i++) {
                    prefixes.add(type.symbol.substring(0, i));
                }
            }
        }
        SYMBOL_PREFIXES = Collections.unmodifiableSet(prefixes);
    }

    private final String symbol;
    private final int level;
    private final boolean rightAssociative;

    DualOperatorType(String symbol, int level) {
        this(symbol, level, false);
    }

    DualOperatorType(String symbol, int level, boolean rightAssociative) {
        this.symbol = symbol;
        this.level = level;
        this.rightAssociative = rightAssociative;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getLevel() {
        return level;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public boolean isSymbolic() {
        return !Character.isLetter(symbol.charAt(0));
    }

    public boolean isAssignment() {
        return level == ASSIGNMENT.level;
    }

    public static Optional<DualOperatorType> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(type -> type.symbol.equals(symbol))
                .findFirst();
    }

    /**
     * @return whether {@code text} is the beginning of at least one symbolic operator
     */
    public static boolean isSymbolPrefix(String text) {
        return SYMBOL_PREFIXES.contains(text);
    }
}
