package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;

/**
 * A numeric literal, kept exactly as written.
 * <p>
 * Accepted forms: decimal digits with {@code _} separators, {@code 0x} hexadecimal,
 * {@code 0b} binary, one decimal point, and an exponent with an optional sign. The sign of a
 * negative number is a prefix operator, never part of the literal.
 * </p>
 *
 * <pre>{@code
 * 42   1_000_000   0xFF   0b1010   3.14   1e-3
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NumberToken extends CharSequenceToken {

    private enum Part { START, LEADING_ZERO, DECIMAL, HEX, BINARY, FRACTION, EXPONENT_SIGN, EXPONENT }

    private Part part = Part.START;

    public NumberToken() {}

    private NumberToken(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (i > 0 && !canAppendChar(c)) {
                throw new IllegalArgumentException("Not a number literal: '" + text + "'");
            }
            if (i == 0) {
                start(c);
            }
            sequence.append(c);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a number literal
     */
    public static NumberToken of(String text) {
        if (text == null || text.isEmpty() || !ResolvingHelper.isDigit(text.charAt(0))) {
            throw new IllegalArgumentException("Not a number literal: '" + text + "'");
        }
        return new NumberToken(text);
    }

    private void start(char c) {
        part = c == '0' ? Part.LEADING_ZERO : Part.DECIMAL;
    }

    @Override
    protected boolean canAppendChar(char c) {
        switch (part) {
            case START -> {
                start(c);
                return true;
            }
            case LEADING_ZERO -> {
                if (c == 'x' || c == 'X') {
                    part = Part.HEX;
                    return true;
                }
                if (c == 'b' || c == 'B') {
                    part = Part.BINARY;
                    return true;
                }
                part = Part.DECIMAL;
                return canAppendChar(c);
            }
            case DECIMAL -> {
                if (c == '.') {
                    part = Part.FRACTION;
                    return true;
                }
                if (c == 'e' || c == 'E') {
                    part = Part.EXPONENT_SIGN;
                    return true;
                }
                return ResolvingHelper.isDigit(c) || c == '_';
            }
            case FRACTION -> {
                if (c == 'e' || c == 'E') {
                    part = Part.EXPONENT_SIGN;
                    return true;
                }
                return ResolvingHelper.isDigit(c) || c == '_';
            }
            case EXPONENT_SIGN -> {
                if (c == '+' || c == '-' || ResolvingHelper.isDigit(c)) {
                    part = Part.EXPONENT;
                    return true;
                }
                return false;
            }
            case EXPONENT -> {
                return ResolvingHelper.isDigit(c) || c == '_';
            }
            case HEX -> {
                return ResolvingHelper.isHexDigit(c) || c == '_';
            }
            case BINARY -> {
                return c == '0' || c == '1' || c == '_';
            }
            default -> {
                return false;
            }
        }
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        if (sequence.length() == 0) {
            start(c);
            sequence.append(c);
            return;
        }
        super.handleChar(c, state);
    }

    public NumberType getNumberType() {
        return switch (part) {
            case HEX -> NumberType.HEX;
            case BINARY -> NumberType.BINARY;
            case FRACTION, EXPONENT_SIGN, EXPONENT -> NumberType.DOUBLE;
            default -> NumberType.INT;
        };
    }

    /**
     * @return the value of an integral literal
     * @throws NumberFormatException if the literal is a double or does not fit a {@code long}
     */
    public long getLongValue() {
        String digits = sequence.toString().replace("_", "");
        return switch (getNumberType()) {
            case HEX -> Long.parseLong(digits.substring(2), 16);
            case BINARY -> Long.parseLong(digits.substring(2), 2);
            case INT -> Long.parseLong(digits);
            case DOUBLE -> throw new NumberFormatException("Not an integral literal: " + sequence);
        };
    }

    /**
     * @throws NumberFormatException if the literal is incomplete, such as {@code 1e}
     */
    public double getDoubleValue() {
        if (getNumberType() != NumberType.DOUBLE) {
            return getLongValue();
        }
        return Double.parseDouble(sequence.toString().replace("_", ""));
    }

    @Override
    public NumberToken clone() {
        return new NumberToken(getSequence());
    }
}
