package io.github.cyfko.gdsyntax.core.reading;

/**
 * Surroundings of an expression being read.
 *
 * @param lineIndentation indentation width of the line holding the expression; blocks opened
 *                        inside it (lambda bodies) must be deeper
 * @param allowNewLines   whether line breaks and comments are trivia (inside brackets) rather than
 *                        the end of the expression
 * @param matchPattern    whether match-pattern forms ({@code var x}, {@code _}, {@code ..}) are read
 * @param stopAtAssign    whether a bare {@code =} ends the expression instead of assigning
 *                        (dictionary keys in the {@code key = value} form)
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ExpressionContext(
    int lineIndentation,
    boolean allowNewLines,
    boolean matchPattern,
    boolean stopAtAssign
) {

    public static ExpressionContext of(int lineIndentation) {
        return new ExpressionContext(lineIndentation, false, false, false);
    }

    /**
     * Context of the content of a bracket pair: line breaks become trivia, the pattern flag is kept.
     */
    public ExpressionContext inBrackets() {
        return new ExpressionContext(lineIndentation, true, matchPattern, false);
    }

    /**
     * Context of call arguments and indexes, which are never patterns.
     */
    public ExpressionContext inArguments() {
        return new ExpressionContext(lineIndentation, true, false, false);
    }

    public ExpressionContext withPattern() {
        return new ExpressionContext(lineIndentation, allowNewLines, true, stopAtAssign);
    }

    public ExpressionContext withStopAtAssign() {
        return new ExpressionContext(lineIndentation, allowNewLines, matchPattern, true);
    }
}
