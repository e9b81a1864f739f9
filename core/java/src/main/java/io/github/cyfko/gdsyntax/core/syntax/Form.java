package io.github.cyfko.gdsyntax.core.syntax;

/**
 * Ordered container of the tokens of a {@link SyntaxNode}.
 * <p>
 * Iteration yields the tokens in source order, trivia included; concatenating their text gives
 * back the exact text the node was read from.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Form extends Iterable<SyntaxToken> {

    /**
     * Inserts trivia right before the slot currently being read.
     */
    void addBeforeActiveToken(SyntaxToken token);

    void addFirst(SyntaxToken token);

    void addToEnd(SyntaxToken token);

    /**
     * Fills {@code target}, the empty form of a node of the same type, with deep copies of the
     * tokens of this form, in the same slots and order.
     *
     * @throws io.github.cyfko.gdsyntax.core.exception.InvalidStateException if {@code target} has
     * another shape
     */
    void copyTo(Form target);
}
