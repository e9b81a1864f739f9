package io.github.cyfko.gdsyntax.core.syntax;

/**
 * Callback of a depth-first, source-order walk of a syntax tree.
 * <p>
 * Nodes are reported twice, when entered and when left; every other token is reported once.
 * Trivia and invalid tokens are walked like any other token, so a visitor that concatenates the
 * text of the leaves it receives rebuilds the source.
 * </p>
 *
 * <pre>{@code
 * root.accept(new SyntaxVisitor() {
 *     @Override
 *     public boolean enterNode(SyntaxNode node) {
 *         return !(node instanceof MethodDeclaration); // skip method bodies
 *     }
 * });
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SyntaxVisitor {

    /**
     * @return {@code false} to skip the children of {@code node}; {@link #leaveNode(SyntaxNode)} is
     * still called
     */
    default boolean enterNode(SyntaxNode node) {
        return true;
    }

    default void leaveNode(SyntaxNode node) {
    }

    /**
     * Receives a token that is not a node.
     */
    default void visitToken(SyntaxToken token) {
    }
}
