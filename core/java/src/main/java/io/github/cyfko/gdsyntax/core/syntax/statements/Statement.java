package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;

/**
 * Base of the elements of a statement block.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class Statement extends SyntaxNode {

    private final int lineIndentation;

    protected Statement(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    /**
     * @return indentation width of the line the statement starts on
     */
    public int getLineIndentation() {
        return lineIndentation;
    }
}
