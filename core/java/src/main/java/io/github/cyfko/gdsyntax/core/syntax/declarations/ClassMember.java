package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;

/**
 * Base of the elements of a class body: attributes, variables, methods, signals, enums and
 * inner classes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class ClassMember extends SyntaxNode {

    private final int lineIndentation;

    protected ClassMember(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    /**
     * @return indentation width of the line the member starts on
     */
    public int getLineIndentation() {
        return lineIndentation;
    }
}
