package io.github.cyfko.gdsyntax.core.syntax.declarations;

/**
 * A {@code get} accessor.
 */
public final class GetAccessorDeclaration extends AccessorDeclaration {

    public GetAccessorDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    @Override
    protected GetAccessorDeclaration createEmptyInstance() {
        return new GetAccessorDeclaration(getLineIndentation());
    }
}
