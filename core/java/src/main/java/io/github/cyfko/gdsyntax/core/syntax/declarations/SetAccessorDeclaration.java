package io.github.cyfko.gdsyntax.core.syntax.declarations;

/**
 * A {@code set} accessor.
 */
public final class SetAccessorDeclaration extends AccessorDeclaration {

    public SetAccessorDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    @Override
    protected SetAccessorDeclaration createEmptyInstance() {
        return new SetAccessorDeclaration(getLineIndentation());
    }
}
