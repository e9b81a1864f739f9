package io.github.cyfko.gdsyntax.core.syntax.statements;

/**
 * The {@code if condition:} branch.
 */
public final class IfBranch extends ConditionBranch {

    public IfBranch(int lineIndentation) {
        super(lineIndentation);
    }

    @Override
    protected IfBranch createEmptyInstance() {
        return new IfBranch(getLineIndentation());
    }
}
