package io.github.cyfko.gdsyntax.core.syntax.statements;

/**
 * An {@code elif condition:} branch.
 */
public final class ElifBranch extends ConditionBranch {

    public ElifBranch(int lineIndentation) {
        super(lineIndentation);
    }

    @Override
    protected ElifBranch createEmptyInstance() {
        return new ElifBranch(getLineIndentation());
    }
}
