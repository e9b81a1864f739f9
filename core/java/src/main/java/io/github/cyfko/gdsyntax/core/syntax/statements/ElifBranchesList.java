package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensListForm;

import java.util.List;

/**
 * The {@code elif} branches of an {@link IfStatement}, each preceded by its line break and
 * indentation. Filled by the if statement, never read on its own.
 */
public final class ElifBranchesList extends SyntaxNode {

    private final TokensListForm<ElifBranch> form = new TokensListForm<>(this, ElifBranch.class);

    public List<ElifBranch> getBranches() {
        return form.elements();
    }

    @Override
    protected ElifBranchesList createEmptyInstance() {
        return new ElifBranchesList();
    }

    @Override
    public TokensListForm<ElifBranch> getForm() {
        return form;
    }
}
