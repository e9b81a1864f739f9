package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.IndentedTokensList;

/**
 * The indented cases of a {@link MatchStatement}.
 */
public final class MatchCasesList extends IndentedTokensList<MatchCaseDeclaration> {

    public MatchCasesList(int parentIndentation) {
        super(MatchCaseDeclaration.class, parentIndentation);
    }

    @Override
    protected void readElement(char c, int lineIndentation, ReadingState state) {
        MatchCaseDeclaration matchCase = new MatchCaseDeclaration(lineIndentation);
        addElement(matchCase);
        state.pushAndPass(matchCase, c);
    }

    @Override
    protected MatchCasesList createEmptyInstance() {
        return new MatchCasesList(getParentIndentation());
    }
}
