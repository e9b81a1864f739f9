package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SeparatedTokensList;

/**
 * Parameters of a method or lambda, up to the closing {@code )}.
 */
public final class ParametersList extends SeparatedTokensList<ParameterDeclaration> {

    private final int lineIndentation;

    public ParametersList(int lineIndentation) {
        super(ParameterDeclaration.class, ')', true);
        this.lineIndentation = lineIndentation;
    }

    @Override
    protected void readElement(char c, ReadingState state) {
        if (ResolvingHelper.isIdentifierStartChar(c)) {
            ParameterDeclaration parameter = new ParameterDeclaration(lineIndentation);
            addElement(parameter);
            state.pushAndPass(parameter, c);
        } else {
            readInvalid(c, state, ResolvingHelper.listItemEnd(')'));
        }
    }

    @Override
    protected ParametersList createEmptyInstance() {
        return new ParametersList(lineIndentation);
    }
}
