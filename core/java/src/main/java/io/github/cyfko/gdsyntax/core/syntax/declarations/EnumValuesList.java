package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SeparatedTokensList;

/**
 * The values of an enum, up to the closing {@code }}.
 */
public final class EnumValuesList extends SeparatedTokensList<EnumValueDeclaration> {

    private final int lineIndentation;

    public EnumValuesList(int lineIndentation) {
        super(EnumValueDeclaration.class, '}', true);
        this.lineIndentation = lineIndentation;
    }

    @Override
    protected void readElement(char c, ReadingState state) {
        if (ResolvingHelper.isIdentifierStartChar(c)) {
            EnumValueDeclaration value = new EnumValueDeclaration(lineIndentation);
            addElement(value);
            state.pushAndPass(value, c);
        } else {
            readInvalid(c, state, ResolvingHelper.listItemEnd('}'));
        }
    }

    @Override
    protected EnumValuesList createEmptyInstance() {
        return new EnumValuesList(lineIndentation);
    }
}
