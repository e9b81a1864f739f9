package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SeparatedTokensList;

/**
 * Entries of a dictionary literal.
 */
public final class DictionaryKeyValuesList extends SeparatedTokensList<DictionaryKeyValue> {

    private final ExpressionContext context;

    public DictionaryKeyValuesList(ExpressionContext context) {
        super(DictionaryKeyValue.class, '}', true);
        this.context = context;
    }

    @Override
    protected void readElement(char c, ReadingState state) {
        DictionaryKeyValue keyValue = new DictionaryKeyValue(context);
        addElement(keyValue);
        state.pushAndPass(keyValue, c);
    }

    @Override
    protected DictionaryKeyValuesList createEmptyInstance() {
        return new DictionaryKeyValuesList(context);
    }
}
