package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * A dictionary literal: {@code {"a": 1, b = 2}}.
 */
public final class DictionaryInitializerExpression extends Expression {

    public enum State implements SlotState { OPEN, KEY_VALUES, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.OPEN);
    private final ExpressionContext context;

    public DictionaryInitializerExpression(ExpressionContext context) {
        this.context = context;
    }

    public List<DictionaryKeyValue> getKeyValues() {
        DictionaryKeyValuesList list = form.get(State.KEY_VALUES.slot(), DictionaryKeyValuesList.class);
        return list == null ? List.of() : list.getElements();
    }

    @Override
    protected DictionaryInitializerExpression createEmptyInstance() {
        return new DictionaryInitializerExpression(context);
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case OPEN -> {
                form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_FIGURE_BRACKET));
                DictionaryKeyValuesList keyValues = new DictionaryKeyValuesList(context);
                form.set(State.KEY_VALUES.slot(), keyValues);
                form.setState(State.CLOSE);
                state.push(keyValues);
            }
            case CLOSE -> {
                form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_FIGURE_BRACKET));
                form.setState(State.COMPLETED);
                state.pop();
            }
            default -> state.popAndPass(c);
        }
    }
}
