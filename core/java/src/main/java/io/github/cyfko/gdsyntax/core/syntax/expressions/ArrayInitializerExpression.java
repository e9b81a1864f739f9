package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * An array literal: {@code [1, 2, 3]}.
 */
public final class ArrayInitializerExpression extends Expression {

    public enum State implements SlotState { OPEN, VALUES, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.OPEN);
    private final ExpressionContext context;

    public ArrayInitializerExpression(ExpressionContext context) {
        this.context = context;
    }

    public ExpressionsList getValuesList() {
        return form.get(State.VALUES.slot(), ExpressionsList.class);
    }

    public List<Expression> getValues() {
        ExpressionsList values = getValuesList();
        return values == null ? List.of() : values.getElements();
    }

    @Override
    protected ArrayInitializerExpression createEmptyInstance() {
        return new ArrayInitializerExpression(context);
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case OPEN -> {
                form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_SQUARE_BRACKET));
                ExpressionsList values = new ExpressionsList(context, ']');
                form.set(State.VALUES.slot(), values);
                form.setState(State.CLOSE);
                state.push(values);
            }
            case CLOSE -> {
                form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_SQUARE_BRACKET));
                form.setState(State.COMPLETED);
                state.pop();
            }
            default -> state.popAndPass(c);
        }
    }
}
