package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * One dictionary entry, {@code key: value} or {@code key = value}.
 */
public final class DictionaryKeyValue extends SyntaxNode {

    public enum State implements SlotState { KEY, SEPARATOR, VALUE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.KEY);
    private final ExpressionContext context;

    public DictionaryKeyValue(ExpressionContext context) {
        this.context = context;
    }

    public Expression getKey() {
        return form.get(State.KEY.slot(), Expression.class);
    }

    public Expression getValue() {
        return form.get(State.VALUE.slot(), Expression.class);
    }

    /**
     * @return whether the entry uses the {@code key = value} form
     */
    public boolean isAssignForm() {
        Punctuation separator = form.get(State.SEPARATOR.slot(), Punctuation.class);
        return separator != null && separator.getType() == PunctuationType.ASSIGN;
    }

    @Override
    protected DictionaryKeyValue createEmptyInstance() {
        return new DictionaryKeyValue(context);
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    protected boolean acceptsTrivia() {
        return form.getState() != State.COMPLETED;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case KEY -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(key -> {
                    form.set(State.KEY.slot(), key);
                    form.setState(State.SEPARATOR);
                }, () -> form.setState(State.SEPARATOR)), context.withStopAtAssign());
                state.pushAndPass(resolver, c);
            }
            case SEPARATOR -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':' || c == '=') {
                    form.set(State.SEPARATOR.slot(),
                            Punctuation.of(c == ':' ? PunctuationType.COLON : PunctuationType.ASSIGN));
                    form.setState(State.VALUE);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case VALUE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(value -> {
                    form.set(State.VALUE.slot(), value);
                    form.setState(State.COMPLETED);
                }, () -> form.setState(State.COMPLETED)), context);
                state.pushAndPass(resolver, c);
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        if (form.getState() == State.VALUE) {
            readNewLine();
        } else {
            form.setState(State.COMPLETED);
            state.popAndPassNewLine();
        }
    }
}
