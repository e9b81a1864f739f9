package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * An index access: {@code caller[index]}.
 */
public final class IndexerExpression extends Expression {

    public enum State implements SlotState { CALLER, OPEN, INDEX, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.OPEN);
    private final ExpressionContext context;

    public IndexerExpression(ExpressionContext context, Expression caller, List<SyntaxToken> beforeOpen) {
        this.context = context;
        form.set(State.CALLER.slot(), caller);
        beforeOpen.forEach(form::addBeforeActiveToken);
    }

    private IndexerExpression(ExpressionContext context) {
        this.context = context;
    }

    public Expression getCaller() {
        return form.get(State.CALLER.slot(), Expression.class);
    }

    public Expression getIndex() {
        return form.get(State.INDEX.slot(), Expression.class);
    }

    @Override
    protected IndexerExpression createEmptyInstance() {
        return new IndexerExpression(context);
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
            case OPEN -> {
                form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_SQUARE_BRACKET));
                form.setState(State.INDEX);
            }
            case INDEX -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ']') {
                    form.setState(State.CLOSE);
                    handleChar(c, state);
                } else {
                    ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(index -> {
                        form.set(State.INDEX.slot(), index);
                        form.setState(State.CLOSE);
                    }, () -> form.setState(State.CLOSE)), context);
                    state.pushAndPass(resolver, c);
                }
            }
            case CLOSE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ']') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_SQUARE_BRACKET));
                    form.setState(State.COMPLETED);
                    state.pop();
                } else {
                    readInvalid(c, state, ch -> ch == ']' || ch == '\r' || ResolvingHelper.isSpace(ch));
                }
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        if (form.getState() == State.COMPLETED) {
            state.popAndPassNewLine();
        } else {
            readNewLine();
        }
    }
}
