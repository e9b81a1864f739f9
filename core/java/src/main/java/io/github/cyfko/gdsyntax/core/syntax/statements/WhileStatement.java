package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * {@code while condition: block}.
 */
public final class WhileStatement extends Statement {

    public enum State implements SlotState { WHILE, CONDITION, COLON, STATEMENTS, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.WHILE);

    public WhileStatement(int lineIndentation) {
        super(lineIndentation);
    }

    public Expression getCondition() {
        return form.get(State.CONDITION.slot(), Expression.class);
    }

    public StatementsList getStatements() {
        return form.get(State.STATEMENTS.slot(), StatementsList.class);
    }

    @Override
    protected WhileStatement createEmptyInstance() {
        return new WhileStatement(getLineIndentation());
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
            case WHILE -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.WHILE.slot(), keyword);
                form.setState(State.CONDITION);
            }, () -> form.setState(State.CONDITION))), c);
            case CONDITION -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.setState(State.COLON);
                    handleChar(c, state);
                } else {
                    state.pushAndPass(new ExpressionResolver(TokenReceiver.of(condition -> {
                        form.set(State.CONDITION.slot(), condition);
                        form.setState(State.COLON);
                    }, () -> form.setState(State.COLON)), ExpressionContext.of(getLineIndentation())), c);
                }
            }
            case COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    StatementsList statements = new StatementsList(getLineIndentation());
                    form.set(State.STATEMENTS.slot(), statements);
                    form.setState(State.COMPLETED);
                    state.push(statements);
                } else {
                    readInvalid(c, state, ch -> ch == ':' || ch == '\r');
                }
            }
            case STATEMENTS, COMPLETED -> state.popAndPass(c);
        }
    }
}
