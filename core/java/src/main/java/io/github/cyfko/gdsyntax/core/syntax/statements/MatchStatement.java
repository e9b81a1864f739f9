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

import java.util.List;

/**
 * {@code match value:} followed by a block of {@link MatchCaseDeclaration}s.
 *
 * <pre>{@code
 * match command:
 *     "jump", "hop":
 *         jump()
 *     [var x, ..] when x > 0:
 *         push(x)
 *     _:
 *         pass
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MatchStatement extends Statement {

    public enum State implements SlotState { MATCH, VALUE, COLON, CASES, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.MATCH);

    public MatchStatement(int lineIndentation) {
        super(lineIndentation);
    }

    public Expression getValue() {
        return form.get(State.VALUE.slot(), Expression.class);
    }

    public List<MatchCaseDeclaration> getCases() {
        MatchCasesList cases = form.get(State.CASES.slot(), MatchCasesList.class);
        return cases == null ? List.of() : cases.getElements();
    }

    @Override
    protected MatchStatement createEmptyInstance() {
        return new MatchStatement(getLineIndentation());
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
            case MATCH -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.MATCH.slot(), keyword);
                form.setState(State.VALUE);
            }, () -> form.setState(State.VALUE))), c);
            case VALUE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.setState(State.COLON);
                    handleChar(c, state);
                } else {
                    state.pushAndPass(new ExpressionResolver(TokenReceiver.of(value -> {
                        form.set(State.VALUE.slot(), value);
                        form.setState(State.COLON);
                    }, () -> form.setState(State.COLON)), ExpressionContext.of(getLineIndentation())), c);
                }
            }
            case COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    MatchCasesList cases = new MatchCasesList(getLineIndentation());
                    form.set(State.CASES.slot(), cases);
                    form.setState(State.COMPLETED);
                    state.push(cases);
                } else {
                    readInvalid(c, state, ch -> ch == ':' || ch == '\r');
                }
            }
            case CASES, COMPLETED -> state.popAndPass(c);
        }
    }
}
