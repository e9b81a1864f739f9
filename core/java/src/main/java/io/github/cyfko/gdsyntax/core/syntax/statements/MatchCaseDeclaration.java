package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.ExpressionsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * One case of a match: comma-separated patterns, an optional {@code when} guard, a colon and
 * the case block.
 */
public final class MatchCaseDeclaration extends SyntaxNode {

    public enum State implements SlotState { CONDITIONS, WHEN, GUARD, COLON, STATEMENTS, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 5, State.CONDITIONS);
    private final int lineIndentation;

    public MatchCaseDeclaration(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    public List<Expression> getPatterns() {
        ExpressionsList patterns = form.get(State.CONDITIONS.slot(), ExpressionsList.class);
        return patterns == null ? List.of() : patterns.getElements();
    }

    public Expression getGuard() {
        return form.get(State.GUARD.slot(), Expression.class);
    }

    public StatementsList getStatements() {
        return form.get(State.STATEMENTS.slot(), StatementsList.class);
    }

    @Override
    protected MatchCaseDeclaration createEmptyInstance() {
        return new MatchCaseDeclaration(lineIndentation);
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
            case CONDITIONS -> {
                ExpressionsList patterns = new ExpressionsList(ExpressionContext.of(lineIndentation).withPattern(), null);
                form.set(State.CONDITIONS.slot(), patterns);
                form.setState(State.WHEN);
                state.pushAndPass(patterns, c);
            }
            case WHEN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.setState(State.COLON);
                    handleChar(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                        if (keyword.is(KeywordType.WHEN)) {
                            form.set(State.WHEN.slot(), keyword);
                            form.setState(State.GUARD);
                        } else {
                            form.addBeforeActiveToken(InvalidToken.of(keyword.toString()));
                        }
                    }, () -> form.setState(State.COLON))), c);
                } else {
                    readInvalid(c, state, ch -> ch == ':' || ch == '\r');
                }
            }
            case GUARD -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.setState(State.COLON);
                    handleChar(c, state);
                } else {
                    state.pushAndPass(new ExpressionResolver(TokenReceiver.of(guard -> {
                        form.set(State.GUARD.slot(), guard);
                        form.setState(State.COLON);
                    }, () -> form.setState(State.COLON)), ExpressionContext.of(lineIndentation)), c);
                }
            }
            case COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    StatementsList statements = new StatementsList(lineIndentation);
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
