package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * The {@code else:} branch.
 */
public final class ElseBranch extends SyntaxNode {

    public enum State implements SlotState { KEYWORD, COLON, STATEMENTS, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.KEYWORD);
    private final int lineIndentation;

    public ElseBranch(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    public StatementsList getStatements() {
        return form.get(State.STATEMENTS.slot(), StatementsList.class);
    }

    @Override
    protected ElseBranch createEmptyInstance() {
        return new ElseBranch(lineIndentation);
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
            case KEYWORD -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.KEYWORD.slot(), keyword);
                form.setState(State.COLON);
            }, () -> form.setState(State.COLON))), c);
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
