package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * Base of property accessors. An accessor either has a body ({@code get: return x},
 * {@code set(value): x = value}) or names a method ({@code get = get_x}).
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class AccessorDeclaration extends SyntaxNode {

    public enum State implements SlotState {
        KEYWORD, OPEN, PARAMETER, CLOSE, COLON, STATEMENTS, ASSIGN, METHOD, COMPLETED
    }

    private final TokensForm<State> form = new TokensForm<>(this, 8, State.KEYWORD);
    private final int lineIndentation;

    protected AccessorDeclaration(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    public int getLineIndentation() {
        return lineIndentation;
    }

    /**
     * @return the value parameter of a setter body, or {@code null}
     */
    public Identifier getParameter() {
        return form.get(State.PARAMETER.slot(), Identifier.class);
    }

    public StatementsList getStatements() {
        return form.get(State.STATEMENTS.slot(), StatementsList.class);
    }

    /**
     * @return the method named in the {@code get = method} form, or {@code null}
     */
    public Identifier getMethod() {
        return form.get(State.METHOD.slot(), Identifier.class);
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
                form.setState(State.OPEN);
            }, () -> form.setState(State.OPEN))), c);
            case OPEN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '(') {
                    form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));
                    form.setState(State.PARAMETER);
                } else {
                    form.setState(State.COLON);
                    handleChar(c, state);
                }
            }
            case PARAMETER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier parameter = new Identifier();
                    form.set(State.PARAMETER.slot(), parameter);
                    form.setState(State.CLOSE);
                    state.pushAndPass(parameter, c);
                } else {
                    form.setState(State.CLOSE);
                    handleChar(c, state);
                }
            }
            case CLOSE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ')') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_BRACKET));
                    form.setState(State.COLON);
                } else {
                    readInvalid(c, state, ch -> ch == ')' || ch == ':' || ch == '\r');
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
                } else if (c == '=') {
                    form.set(State.ASSIGN.slot(), Punctuation.of(PunctuationType.ASSIGN));
                    form.setState(State.METHOD);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case METHOD -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier method = new Identifier();
                    form.set(State.METHOD.slot(), method);
                    form.setState(State.COMPLETED);
                    state.pushAndPass(method, c);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case STATEMENTS, ASSIGN, COMPLETED -> state.popAndPass(c);
        }
    }
}
