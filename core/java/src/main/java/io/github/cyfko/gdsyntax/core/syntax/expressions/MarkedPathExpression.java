package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * Base of the literals introduced by a one-character mark: {@code $path}, {@code %Name},
 * {@code ^"path"}, {@code &"name"}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class MarkedPathExpression extends Expression {

    public enum State implements SlotState { MARK, PATH, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 2, State.MARK);
    private final PunctuationType mark;

    protected MarkedPathExpression(PunctuationType mark) {
        this.mark = mark;
    }

    /**
     * @return the token reading the path starting at {@code c}, or {@code null} if {@code c}
     * cannot start one
     */
    protected abstract SyntaxToken createPathToken(char c);

    public SyntaxToken getPathToken() {
        return form.get(State.PATH.slot());
    }

    /**
     * @return the path text, quotes removed
     */
    public String getPath() {
        SyntaxToken path = getPathToken();
        if (path == null) {
            return "";
        }
        return path instanceof StringToken string ? string.getValue() : path.toString();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    protected boolean acceptsTrivia() {
        return false;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case MARK -> {
                form.set(State.MARK.slot(), Punctuation.of(mark));
                form.setState(State.PATH);
            }
            case PATH -> {
                form.setState(State.COMPLETED);
                SyntaxToken path = createPathToken(c);
                if (path == null) {
                    state.popAndPass(c);
                    return;
                }
                form.set(State.PATH.slot(), path);
                state.pop();
                state.pushAndPass(path, c);
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
