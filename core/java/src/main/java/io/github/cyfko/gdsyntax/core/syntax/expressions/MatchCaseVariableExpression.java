package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;

/**
 * Binding pattern of a match case: {@code var name}.
 */
public final class MatchCaseVariableExpression extends Expression {

    public enum State implements SlotState { VAR, IDENTIFIER, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 2, State.VAR);

    public Identifier getIdentifier() {
        return form.get(State.IDENTIFIER.slot(), Identifier.class);
    }

    @Override
    protected MatchCaseVariableExpression createEmptyInstance() {
        return new MatchCaseVariableExpression();
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
            case VAR -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.VAR.slot(), keyword);
                form.setState(State.IDENTIFIER);
            }, () -> form.setState(State.IDENTIFIER))), c);
            case IDENTIFIER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                form.setState(State.COMPLETED);
                if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier identifier = new Identifier();
                    form.set(State.IDENTIFIER.slot(), identifier);
                    state.pop();
                    state.pushAndPass(identifier, c);
                } else {
                    state.popAndPass(c);
                }
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
