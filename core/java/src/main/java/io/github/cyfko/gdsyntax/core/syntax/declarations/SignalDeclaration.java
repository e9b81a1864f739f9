package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * {@code signal name} with an optional parameter list.
 */
public final class SignalDeclaration extends ClassMember {

    public enum State implements SlotState { SIGNAL, NAME, OPEN, PARAMETERS, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 5, State.SIGNAL);

    public SignalDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    public Identifier getName() {
        return form.get(State.NAME.slot(), Identifier.class);
    }

    public List<ParameterDeclaration> getParameters() {
        ParametersList parameters = form.get(State.PARAMETERS.slot(), ParametersList.class);
        return parameters == null ? List.of() : parameters.getElements();
    }

    @Override
    protected SignalDeclaration createEmptyInstance() {
        return new SignalDeclaration(getLineIndentation());
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
            case SIGNAL -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.SIGNAL.slot(), keyword);
                form.setState(State.NAME);
            }, () -> form.setState(State.NAME))), c);
            case NAME -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier name = new Identifier();
                    form.set(State.NAME.slot(), name);
                    form.setState(State.OPEN);
                    state.pushAndPass(name, c);
                } else {
                    form.setState(State.OPEN);
                    handleChar(c, state);
                }
            }
            case OPEN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '(') {
                    form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));
                    ParametersList parameters = new ParametersList(getLineIndentation());
                    form.set(State.PARAMETERS.slot(), parameters);
                    form.setState(State.CLOSE);
                    state.push(parameters);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case CLOSE -> {
                form.setState(State.COMPLETED);
                if (c == ')') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_BRACKET));
                } else {
                    state.popAndPass(c);
                }
            }
            case PARAMETERS, COMPLETED -> state.popAndPass(c);
        }
    }
}
