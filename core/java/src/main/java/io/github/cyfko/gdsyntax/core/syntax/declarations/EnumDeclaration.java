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
 * {@code enum Name { A, B = 4, C }}; the name is optional.
 * <p>
 * Text between the keyword and the opening brace that is not a name is kept as invalid tokens.
 * </p>
 */
public final class EnumDeclaration extends ClassMember {

    public enum State implements SlotState { ENUM, NAME, OPEN, VALUES, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 5, State.ENUM);

    public EnumDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    /**
     * @return the enum name, or {@code null} for an anonymous enum
     */
    public Identifier getName() {
        return form.get(State.NAME.slot(), Identifier.class);
    }

    public List<EnumValueDeclaration> getValues() {
        EnumValuesList values = form.get(State.VALUES.slot(), EnumValuesList.class);
        return values == null ? List.of() : values.getElements();
    }

    @Override
    protected EnumDeclaration createEmptyInstance() {
        return new EnumDeclaration(getLineIndentation());
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
            case ENUM -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.ENUM.slot(), keyword);
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
                } else if (c == '{') {
                    form.setState(State.OPEN);
                    handleChar(c, state);
                } else {
                    readInvalid(c, state, ch -> ResolvingHelper.isSpace(ch) || ch == '{' || ch == '\r'
                            || ResolvingHelper.isIdentifierStartChar(ch));
                }
            }
            case OPEN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '{') {
                    form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_FIGURE_BRACKET));
                    EnumValuesList values = new EnumValuesList(getLineIndentation());
                    form.set(State.VALUES.slot(), values);
                    form.setState(State.CLOSE);
                    state.push(values);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case CLOSE -> {
                form.setState(State.COMPLETED);
                if (c == '}') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_FIGURE_BRACKET));
                } else {
                    state.popAndPass(c);
                }
            }
            case VALUES, COMPLETED -> state.popAndPass(c);
        }
    }
}
