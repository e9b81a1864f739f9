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
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * {@code class_name Name}, optionally followed by {@code , "res://icon.svg"}.
 */
public final class ClassNameAttribute extends ClassMember {

    public enum State implements SlotState { KEYWORD, NAME, COMMA, ICON, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.KEYWORD);

    public ClassNameAttribute(int lineIndentation) {
        super(lineIndentation);
    }

    public Identifier getName() {
        return form.get(State.NAME.slot(), Identifier.class);
    }

    /**
     * @return the icon path, or {@code null} when there is none
     */
    public String getIconPath() {
        StringToken icon = form.get(State.ICON.slot(), StringToken.class);
        return icon == null ? null : icon.getValue();
    }

    @Override
    protected ClassNameAttribute createEmptyInstance() {
        return new ClassNameAttribute(getLineIndentation());
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
                form.setState(State.NAME);
            }, () -> form.setState(State.NAME))), c);
            case NAME -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier name = new Identifier();
                    form.set(State.NAME.slot(), name);
                    form.setState(State.COMMA);
                    state.pushAndPass(name, c);
                } else {
                    form.setState(State.COMMA);
                    handleChar(c, state);
                }
            }
            case COMMA -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ',') {
                    form.set(State.COMMA.slot(), Punctuation.of(PunctuationType.COMMA));
                    form.setState(State.ICON);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case ICON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isQuote(c)) {
                    StringToken icon = new StringToken();
                    form.set(State.ICON.slot(), icon);
                    form.setState(State.COMPLETED);
                    state.pushAndPass(icon, c);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
