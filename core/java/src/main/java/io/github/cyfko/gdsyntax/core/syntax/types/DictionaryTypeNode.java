package io.github.cyfko.gdsyntax.core.syntax.types;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * A typed dictionary: {@code Dictionary[String, int]}.
 */
public final class DictionaryTypeNode extends TypeNode {

    public enum State implements SlotState { NAME, OPEN, KEY, COMMA, VALUE, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 6, State.OPEN);

    public DictionaryTypeNode(Identifier name) {
        form.set(State.NAME.slot(), name);
    }

    private DictionaryTypeNode() {
    }

    public TypeNode getKeyType() {
        return form.get(State.KEY.slot(), TypeNode.class);
    }

    public TypeNode getValueType() {
        return form.get(State.VALUE.slot(), TypeNode.class);
    }

    @Override
    public String getTypeName() {
        TypeNode key = getKeyType();
        TypeNode value = getValueType();
        return "Dictionary[" + (key == null ? "" : key.getTypeName()) + ", "
                + (value == null ? "" : value.getTypeName()) + "]";
    }

    @Override
    protected DictionaryTypeNode createEmptyInstance() {
        return new DictionaryTypeNode();
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
            case OPEN -> {
                form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_SQUARE_BRACKET));
                form.setState(State.KEY);
            }
            case KEY -> readType(c, state, State.KEY, State.COMMA);
            case COMMA -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ',') {
                    form.set(State.COMMA.slot(), Punctuation.of(PunctuationType.COMMA));
                    form.setState(State.VALUE);
                } else {
                    form.setState(State.CLOSE);
                    handleChar(c, state);
                }
            }
            case VALUE -> readType(c, state, State.VALUE, State.CLOSE);
            case CLOSE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ']') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_SQUARE_BRACKET));
                    form.setState(State.COMPLETED);
                    state.pop();
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case COMPLETED, NAME -> state.popAndPass(c);
        }
    }

    private void readType(char c, ReadingState state, State slot, State next) {
        if (ResolvingHelper.isSpace(c)) {
            readSpace(c, state);
        } else if (ResolvingHelper.isTypeStartChar(c)) {
            state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                form.set(slot.slot(), type);
                form.setState(next);
            }, () -> form.setState(next))), c);
        } else {
            form.setState(next);
            handleChar(c, state);
        }
    }
}
