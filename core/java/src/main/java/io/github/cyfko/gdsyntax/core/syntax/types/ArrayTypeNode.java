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
 * A typed array: {@code Array[int]}.
 */
public final class ArrayTypeNode extends TypeNode {

    public enum State implements SlotState { NAME, OPEN, ELEMENT, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.OPEN);

    public ArrayTypeNode(Identifier name) {
        form.set(State.NAME.slot(), name);
    }

    private ArrayTypeNode() {
    }

    public TypeNode getElementType() {
        return form.get(State.ELEMENT.slot(), TypeNode.class);
    }

    @Override
    public String getTypeName() {
        TypeNode element = getElementType();
        return "Array[" + (element == null ? "" : element.getTypeName()) + "]";
    }

    @Override
    protected ArrayTypeNode createEmptyInstance() {
        return new ArrayTypeNode();
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
                form.setState(State.ELEMENT);
            }
            case ELEMENT -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isTypeStartChar(c)) {
                    state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                        form.set(State.ELEMENT.slot(), type);
                        form.setState(State.CLOSE);
                    }, () -> form.setState(State.CLOSE))), c);
                } else {
                    form.setState(State.CLOSE);
                    handleChar(c, state);
                }
            }
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
}
