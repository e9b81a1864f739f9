package io.github.cyfko.gdsyntax.core.syntax.types;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

/**
 * A script path used as a type, as in {@code extends "res://base.gd"}.
 */
public final class StringTypeNode extends TypeNode {

    public enum State implements SlotState { PATH, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public StringTypeNode(StringToken path) {
        form.set(State.PATH.slot(), path);
    }

    private StringTypeNode() {
    }

    public String getPath() {
        return form.get(State.PATH.slot(), StringToken.class).getValue();
    }

    @Override
    public String getTypeName() {
        return form.get(State.PATH.slot()).toString();
    }

    @Override
    protected StringTypeNode createEmptyInstance() {
        return new StringTypeNode();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
