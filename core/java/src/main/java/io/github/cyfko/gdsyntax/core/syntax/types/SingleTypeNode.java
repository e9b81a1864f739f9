package io.github.cyfko.gdsyntax.core.syntax.types;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;

/**
 * A plain type name.
 */
public final class SingleTypeNode extends TypeNode {

    public enum State implements SlotState { NAME, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.COMPLETED);

    public SingleTypeNode(Identifier name) {
        form.set(State.NAME.slot(), name);
    }

    private SingleTypeNode() {
    }

    @Override
    public String getTypeName() {
        return form.get(State.NAME.slot(), Identifier.class).getName();
    }

    @Override
    protected SingleTypeNode createEmptyInstance() {
        return new SingleTypeNode();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
