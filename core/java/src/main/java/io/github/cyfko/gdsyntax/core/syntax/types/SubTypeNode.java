package io.github.cyfko.gdsyntax.core.syntax.types;

import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * A nested type: {@code Outer.Inner}.
 */
public final class SubTypeNode extends TypeNode {

    public enum State implements SlotState { BASE, POINT, NAME, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.COMPLETED);

    public SubTypeNode(TypeNode base) {
        form.set(State.BASE.slot(), base);
        form.set(State.POINT.slot(), Punctuation.of(PunctuationType.POINT));
    }

    private SubTypeNode() {
    }

    public TypeNode getBase() {
        return form.get(State.BASE.slot(), TypeNode.class);
    }

    public Identifier getName() {
        return form.get(State.NAME.slot(), Identifier.class);
    }

    public void setName(Identifier name) {
        form.set(State.NAME.slot(), name);
    }

    @Override
    public String getTypeName() {
        Identifier name = getName();
        return getBase().getTypeName() + "." + (name == null ? "" : name.getName());
    }

    @Override
    protected SubTypeNode createEmptyInstance() {
        return new SubTypeNode();
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }
}
