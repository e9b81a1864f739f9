package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

/**
 * {@code extends Base}, where the base is a class name, a dotted name or a script path.
 */
public final class ExtendsAttribute extends ClassMember {

    public enum State implements SlotState { KEYWORD, TYPE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 2, State.KEYWORD);

    public ExtendsAttribute(int lineIndentation) {
        super(lineIndentation);
    }

    public TypeNode getType() {
        return form.get(State.TYPE.slot(), TypeNode.class);
    }

    @Override
    protected ExtendsAttribute createEmptyInstance() {
        return new ExtendsAttribute(getLineIndentation());
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
                form.setState(State.TYPE);
            }, () -> form.setState(State.TYPE))), c);
            case TYPE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isTypeStartChar(c)) {
                    state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                        form.set(State.TYPE.slot(), type);
                        form.setState(State.COMPLETED);
                    }, () -> form.setState(State.COMPLETED))), c);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
