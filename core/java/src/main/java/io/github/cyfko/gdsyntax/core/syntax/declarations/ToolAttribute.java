package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

/**
 * The bare {@code tool} keyword; the annotation form {@code @tool} is a {@link CustomAttribute}.
 */
public final class ToolAttribute extends ClassMember {

    public enum State implements SlotState { KEYWORD, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 1, State.KEYWORD);

    public ToolAttribute(int lineIndentation) {
        super(lineIndentation);
    }

    @Override
    protected ToolAttribute createEmptyInstance() {
        return new ToolAttribute(getLineIndentation());
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        if (form.getState() == State.KEYWORD) {
            Keyword keyword = new Keyword();
            form.set(State.KEYWORD.slot(), keyword);
            form.setState(State.COMPLETED);
            state.pushAndPass(keyword, c);
            return;
        }
        state.popAndPass(c);
    }
}
