package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.ExpressionsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * An annotation: {@code @onready}, {@code @export_range(0, 100)}.
 * <p>
 * Arguments must follow the name directly; after a space, {@code (} belongs to what follows.
 * </p>
 */
public final class CustomAttribute extends ClassMember {

    public enum State implements SlotState { AT, NAME, OPEN, ARGUMENTS, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 5, State.AT);

    public CustomAttribute(int lineIndentation) {
        super(lineIndentation);
    }

    public String getName() {
        Identifier name = form.get(State.NAME.slot(), Identifier.class);
        return name == null ? "" : name.getName();
    }

    public List<Expression> getArguments() {
        ExpressionsList arguments = form.get(State.ARGUMENTS.slot(), ExpressionsList.class);
        return arguments == null ? List.of() : arguments.getElements();
    }

    @Override
    protected CustomAttribute createEmptyInstance() {
        return new CustomAttribute(getLineIndentation());
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
            case AT -> {
                form.set(State.AT.slot(), Punctuation.of(PunctuationType.AT));
                form.setState(State.NAME);
            }
            case NAME -> {
                if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier name = new Identifier();
                    form.set(State.NAME.slot(), name);
                    form.setState(State.OPEN);
                    state.pushAndPass(name, c);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case OPEN -> {
                if (c == '(') {
                    form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));
                    ExpressionsList arguments = new ExpressionsList(ExpressionContext.of(getLineIndentation()).inArguments(), ')');
                    form.set(State.ARGUMENTS.slot(), arguments);
                    form.setState(State.CLOSE);
                    state.push(arguments);
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
            case ARGUMENTS, COMPLETED -> state.popAndPass(c);
        }
    }
}
