package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

/**
 * An enum value with its optional explicit value: {@code IDLE}, {@code RUN = 2}.
 */
public final class EnumValueDeclaration extends SyntaxNode {

    public enum State implements SlotState { NAME, ASSIGN, VALUE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.NAME);
    private final int lineIndentation;

    public EnumValueDeclaration(int lineIndentation) {
        this.lineIndentation = lineIndentation;
    }

    public Identifier getName() {
        return form.get(State.NAME.slot(), Identifier.class);
    }

    public Expression getValue() {
        return form.get(State.VALUE.slot(), Expression.class);
    }

    @Override
    protected EnumValueDeclaration createEmptyInstance() {
        return new EnumValueDeclaration(lineIndentation);
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
            case NAME -> {
                Identifier name = new Identifier();
                form.set(State.NAME.slot(), name);
                form.setState(State.ASSIGN);
                state.pushAndPass(name, c);
            }
            case ASSIGN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '=') {
                    form.set(State.ASSIGN.slot(), Punctuation.of(PunctuationType.ASSIGN));
                    form.setState(State.VALUE);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case VALUE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                state.pushAndPass(new ExpressionResolver(TokenReceiver.of(value -> {
                    form.set(State.VALUE.slot(), value);
                    form.setState(State.COMPLETED);
                }, () -> form.setState(State.COMPLETED)), ExpressionContext.of(lineIndentation).inArguments()), c);
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
