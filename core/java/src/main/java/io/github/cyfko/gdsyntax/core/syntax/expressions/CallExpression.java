package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;
import java.util.Set;

/**
 * A call: {@code caller(arg1, arg2)}.
 */
public final class CallExpression extends Expression {

    private static final Set<String> RESOURCE_LOADERS = Set.of("preload", "load");

    public enum State implements SlotState { CALLER, OPEN, PARAMETERS, CLOSE, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 4, State.OPEN);
    private final ExpressionContext context;

    public CallExpression(ExpressionContext context, Expression caller, List<SyntaxToken> beforeOpen) {
        this.context = context;
        form.set(State.CALLER.slot(), caller);
        beforeOpen.forEach(form::addBeforeActiveToken);
    }

    private CallExpression(ExpressionContext context) {
        this.context = context;
    }

    public Expression getCaller() {
        return form.get(State.CALLER.slot(), Expression.class);
    }

    public List<Expression> getParameters() {
        ExpressionsList parameters = form.get(State.PARAMETERS.slot(), ExpressionsList.class);
        return parameters == null ? List.of() : parameters.getElements();
    }

    /**
     * @return whether this is a {@code preload(...)} or {@code load(...)} call
     */
    public boolean isResourceLoad() {
        return getCaller() instanceof IdentifierExpression identifier
                && RESOURCE_LOADERS.contains(identifier.getName());
    }

    @Override
    protected CallExpression createEmptyInstance() {
        return new CallExpression(context);
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case OPEN -> {
                form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));
                ExpressionsList parameters = new ExpressionsList(context, ')');
                form.set(State.PARAMETERS.slot(), parameters);
                form.setState(State.CLOSE);
                state.push(parameters);
            }
            case CLOSE -> {
                form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_BRACKET));
                form.setState(State.COMPLETED);
                state.pop();
            }
            default -> state.popAndPass(c);
        }
    }
}
