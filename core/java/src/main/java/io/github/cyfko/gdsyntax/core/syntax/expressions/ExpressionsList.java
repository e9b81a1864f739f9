package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SeparatedTokensList;

/**
 * Comma-separated expressions: call arguments, array values, match patterns.
 */
public final class ExpressionsList extends SeparatedTokensList<Expression> {

    private final ExpressionContext context;

    /**
     * @param context context of each element
     * @param closer  the closing mark, or {@code null} for an open list
     */
    public ExpressionsList(ExpressionContext context, Character closer) {
        super(Expression.class, closer, context.allowNewLines());
        this.context = context;
    }

    @Override
    protected void readElement(char c, ReadingState state) {
        ExpressionResolver resolver = new ExpressionResolver(
                TokenReceiver.of(this::addElement, () -> elementSkipped(state)), context);
        state.pushAndPass(resolver, c);
    }

    @Override
    protected ExpressionsList createEmptyInstance() {
        return new ExpressionsList(context, getCloser());
    }
}
