package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ParameterDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ParametersList;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

import java.util.List;

/**
 * A lambda: {@code func(x): return x * 2}, optionally named and typed.
 * <p>
 * The body is a statement block: inline on the header line, or on the following lines when
 * deeper than the line holding the expression. A header without a colon ends the lambda where
 * it stops.
 * </p>
 *
 * <pre>{@code
 * button.pressed.connect(func():
 *     print("pressed")
 *     count += 1
 * )
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MethodExpression extends Expression {

    public enum State implements SlotState {
        FUNC, IDENTIFIER, OPEN, PARAMETERS, CLOSE, RETURN_ARROW, RETURN_TYPE, COLON, STATEMENTS, COMPLETED
    }

    private final TokensForm<State> form = new TokensForm<>(this, 9, State.FUNC);
    private final ExpressionContext context;

    public MethodExpression(ExpressionContext context) {
        this.context = context;
    }

    public Identifier getIdentifier() {
        return form.get(State.IDENTIFIER.slot(), Identifier.class);
    }

    public List<ParameterDeclaration> getParameters() {
        ParametersList parameters = form.get(State.PARAMETERS.slot(), ParametersList.class);
        return parameters == null ? List.of() : parameters.getElements();
    }

    public TypeNode getReturnType() {
        return form.get(State.RETURN_TYPE.slot(), TypeNode.class);
    }

    public StatementsList getStatements() {
        return form.get(State.STATEMENTS.slot(), StatementsList.class);
    }

    @Override
    protected MethodExpression createEmptyInstance() {
        return new MethodExpression(context);
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
            case FUNC -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.FUNC.slot(), keyword);
                form.setState(State.IDENTIFIER);
            }, () -> form.setState(State.IDENTIFIER))), c);
            case IDENTIFIER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier identifier = new Identifier();
                    form.set(State.IDENTIFIER.slot(), identifier);
                    form.setState(State.OPEN);
                    state.pushAndPass(identifier, c);
                } else {
                    form.setState(State.OPEN);
                    handleChar(c, state);
                }
            }
            case OPEN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '(') {
                    form.set(State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));
                    ParametersList parameters = new ParametersList(context.lineIndentation());
                    form.set(State.PARAMETERS.slot(), parameters);
                    form.setState(State.CLOSE);
                    state.push(parameters);
                } else {
                    form.setState(State.RETURN_ARROW);
                    handleChar(c, state);
                }
            }
            case CLOSE -> {
                form.setState(State.RETURN_ARROW);
                if (c == ')') {
                    form.set(State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_BRACKET));
                } else {
                    handleChar(c, state);
                }
            }
            case RETURN_ARROW -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '-') {
                    Punctuation arrow = new Punctuation(PunctuationType.ARROW);
                    form.set(State.RETURN_ARROW.slot(), arrow);
                    form.setState(State.RETURN_TYPE);
                    state.pushAndPass(arrow, c);
                } else {
                    form.setState(State.COLON);
                    handleChar(c, state);
                }
            }
            case RETURN_TYPE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isTypeStartChar(c)) {
                    state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                        form.set(State.RETURN_TYPE.slot(), type);
                        form.setState(State.COLON);
                    }, () -> form.setState(State.COLON))), c);
                } else {
                    form.setState(State.COLON);
                    handleChar(c, state);
                }
            }
            case COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    StatementsList statements = new StatementsList(context.lineIndentation());
                    form.set(State.STATEMENTS.slot(), statements);
                    form.setState(State.COMPLETED);
                    state.push(statements);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case PARAMETERS, STATEMENTS, COMPLETED -> state.popAndPass(c);
        }
    }
}
