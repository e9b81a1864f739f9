package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

import java.util.List;

/**
 * A method: {@code static func name(params) -> Type:} followed by its body.
 *
 * <pre>{@code
 * func move(delta: float, speed := 10.0) -> void:
 *     position.x += speed * delta
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MethodDeclaration extends ClassMember {

    public enum State implements SlotState {
        STATIC, FUNC, IDENTIFIER, OPEN, PARAMETERS, CLOSE, RETURN_ARROW, RETURN_TYPE, COLON, STATEMENTS, COMPLETED
    }

    private final TokensForm<State> form = new TokensForm<>(this, 10, State.STATIC);

    public MethodDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    public boolean isStatic() {
        return form.get(State.STATIC.slot()) != null;
    }

    public String getName() {
        Identifier name = form.get(State.IDENTIFIER.slot(), Identifier.class);
        return name == null ? "" : name.getName();
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
    protected MethodDeclaration createEmptyInstance() {
        return new MethodDeclaration(getLineIndentation());
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
            case STATIC -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                if (keyword.is(KeywordType.STATIC)) {
                    form.set(State.STATIC.slot(), keyword);
                    form.setState(State.FUNC);
                } else {
                    form.set(State.FUNC.slot(), keyword);
                    form.setState(State.IDENTIFIER);
                }
            }, () -> form.setState(State.IDENTIFIER))), c);
            case FUNC -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                    form.set(State.FUNC.slot(), keyword);
                    form.setState(State.IDENTIFIER);
                }, () -> form.setState(State.IDENTIFIER))), c);
            }
            case IDENTIFIER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier name = new Identifier();
                    form.set(State.IDENTIFIER.slot(), name);
                    form.setState(State.OPEN);
                    state.pushAndPass(name, c);
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
                    ParametersList parameters = new ParametersList(getLineIndentation());
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
                    StatementsList statements = new StatementsList(getLineIndentation());
                    form.set(State.STATEMENTS.slot(), statements);
                    form.setState(State.COMPLETED);
                    state.push(statements);
                } else {
                    readInvalid(c, state, ch -> ch == ':' || ch == '\r');
                }
            }
            case PARAMETERS, STATEMENTS, COMPLETED -> state.popAndPass(c);
        }
    }
}
