package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.reading.TypeResolver;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

/**
 * {@code for item: Type in collection: block}; the variable type is optional.
 * <p>
 * A word other than {@code in} between the variable and the collection is kept as an invalid
 * token.
 * </p>
 */
public final class ForStatement extends Statement {

    public enum State implements SlotState {
        FOR, VARIABLE, TYPE_COLON, TYPE, IN, COLLECTION, COLON, STATEMENTS, COMPLETED
    }

    private final TokensForm<State> form = new TokensForm<>(this, 8, State.FOR);

    public ForStatement(int lineIndentation) {
        super(lineIndentation);
    }

    public Identifier getVariable() {
        return form.get(State.VARIABLE.slot(), Identifier.class);
    }

    public TypeNode getVariableType() {
        return form.get(State.TYPE.slot(), TypeNode.class);
    }

    public Expression getCollection() {
        return form.get(State.COLLECTION.slot(), Expression.class);
    }

    public StatementsList getStatements() {
        return form.get(State.STATEMENTS.slot(), StatementsList.class);
    }

    @Override
    protected ForStatement createEmptyInstance() {
        return new ForStatement(getLineIndentation());
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
            case FOR -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                form.set(State.FOR.slot(), keyword);
                form.setState(State.VARIABLE);
            }, () -> form.setState(State.VARIABLE))), c);
            case VARIABLE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier variable = new Identifier();
                    form.set(State.VARIABLE.slot(), variable);
                    form.setState(State.TYPE_COLON);
                    state.pushAndPass(variable, c);
                } else {
                    form.setState(State.TYPE_COLON);
                    handleChar(c, state);
                }
            }
            case TYPE_COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.TYPE_COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    form.setState(State.TYPE);
                } else {
                    form.setState(State.IN);
                    handleChar(c, state);
                }
            }
            case TYPE -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isTypeStartChar(c)) {
                    state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                        form.set(State.TYPE.slot(), type);
                        form.setState(State.IN);
                    }, () -> form.setState(State.IN))), c);
                } else {
                    form.setState(State.IN);
                    handleChar(c, state);
                }
            }
            case IN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                        if (keyword.is(KeywordType.IN)) {
                            form.set(State.IN.slot(), keyword);
                            form.setState(State.COLLECTION);
                        } else {
                            form.addBeforeActiveToken(InvalidToken.of(keyword.toString()));
                        }
                    }, () -> form.setState(State.COLLECTION))), c);
                } else {
                    form.setState(State.COLLECTION);
                    handleChar(c, state);
                }
            }
            case COLLECTION -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.setState(State.COLON);
                    handleChar(c, state);
                } else {
                    state.pushAndPass(new ExpressionResolver(TokenReceiver.of(collection -> {
                        form.set(State.COLLECTION.slot(), collection);
                        form.setState(State.COLON);
                    }, () -> form.setState(State.COLON)), ExpressionContext.of(getLineIndentation())), c);
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
            case STATEMENTS, COMPLETED -> state.popAndPass(c);
        }
    }
}
