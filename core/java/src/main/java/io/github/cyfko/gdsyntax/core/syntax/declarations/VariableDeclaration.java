package io.github.cyfko.gdsyntax.core.syntax.declarations;

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
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

import java.util.List;

/**
 * A member variable or constant, with optional {@code static}, type, initializer and property
 * accessors.
 *
 * <h2>Forms</h2>
 * <pre>{@code
 * var health := 100
 * static var instances: int = 0
 * const SPEED = 4.5
 * var ratio: float:
 *     get:
 *         return value / max
 *     set(v):
 *         value = v * max
 * var hp: int = 10: get = get_hp, set = set_hp
 * }</pre>
 * <p>
 * A colon directly followed by the end of the line ({@code var ratio:}) opens the accessors of an
 * untyped variable rather than a type annotation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableDeclaration extends ClassMember {

    public enum State implements SlotState {
        STATIC, VAR, IDENTIFIER, TYPE_COLON, TYPE, ASSIGN, INITIALIZER, ACCESSORS_COLON, ACCESSORS, COMPLETED
    }

    private final TokensForm<State> form = new TokensForm<>(this, 9, State.STATIC);
    private final StringBuilder pendingSpaces = new StringBuilder();
    private boolean pendingColon;

    public VariableDeclaration(int lineIndentation) {
        super(lineIndentation);
    }

    public boolean isStatic() {
        return form.get(State.STATIC.slot()) != null;
    }

    public boolean isConstant() {
        Keyword keyword = form.get(State.VAR.slot(), Keyword.class);
        return keyword != null && keyword.is(KeywordType.CONST);
    }

    public Identifier getIdentifier() {
        return form.get(State.IDENTIFIER.slot(), Identifier.class);
    }

    public TypeNode getType() {
        return form.get(State.TYPE.slot(), TypeNode.class);
    }

    /**
     * @return whether the type is inferred with {@code :=}
     */
    public boolean isTypeInferred() {
        return form.get(State.TYPE_COLON.slot()) != null && getType() == null && getInitializer() != null;
    }

    public Expression getInitializer() {
        return form.get(State.INITIALIZER.slot(), Expression.class);
    }

    public List<AccessorDeclaration> getAccessors() {
        AccessorsList accessors = form.get(State.ACCESSORS.slot(), AccessorsList.class);
        return accessors == null ? List.of() : accessors.getElements();
    }

    @Override
    protected VariableDeclaration createEmptyInstance() {
        return new VariableDeclaration(getLineIndentation());
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
    public void handleNewLineChar(ReadingState state) {
        if (pendingColon) {
            openAccessors('\n', state);
        } else if (form.getState() == State.ACCESSORS) {
            handleChar('\n', state);
        } else {
            super.handleNewLineChar(state);
        }
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        if (pendingColon) {
            openAccessors('#', state);
        } else {
            super.handleSharpChar(state);
        }
    }

    @Override
    public void handleCarriageReturnChar(ReadingState state) {
        if (pendingColon) {
            openAccessors('\r', state);
        } else {
            super.handleCarriageReturnChar(state);
        }
    }

    @Override
    public void handleLeftSlashChar(ReadingState state) {
        if (pendingColon) {
            commitTypeColon();
        }
        super.handleLeftSlashChar(state);
    }

    @Override
    public void forceComplete(ReadingState state) {
        if (pendingColon) {
            commitTypeColon();
        }
        state.pop();
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (form.getState()) {
            case STATIC -> state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                if (keyword.is(KeywordType.STATIC)) {
                    form.set(State.STATIC.slot(), keyword);
                    form.setState(State.VAR);
                } else {
                    form.set(State.VAR.slot(), keyword);
                    form.setState(State.IDENTIFIER);
                }
            }, () -> form.setState(State.IDENTIFIER))), c);
            case VAR -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
                    form.set(State.VAR.slot(), keyword);
                    form.setState(State.IDENTIFIER);
                }, () -> form.setState(State.IDENTIFIER))), c);
            }
            case IDENTIFIER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier identifier = new Identifier();
                    form.set(State.IDENTIFIER.slot(), identifier);
                    form.setState(State.TYPE_COLON);
                    state.pushAndPass(identifier, c);
                } else {
                    form.setState(State.TYPE_COLON);
                    handleChar(c, state);
                }
            }
            case TYPE_COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    pendingColon = true;
                    form.setState(State.TYPE);
                } else {
                    form.setState(State.ASSIGN);
                    handleChar(c, state);
                }
            }
            case TYPE -> readType(c, state);
            case ASSIGN -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == '=') {
                    form.set(State.ASSIGN.slot(), Punctuation.of(PunctuationType.ASSIGN));
                    form.setState(State.INITIALIZER);
                } else {
                    form.setState(State.ACCESSORS_COLON);
                    handleChar(c, state);
                }
            }
            case INITIALIZER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                ExpressionResolver resolver = new ExpressionResolver(TokenReceiver.of(initializer -> {
                    form.set(State.INITIALIZER.slot(), initializer);
                    form.setState(State.ACCESSORS_COLON);
                }, () -> form.setState(State.ACCESSORS_COLON)), ExpressionContext.of(getLineIndentation()));
                state.pushAndPass(resolver, c);
            }
            case ACCESSORS_COLON -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (c == ':') {
                    form.set(State.ACCESSORS_COLON.slot(), Punctuation.of(PunctuationType.COLON));
                    form.setState(State.ACCESSORS);
                } else {
                    form.setState(State.COMPLETED);
                    state.popAndPass(c);
                }
            }
            case ACCESSORS -> {
                AccessorsList accessors = new AccessorsList(getLineIndentation());
                form.set(State.ACCESSORS.slot(), accessors);
                form.setState(State.COMPLETED);
                state.pushAndPass(accessors, c);
            }
            case COMPLETED -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else {
                    state.popAndPass(c);
                }
            }
        }
    }

    private void readType(char c, ReadingState state) {
        if (pendingColon && ResolvingHelper.isSpace(c)) {
            pendingSpaces.append(c);
        } else if (pendingColon && (ResolvingHelper.isTypeStartChar(c) || c == '=')) {
            commitTypeColon();
            readType(c, state);
        } else if (pendingColon) {
            openAccessors(c, state);
        } else if (ResolvingHelper.isSpace(c)) {
            readSpace(c, state);
        } else if (ResolvingHelper.isTypeStartChar(c)) {
            state.pushAndPass(new TypeResolver(TokenReceiver.of(type -> {
                form.set(State.TYPE.slot(), type);
                form.setState(State.ASSIGN);
            }, () -> form.setState(State.ASSIGN))), c);
        } else {
            form.setState(State.ASSIGN);
            handleChar(c, state);
        }
    }

    private void commitTypeColon() {
        pendingColon = false;
        form.set(State.TYPE_COLON.slot(), Punctuation.of(PunctuationType.COLON));
        ResolvingHelper.emitWhitespace(pendingSpaces, false, form::addBeforeActiveToken);
        pendingSpaces.setLength(0);
    }

    private void openAccessors(char c, ReadingState state) {
        pendingColon = false;
        form.setState(State.ACCESSORS);
        form.set(State.ACCESSORS_COLON.slot(), Punctuation.of(PunctuationType.COLON));
        ResolvingHelper.emitWhitespace(pendingSpaces, false, form::addBeforeActiveToken);
        pendingSpaces.setLength(0);
        state.passChar(c);
    }
}
