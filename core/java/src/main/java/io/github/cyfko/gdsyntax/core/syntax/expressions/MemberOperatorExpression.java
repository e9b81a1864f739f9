package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * A member access: {@code caller.member}. A missing member name leaves its slot empty.
 */
public final class MemberOperatorExpression extends Expression {

    public enum State implements SlotState { CALLER, POINT, MEMBER, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.POINT);

    public MemberOperatorExpression(Expression caller, List<SyntaxToken> beforePoint) {
        form.set(State.CALLER.slot(), caller);
        beforePoint.forEach(form::addBeforeActiveToken);
    }

    private MemberOperatorExpression() {
    }

    public Expression getCaller() {
        return form.get(State.CALLER.slot(), Expression.class);
    }

    public Identifier getMember() {
        return form.get(State.MEMBER.slot(), Identifier.class);
    }

    public String getMemberName() {
        Identifier member = getMember();
        return member == null ? null : member.getName();
    }

    @Override
    protected MemberOperatorExpression createEmptyInstance() {
        return new MemberOperatorExpression();
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
            case POINT -> {
                form.set(State.POINT.slot(), Punctuation.of(PunctuationType.POINT));
                form.setState(State.MEMBER);
            }
            case MEMBER -> {
                form.setState(State.COMPLETED);
                if (ResolvingHelper.isIdentifierStartChar(c)) {
                    Identifier member = new Identifier();
                    form.set(State.MEMBER.slot(), member);
                    state.pop();
                    state.pushAndPass(member, c);
                } else {
                    state.popAndPass(c);
                }
            }
            case COMPLETED -> state.popAndPass(c);
        }
    }
}
