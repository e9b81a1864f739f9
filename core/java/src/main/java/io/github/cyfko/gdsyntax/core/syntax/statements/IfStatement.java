package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.SlotState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;

import java.util.List;
import java.util.function.Consumer;

/**
 * {@code if} / {@code elif} / {@code else} chain.
 * <p>
 * After each branch, the next line is examined before being given back: when it starts with
 * {@code elif} or {@code else} at the indentation of the {@code if} line, it continues the chain;
 * otherwise its line break, indentation and first word are passed back unchanged.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IfStatement extends Statement {

    private static final int EOF = -1;

    public enum State implements SlotState { IF_BRANCH, ELIF_BRANCHES, ELSE_BRANCH, COMPLETED }

    private final TokensForm<State> form = new TokensForm<>(this, 3, State.IF_BRANCH);
    private final StringBuilder nextLineIndentation = new StringBuilder();
    private final StringBuilder nextLineWord = new StringBuilder();
    private boolean lookingAhead;

    public IfStatement(int lineIndentation) {
        super(lineIndentation);
    }

    public IfBranch getIfBranch() {
        return form.get(State.IF_BRANCH.slot(), IfBranch.class);
    }

    public List<ElifBranch> getElifBranches() {
        ElifBranchesList branches = form.get(State.ELIF_BRANCHES.slot(), ElifBranchesList.class);
        return branches == null ? List.of() : branches.getBranches();
    }

    public ElseBranch getElseBranch() {
        return form.get(State.ELSE_BRANCH.slot(), ElseBranch.class);
    }

    @Override
    protected IfStatement createEmptyInstance() {
        return new IfStatement(getLineIndentation());
    }

    @Override
    public TokensForm<State> getForm() {
        return form;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        if (lookingAhead) {
            lookAhead(c, state);
            return;
        }
        if (form.getState() == State.IF_BRANCH) {
            IfBranch branch = new IfBranch(getLineIndentation());
            form.set(State.IF_BRANCH.slot(), branch);
            form.setState(State.ELIF_BRANCHES);
            state.pushAndPass(branch, c);
            return;
        }
        state.popAndPass(c);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        if (lookingAhead) {
            lookAhead('\n', state);
        } else if (form.getState() == State.ELIF_BRANCHES) {
            lookingAhead = true;
        } else {
            state.popAndPassNewLine();
        }
    }

    @Override
    public void handleCarriageReturnChar(ReadingState state) {
        routeSpecial('\r', state);
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        routeSpecial('#', state);
    }

    @Override
    public void handleLeftSlashChar(ReadingState state) {
        routeSpecial('\\', state);
    }

    @Override
    public void forceComplete(ReadingState state) {
        if (lookingAhead) {
            giveBack(EOF, state);
        } else {
            state.pop();
        }
    }

    private void routeSpecial(char c, ReadingState state) {
        if (lookingAhead) {
            lookAhead(c, state);
        } else {
            state.popAndPass(c);
        }
    }

    private void lookAhead(int c, ReadingState state) {
        char ch = (char) c;
        if (nextLineWord.length() == 0 && (ResolvingHelper.isSpace(ch) || ch == '\r')) {
            nextLineIndentation.append(ch);
            return;
        }
        boolean wordChar = nextLineWord.length() == 0
                ? ResolvingHelper.isIdentifierStartChar(ch)
                : ResolvingHelper.isIdentifierChar(ch);
        if (wordChar) {
            nextLineWord.append(ch);
            return;
        }
        int width = ResolvingHelper.computeIndentation(nextLineIndentation, state.getPolicy().tabWidth());
        String word = nextLineWord.toString();
        if (width != getLineIndentation()) {
            giveBack(c, state);
        } else if (KeywordType.ELIF.getText().equals(word)) {
            ElifBranchesList branches = form.getOrInit(State.ELIF_BRANCHES.slot(), ElifBranchesList.class, ElifBranchesList::new);
            ElifBranch branch = new ElifBranch(getLineIndentation());
            continueWith(branches.getForm()::addToEnd);
            branches.getForm().addToEnd(branch);
            state.push(branch);
            state.passString(word);
            state.passChar(ch);
        } else if (KeywordType.ELSE.getText().equals(word)) {
            ElseBranch branch = new ElseBranch(getLineIndentation());
            continueWith(token -> form.addBefore(State.ELSE_BRANCH.slot(), token));
            form.set(State.ELSE_BRANCH.slot(), branch);
            form.setState(State.COMPLETED);
            state.push(branch);
            state.passString(word);
            state.passChar(ch);
        } else {
            giveBack(c, state);
        }
    }

    private void continueWith(Consumer<SyntaxToken> sink) {
        sink.accept(new NewLine());
        ResolvingHelper.emitWhitespace(nextLineIndentation, true, sink);
        lookingAhead = false;
        nextLineIndentation.setLength(0);
        nextLineWord.setLength(0);
    }

    private void giveBack(int c, ReadingState state) {
        String tail = "\n" + nextLineIndentation + nextLineWord;
        lookingAhead = false;
        nextLineIndentation.setLength(0);
        nextLineWord.setLength(0);
        form.setState(State.COMPLETED);
        state.pop();
        state.passString(tail);
        if (c != EOF) {
            state.passChar((char) c);
        }
    }
}
