package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.tokens.CarriageReturn;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Comment;
import io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.MultiLineSplit;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Space;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A syntax element made of other tokens, stored in a {@link Form}.
 * <p>
 * The text of a node is the concatenation of the tokens of its form. Subclasses drive the
 * filling of their form from the character handlers; this base class provides the helpers that
 * put trivia (spaces, comments, carriage returns, line continuations, invalid spans) in front of
 * the slot currently being read.
 * </p>
 *
 * <h2>Default handling</h2>
 * <ul>
 *   <li>ordinary characters and line feeds end the node: it pops itself and passes the character on</li>
 *   <li>{@code '#'}, {@code '\r'} and {@code '\\'} become trivia while {@link #acceptsTrivia()} holds</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class SyntaxNode extends SyntaxToken {

    public abstract Form getForm();

    /**
     * @return a fresh, empty node of the same type, built with the same reading parameters
     */
    protected abstract SyntaxNode createEmptyInstance();

    @Override
    public SyntaxNode clone() {
        SyntaxNode copy = createEmptyInstance();
        getForm().copyTo(copy.getForm());
        return copy;
    }

    @Override
    public void accept(SyntaxVisitor visitor) {
        if (visitor.enterNode(this)) {
            for (SyntaxToken token : getForm()) {
                token.accept(visitor);
            }
        }
        visitor.leaveNode(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (SyntaxToken token : getForm()) {
            builder.append(token);
        }
        return builder.toString();
    }

    @Override
    public Stream<SyntaxToken> getAllTokens() {
        return Stream.concat(Stream.of(this), getTokens().flatMap(SyntaxToken::getAllTokens));
    }

    /**
     * @return the direct tokens of this node, in source order
     */
    public Stream<SyntaxToken> getTokens() {
        return StreamSupport.stream(getForm().spliterator(), false);
    }

    public List<InvalidToken> getInvalidTokens() {
        return getAllTokens()
                .filter(InvalidToken.class::isInstance)
                .map(InvalidToken.class::cast)
                .collect(Collectors.toList());
    }

    /**
     * @param type the node or token type searched
     * @return every descendant of the given type, this node excluded, in source order
     */
    public <T extends SyntaxToken> List<T> getAllTokens(Class<T> type) {
        return getAllTokens()
                .skip(1)
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    /**
     * Whether {@code '#'}, {@code '\r'} and {@code '\\'} are kept as trivia of this node rather than
     * ending it.
     */
    protected boolean acceptsTrivia() {
        return true;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        state.popAndPass(c);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        state.popAndPassNewLine();
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        if (acceptsTrivia()) {
            readComment(state);
        } else {
            state.popAndPass('#');
        }
    }

    @Override
    public void handleCarriageReturnChar(ReadingState state) {
        if (acceptsTrivia()) {
            getForm().addBeforeActiveToken(new CarriageReturn());
        } else {
            state.popAndPass('\r');
        }
    }

    @Override
    public void handleLeftSlashChar(ReadingState state) {
        if (acceptsTrivia()) {
            readLineSplit(state);
        } else {
            state.popAndPass('\\');
        }
    }

    @Override
    public void forceComplete(ReadingState state) {
        state.pop();
    }

    protected void readSpace(char c, ReadingState state) {
        Space space = new Space();
        getForm().addBeforeActiveToken(space);
        state.pushAndPass(space, c);
    }

    protected void readComment(ReadingState state) {
        Comment comment = new Comment();
        getForm().addBeforeActiveToken(comment);
        state.pushAndPass(comment, '#');
    }

    protected void readLineSplit(ReadingState state) {
        MultiLineSplit split = new MultiLineSplit();
        getForm().addBeforeActiveToken(split);
        state.pushAndPass(split, '\\');
    }

    protected void readNewLine() {
        getForm().addBeforeActiveToken(new NewLine());
    }

    /**
     * Captures unexpected text as an {@link InvalidToken} placed before the active slot.
     * The token always keeps {@code c} and stops before the first character matching {@code stop}
     * or at the end of the line.
     */
    protected void readInvalid(char c, ReadingState state, Predicate<Character> stop) {
        InvalidToken invalid = new InvalidToken(stop);
        getForm().addBeforeActiveToken(invalid);
        state.pushAndPass(invalid, c);
    }
}
