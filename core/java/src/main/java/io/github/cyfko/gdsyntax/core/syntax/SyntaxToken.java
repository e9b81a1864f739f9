package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.reading.Reader;

import java.util.stream.Stream;

/**
 * Base of every element of the syntax tree.
 * <p>
 * A token is both a piece of the tree and the {@link Reader} that built it. Its
 * {@link #toString()} is the exact source text it covers, so that serializing the root gives
 * back the whole source.
 * </p>
 *
 * <h2>Positions</h2>
 * <p>
 * Offsets are computed on demand, in one walk of the root in source order; lines and columns are
 * zero-based. Start positions point at the first character, end positions right after the last.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class SyntaxToken extends Reader {

    private SyntaxNode parent;

    public SyntaxNode getParent() {
        return parent;
    }

    void setParent(SyntaxNode parent) {
        this.parent = parent;
    }

    /**
     * @return the exact source text covered by this token
     */
    @Override
    public abstract String toString();

    public int length() {
        return toString().length();
    }

    /**
     * @return this token followed by all its descendants, in source order
     */
    public Stream<SyntaxToken> getAllTokens() {
        return Stream.of(this);
    }

    public SyntaxToken getRoot() {
        SyntaxToken root = this;
        while (root.parent != null) {
            root = root.parent;
        }
        return root;
    }

    /**
     * @return the offset of the first character of this token in the root text
     */
    public int getStartPosition() {
        return TextLocation.startOf(this).offset();
    }

    public int getStartLine() {
        return TextLocation.startOf(this).line();
    }

    public int getStartColumn() {
        return TextLocation.startOf(this).column();
    }

    /**
     * @return the offset right after the last character of this token in the root text
     */
    public int getEndPosition() {
        return TextLocation.endOf(this).offset();
    }

    /**
     * The line the token ends on. A token ending with a line feed ends at column 0 of the next line.
     */
    public int getEndLine() {
        return TextLocation.endOf(this).line();
    }

    public int getEndColumn() {
        return TextLocation.endOf(this).column();
    }

    /**
     * @return the root text of the line this token ends on, without its line break
     */
    public String getWholeLine() {
        String text = getRoot().toString();
        int end = getEndPosition();
        int lineStart = text.lastIndexOf('\n', end - 1) + 1;
        int lineEnd = text.indexOf('\n', lineStart);
        String line = lineEnd < 0 ? text.substring(lineStart) : text.substring(lineStart, lineEnd);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Walks this token with the given visitor.
     */
    public void accept(SyntaxVisitor visitor) {
        visitor.visitToken(this);
    }

    /**
     * @return a detached deep copy of this token, with the same text and reading progress
     */
    @Override
    public abstract SyntaxToken clone();
}
