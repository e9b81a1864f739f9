package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.tokens.CarriageReturn;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * Base of indentation-delimited blocks: class bodies, statement blocks, match cases, property
 * accessors.
 *
 * <h2>Block membership</h2>
 * <p>
 * A block opens after the colon of its header. Its first content line fixes the block
 * indentation and must be deeper than the header line; following content lines belong to the
 * block while they are at least as deep. A shallower content line closes the block: the line
 * break, the indentation and the first character are passed back to the enclosing reader.
 * Blank lines and comment-only lines always stay in the innermost open block.
 * </p>
 *
 * <h2>Inline blocks</h2>
 * <p>
 * Content on the header line itself ({@code if ready: start()}) makes the block inline: it holds
 * that line only, with {@code ;}-separated elements, and ends at the line break or at the first
 * character that does not fit (such as the {@code )} closing a call around a lambda).
 * </p>
 *
 * <pre>{@code
 * func run():          <- header line, indentation 0
 *     var a = 1        <- fixes the block indentation to 4
 *
 *     # comment        <- trivia of this block
 *     print(a)
 * print("done")        <- closes the block
 * }</pre>
 *
 * @param <T> the element type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class IndentedTokensList<T extends SyntaxNode> extends SyntaxNode {

    private enum Mode { HEADER, LINE_START, AFTER_ELEMENT, SKIPPED, COMPLETED }

    private final TokensListForm<T> form;
    private final int parentIndentation;
    private final boolean root;
    private final StringBuilder pendingIndentation = new StringBuilder();
    private int blockIndentation = -1;
    private int lineIndentation;
    private Mode mode;
    private boolean pendingNewLine;
    private boolean inline;
    private boolean separated;
    private T lastElement;

    /**
     * A block opened by a header line of indentation {@code parentIndentation}.
     */
    protected IndentedTokensList(Class<T> elementType, int parentIndentation) {
        this.form = new TokensListForm<>(this, elementType);
        this.parentIndentation = parentIndentation;
        this.root = false;
        this.mode = Mode.HEADER;
    }

    /**
     * A top-level block: every line belongs to it.
     */
    protected IndentedTokensList(Class<T> elementType) {
        this.form = new TokensListForm<>(this, elementType);
        this.parentIndentation = -1;
        this.root = true;
        this.mode = Mode.LINE_START;
    }

    /**
     * Starts reading an element at {@code c}. The element, once known, must be registered with
     * {@link #addElement(SyntaxNode)} before it is pushed; text that starts no element is reported
     * with {@link #elementSkipped()} and passed back.
     *
     * @param lineIndentation indentation width of the line the element starts on
     */
    protected abstract void readElement(char c, int lineIndentation, ReadingState state);

    /**
     * Whether a new element may follow {@code previous} on the same line without a separator.
     */
    protected boolean allowsElementAfter(T previous) {
        return false;
    }

    protected boolean isSeparator(char c) {
        return c == ';';
    }

    public List<T> getElements() {
        return form.elements();
    }

    public boolean isInline() {
        return inline;
    }

    public int getBlockIndentation() {
        return blockIndentation;
    }

    /**
     * Whether this block is a top-level block rather than one opened by a header line.
     */
    protected boolean isRoot() {
        return root;
    }

    protected int getParentIndentation() {
        return parentIndentation;
    }

    @Override
    public TokensListForm<T> getForm() {
        return form;
    }

    /**
     * Copies the elements together with the block layout: indentation, inline flag and reading mode.
     */
    @Override
    public IndentedTokensList<T> clone() {
        @SuppressWarnings("unchecked")
        IndentedTokensList<T> copy = (IndentedTokensList<T>) super.clone();
        copy.pendingIndentation.append(pendingIndentation);
        copy.blockIndentation = blockIndentation;
        copy.lineIndentation = lineIndentation;
        copy.mode = mode;
        copy.pendingNewLine = pendingNewLine;
        copy.inline = inline;
        copy.separated = separated;
        int last = form.tokens().indexOf(lastElement);
        copy.lastElement = last < 0 ? null : copy.form.elementType().cast(copy.form.tokens().get(last));
        return copy;
    }

    protected void addElement(T element) {
        form.addToEnd(element);
        lastElement = element;
    }

    protected void elementSkipped() {
        mode = Mode.SKIPPED;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        switch (mode) {
            case HEADER -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                    return;
                }
                inline = true;
                startElement(c, parentIndentation, state);
            }
            case LINE_START -> {
                if (ResolvingHelper.isSpace(c)) {
                    pendingIndentation.append(c);
                    return;
                }
                int width = ResolvingHelper.computeIndentation(pendingIndentation, state.getPolicy().tabWidth());
                if (!belongs(width)) {
                    dedent(c, state);
                    return;
                }
                if (blockIndentation < 0) {
                    blockIndentation = width;
                }
                commitPending(true);
                startElement(c, width, state);
            }
            case AFTER_ELEMENT -> {
                if (ResolvingHelper.isSpace(c)) {
                    readSpace(c, state);
                } else if (isSeparator(c)) {
                    form.addToEnd(Punctuation.of(c == ';' ? PunctuationType.SEMICOLON : PunctuationType.fromChar(c)));
                    separated = true;
                } else if (isLastElementEmpty()) {
                    readInvalid(c, state, ResolvingHelper.LINE_END);
                } else if (separated || (lastElement != null && allowsElementAfter(lastElement))) {
                    startElement(c, lineIndentation, state);
                } else if (inline) {
                    mode = Mode.COMPLETED;
                    state.popAndPass(c);
                } else {
                    readInvalid(c, state, ResolvingHelper.LINE_END);
                }
            }
            case SKIPPED -> {
                mode = Mode.AFTER_ELEMENT;
                readInvalid(c, state, ResolvingHelper.LINE_END);
            }
            case COMPLETED -> throw new InvalidStateException(
                    getClass().getSimpleName() + " received a character after completion");
        }
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        switch (mode) {
            case HEADER -> {
                mode = Mode.LINE_START;
                pendingNewLine = true;
            }
            case LINE_START -> {
                commitPending(false);
                pendingNewLine = true;
            }
            case AFTER_ELEMENT, SKIPPED -> {
                separated = false;
                if (inline) {
                    mode = Mode.COMPLETED;
                    state.popAndPassNewLine();
                } else {
                    mode = Mode.LINE_START;
                    pendingNewLine = true;
                }
            }
            case COMPLETED -> throw new InvalidStateException(
                    getClass().getSimpleName() + " received a line break after completion");
        }
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        if (mode == Mode.LINE_START) {
            commitPending(false);
        } else if (mode == Mode.SKIPPED) {
            mode = Mode.AFTER_ELEMENT;
        }
        readComment(state);
    }

    @Override
    public void handleCarriageReturnChar(ReadingState state) {
        if (mode == Mode.LINE_START) {
            pendingIndentation.append('\r');
        } else {
            form.addToEnd(new CarriageReturn());
        }
    }

    @Override
    public void handleLeftSlashChar(ReadingState state) {
        if (mode == Mode.LINE_START || mode == Mode.SKIPPED) {
            handleChar('\\', state);
        } else {
            readLineSplit(state);
        }
    }

    @Override
    public void forceComplete(ReadingState state) {
        if (mode == Mode.LINE_START) {
            commitPending(false);
        }
        mode = Mode.COMPLETED;
        state.pop();
    }

    private boolean belongs(int width) {
        if (root) {
            return true;
        }
        if (inline) {
            return false;
        }
        return blockIndentation < 0 ? width > parentIndentation : width >= blockIndentation;
    }

    private void startElement(char c, int width, ReadingState state) {
        mode = Mode.AFTER_ELEMENT;
        separated = false;
        lineIndentation = width;
        readElement(c, width, state);
    }

    private void dedent(char c, ReadingState state) {
        String tail = (pendingNewLine ? "\n" : "") + pendingIndentation + c;
        pendingNewLine = false;
        pendingIndentation.setLength(0);
        mode = Mode.COMPLETED;
        state.pop();
        state.passString(tail);
    }

    private void commitPending(boolean beforeContent) {
        if (pendingNewLine) {
            form.addToEnd(new NewLine());
            pendingNewLine = false;
        }
        ResolvingHelper.emitWhitespace(pendingIndentation, beforeContent, form::addToEnd);
        pendingIndentation.setLength(0);
    }

    private boolean isLastElementEmpty() {
        return lastElement != null && form.last() == lastElement && lastElement.length() == 0;
    }
}
