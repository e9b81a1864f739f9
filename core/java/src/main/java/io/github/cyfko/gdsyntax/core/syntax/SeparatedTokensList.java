package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;

import java.util.List;

/**
 * Base of comma-separated lists: call arguments, array values, parameters, enum values,
 * dictionary entries, match patterns.
 *
 * <h2>Ending</h2>
 * <ul>
 *   <li>with a closer (such as {@code )}), the list ends only on that closer; unreadable text
 *       between elements becomes invalid tokens, and so does an element missing its comma</li>
 *   <li>without a closer, the list ends on the first character that neither starts an element
 *       after a comma nor is trivia</li>
 * </ul>
 * <p>
 * The closer itself is left to the owner, which pushed the list right after its opening mark.
 * </p>
 *
 * @param <T> the element type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class SeparatedTokensList<T extends SyntaxNode> extends SyntaxNode {

    private final TokensListForm<T> form;
    private final Character closer;
    private final boolean allowNewLines;
    private boolean expectingElement = true;
    private boolean skipped;
    private SyntaxToken lastElement;

    protected SeparatedTokensList(Class<T> elementType, Character closer, boolean allowNewLines) {
        this.form = new TokensListForm<>(this, elementType);
        this.closer = closer;
        this.allowNewLines = allowNewLines;
    }

    public List<T> getElements() {
        return form.elements();
    }

    protected Character getCloser() {
        return closer;
    }

    public int size() {
        return form.elements().size();
    }

    @Override
    public TokensListForm<T> getForm() {
        return form;
    }

    @Override
    public SeparatedTokensList<T> clone() {
        @SuppressWarnings("unchecked")
        SeparatedTokensList<T> copy = (SeparatedTokensList<T>) super.clone();
        copy.expectingElement = expectingElement;
        copy.skipped = skipped;
        int last = form.tokens().indexOf(lastElement);
        copy.lastElement = last < 0 ? null : copy.form.tokens().get(last);
        return copy;
    }

    /**
     * Starts reading an element at {@code c}: either pushes the element node after calling
     * {@link #addElement(SyntaxNode)}, or pushes a resolver reporting to {@link #addElement(SyntaxNode)}
     * and {@link #elementSkipped(ReadingState)}.
     */
    protected abstract void readElement(char c, ReadingState state);

    protected void addElement(T element) {
        form.addToEnd(element);
        lastElement = element;
    }

    protected void elementSkipped(ReadingState state) {
        if (closer == null) {
            state.pop();
        } else {
            skipped = true;
        }
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        if (ResolvingHelper.isSpace(c)) {
            readSpace(c, state);
            return;
        }
        if (closer != null && c == closer) {
            state.popAndPass(c);
            return;
        }
        if (c == ',') {
            form.addToEnd(Punctuation.of(PunctuationType.COMMA));
            expectingElement = true;
            skipped = false;
            return;
        }
        if (skipped || isLastElementEmpty()) {
            skipped = false;
            readInvalid(c, state, ResolvingHelper.listItemEnd(closer));
            return;
        }
        if (!expectingElement) {
            if (closer == null) {
                state.popAndPass(c);
            } else {
                readInvalid(c, state, ResolvingHelper.listItemEnd(closer));
            }
            return;
        }
        expectingElement = false;
        readElement(c, state);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        if (allowNewLines) {
            form.addToEnd(new NewLine());
        } else {
            state.popAndPassNewLine();
        }
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        if (allowNewLines) {
            readComment(state);
        } else {
            state.popAndPass('#');
        }
    }

    private boolean isLastElementEmpty() {
        return lastElement != null && form.last() == lastElement && lastElement.length() == 0;
    }
}
