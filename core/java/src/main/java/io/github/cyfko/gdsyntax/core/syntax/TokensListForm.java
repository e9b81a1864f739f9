package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Open-ended form of list nodes: elements and the trivia or separators between them, in order.
 *
 * @param <T> the element type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokensListForm<T extends SyntaxToken> implements Form {

    private final SyntaxNode owner;
    private final Class<T> elementType;
    private final List<SyntaxToken> tokens = new ArrayList<>();

    public TokensListForm(SyntaxNode owner, Class<T> elementType) {
        this.owner = Objects.requireNonNull(owner, "Form owner cannot be null");
        this.elementType = Objects.requireNonNull(elementType, "Element type cannot be null");
    }

    /**
     * @return the elements of the list, separators and trivia excluded
     */
    public List<T> elements() {
        return tokens.stream()
                .filter(elementType::isInstance)
                .map(elementType::cast)
                .collect(Collectors.toList());
    }

    public Class<T> elementType() {
        return elementType;
    }

    public List<SyntaxToken> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public SyntaxToken last() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public void addBeforeActiveToken(SyntaxToken token) {
        addToEnd(token);
    }

    @Override
    public void addFirst(SyntaxToken token) {
        token.setParent(owner);
        tokens.add(0, token);
    }

    @Override
    public void addToEnd(SyntaxToken token) {
        token.setParent(owner);
        tokens.add(token);
    }

    @Override
    public void copyTo(Form target) {
        if (!(target instanceof TokensListForm<?> other) || other.elementType != elementType) {
            throw new InvalidStateException("Cannot copy the list of " + owner.getClass().getSimpleName()
                    + " into a list of another element type");
        }
        if (!other.tokens.isEmpty()) {
            throw new InvalidStateException("Target list of " + other.owner.getClass().getSimpleName()
                    + " is not empty");
        }
        tokens.forEach(token -> other.addToEnd(token.clone()));
    }

    @Override
    public Iterator<SyntaxToken> iterator() {
        return Collections.unmodifiableList(tokens).iterator();
    }
}
