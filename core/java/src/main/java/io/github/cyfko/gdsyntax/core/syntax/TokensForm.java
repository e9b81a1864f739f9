package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fixed-slot form of a node: each grammar position of the node is a numbered slot, and trivia
 * read between positions is kept in between the slots, in order.
 * <p>
 * The form also carries the reading state of its node. States only move forward: once a slot is
 * passed, the node never comes back to it.
 * </p>
 *
 * <pre>{@code
 * enum State implements SlotState { LEFT, OPERATOR, RIGHT, COMPLETED }
 *
 * TokensForm<State> form = new TokensForm<>(this, 3, State.LEFT);
 * form.set(State.LEFT.slot(), left);
 * form.setState(State.OPERATOR);
 * form.addBeforeActiveToken(space); // lands between LEFT and OPERATOR
 * }</pre>
 *
 * @param <S> the state enum of the owning node
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokensForm<S extends Enum<S> & SlotState> implements Form {

    private static final class Cell {
        private final int slot;
        private SyntaxToken token;

        private Cell(int slot, SyntaxToken token) {
            this.slot = slot;
            this.token = token;
        }
    }

    private final SyntaxNode owner;
    private final List<Cell> cells = new ArrayList<>();
    private final Cell[] slots;
    private S state;

    public TokensForm(SyntaxNode owner, int size, S initialState) {
        this.owner = Objects.requireNonNull(owner, "Form owner cannot be null");
        this.state = Objects.requireNonNull(initialState, "Initial state cannot be null");
        this.slots = new Cell[size];
        for (int i = 0; i < size; i++) {
            slots[i] = new Cell(i, null);
            cells.add(slots[i]);
        }
    }

    public int size() {
        return slots.length;
    }

    public S getState() {
        return state;
    }

    /**
     * @throws InvalidStateException if {@code newState} comes before the current state
     */
    public void setState(S newState) {
        if (newState.compareTo(state) < 0) {
            throw new InvalidStateException(String.format("%s cannot move back from state %s to %s",
                    owner.getClass().getSimpleName(), state, newState));
        }
        state = newState;
    }

    public boolean isOrLowerState(S other) {
        return state.compareTo(other) <= 0;
    }

    public boolean isState(S other) {
        return state == other;
    }

    public SyntaxToken get(int slot) {
        return slots[checkSlot(slot)].token;
    }

    /**
     * @return the token of the slot if it has the given type, {@code null} otherwise
     */
    public <T extends SyntaxToken> T get(int slot, Class<T> type) {
        SyntaxToken token = get(slot);
        return type.isInstance(token) ? type.cast(token) : null;
    }

    public void set(int slot, SyntaxToken token) {
        Cell cell = slots[checkSlot(slot)];
        if (cell.token != null && cell.token != token) {
            cell.token.setParent(null);
        }
        if (token != null) {
            token.setParent(owner);
        }
        cell.token = token;
    }

    public <T extends SyntaxToken> T getOrInit(int slot, Class<T> type, Supplier<T> init) {
        T existing = get(slot, type);
        if (existing != null) {
            return existing;
        }
        T created = init.get();
        set(slot, created);
        return created;
    }

    /**
     * Inserts a token right before the given slot, after any trivia already placed there.
     * A slot index past the last slot appends the token.
     */
    public void addBefore(int slot, SyntaxToken token) {
        if (slot >= slots.length) {
            addToEnd(token);
            return;
        }
        token.setParent(owner);
        cells.add(cells.indexOf(slots[checkSlot(slot)]), new Cell(-1, token));
    }

    @Override
    public void addBeforeActiveToken(SyntaxToken token) {
        addBefore(state.slot(), token);
    }

    @Override
    public void addFirst(SyntaxToken token) {
        token.setParent(owner);
        cells.add(0, new Cell(-1, token));
    }

    @Override
    public void addToEnd(SyntaxToken token) {
        token.setParent(owner);
        cells.add(new Cell(-1, token));
    }

    /**
     * Replaces the content and state of {@code target} with deep copies of this form's cells.
     */
    @Override
    public void copyTo(Form target) {
        if (!(target instanceof TokensForm<?> other) || other.slots.length != slots.length
                || other.state.getDeclaringClass() != state.getDeclaringClass()) {
            throw new InvalidStateException("Cannot copy the form of " + owner.getClass().getSimpleName()
                    + " into a form of another shape");
        }
        @SuppressWarnings("unchecked")
        TokensForm<S> copy = (TokensForm<S>) other;
        copy.cells.forEach(cell -> {
            if (cell.token != null) {
                cell.token.setParent(null);
            }
        });
        copy.cells.clear();
        for (Cell cell : cells) {
            SyntaxToken token = cell.token == null ? null : cell.token.clone();
            if (token != null) {
                token.setParent(copy.owner);
            }
            if (cell.slot < 0) {
                copy.cells.add(new Cell(-1, token));
            } else {
                copy.slots[cell.slot].token = token;
                copy.cells.add(copy.slots[cell.slot]);
            }
        }
        copy.state = state;
    }

    @Override
    public Iterator<SyntaxToken> iterator() {
        return cells.stream()
                .filter(cell -> cell.token != null)
                .map(cell -> cell.token)
                .iterator();
    }

    private int checkSlot(int slot) {
        if (slot < 0 || slot >= slots.length) {
            throw new InvalidStateException(String.format("Slot %d out of range for %s (size %d)",
                    slot, owner.getClass().getSimpleName(), slots.length));
        }
        return slot;
    }
}
