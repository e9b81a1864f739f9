package io.github.cyfko.gdsyntax.core.syntax;

/**
 * A reading state of a {@link TokensForm}, bound to the slot filled while in that state.
 * <p>
 * State enums list their constants in slot order, so the default mapping is the ordinal.
 * The constant following the last slot is the completed state; trivia received there is
 * appended after every slot.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface SlotState {

    default int slot() {
        return ((Enum<?>) this).ordinal();
    }
}
