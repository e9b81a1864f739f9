package io.github.cyfko.gdsyntax.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InvalidStateExceptionTest {

    @Test
    @DisplayName("Should create InvalidStateException with message")
    void shouldCreateWithMessage() {
        InvalidStateException exception = new InvalidStateException("Cannot pop: the reading stack is empty");

        assertEquals("Cannot pop: the reading stack is empty", exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should keep the cause")
    void shouldKeepCause() {
        Throwable cause = new ArithmeticException("boom");

        InvalidStateException exception = new InvalidStateException("Unbalanced operator chain", cause);

        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should not be mistaken for a reading failure")
    void shouldBeDistinctFromReadingException() {
        assertFalse(ScriptReadingException.class.isAssignableFrom(InvalidStateException.class));
        assertInstanceOf(RuntimeException.class, new InvalidStateException("x"));
    }
}
