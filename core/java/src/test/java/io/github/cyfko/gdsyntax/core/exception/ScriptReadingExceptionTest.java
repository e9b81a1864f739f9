package io.github.cyfko.gdsyntax.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScriptReadingExceptionTest {

    @Test
    @DisplayName("Should create ScriptReadingException with message")
    void shouldCreateWithMessage() {
        // Given
        String message = "Script content too long";

        // When
        ScriptReadingException exception = new ScriptReadingException(message);

        // Then
        assertEquals(message, exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should create ScriptReadingException with message and cause")
    void shouldCreateWithMessageAndCause() {
        // Given
        String message = "Nesting too deep";
        Throwable cause = new IllegalStateException("Root cause");

        // When
        ScriptReadingException exception = new ScriptReadingException(message, cause);

        // Then
        assertEquals(message, exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should be unchecked")
    void shouldBeRuntimeException() {
        assertInstanceOf(RuntimeException.class, new ScriptReadingException("x"));
    }

    @Test
    @DisplayName("Should be throwable and catchable")
    void shouldBeThrowable() {
        ScriptReadingException thrown = assertThrows(ScriptReadingException.class, () -> {
            throw new ScriptReadingException("Script content cannot be null");
        });

        assertEquals("Script content cannot be null", thrown.getMessage());
    }
}
