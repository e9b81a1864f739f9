package io.github.cyfko.gdsyntax.core;

import io.github.cyfko.gdsyntax.core.api.ScriptReader;
import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;
import io.github.cyfko.gdsyntax.core.exception.ScriptReadingException;
import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ScriptReaderFactory}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("ScriptReaderFactory Tests")
class ScriptReaderFactoryTest {

    @Test
    @DisplayName("Default reader uses the default policy")
    void testCreateDefault() {
        ScriptReader reader = ScriptReaderFactory.create();

        BasicScriptReader basic = assertInstanceOf(BasicScriptReader.class, reader);
        assertEquals(ReaderPolicy.defaults(), basic.getPolicy());
    }

    @Test
    @DisplayName("Reader honours the given policy")
    void testCreateWithPolicy() {
        ScriptReader reader = ScriptReaderFactory.create(ReaderPolicy.builder().maxContentLength(5).build());

        assertThrows(ScriptReadingException.class, () -> reader.parseFileContent("extends Node"));
        assertDoesNotThrow(() -> reader.parseFileContent("var a"));
    }

    @Test
    @DisplayName("Null policy is rejected")
    void testNullPolicy() {
        assertThrows(IllegalArgumentException.class, () -> ScriptReaderFactory.create(null));
    }

    @Test
    @DisplayName("Readers are independent and reusable")
    void testReusable() {
        ScriptReader reader = ScriptReaderFactory.create();

        String first = reader.parseFileContent("var a = 1\n").toString();
        String second = reader.parseFileContent("var b = 2\n").toString();

        assertEquals("var a = 1\n", first);
        assertEquals("var b = 2\n", second);
    }
}
