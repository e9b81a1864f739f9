package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.StringExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for leaf tokens: literals, comments and their factories.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Tokens Tests")
class TokensTest {

    private final BasicScriptReader reader = new BasicScriptReader();

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @ParameterizedTest
        @CsvSource({
            "0x1F, HEX",
            "0b1010_1010, BINARY",
            "1e10, DOUBLE",
            "2.5e-3, DOUBLE",
            "7, INT"
        })
        @DisplayName("Number types are recognized from their text")
        void testNumberTypes(String text, NumberType type) {
            assertEquals(type, NumberToken.of(text).getNumberType());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", ".5", "x1", "12a"})
        @DisplayName("Factory rejects text that is not a number literal")
        void testInvalidNumber(String text) {
            assertThrows(IllegalArgumentException.class, () -> NumberToken.of(text));
        }

        @Test
        @DisplayName("Double value of a scientific literal")
        void testScientific() {
            assertEquals(0.0025, NumberToken.of("2.5e-3").getDoubleValue(), 1e-12);
        }

        @Test
        @DisplayName("Underscores are ignored in values but kept in text")
        void testUnderscores() {
            NumberToken token = NumberToken.of("0xFF_FF");

            assertEquals(65535, token.getLongValue());
            assertEquals("0xFF_FF", token.toString());
        }
    }

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        @DisplayName("Escapes are kept raw and do not close the string")
        void testEscapedQuote() {
            Expression expression = reader.parseExpression("\"say \\\"hi\\\"\"");

            StringToken string = ((StringExpression) expression).getString();
            assertTrue(string.isClosed());
            assertEquals("say \\\"hi\\\"", string.getValue());
            assertEquals(StringBoundingType.DOUBLE_QUOTAS, string.getBoundingType());
        }

        @Test
        @DisplayName("Triple-quoted strings span lines")
        void testTripleQuoted() {
            Expression expression = reader.parseExpression("'''a\nb'''");

            StringToken string = ((StringExpression) expression).getString();
            assertEquals("a\nb", string.getValue());
            assertEquals(StringBoundingType.TRIPLE_SINGLE_QUOTAS, string.getBoundingType());
        }

        @Test
        @DisplayName("Unclosed string runs to the end of the content")
        void testUnclosed() {
            Expression expression = reader.parseExpression("\"open");

            assertFalse(((StringExpression) expression).getString().isClosed());
            assertEquals("\"open", expression.toString());
        }

        @Test
        @DisplayName("Factory builds a closed literal")
        void testFactory() {
            StringToken token = StringToken.of("text", StringBoundingType.SINGLE_QUOTAS);

            assertEquals("'text'", token.toString());
            assertTrue(token.isClosed());
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        @DisplayName("Comment text excludes the sharp sign")
        void testText() {
            assertEquals(" note", Comment.of("# note").getText());
        }

        @ParameterizedTest
        @ValueSource(strings = {"note", "# a\nb", "# a\r"})
        @DisplayName("Factory rejects text that is not a single comment")
        void testInvalid(String text) {
            assertThrows(IllegalArgumentException.class, () -> Comment.of(text));
        }
    }

    @Test
    @DisplayName("Keywords resolve their type from text")
    void testKeywordType() {
        assertEquals(KeywordType.FUNC, Keyword.of("func").getType());
        assertNull(Keyword.of("speed").getType());
        assertTrue(Keyword.of(KeywordType.RETURN).is(KeywordType.RETURN));
    }
}
