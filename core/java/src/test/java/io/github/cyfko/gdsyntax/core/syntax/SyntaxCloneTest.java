package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;
import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;
import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.MethodDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.VariableDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.expressions.DualOperatorExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.NumberExpression;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NumberToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for deep copies of syntax trees.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Syntax Clone Tests")
class SyntaxCloneTest {

    private final BasicScriptReader reader = new BasicScriptReader();

    // ==================== Whole trees ====================

    @Nested
    @DisplayName("Whole trees")
    class WholeTrees {

        @ParameterizedTest
        @ValueSource(strings = {
                "class_name Foo\nextends Node\nvar x: int = 5\nfunc bar():\n\tpass\n",
                "@tool\nsignal hit(amount: int)\nenum State { IDLE, RUNNING, JUMPING = 10 }\n",
                "var ratio: float:\n\tget:\n\t\treturn value / max\n\tset(v):\n\t\tvalue = v * max\n",
                "func f(a = 1, b: Array[int] = []):\n\tfor i in range(3):\n\t\twhile a < i: a += 1\n"
                        + "\tmatch b:\n\t\t[var first, ..]:\n\t\t\tprint(first)\n\t\t_:\n\t\t\tpass\n",
                "class Inner extends Node:\n\tvar d := {\"a\": $Path/To, b = %Unique}\r\n",
                "var s = \"\"\"multi\nline\"\"\" # note\nvar broken = (1 +\n",
                "enum {A B}\nfunc ?? ():\n"
        })
        @DisplayName("A clone serializes like its source")
        void testCloneSerializes(String source) {
            // Given
            ClassDeclaration root = reader.parseFileContent(source);

            // When
            ClassDeclaration copy = (ClassDeclaration) root.clone();

            // Then
            assertEquals(source, copy.toString());
            assertEquals(root.getAllTokens().count(), copy.getAllTokens().count());
            assertEquals(root.getInvalidTokens().size(), copy.getInvalidTokens().size());
        }

        @Test
        @DisplayName("A clone shares no token with its source and is detached")
        void testCloneIsDeep() {
            ClassDeclaration root = reader.parseFileContent("var a = 1\nfunc f(b):\n\treturn a + b\n");

            ClassDeclaration copy = (ClassDeclaration) root.clone();

            Set<SyntaxToken> original = Collections.newSetFromMap(new IdentityHashMap<>());
            original.addAll(root.getAllTokens().collect(Collectors.toList()));
            assertTrue(copy.getAllTokens().noneMatch(original::contains));
            assertNull(copy.getParent());
            copy.getAllTokens().forEach(token -> assertSame(copy, token.getRoot()));
        }

        @Test
        @DisplayName("A clone keeps the structure and queries of its source")
        void testCloneStructure() {
            ClassDeclaration root = reader.parseFileContent(
                    "class_name Foo\nextends Node\nvar x: int = 5\nfunc bar(a, b):\n\tpass\n");

            ClassDeclaration copy = (ClassDeclaration) root.clone();

            assertEquals(root.getClassName(), copy.getClassName());
            assertEquals("Node", copy.getExtends().orElseThrow().toString());
            VariableDeclaration x = copy.getVariables().get(0);
            assertEquals("x", x.getIdentifier().getName());
            assertEquals("int", x.getType().toString());
            assertInstanceOf(NumberExpression.class, x.getInitializer());
            MethodDeclaration bar = copy.getMethods().get(0);
            assertEquals(2, bar.getParameters().size());
            assertEquals(1, bar.getStatements().getElements().size());
            assertEquals(bar.getStatements().getBlockIndentation(),
                    root.getMethods().get(0).getStatements().getBlockIndentation());
        }

        @Test
        @DisplayName("Editing a clone leaves the source unchanged")
        void testCloneIsIndependent() {
            ClassDeclaration root = reader.parseFileContent("var a = 1\n");
            ClassDeclaration copy = (ClassDeclaration) root.clone();

            copy.getVariables().get(0).getForm()
                    .set(VariableDeclaration.State.INITIALIZER.slot(), new NumberExpression(NumberToken.of("2")));

            assertEquals("var a = 1\n", root.toString());
            assertEquals("var a = 2\n", copy.toString());
        }

        @Test
        @DisplayName("Cloning a subtree gives a detached copy of that subtree")
        void testSubtreeClone() {
            ClassDeclaration root = reader.parseFileContent("func f():\n\treturn (a + b) * c\n");
            DualOperatorExpression product = root.getAllTokens(DualOperatorExpression.class).get(0);

            SyntaxNode copy = product.clone();

            assertEquals("(a + b) * c", copy.toString());
            assertNull(copy.getParent());
            assertEquals(0, copy.getStartPosition());
            assertNotSame(product, copy);
        }
    }

    // ==================== Leaves ====================

    @Nested
    @DisplayName("Leaves")
    class Leaves {

        @Test
        @DisplayName("Leaf copies keep their text and kind")
        void testLeafCopies() {
            NumberToken number = NumberToken.of("0xFF");
            StringToken string = reader.parseExpression("'it\\'s'").getAllTokens(StringToken.class).get(0);

            NumberToken numberCopy = number.clone();
            StringToken stringCopy = string.clone();

            assertEquals("0xFF", numberCopy.toString());
            assertEquals(number.getNumberType(), numberCopy.getNumberType());
            assertEquals(255, numberCopy.getLongValue());
            assertEquals("'it\\'s'", stringCopy.toString());
            assertEquals(string.getValue(), stringCopy.getValue());
            assertTrue(stringCopy.isClosed());
        }

        @Test
        @DisplayName("An unclosed string stays unclosed")
        void testUnclosedString() {
            StringToken string = reader.parseExpression("\"open").getAllTokens(StringToken.class).get(0);

            StringToken copy = string.clone();

            assertFalse(copy.isClosed());
            assertEquals("\"open", copy.toString());
        }

        @Test
        @DisplayName("A partially read punctuation keeps its progress")
        void testPartialPunctuation() {
            Punctuation arrow = new Punctuation(PunctuationType.ARROW);
            ReadingState state = new ReadingState(ReaderPolicy.defaults());
            state.push(StatementsList.root());
            state.push(arrow);
            state.passChar('-');

            Punctuation copy = arrow.clone();

            assertEquals("-", copy.toString());
            assertFalse(copy.isComplete());
            assertEquals(arrow.getType(), copy.getType());
        }
    }

    // ==================== Form copies ====================

    @Test
    @DisplayName("A form cannot be copied into a form of another shape")
    void testCopyIntoOtherShape() {
        NumberExpression number = new NumberExpression(NumberToken.of("1"));
        VariableDeclaration variable = new VariableDeclaration(0);

        assertThrows(InvalidStateException.class, () -> number.getForm().copyTo(variable.getForm()));
    }

    @Test
    @DisplayName("A list form is only copied into an empty list")
    void testCopyIntoFilledList() {
        StatementsList statements = reader.parseStatements("pass\n");
        StatementsList target = reader.parseStatements("pass\n");

        assertThrows(InvalidStateException.class, () -> statements.getForm().copyTo(target.getForm()));
    }
}
