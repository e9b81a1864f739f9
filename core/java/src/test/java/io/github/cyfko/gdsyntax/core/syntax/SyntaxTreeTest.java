package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;
import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.MethodDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.expressions.NumberExpression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NumberToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tree navigation and slot bookkeeping shared by every node.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Syntax Tree Tests")
class SyntaxTreeTest {

    private final BasicScriptReader reader = new BasicScriptReader();

    @Test
    @DisplayName("Every token reaches the root through its parents")
    void testParents() {
        ClassDeclaration root = reader.parseFileContent("func f(a):\n\treturn a\n");

        root.getAllTokens().forEach(token -> assertSame(root, token.getRoot()));
        MethodDeclaration method = root.getMethods().get(0);
        assertSame(root.getMembersList(), method.getParent());
    }

    @Test
    @DisplayName("Typed search walks the whole tree")
    void testTypedSearch() {
        ClassDeclaration root = reader.parseFileContent("var a = b\nfunc f(c):\n\treturn d.e\n");

        List<Identifier> identifiers = root.getAllTokens(Identifier.class);

        assertEquals(List.of("a", "b", "f", "c", "d", "e"),
                identifiers.stream().map(Identifier::getName).toList());
    }

    @Test
    @DisplayName("Columns and lines of nested tokens")
    void testPositions() {
        ClassDeclaration root = reader.parseFileContent("var a = 1\nfunc f():\n\treturn 42\n");

        NumberToken answer = root.getAllTokens(NumberToken.class).get(1);
        assertEquals(2, answer.getStartLine());
        assertEquals(8, answer.getStartColumn());
        assertEquals(28, answer.getStartPosition());
    }

    @Test
    @DisplayName("Slot states only move forward")
    void testForwardOnlyState() {
        NumberExpression number = new NumberExpression(NumberToken.of("1"));

        assertThrows(InvalidStateException.class, () -> number.getForm().setState(NumberExpression.State.NUMBER));
    }

    @Test
    @DisplayName("A detached token is its own root")
    void testDetached() {
        Identifier identifier = Identifier.of("alone");

        assertNull(identifier.getParent());
        assertSame(identifier, identifier.getRoot());
        assertEquals(0, identifier.getStartPosition());
    }

    // ==================== End positions ====================

    @Test
    @DisplayName("End line and column of tokens, a line feed ending on the next line")
    void testEndPositions() {
        // Given
        ClassDeclaration root = reader.parseFileContent("extends Node2D\n\nclass_name Usage\n");

        // When
        List<SyntaxToken> leaves = root.getAllTokens()
                .filter(token -> !(token instanceof SyntaxNode))
                .filter(token -> token.length() > 0)
                .toList();

        // Then
        assertPosition(leaves.get(0), "extends", 0, 0, 0, 7);
        assertPosition(leaves.get(1), " ", 0, 7, 0, 8);
        assertPosition(leaves.get(2), "Node2D", 0, 8, 0, 14);
        assertPosition(leaves.get(3), "\n", 0, 14, 1, 0);
        assertPosition(leaves.get(4), "\n", 1, 0, 2, 0);
        assertPosition(leaves.get(5), "class_name", 2, 0, 2, 10);
        assertPosition(leaves.get(7), "Usage", 2, 11, 2, 16);
    }

    @Test
    @DisplayName("Every token covers the root text between its start and end offsets")
    void testOffsetsMatchRootText() {
        String source = "extends Node\n\nvar speed := 4.5 # px\r\nfunc run(delta):\n"
                + "\tif speed > 0:\n\t\tmove(speed * delta)\n\telse:\n\t\tpass\n";
        ClassDeclaration root = reader.parseFileContent(source);

        root.getAllTokens().forEach(token -> {
            int start = token.getStartPosition();
            int end = token.getEndPosition();
            assertEquals(token.length(), end - start, token.getClass().getSimpleName());
            assertEquals(token.toString(), source.substring(start, end));
            assertEquals(source.substring(0, start).split("\n", -1).length - 1, token.getStartLine());
            assertEquals(source.substring(0, end).split("\n", -1).length - 1, token.getEndLine());
        });
    }

    @Test
    @DisplayName("The whole line of a token is the source line it ends on")
    void testWholeLine() {
        // Given
        String source = "extends Node2D \n\nclass_name Usage \n\n# Called first. \nfunc _ready(): \n\tpass\n\n"
                + "func updateSample(obj):\n\tvar value = obj.t()\n\n    print(value)\n";
        String[] lines = source.split("\n", -1);

        // When
        ClassDeclaration root = reader.parseFileContent(source);

        // Then
        assertEquals(source, root.toString());
        root.getAllTokens().forEach(token -> assertEquals(lines[token.getEndLine()], token.getWholeLine()));
    }

    @Test
    @DisplayName("Positions of the last token of a long script")
    void testPositionsOnLongScript() {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 2_000; i++) {
            source.append("var v").append(i).append(" = ").append(i).append("\n");
        }
        ClassDeclaration root = reader.parseFileContent(source.toString());

        List<NumberToken> numbers = root.getAllTokens(NumberToken.class);
        NumberToken last = numbers.get(numbers.size() - 1);

        assertEquals(1_999, last.getStartLine());
        assertEquals(source.length() - 5, last.getStartPosition());
        assertEquals(source.length() - 1, last.getEndPosition());
        assertEquals("var v1999 = 1999", last.getWholeLine());
    }

    private static void assertPosition(SyntaxToken token, String text, int startLine, int startColumn,
                                       int endLine, int endColumn) {
        assertEquals(text, token.toString());
        assertEquals(startLine, token.getStartLine(), "start line of " + text);
        assertEquals(startColumn, token.getStartColumn(), "start column of " + text);
        assertEquals(endLine, token.getEndLine(), "end line of " + text);
        assertEquals(endColumn, token.getEndColumn(), "end column of " + text);
    }
}
