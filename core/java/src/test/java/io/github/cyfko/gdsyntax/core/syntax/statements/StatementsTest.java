package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;
import io.github.cyfko.gdsyntax.core.syntax.expressions.*;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperatorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for block statements and their indentation-driven nesting.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Statements Tests")
class StatementsTest {

    private final BasicScriptReader reader = new BasicScriptReader();

    private List<Statement> read(String source) {
        StatementsList statements = reader.parseStatements(source);
        assertEquals(source, statements.toString());
        assertTrue(statements.getInvalidTokens().isEmpty(), () -> "Unexpected invalid tokens in:\n" + source);
        return statements.getElements();
    }

    // ==================== Conditionals ====================

    @Nested
    @DisplayName("if / elif / else")
    class Conditionals {

        @Test
        @DisplayName("Full chain of branches")
        void testFullChain() {
            List<Statement> statements = read(
                    "if a:\n\tx = 1\nelif b:\n\tx = 2\nelif c:\n\tx = 3\nelse:\n\tx = 4\nprint(x)\n");

            assertEquals(2, statements.size());
            IfStatement ifStatement = assertInstanceOf(IfStatement.class, statements.get(0));
            assertEquals("a", ((IdentifierExpression) ifStatement.getIfBranch().getCondition()).getName());
            assertEquals(2, ifStatement.getElifBranches().size());
            assertEquals("c", ((IdentifierExpression) ifStatement.getElifBranches().get(1).getCondition()).getName());
            assertNotNull(ifStatement.getElseBranch());
            assertEquals(1, ifStatement.getElseBranch().getStatements().getElements().size());
        }

        @Test
        @DisplayName("if without else hands the next line back")
        void testIfAlone() {
            List<Statement> statements = read("if a:\n\tpass\nvar elsewhere = 1\n");

            assertEquals(2, statements.size());
            IfStatement ifStatement = assertInstanceOf(IfStatement.class, statements.get(0));
            assertTrue(ifStatement.getElifBranches().isEmpty());
            assertNull(ifStatement.getElseBranch());
            assertInstanceOf(VariableDeclarationStatement.class, statements.get(1));
        }

        @Test
        @DisplayName("Nested if binds else to the right level")
        void testNestedElse() {
            List<Statement> statements = read("if a:\n\tif b:\n\t\tpass\nelse:\n\tpass\n");

            assertEquals(1, statements.size());
            IfStatement outer = (IfStatement) statements.get(0);
            assertNotNull(outer.getElseBranch());
            IfStatement inner = (IfStatement) outer.getIfBranch().getStatements().getElements().get(0);
            assertNull(inner.getElseBranch());
        }

        @Test
        @DisplayName("Inline branches")
        void testInlineBranches() {
            IfStatement ifStatement = (IfStatement) read("if a: return 1\nelse: return 2\n").get(0);

            assertTrue(ifStatement.getIfBranch().getStatements().isInline());
            assertNotNull(ifStatement.getElseBranch());
        }
    }

    // ==================== Loops ====================

    @Nested
    @DisplayName("Loops")
    class Loops {

        @Test
        @DisplayName("for over a collection")
        void testFor() {
            ForStatement loop = (ForStatement) read("for item in items:\n\tprint(item)\n").get(0);

            assertEquals("item", loop.getVariable().getName());
            assertNull(loop.getVariableType());
            assertEquals("items", ((IdentifierExpression) loop.getCollection()).getName());
            assertEquals(1, loop.getStatements().getElements().size());
        }

        @Test
        @DisplayName("for with a typed variable")
        void testTypedFor() {
            ForStatement loop = (ForStatement) read("for i: int in range(10):\n\tcontinue\n").get(0);

            assertEquals("int", loop.getVariableType().getTypeName());
            assertInstanceOf(CallExpression.class, loop.getCollection());
        }

        @Test
        @DisplayName("while with break")
        void testWhile() {
            WhileStatement loop = (WhileStatement) read("while i < 10:\n\ti += 1\n\tif i == 5:\n\t\tbreak\n").get(0);

            DualOperatorExpression condition = (DualOperatorExpression) loop.getCondition();
            assertEquals(DualOperatorType.LESS, condition.getOperatorType());
            assertEquals(2, loop.getStatements().getElements().size());
        }
    }

    // ==================== Match ====================

    @Nested
    @DisplayName("match")
    class Match {

        @Test
        @DisplayName("Cases with literals, bindings, wildcards and guards")
        void testMatch() {
            MatchStatement match = (MatchStatement) read(
                    "match value:\n"
                    + "\t1, 2:\n\t\tprint(\"small\")\n"
                    + "\t[var first, ..]:\n\t\tprint(first)\n"
                    + "\tvar n when n > 10:\n\t\tprint(\"big\")\n"
                    + "\t_:\n\t\tpass\n").get(0);

            assertEquals("value", ((IdentifierExpression) match.getValue()).getName());
            List<MatchCaseDeclaration> cases = match.getCases();
            assertEquals(4, cases.size());
            assertEquals(2, cases.get(0).getPatterns().size());

            ArrayInitializerExpression array = (ArrayInitializerExpression) cases.get(1).getPatterns().get(0);
            assertInstanceOf(MatchCaseVariableExpression.class, array.getValues().get(0));
            assertInstanceOf(MatchRestExpression.class, array.getValues().get(1));

            assertNotNull(cases.get(2).getGuard());
            assertInstanceOf(MatchDefaultOperatorExpression.class, cases.get(3).getPatterns().get(0));
            assertNull(cases.get(3).getGuard());
        }
    }

    // ==================== Simple statements ====================

    @Nested
    @DisplayName("Simple statements")
    class Simple {

        @Test
        @DisplayName("Local variable and constant")
        void testLocalVariables() {
            List<Statement> statements = read("var a: int = 1\nconst B := 2\nvar c\n");

            VariableDeclarationStatement a = (VariableDeclarationStatement) statements.get(0);
            assertEquals("int", a.getType().getTypeName());
            VariableDeclarationStatement b = (VariableDeclarationStatement) statements.get(1);
            assertTrue(b.isConstant());
            assertTrue(b.isTypeInferred());
            VariableDeclarationStatement c = (VariableDeclarationStatement) statements.get(2);
            assertNull(c.getInitializer());
        }

        @Test
        @DisplayName("return with and without a value")
        void testReturn() {
            List<Statement> statements = read("return\nreturn a + 1\n");

            ReturnExpression bare = (ReturnExpression) ((ExpressionStatement) statements.get(0)).getExpression();
            assertNull(bare.getResult());
            ReturnExpression valued = (ReturnExpression) ((ExpressionStatement) statements.get(1)).getExpression();
            assertInstanceOf(DualOperatorExpression.class, valued.getResult());
        }

        @Test
        @DisplayName("Semicolons separate statements on one line")
        void testSemicolons() {
            assertEquals(3, read("a = 1; b = 2; c = 3\n").size());
        }

        @Test
        @DisplayName("Lambda with a multi-line body")
        void testLambda() {
            List<Statement> statements = read("var cb = func(x: int) -> int:\n\tvar y = x * 2\n\treturn y\ncb.call(1)\n");

            assertEquals(2, statements.size());
            MethodExpression lambda = (MethodExpression) ((VariableDeclarationStatement) statements.get(0)).getInitializer();
            assertEquals(1, lambda.getParameters().size());
            assertEquals("int", lambda.getReturnType().getTypeName());
            assertEquals(2, lambda.getStatements().getElements().size());
        }

        @Test
        @DisplayName("await on a signal")
        void testAwait() {
            ExpressionStatement statement = (ExpressionStatement) read("await get_tree().process_frame\n").get(0);

            AwaitExpression await = assertInstanceOf(AwaitExpression.class, statement.getExpression());
            assertInstanceOf(MemberOperatorExpression.class, await.getExpression());
        }

        @Test
        @DisplayName("Blank lines, comments and stray indentation do not split statements")
        void testTrivia() {
            List<Statement> statements = read("a()\n\n# note\n\tb()\nc()\n");

            assertEquals(3, statements.size());
        }
    }
}
