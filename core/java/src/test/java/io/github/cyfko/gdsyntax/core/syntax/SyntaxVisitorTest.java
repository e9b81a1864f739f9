package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.impl.BasicScriptReader;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.declarations.MethodDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.expressions.DualOperatorExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the depth-first walk of syntax trees.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Syntax Visitor Tests")
class SyntaxVisitorTest {

    private final BasicScriptReader reader = new BasicScriptReader();

    // ==================== Walk order ====================

    @Nested
    @DisplayName("Walk order")
    class WalkOrder {

        @ParameterizedTest
        @ValueSource(strings = {
                "extends Node\nvar a := 1 # one\n",
                "func f(x, y = 2):\n\tif x:\n\t\treturn [x, {\"k\": y}]\n\telse:\n\t\tpass\n",
                "enum {A B}\nvar = \n",
                "func g():\r\n\tmatch v:\r\n\t\t1, 2:\r\n\t\t\tpass\r\n"
        })
        @DisplayName("Leaves in walk order rebuild the source")
        void testLeavesRebuildSource(String source) {
            // Given
            ClassDeclaration root = reader.parseFileContent(source);
            StringBuilder text = new StringBuilder();

            // When
            root.accept(new SyntaxVisitor() {
                @Override
                public void visitToken(SyntaxToken token) {
                    text.append(token);
                }
            });

            // Then
            assertEquals(source, text.toString());
        }

        @Test
        @DisplayName("Nodes are entered before and left after their children")
        void testNesting() {
            Expression expression = reader.parseExpression("a + b");
            List<String> events = new ArrayList<>();

            expression.accept(new SyntaxVisitor() {
                @Override
                public boolean enterNode(SyntaxNode node) {
                    events.add("enter " + node.getClass().getSimpleName());
                    return true;
                }

                @Override
                public void leaveNode(SyntaxNode node) {
                    events.add("leave " + node.getClass().getSimpleName());
                }

                @Override
                public void visitToken(SyntaxToken token) {
                    events.add("'" + token + "'");
                }
            });

            assertEquals(List.of(
                    "enter DualOperatorExpression",
                    "enter IdentifierExpression", "'a'", "leave IdentifierExpression",
                    "' '", "'+'", "' '",
                    "enter IdentifierExpression", "'b'", "leave IdentifierExpression",
                    "leave DualOperatorExpression"), events);
        }

        @Test
        @DisplayName("Invalid tokens are walked like any other token")
        void testInvalidTokensVisited() {
            ClassDeclaration root = reader.parseFileContent("var x = 1 ?? 2\n");
            List<SyntaxToken> invalid = new ArrayList<>();

            root.accept(new SyntaxVisitor() {
                @Override
                public void visitToken(SyntaxToken token) {
                    if (token instanceof InvalidToken) {
                        invalid.add(token);
                    }
                }
            });

            assertFalse(invalid.isEmpty());
            assertEquals(root.getInvalidTokens(), invalid);
        }
    }

    // ==================== Skipping ====================

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Skipping subtrees")
    class Skipping {

        @Mock
        private SyntaxVisitor visitor;

        @Test
        @DisplayName("Refusing a node skips its children but still leaves it")
        void testSkipChildren() {
            // Given
            Expression expression = reader.parseExpression("a * b");
            when(visitor.enterNode(any())).thenReturn(false);

            // When
            expression.accept(visitor);

            // Then
            InOrder inOrder = inOrder(visitor);
            inOrder.verify(visitor).enterNode(expression);
            inOrder.verify(visitor).leaveNode(expression);
            verify(visitor, never()).visitToken(any());
        }

        @Test
        @DisplayName("Method bodies can be skipped while members are walked")
        void testSkipMethodBodies() {
            // Given
            ClassDeclaration root = reader.parseFileContent("var a = 1\nfunc f():\n\treturn b + c\n");
            when(visitor.enterNode(any())).thenAnswer(call -> !(call.getArgument(0) instanceof MethodDeclaration));

            // When
            root.accept(visitor);

            // Then
            verify(visitor).enterNode(root.getMethods().get(0));
            verify(visitor, never()).enterNode(any(DualOperatorExpression.class));
            verify(visitor, never()).visitToken(root.getMethods().get(0).getAllTokens(Identifier.class).get(0));
            verify(visitor).visitToken(root.getVariables().get(0).getIdentifier());
        }

        @Test
        @DisplayName("A leaf token reports itself once")
        void testLeafAccept() {
            Identifier identifier = Identifier.of("alone");

            identifier.accept(visitor);

            verify(visitor).visitToken(identifier);
            verifyNoMoreInteractions(visitor);
        }
    }
}
