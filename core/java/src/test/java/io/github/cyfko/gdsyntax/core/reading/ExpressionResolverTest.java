package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;
import io.github.cyfko.gdsyntax.core.syntax.expressions.*;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperatorType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NumberType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.SingleOperatorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Test suite for {@link ExpressionResolver}.
 * <p>
 * Covers operator precedence and associativity, literal forms, postfix chains and the
 * hand-over of the finished expression to its owner.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ExpressionResolver Tests")
class ExpressionResolverTest {

    @Mock
    private TokenReceiver<Expression> receiver;

    private Expression resolve(String source) {
        ReadingState state = new ReadingState(ReaderPolicy.defaults());
        state.push(new ExpressionResolver(receiver, ExpressionContext.of(0)));
        state.passString(source);
        state.completeReading();

        ArgumentCaptor<Expression> captor = ArgumentCaptor.forClass(Expression.class);
        verify(receiver).handleReceivedToken(captor.capture());
        Expression expression = captor.getValue();
        assertEquals(source, expression.toString(), "Expression must serialize back to its source");
        return expression;
    }

    private static DualOperatorExpression dual(Expression expression, DualOperatorType type) {
        DualOperatorExpression dual = assertInstanceOf(DualOperatorExpression.class, expression);
        assertEquals(type, dual.getOperatorType());
        return dual;
    }

    private static void assertIdentifier(String name, Expression expression) {
        assertEquals(name, assertInstanceOf(IdentifierExpression.class, expression).getName());
    }

    // ==================== Precedence ====================

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void testMultiplicationFirst() {
            DualOperatorExpression add = dual(resolve("a + b * c"), DualOperatorType.ADD);

            assertIdentifier("a", add.getLeft());
            DualOperatorExpression multiply = dual(add.getRight(), DualOperatorType.MULTIPLY);
            assertIdentifier("b", multiply.getLeft());
            assertIdentifier("c", multiply.getRight());
        }

        @Test
        @DisplayName("Brackets override precedence")
        void testBrackets() {
            DualOperatorExpression multiply = dual(resolve("(a + b) * c"), DualOperatorType.MULTIPLY);

            BracketExpression bracket = assertInstanceOf(BracketExpression.class, multiply.getLeft());
            dual(bracket.getExpression(), DualOperatorType.ADD);
            assertIdentifier("c", multiply.getRight());
        }

        @Test
        @DisplayName("Subtraction is left-associative")
        void testLeftAssociative() {
            DualOperatorExpression outer = dual(resolve("a - b - c"), DualOperatorType.SUBTRACT);

            dual(outer.getLeft(), DualOperatorType.SUBTRACT);
            assertIdentifier("c", outer.getRight());
        }

        @Test
        @DisplayName("Comparisons chain to the left while assignments chain to the right")
        void testMixedAssociativity() {
            DualOperatorExpression assign = dual(resolve("a > b > c = d = e > f > g"), DualOperatorType.ASSIGNMENT);

            DualOperatorExpression left = dual(assign.getLeft(), DualOperatorType.GREATER);
            dual(left.getLeft(), DualOperatorType.GREATER);
            assertIdentifier("c", left.getRight());

            DualOperatorExpression innerAssign = dual(assign.getRight(), DualOperatorType.ASSIGNMENT);
            assertIdentifier("d", innerAssign.getLeft());
            DualOperatorExpression right = dual(innerAssign.getRight(), DualOperatorType.GREATER);
            dual(right.getLeft(), DualOperatorType.GREATER);
            assertIdentifier("g", right.getRight());
        }

        @Test
        @DisplayName("Unary minus binds tighter than multiplication")
        void testNegate() {
            DualOperatorExpression multiply = dual(resolve("-a * b"), DualOperatorType.MULTIPLY);

            SingleOperatorExpression negate = assertInstanceOf(SingleOperatorExpression.class, multiply.getLeft());
            assertEquals(SingleOperatorType.NEGATE, negate.getOperatorType());
            assertIdentifier("a", negate.getOperand());
        }

        @Test
        @DisplayName("Power binds tighter than unary minus")
        void testPowerOverNegate() {
            SingleOperatorExpression negate = assertInstanceOf(SingleOperatorExpression.class, resolve("-a ** 2"));

            dual(negate.getOperand(), DualOperatorType.POWER);
        }

        @Test
        @DisplayName("Keyword not binds tighter than and")
        void testNotAnd() {
            DualOperatorExpression and = dual(resolve("not a and b"), DualOperatorType.AND);

            SingleOperatorExpression not = assertInstanceOf(SingleOperatorExpression.class, and.getLeft());
            assertEquals(SingleOperatorType.NOT2, not.getOperatorType());
            assertIdentifier("b", and.getRight());
        }

        @Test
        @DisplayName("And binds tighter than or")
        void testAndOr() {
            DualOperatorExpression or = dual(resolve("a or b and c"), DualOperatorType.OR);

            dual(or.getRight(), DualOperatorType.AND);
        }

        @Test
        @DisplayName("Ternary selects between two expressions")
        void testTernary() {
            IfExpression ternary = assertInstanceOf(IfExpression.class, resolve("x if c else y"));

            assertIdentifier("x", ternary.getTrueExpression());
            assertIdentifier("c", ternary.getCondition());
            assertIdentifier("y", ternary.getFalseExpression());
        }

        @Test
        @DisplayName("Ternary takes the whole arithmetic on each side")
        void testTernaryWithArithmetic() {
            IfExpression ternary = assertInstanceOf(IfExpression.class, resolve("a + 1 if a > 0 else a - 1"));

            dual(ternary.getTrueExpression(), DualOperatorType.ADD);
            dual(ternary.getCondition(), DualOperatorType.GREATER);
            dual(ternary.getFalseExpression(), DualOperatorType.SUBTRACT);
        }
    }

    // ==================== Membership ====================

    @Nested
    @DisplayName("Membership operators")
    class Membership {

        @Test
        @DisplayName("in is a plain membership test")
        void testIn() {
            DualOperatorExpression in = dual(resolve("item in items"), DualOperatorType.IN);

            assertFalse(in.isNotIn());
        }

        @Test
        @DisplayName("not in is a negated membership test")
        void testNotIn() {
            DualOperatorExpression in = dual(resolve("item not in items"), DualOperatorType.IN);

            assertTrue(in.isNotIn());
            assertIdentifier("item", in.getLeft());
            assertIdentifier("items", in.getRight());
        }

        @Test
        @DisplayName("is and as keep their operands")
        void testIsAs() {
            dual(resolve("node is Sprite2D"), DualOperatorType.IS);
            dual(resolve("node as Sprite2D"), DualOperatorType.AS);
        }
    }

    // ==================== Literals ====================

    @Nested
    @DisplayName("Literals")
    class Literals {

        @ParameterizedTest
        @CsvSource({
            "0xFF, HEX, 255",
            "0b101, BINARY, 5",
            "1_000_000, INT, 1000000",
            "42, INT, 42"
        })
        @DisplayName("Integer literals keep their text and expose their value")
        void testIntegers(String source, NumberType type, long value) {
            NumberExpression number = assertInstanceOf(NumberExpression.class, resolve(source));

            assertEquals(type, number.getNumber().getNumberType());
            assertEquals(value, number.getNumber().getLongValue());
        }

        @Test
        @DisplayName("Floating point literal")
        void testDouble() {
            NumberExpression number = assertInstanceOf(NumberExpression.class, resolve("3.25"));

            assertEquals(NumberType.DOUBLE, number.getNumber().getNumberType());
            assertEquals(3.25, number.getNumber().getDoubleValue());
        }

        @ParameterizedTest
        @ValueSource(strings = {"\"text\"", "'text'", "\"\"\"text\"\"\""})
        @DisplayName("Strings of every quoting style")
        void testStrings(String source) {
            StringExpression string = assertInstanceOf(StringExpression.class, resolve(source));

            assertEquals("text", string.getValue());
        }

        @Test
        @DisplayName("Booleans")
        void testBooleans() {
            assertTrue(assertInstanceOf(BoolExpression.class, resolve("true")).getValue());
        }

        @Test
        @DisplayName("Node paths")
        void testNodePaths() {
            MarkedPathExpression path = assertInstanceOf(MarkedPathExpression.class, resolve("$Player/Sprite"));

            assertEquals("Player/Sprite", path.getPath());
        }
    }

    // ==================== Postfix chains ====================

    @Nested
    @DisplayName("Calls, members and indexers")
    class Postfix {

        @Test
        @DisplayName("Call with arguments")
        void testCall() {
            CallExpression call = assertInstanceOf(CallExpression.class, resolve("move(dx, dy * 2)"));

            assertIdentifier("move", call.getCaller());
            assertEquals(2, call.getParameters().size());
            dual(call.getParameters().get(1), DualOperatorType.MULTIPLY);
        }

        @Test
        @DisplayName("preload is a resource load")
        void testPreload() {
            CallExpression call = assertInstanceOf(CallExpression.class, resolve("preload(\"res://icon.png\")"));

            assertTrue(call.isResourceLoad());
        }

        @Test
        @DisplayName("Member access chains onto calls and indexers")
        void testMemberChain() {
            MemberOperatorExpression member = assertInstanceOf(MemberOperatorExpression.class,
                    resolve("get_node(path).items[0].name"));

            assertEquals("name", member.getMemberName());
            IndexerExpression indexer = assertInstanceOf(IndexerExpression.class, member.getCaller());
            assertInstanceOf(MemberOperatorExpression.class, indexer.getCaller());
        }

        @Test
        @DisplayName("Array and dictionary initializers")
        void testInitializers() {
            ArrayInitializerExpression array = assertInstanceOf(ArrayInitializerExpression.class, resolve("[1, 2, 3]"));
            assertEquals(3, array.getValues().size());

            reset(receiver);
            DictionaryInitializerExpression dictionary = assertInstanceOf(DictionaryInitializerExpression.class,
                    resolve("{\"a\": 1, b = 2}"));
            assertEquals(2, dictionary.getKeyValues().size());
            assertFalse(dictionary.getKeyValues().get(0).isAssignForm());
            assertTrue(dictionary.getKeyValues().get(1).isAssignForm());
        }
    }

    // ==================== Owner notification ====================

    @Nested
    @DisplayName("Owner notification")
    class Notification {

        @Test
        @DisplayName("Nothing readable signals a skip")
        void testSkip() {
            ReadingState state = new ReadingState(ReaderPolicy.defaults());
            state.push(new ExpressionResolver(receiver, ExpressionContext.of(0)));

            state.completeReading();

            verify(receiver).handleReceivedTokenSkip();
            verify(receiver, never()).handleReceivedToken(any());
        }

        @Test
        @DisplayName("Text after the expression is handed back to the reader below")
        void testTailHandedBack() {
            Reader below = mock(Reader.class);
            ReadingState state = new ReadingState(ReaderPolicy.defaults());
            state.push(below);
            state.push(new ExpressionResolver(receiver, ExpressionContext.of(0)));

            state.passString("a + b )");

            verify(receiver).handleReceivedToken(any(DualOperatorExpression.class));
            verify(below).handleChar(' ', state);
            verify(below).handleChar(')', state);
        }

        @Test
        @DisplayName("A dangling operator leaves an empty right operand")
        void testDanglingOperator() {
            DualOperatorExpression add = dual(resolve("a +"), DualOperatorType.ADD);

            assertNull(add.getRight());
        }
    }
}
