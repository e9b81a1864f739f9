package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.expressions.AwaitExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.DualOperatorExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.IfExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.SingleOperatorExpression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperator;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.SingleOperator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Flat sequence of operands and operators read by {@link ExpressionResolver}, turned into a
 * tree by priority once the expression ends.
 * <p>
 * Re-association uses an operator stack: an operator on top of the stack is reduced before an
 * incoming binary operator when it binds tighter, or binds the same and the incoming operator is
 * left associative. Prefix operators are stacked without reducing anything.
 * </p>
 *
 * <h2>Trivia placement</h2>
 * <ul>
 *   <li>trivia read before a binary operator goes between its left operand and the operator</li>
 *   <li>trivia read after an operator goes in front of the operand that follows it</li>
 *   <li>trivia read before the first item goes in front of the whole expression</li>
 * </ul>
 * <p>
 * Since the operand following an operator always starts the right-hand side of that operator,
 * this keeps the tree text identical to the text read.
 * </p>
 *
 * <pre>{@code
 * a + b * c      -> a + (b * c)
 * (a + b) * c    -> bracket * c
 * a = b = c      -> a = (b = c)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class OperatorChain {

    private abstract static class Link {
        List<SyntaxToken> after = List.of();

        abstract int level();
    }

    private static final class PrefixLink extends Link {
        private final SyntaxToken operator;
        private final int level;

        private PrefixLink(SyntaxToken operator, int level) {
            this.operator = operator;
            this.level = level;
        }

        @Override
        int level() {
            return level;
        }

        Expression combine(Expression operand) {
            if (operator instanceof SingleOperator single) {
                return new SingleOperatorExpression(single, after, operand);
            }
            return new AwaitExpression((Keyword) operator, after, operand);
        }
    }

    abstract static class InfixLink extends Link {
        final List<SyntaxToken> before;

        InfixLink(List<SyntaxToken> before) {
            this.before = before;
        }

        abstract boolean rightAssociative();

        abstract Expression combine(Expression left, Expression right);
    }

    static final class BinaryLink extends InfixLink {
        private final Keyword not;
        private final List<SyntaxToken> betweenNotAndOperator;
        private final DualOperator operator;

        BinaryLink(List<SyntaxToken> before, DualOperator operator) {
            this(before, null, List.of(), operator);
        }

        BinaryLink(List<SyntaxToken> before, Keyword not, List<SyntaxToken> betweenNotAndOperator, DualOperator operator) {
            super(before);
            this.not = not;
            this.betweenNotAndOperator = betweenNotAndOperator;
            this.operator = operator;
        }

        @Override
        int level() {
            return operator.getType().getLevel();
        }

        @Override
        boolean rightAssociative() {
            return operator.getType().isRightAssociative();
        }

        @Override
        Expression combine(Expression left, Expression right) {
            return new DualOperatorExpression(left, before, not, betweenNotAndOperator, operator, after, right);
        }
    }

    static final class TernaryLink extends InfixLink {
        static final int LEVEL = 21;

        private final Keyword ifKeyword;
        List<SyntaxToken> afterIf = List.of();
        Expression condition;
        List<SyntaxToken> beforeElse = List.of();
        Keyword elseKeyword;

        TernaryLink(List<SyntaxToken> before, Keyword ifKeyword) {
            super(before);
            this.ifKeyword = ifKeyword;
        }

        @Override
        int level() {
            return LEVEL;
        }

        @Override
        boolean rightAssociative() {
            return true;
        }

        @Override
        Expression combine(Expression left, Expression right) {
            return new IfExpression(left, before, ifKeyword, afterIf, condition, beforeElse, elseKeyword, after, right);
        }
    }

    private final List<Object> items = new ArrayList<>();
    private List<SyntaxToken> leading = List.of();

    boolean isEmpty() {
        return items.isEmpty();
    }

    void addOperand(Expression operand, List<SyntaxToken> trivia) {
        placeAfterLastLink(trivia);
        items.add(operand);
    }

    void addPrefix(SyntaxToken operator, int level, List<SyntaxToken> trivia) {
        placeAfterLastLink(trivia);
        items.add(new PrefixLink(operator, level));
    }

    void addInfix(InfixLink link) {
        items.add(link);
    }

    private void placeAfterLastLink(List<SyntaxToken> trivia) {
        if (trivia.isEmpty()) {
            return;
        }
        if (items.isEmpty()) {
            leading = trivia;
            return;
        }
        Object last = items.get(items.size() - 1);
        if (!(last instanceof Link link)) {
            throw new InvalidStateException("Trivia cannot follow an operand directly");
        }
        link.after = trivia;
    }

    /**
     * Builds the expression tree. A chain ending on an operator gets an empty operand slot.
     */
    Expression build() {
        // operands may be null (missing operand), so no ArrayDeque here
        List<Expression> operands = new ArrayList<>();
        Deque<Link> operators = new ArrayDeque<>();
        boolean expectsOperand = true;

        for (Object item : items) {
            if (item instanceof Expression operand) {
                operands.add(operand);
                expectsOperand = false;
            } else if (item instanceof PrefixLink prefix) {
                operators.push(prefix);
                expectsOperand = true;
            } else {
                InfixLink infix = (InfixLink) item;
                while (!operators.isEmpty() && reducesBefore(operators.peek(), infix)) {
                    reduce(operators.pop(), operands);
                }
                operators.push(infix);
                expectsOperand = true;
            }
        }
        if (expectsOperand) {
            operands.add(null);
        }
        while (!operators.isEmpty()) {
            reduce(operators.pop(), operands);
        }
        if (operands.size() != 1) {
            throw new InvalidStateException("Unbalanced operator chain: " + operands.size() + " operands left");
        }
        Expression root = operands.get(0);
        for (int i = leading.size() - 1; i >= 0; i--) {
            root.getForm().addFirst(leading.get(i));
        }
        return root;
    }

    private static boolean reducesBefore(Link top, InfixLink incoming) {
        return top.level() < incoming.level()
                || (top.level() == incoming.level() && !incoming.rightAssociative());
    }

    private static void reduce(Link link, List<Expression> operands) {
        Expression right = operands.remove(operands.size() - 1);
        if (link instanceof PrefixLink prefix) {
            operands.add(prefix.combine(right));
            return;
        }
        Expression left = operands.remove(operands.size() - 1);
        operands.add(((InfixLink) link).combine(left, right));
    }
}
