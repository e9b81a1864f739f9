package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.expressions.ArrayInitializerExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.BoolExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.BracketExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.BreakExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.BreakPointExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.CallExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.ContinueExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.DictionaryInitializerExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.GetNodeExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.GetUniqueNodeExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.IdentifierExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.IndexerExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.MatchCaseVariableExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.MatchDefaultOperatorExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.MatchRestExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.MemberOperatorExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.MethodExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.NodePathExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.NumberExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.PassExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.ReturnExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.StringExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.StringNameExpression;
import io.github.cyfko.gdsyntax.core.syntax.tokens.CarriageReturn;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Comment;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperator;
import io.github.cyfko.gdsyntax.core.syntax.tokens.DualOperatorType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.MultiLineSplit;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NumberToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.SingleOperator;
import io.github.cyfko.gdsyntax.core.syntax.tokens.SingleOperatorType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Space;
import io.github.cyfko.gdsyntax.core.syntax.tokens.StringToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads one expression and hands it to its owner.
 * <p>
 * Operands and operators are collected left to right in an {@link OperatorChain}; postfix forms
 * (calls, indexers, member access) are attached to the operand they follow as soon as they are
 * read. The resolver ends at the first character that cannot continue the expression; that
 * character, preceded by any whitespace read after the last operand, is passed back to the owner
 * after the expression was delivered.
 * </p>
 *
 * <h2>What ends an expression</h2>
 * <ul>
 *   <li>a separator or closer: {@code , : ; ) ] }}</li>
 *   <li>a reserved word in operator position, such as {@code else} or {@code when}</li>
 *   <li>a line break or a comment, unless the expression is inside brackets</li>
 *   <li>a bare {@code =} for dictionary keys of the {@code key = value} form</li>
 * </ul>
 *
 * <p>
 * When nothing was read the owner receives {@link TokenReceiver#handleReceivedTokenSkip()} and
 * everything read is passed back.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionResolver extends Reader {

    private static final int EOF = -1;
    private static final int AWAIT_LEVEL = 5;
    private static final Set<String> ENDING_WORDS = Set.of(
            "and", "or", "in", "is", "as", "if", "elif", "else", "when", "const", "static",
            "class", "class_name", "extends", "signal", "enum", "for", "while", "match");

    private enum Mode {
        OPERAND, OPERAND_WORD, AFTER_OPERAND, OPERATOR_SYMBOL, OPERATOR_WORD,
        NOT_IN, NOT_IN_WORD, TERNARY_CONDITION, TERNARY_ELSE, TERNARY_ELSE_WORD
    }

    private final TokenReceiver<Expression> owner;
    private final ExpressionContext context;
    private final OperatorChain chain = new OperatorChain();
    private final StringBuilder word = new StringBuilder();
    private final StringBuilder operator = new StringBuilder();
    private List<SyntaxToken> pending = new ArrayList<>();
    private Mode mode = Mode.OPERAND;
    private Expression atom;
    private List<SyntaxToken> atomTrivia = List.of();
    private List<SyntaxToken> notTrivia = List.of();
    private OperatorChain.TernaryLink ternary;

    public ExpressionResolver(TokenReceiver<Expression> owner, ExpressionContext context) {
        this.owner = Objects.requireNonNull(owner, "Expression owner cannot be null");
        this.context = Objects.requireNonNull(context, "Expression context cannot be null");
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        step(c, state);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        step('\n', state);
    }

    @Override
    public void handleCarriageReturnChar(ReadingState state) {
        step('\r', state);
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        step('#', state);
    }

    @Override
    public void handleLeftSlashChar(ReadingState state) {
        step('\\', state);
    }

    @Override
    public void forceComplete(ReadingState state) {
        step(EOF, state);
    }

    private void step(int c, ReadingState state) {
        switch (mode) {
            case OPERAND -> readOperand(c, state);
            case OPERAND_WORD -> readOperandWord(c, state);
            case AFTER_OPERAND -> readAfterOperand(c, state);
            case OPERATOR_SYMBOL -> readOperatorSymbol(c, state);
            case OPERATOR_WORD -> readOperatorWord(c, state);
            case NOT_IN -> readNotIn(c, state);
            case NOT_IN_WORD -> readNotInWord(c, state);
            case TERNARY_CONDITION -> readTernaryCondition(c, state);
            case TERNARY_ELSE -> readTernaryElse(c, state);
            case TERNARY_ELSE_WORD -> readTernaryElseWord(c, state);
        }
    }

    private void readOperand(int c, ReadingState state) {
        if (readTrivia(c, state)) {
            return;
        }
        if (c == EOF) {
            finish(state, takeRaw(), c);
            return;
        }
        char ch = (char) c;
        if (ResolvingHelper.isIdentifierStartChar(ch)) {
            word.append(ch);
            mode = Mode.OPERAND_WORD;
            return;
        }
        if (ResolvingHelper.isDigit(ch)) {
            NumberToken number = new NumberToken();
            startAtom(new NumberExpression(number));
            state.pushAndPass(number, ch);
            return;
        }
        if (ResolvingHelper.isQuote(ch)) {
            StringToken string = new StringToken();
            startAtom(new StringExpression(string));
            state.pushAndPass(string, ch);
            return;
        }
        Expression node = switch (ch) {
            case '(' -> new BracketExpression(context.inBrackets());
            case '[' -> new ArrayInitializerExpression(context.inBrackets());
            case '{' -> new DictionaryInitializerExpression(context.inBrackets());
            case '$' -> new GetNodeExpression();
            case '%' -> new GetUniqueNodeExpression();
            case '^' -> new NodePathExpression();
            case '&' -> new StringNameExpression();
            default -> null;
        };
        if (node != null) {
            startAtom(node);
            state.pushAndPass(node, ch);
            return;
        }
        SingleOperatorType prefix = SingleOperatorType.fromChar(ch);
        if (prefix != null) {
            chain.addPrefix(SingleOperator.of(prefix), prefix.getLevel(), takePending());
            return;
        }
        if (ch == '.' && context.matchPattern()) {
            Punctuation range = new Punctuation(PunctuationType.RANGE);
            startAtom(new MatchRestExpression(range));
            state.pushAndPass(range, ch);
            return;
        }
        finish(state, takeRaw(), c);
    }

    private void readOperandWord(int c, ReadingState state) {
        if (c != EOF && ResolvingHelper.isIdentifierChar((char) c)) {
            word.append((char) c);
            return;
        }
        String text = takeWord();
        mode = Mode.OPERAND;
        switch (text) {
            case "true", "false" -> {
                startAtom(new BoolExpression(Keyword.of(text)));
                step(c, state);
            }
            case "not" -> {
                chain.addPrefix(SingleOperator.of(SingleOperatorType.NOT2), SingleOperatorType.NOT2.getLevel(), takePending());
                step(c, state);
            }
            case "await" -> {
                chain.addPrefix(Keyword.of(text), AWAIT_LEVEL, takePending());
                step(c, state);
            }
            case "pass" -> readAtom(new PassExpression(Keyword.of(text)), c, state);
            case "break" -> readAtom(new BreakExpression(Keyword.of(text)), c, state);
            case "continue" -> readAtom(new ContinueExpression(Keyword.of(text)), c, state);
            case "breakpoint" -> readAtom(new BreakPointExpression(Keyword.of(text)), c, state);
            case "func" -> pushAtom(new MethodExpression(context), text, c, state);
            case "return" -> pushAtom(new ReturnExpression(context), text, c, state);
            case "var" -> {
                if (context.matchPattern()) {
                    pushAtom(new MatchCaseVariableExpression(), text, c, state);
                } else {
                    finish(state, takeRaw() + text, c);
                }
            }
            case "_" -> {
                if (context.matchPattern()) {
                    readAtom(new MatchDefaultOperatorExpression(Punctuation.of(PunctuationType.UNDERSCORE)), c, state);
                } else {
                    readAtom(new IdentifierExpression(Identifier.of(text)), c, state);
                }
            }
            default -> {
                if (ENDING_WORDS.contains(text)) {
                    finish(state, takeRaw() + text, c);
                } else {
                    readAtom(new IdentifierExpression(Identifier.of(text)), c, state);
                }
            }
        }
    }

    private void readAfterOperand(int c, ReadingState state) {
        if (readTrivia(c, state)) {
            return;
        }
        if (c == EOF) {
            finish(state, takeRaw(), c);
            return;
        }
        char ch = (char) c;
        switch (ch) {
            case '(' -> postfix(new CallExpression(context.inArguments(), atom, takePending()), ch, state);
            case '[' -> postfix(new IndexerExpression(context.inArguments(), atom, takePending()), ch, state);
            case '.' -> postfix(new MemberOperatorExpression(atom, takePending()), ch, state);
            default -> {
                if (ResolvingHelper.isOperatorChar(ch)) {
                    operator.append(ch);
                    mode = Mode.OPERATOR_SYMBOL;
                } else if (ResolvingHelper.isIdentifierStartChar(ch)) {
                    word.append(ch);
                    mode = Mode.OPERATOR_WORD;
                } else {
                    finish(state, takeRaw(), c);
                }
            }
        }
    }

    private void readOperatorSymbol(int c, ReadingState state) {
        if (c != EOF && DualOperatorType.isSymbolPrefix(operator.toString() + (char) c)) {
            operator.append((char) c);
            return;
        }
        String symbol = operator.toString();
        operator.setLength(0);
        Optional<DualOperatorType> type = DualOperatorType.fromSymbol(symbol);
        if (type.isEmpty() || (type.get() == DualOperatorType.ASSIGNMENT && context.stopAtAssign())) {
            finish(state, takeRaw() + symbol, c);
            return;
        }
        binary(type.get(), c, state);
    }

    private void readOperatorWord(int c, ReadingState state) {
        if (c != EOF && ResolvingHelper.isIdentifierChar((char) c)) {
            word.append((char) c);
            return;
        }
        String text = takeWord();
        switch (text) {
            case "and" -> binary(DualOperatorType.AND, c, state);
            case "or" -> binary(DualOperatorType.OR, c, state);
            case "is" -> binary(DualOperatorType.IS, c, state);
            case "as" -> binary(DualOperatorType.AS, c, state);
            case "in" -> binary(DualOperatorType.IN, c, state);
            case "not" -> {
                notTrivia = takePending();
                mode = Mode.NOT_IN;
                step(c, state);
            }
            case "if" -> {
                commitAtom();
                ternary = new OperatorChain.TernaryLink(takePending(), Keyword.of(text));
                chain.addInfix(ternary);
                mode = Mode.TERNARY_CONDITION;
                step(c, state);
            }
            default -> finish(state, takeRaw() + text, c);
        }
    }

    private void readNotIn(int c, ReadingState state) {
        if (readTrivia(c, state)) {
            return;
        }
        if (c != EOF && ResolvingHelper.isIdentifierStartChar((char) c)) {
            word.append((char) c);
            mode = Mode.NOT_IN_WORD;
            return;
        }
        finish(state, raw(notTrivia) + KeywordType.NOT.getText() + takeRaw(), c);
    }

    private void readNotInWord(int c, ReadingState state) {
        if (c != EOF && ResolvingHelper.isIdentifierChar((char) c)) {
            word.append((char) c);
            return;
        }
        String text = takeWord();
        if (!KeywordType.IN.getText().equals(text)) {
            finish(state, raw(notTrivia) + KeywordType.NOT.getText() + takeRaw() + text, c);
            return;
        }
        commitAtom();
        chain.addInfix(new OperatorChain.BinaryLink(notTrivia, Keyword.of(KeywordType.NOT), takePending(),
                DualOperator.of(DualOperatorType.IN)));
        notTrivia = List.of();
        mode = Mode.OPERAND;
        step(c, state);
    }

    private void readTernaryCondition(int c, ReadingState state) {
        if (readTrivia(c, state)) {
            return;
        }
        OperatorChain.TernaryLink link = ternary;
        link.afterIf = takePending();
        mode = Mode.TERNARY_ELSE;
        if (c == EOF) {
            step(c, state);
            return;
        }
        ExpressionResolver condition = new ExpressionResolver(
                TokenReceiver.of(expression -> link.condition = expression, () -> { }), context);
        state.pushAndPass(condition, (char) c);
    }

    private void readTernaryElse(int c, ReadingState state) {
        if (readTrivia(c, state)) {
            return;
        }
        if (c != EOF && ResolvingHelper.isIdentifierStartChar((char) c)) {
            word.append((char) c);
            mode = Mode.TERNARY_ELSE_WORD;
            return;
        }
        finish(state, takeRaw(), c);
    }

    private void readTernaryElseWord(int c, ReadingState state) {
        if (c != EOF && ResolvingHelper.isIdentifierChar((char) c)) {
            word.append((char) c);
            return;
        }
        String text = takeWord();
        if (!KeywordType.ELSE.getText().equals(text)) {
            finish(state, takeRaw() + text, c);
            return;
        }
        ternary.beforeElse = takePending();
        ternary.elseKeyword = Keyword.of(text);
        ternary = null;
        mode = Mode.OPERAND;
        step(c, state);
    }

    private void binary(DualOperatorType type, int c, ReadingState state) {
        commitAtom();
        chain.addInfix(new OperatorChain.BinaryLink(takePending(), DualOperator.of(type)));
        mode = Mode.OPERAND;
        step(c, state);
    }

    private boolean readTrivia(int c, ReadingState state) {
        if (c == EOF) {
            return false;
        }
        char ch = (char) c;
        if (ResolvingHelper.isSpace(ch)) {
            Space space = new Space();
            pending.add(space);
            state.pushAndPass(space, ch);
            return true;
        }
        if (ch == '\r') {
            pending.add(new CarriageReturn());
            return true;
        }
        if (ch == '\\') {
            MultiLineSplit split = new MultiLineSplit();
            pending.add(split);
            state.pushAndPass(split, ch);
            return true;
        }
        if (!context.allowNewLines()) {
            return false;
        }
        if (ch == '\n') {
            pending.add(new NewLine());
            return true;
        }
        if (ch == '#') {
            Comment comment = new Comment();
            pending.add(comment);
            state.pushAndPass(comment, ch);
            return true;
        }
        return false;
    }

    private void startAtom(Expression expression) {
        atom = expression;
        atomTrivia = takePending();
        mode = Mode.AFTER_OPERAND;
    }

    private void readAtom(Expression expression, int c, ReadingState state) {
        startAtom(expression);
        step(c, state);
    }

    private void pushAtom(Expression expression, String text, int c, ReadingState state) {
        startAtom(expression);
        state.pushAndPass(expression, text);
        if (c != EOF) {
            state.passChar((char) c);
        }
    }

    private void postfix(Expression expression, char c, ReadingState state) {
        atom = expression;
        state.pushAndPass(expression, c);
    }

    private void commitAtom() {
        if (atom != null) {
            chain.addOperand(atom, atomTrivia);
            atom = null;
            atomTrivia = List.of();
        }
    }

    private void finish(ReadingState state, String tail, int c) {
        commitAtom();
        Expression result = chain.isEmpty() ? null : chain.build();
        state.pop();
        if (result == null) {
            owner.handleReceivedTokenSkip();
        } else {
            owner.handleReceivedToken(result);
        }
        state.passString(tail);
        if (c != EOF) {
            state.passChar((char) c);
        }
    }

    private String takeWord() {
        String text = word.toString();
        word.setLength(0);
        return text;
    }

    private List<SyntaxToken> takePending() {
        List<SyntaxToken> taken = pending;
        pending = new ArrayList<>();
        return taken;
    }

    private String takeRaw() {
        return raw(takePending());
    }

    private static String raw(List<SyntaxToken> tokens) {
        StringBuilder builder = new StringBuilder();
        tokens.forEach(builder::append);
        return builder.toString();
    }
}
