package io.github.cyfko.gdsyntax.core.impl;

import io.github.cyfko.gdsyntax.core.api.ScriptReader;
import io.github.cyfko.gdsyntax.core.config.ReaderPolicy;
import io.github.cyfko.gdsyntax.core.exception.ScriptReadingException;
import io.github.cyfko.gdsyntax.core.reading.ExpressionContext;
import io.github.cyfko.gdsyntax.core.reading.ExpressionResolver;
import io.github.cyfko.gdsyntax.core.reading.Reader;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.CarriageReturn;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Comment;
import io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Space;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ScriptReader}: drives a {@link ReadingState} over the source, one character at
 * a time, then completes the readers left open at the end of the source.
 *
 * <h2>Reading steps</h2>
 * <ol>
 *   <li>validate the content against the {@link ReaderPolicy}</li>
 *   <li>push the root node (or resolver) and pass every character</li>
 *   <li>complete the remaining readers, innermost first</li>
 *   <li>report invalid spans in the log</li>
 * </ol>
 *
 * <h2>Thread safety</h2>
 * <p>
 * Instances hold only their policy and can be shared; each call uses its own reading state.
 * </p>
 *
 * <pre>{@code
 * ScriptReader reader = new BasicScriptReader(ReaderPolicy.strict());
 * ClassDeclaration script = reader.parseFileContent(source);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicScriptReader implements ScriptReader {

    private static final Logger log = Logger.getLogger(BasicScriptReader.class.getName());

    private final ReaderPolicy policy;

    /**
     * Reader using {@link ReaderPolicy#defaults()}.
     */
    public BasicScriptReader() {
        this(ReaderPolicy.defaults());
    }

    /**
     * @param policy the limits applied to every read
     * @throws IllegalArgumentException if policy is null
     */
    public BasicScriptReader(ReaderPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Reader policy is required");
        }
        this.policy = policy;
    }

    public ReaderPolicy getPolicy() {
        return policy;
    }

    @Override
    public ClassDeclaration parseFileContent(String content) {
        validate(content);
        long start = System.nanoTime();

        ClassDeclaration declaration = new ClassDeclaration();
        ReadingState state = new ReadingState(policy);
        state.push(declaration);
        state.push(declaration.getMembersList());
        read(state, content);

        report("script", declaration, content, start);
        return declaration;
    }

    @Override
    public Expression parseExpression(String content) {
        validate(content);
        long start = System.nanoTime();

        TrailingTextSink sink = new TrailingTextSink();
        ReadingState state = new ReadingState(policy);
        state.push(sink);
        state.push(new ExpressionResolver(TokenReceiver.of(sink::setExpression, () -> { }), ExpressionContext.of(0)));
        read(state, content);

        Expression expression = sink.expression;
        if (expression == null) {
            throw new ScriptReadingException("No expression found at the start of the content");
        }
        appendTrailingText(expression, sink.text.toString());

        report("expression", expression, content, start);
        return expression;
    }

    @Override
    public StatementsList parseStatements(String content) {
        validate(content);
        long start = System.nanoTime();

        StatementsList statements = StatementsList.root();
        ReadingState state = new ReadingState(policy);
        state.push(statements);
        read(state, content);

        report("statements", statements, content, start);
        return statements;
    }

    private void validate(String content) {
        if (content == null) {
            throw new ScriptReadingException("Script content cannot be null");
        }
        if (content.length() > policy.maxContentLength()) {
            throw new ScriptReadingException(String.format(
                    "Script content too long: %d characters (maximum allowed: %d, policy %s)",
                    content.length(), policy.maxContentLength(), policy.policyName()));
        }
    }

    private void read(ReadingState state, String content) {
        log.fine(() -> String.format("Reading %d characters (policy %s)", content.length(), policy.policyName()));
        state.passString(content);
        state.completeReading();
    }

    private void report(String kind, SyntaxNode root, String content, long start) {
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.fine(() -> String.format("Read %s of %d characters in %d ms", kind, content.length(), durationMs));

        if (log.isLoggable(Level.WARNING)) {
            int invalidCount = root.getInvalidTokens().size();
            if (invalidCount > 0) {
                log.warning(() -> String.format("%s contains %d invalid token(s)", kind, invalidCount));
            }
        }
    }

    /**
     * Splits what follows an expression into whitespace, line breaks, comments and invalid text.
     */
    private static void appendTrailingText(Expression expression, String text) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int end = i + 1;
            if (c == '\n') {
                expression.getForm().addToEnd(new NewLine());
            } else if (c == '\r') {
                expression.getForm().addToEnd(new CarriageReturn());
            } else if (ResolvingHelper.isSpace(c)) {
                while (end < text.length() && ResolvingHelper.isSpace(text.charAt(end))) {
                    end++;
                }
                expression.getForm().addToEnd(Space.of(text.substring(i, end)));
            } else if (c == '#') {
                while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
                    end++;
                }
                expression.getForm().addToEnd(Comment.of(text.substring(i, end)));
            } else {
                while (end < text.length() && !isTrailingBoundary(text.charAt(end))) {
                    end++;
                }
                expression.getForm().addToEnd(InvalidToken.of(text.substring(i, end)));
            }
            i = end;
        }
    }

    private static boolean isTrailingBoundary(char c) {
        return c == '\n' || c == '\r' || c == '#' || ResolvingHelper.isSpace(c);
    }

    /**
     * Bottom of the stack while reading an expression: collects whatever the expression leaves.
     */
    private static final class TrailingTextSink extends Reader {

        private final StringBuilder text = new StringBuilder();
        private Expression expression;

        private void setExpression(Expression expression) {
            this.expression = expression;
        }

        @Override
        public void handleChar(char c, ReadingState state) {
            text.append(c);
        }

        @Override
        public void handleNewLineChar(ReadingState state) {
            text.append('\n');
        }

        @Override
        public void forceComplete(ReadingState state) {
            state.pop();
        }
    }
}
