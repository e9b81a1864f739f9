package io.github.cyfko.gdsyntax.core.api;

import io.github.cyfko.gdsyntax.core.exception.ScriptReadingException;
import io.github.cyfko.gdsyntax.core.syntax.declarations.ClassDeclaration;
import io.github.cyfko.gdsyntax.core.syntax.expressions.Expression;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;

/**
 * Reads GDScript source into lossless syntax trees.
 * <p>
 * Every tree keeps all the characters it was read from, in order: whitespace, comments, line
 * breaks and unreadable text included. Serializing a tree with {@code toString()} gives back the
 * exact source.
 * </p>
 *
 * <h2>Malformed input</h2>
 * <p>
 * Reading never fails on bad syntax. Text that does not fit the grammar becomes
 * {@link io.github.cyfko.gdsyntax.core.syntax.tokens.InvalidToken}s, reachable through
 * {@link io.github.cyfko.gdsyntax.core.syntax.SyntaxNode#getInvalidTokens()}.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ScriptReader reader = ScriptReaderFactory.create();
 *
 * ClassDeclaration script = reader.parseFileContent(Files.readString(path));
 * script.getMethods().forEach(method -> System.out.println(method.getName()));
 *
 * Expression expression = reader.parseExpression("a + b * c");
 * assert expression.toString().equals("a + b * c");
 * }</pre>
 *
 * <h2>Limits</h2>
 * <p>
 * Content length and nesting depth are bounded by the
 * {@link io.github.cyfko.gdsyntax.core.config.ReaderPolicy} the reader was created with.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ScriptReader {

    /**
     * Reads a whole script. The root is always a class declaration, whether or not the script
     * names its class.
     *
     * @param content the script source
     * @return the script as a class declaration
     * @throws ScriptReadingException if {@code content} is {@code null} or exceeds the policy limits
     */
    ClassDeclaration parseFileContent(String content) throws ScriptReadingException;

    /**
     * Reads one expression. Text following the expression (trailing whitespace, a comment,
     * anything unreadable) is kept at the end of the returned node.
     *
     * @param content the expression source
     * @return the expression
     * @throws ScriptReadingException if {@code content} is {@code null}, exceeds the policy limits
     *                                or does not start with an expression
     */
    Expression parseExpression(String content) throws ScriptReadingException;

    /**
     * Reads a sequence of statements, as found in a method body.
     *
     * @param content the statements source
     * @return the top-level block
     * @throws ScriptReadingException if {@code content} is {@code null} or exceeds the policy limits
     */
    StatementsList parseStatements(String content) throws ScriptReadingException;
}
