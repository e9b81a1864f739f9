package io.github.cyfko.gdsyntax.core.syntax.expressions;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;

/**
 * Base of every expression node.
 * <p>
 * Expressions are read by {@link io.github.cyfko.gdsyntax.core.reading.ExpressionResolver}, which
 * reads operands and operators left to right and re-associates them by priority once the
 * expression ends.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class Expression extends SyntaxNode {
}
