package io.github.cyfko.gdsyntax.core.syntax.types;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxNode;

/**
 * Base of type annotations: {@code int}, {@code Node2D.Mode}, {@code Array[int]},
 * {@code Dictionary[String, int]}, {@code "res://base.gd"}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class TypeNode extends SyntaxNode {

    /**
     * @return the type name without trivia, such as {@code Array[int]}
     */
    public abstract String getTypeName();
}
