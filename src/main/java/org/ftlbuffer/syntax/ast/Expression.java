package org.ftlbuffer.syntax.ast;

/**
 * Anything that can appear inside a placeable.
 */
public sealed interface Expression extends SyntaxNode permits InlineExpression, SelectExpression {
}
