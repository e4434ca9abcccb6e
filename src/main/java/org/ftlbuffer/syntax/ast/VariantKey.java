package org.ftlbuffer.syntax.ast;

/**
 * The key of a select-expression variant.
 */
public sealed interface VariantKey extends SyntaxNode permits Identifier, NumberLiteral {
}
