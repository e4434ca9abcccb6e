package org.ftlbuffer.syntax.ast;

/**
 * A string or number literal. Named call arguments only accept literals.
 */
public sealed interface Literal extends InlineExpression permits StringLiteral, NumberLiteral {
}
