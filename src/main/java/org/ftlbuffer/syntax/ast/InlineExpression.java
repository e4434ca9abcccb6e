package org.ftlbuffer.syntax.ast;

/**
 * An expression that may appear as a selector or as a call argument.
 */
public sealed interface InlineExpression extends Expression
        permits Literal, VariableReference, MessageReference, TermReference, FunctionReference {
}
