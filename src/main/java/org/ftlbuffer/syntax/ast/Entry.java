package org.ftlbuffer.syntax.ast;

/**
 * A top-level item of a {@link Resource}.
 */
public sealed interface Entry extends SyntaxNode permits Message, Term, Comment, Junk {
}
