package org.ftlbuffer.syntax.ast;

/**
 * One element of a {@link Pattern}: either literal text or a placeable.
 */
public sealed interface PatternElement extends SyntaxNode permits TextElement, Placeable {
}
