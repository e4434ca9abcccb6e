package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;

/**
 * The value of a message, term, attribute or variant.
 *
 * @param elements The text elements and placeables in order.
 */
public record Pattern(List<PatternElement> elements) implements SyntaxNode {

    public Pattern {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitPattern(this);
    }
}
