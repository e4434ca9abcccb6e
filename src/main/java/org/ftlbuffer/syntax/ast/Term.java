package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A private, reusable definition referenced as {@code -id}. Terms always have a value.
 *
 * @param id         The term identifier, without the leading dash.
 * @param value      The term value, never empty.
 * @param attributes The attributes in source order.
 * @param span       The source range of the whole entry.
 */
public record Term(Identifier id, Pattern value, List<Attribute> attributes, Span span) implements Entry {

    public Term {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    /**
     * @param name The attribute name without the leading dot.
     * @return The attribute, or empty if this term has no attribute of that name.
     */
    public Optional<Attribute> attribute(String name) {
        Attribute found = null;
        for (Attribute attribute : attributes) {
            if (attribute.id().name().equals(name)) {
                found = attribute;
            }
        }
        return Optional.ofNullable(found);
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(id);
        children.add(value);
        children.addAll(attributes);
        return children;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitTerm(this);
    }
}
