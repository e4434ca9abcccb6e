package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A translatable message.
 *
 * @param id         The message identifier.
 * @param value      The message value, or {@code null} if the message only has attributes.
 * @param attributes The attributes in source order.
 * @param span       The source range of the whole entry.
 */
public record Message(Identifier id, Pattern value, List<Attribute> attributes, Span span) implements Entry {

    public Message {
        Objects.requireNonNull(id, "id");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    /**
     * @param name The attribute name without the leading dot.
     * @return The attribute, or empty if this message has no attribute of that name.
     */
    public Optional<Attribute> attribute(String name) {
        // Last definition wins, like duplicate entries in a resource.
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
        if (value != null) {
            children.add(value);
        }
        children.addAll(attributes);
        return children;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitMessage(this);
    }
}
