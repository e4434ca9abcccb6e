package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reference to another message or one of its attributes.
 *
 * @param id        The referenced message.
 * @param attribute The referenced attribute, or {@code null} for the message value.
 */
public record MessageReference(Identifier id, Identifier attribute) implements InlineExpression {

    public MessageReference {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(id);
        if (attribute != null) {
            children.add(attribute);
        }
        return children;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitMessageReference(this);
    }
}
