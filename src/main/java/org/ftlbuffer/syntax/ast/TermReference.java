package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reference to a term, optionally to one of its attributes and optionally parameterized.
 *
 * @param id        The referenced term, without the leading dash.
 * @param attribute The referenced attribute, or {@code null}.
 * @param arguments The call arguments, or {@code null} if the reference has no parentheses.
 */
public record TermReference(Identifier id, Identifier attribute, CallArguments arguments)
        implements InlineExpression {

    public TermReference {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public List<SyntaxNode> getChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(id);
        if (attribute != null) {
            children.add(attribute);
        }
        if (arguments != null) {
            children.add(arguments);
        }
        return children;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitTermReference(this);
    }
}
