package org.ftlbuffer.introspection;

import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.Term;

import java.util.List;

/**
 * Entry point for analysing what messages and terms need at format time.
 */
public final class MessageIntrospector {

    private MessageIntrospector() {
    }

    public static MessageIntrospection introspect(Message message) {
        return introspect(message.id().name(), message.value(), message.attributes());
    }

    public static MessageIntrospection introspect(Term term) {
        return introspect(term.id().name(), term.value(), term.attributes());
    }

    private static MessageIntrospection introspect(String id, Pattern value, List<Attribute> attributes) {
        IntrospectionVisitor visitor = new IntrospectionVisitor();
        visitor.visit(value);
        for (Attribute attribute : attributes) {
            visitor.visit(attribute.value());
        }
        return visitor.result(id);
    }
}
