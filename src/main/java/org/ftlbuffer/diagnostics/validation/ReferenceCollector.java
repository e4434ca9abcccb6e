package org.ftlbuffer.diagnostics.validation;

import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the ids of all messages and terms referenced from patterns.
 */
public class ReferenceCollector extends AstVisitor {

    private final Set<String> messageReferences = new LinkedHashSet<>();
    private final Set<String> termReferences = new LinkedHashSet<>();

    /**
     * Collects the references of an entry's value and attributes.
     * @param value      The entry value, may be {@code null}.
     * @param attributes The entry attributes.
     * @return A collector holding the references.
     */
    public static ReferenceCollector of(Pattern value, List<Attribute> attributes) {
        ReferenceCollector collector = new ReferenceCollector();
        collector.visit(value);
        collector.visitAll(attributes);
        return collector;
    }

    @Override
    public void visitMessageReference(MessageReference node) {
        messageReferences.add(node.id().name());
        visitChildren(node);
    }

    @Override
    public void visitTermReference(TermReference node) {
        termReferences.add(node.id().name());
        visitChildren(node);
    }

    /**
     * @return The referenced message ids in order of first appearance.
     */
    public Set<String> getMessageReferences() {
        return Collections.unmodifiableSet(messageReferences);
    }

    /**
     * @return The referenced term ids, without the leading dash, in order of first appearance.
     */
    public Set<String> getTermReferences() {
        return Collections.unmodifiableSet(termReferences);
    }
}
