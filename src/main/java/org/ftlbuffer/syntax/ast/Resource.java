package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;

/**
 * The root of a parsed FTL document: its entries in source order.
 *
 * @param entries The messages, terms, comments and junk of the document.
 */
public record Resource(List<Entry> entries) implements SyntaxNode {

    public Resource {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * @return The messages of this resource in source order.
     */
    public List<Message> messages() {
        return entries.stream().filter(Message.class::isInstance).map(Message.class::cast).toList();
    }

    /**
     * @return The terms of this resource in source order.
     */
    public List<Term> terms() {
        return entries.stream().filter(Term.class::isInstance).map(Term.class::cast).toList();
    }

    /**
     * @return The junk entries of this resource in source order.
     */
    public List<Junk> junk() {
        return entries.stream().filter(Junk.class::isInstance).map(Junk.class::cast).toList();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.copyOf(entries);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitResource(this);
    }
}
