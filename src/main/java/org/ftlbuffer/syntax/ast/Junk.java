package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.List;
import java.util.Objects;

/**
 * Source text that could not be parsed, kept so that tools can report and preserve it.
 *
 * @param content     The raw source text of the failed entry.
 * @param annotations The errors explaining why parsing failed.
 * @param span        The source range of the junk.
 */
public record Junk(String content, List<Annotation> annotations, Span span) implements Entry {

    public Junk {
        Objects.requireNonNull(content, "content");
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitJunk(this);
    }
}
