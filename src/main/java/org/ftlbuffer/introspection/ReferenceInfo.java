package org.ftlbuffer.introspection;

/**
 * A reference from a message to another message or a term.
 *
 * @param id        The referenced id, without the leading dash for terms.
 * @param kind      Whether a message or a term is referenced.
 * @param attribute The referenced attribute, or {@code null}.
 */
public record ReferenceInfo(String id, Kind kind, String attribute) {

    public enum Kind {
        MESSAGE,
        TERM
    }
}
