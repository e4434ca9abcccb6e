package org.ftlbuffer.syntax.ast;

import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.visitor.AstVisitor;

import java.util.Objects;

/**
 * A standalone comment line or block.
 *
 * @param content The comment text without the leading hashes; lines joined with {@code \n}.
 * @param kind    The comment level.
 * @param span    The source range.
 */
public record Comment(String content, Kind kind, Span span) implements Entry {

    public Comment {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(kind, "kind");
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visitComment(this);
    }

    /**
     * The comment level, given by the number of leading hashes.
     */
    public enum Kind {
        LINE("#"),
        GROUP("##"),
        RESOURCE("###");

        private final String sigil;

        Kind(String sigil) {
            this.sigil = sigil;
        }

        public String sigil() {
            return sigil;
        }

        /**
         * @param hashes The number of leading {@code #} characters, 1 to 3.
         * @return The matching kind.
         */
        public static Kind ofLevel(int hashes) {
            return switch (hashes) {
                case 1 -> LINE;
                case 2 -> GROUP;
                case 3 -> RESOURCE;
                default -> throw new IllegalArgumentException("Comment level must be 1-3, got " + hashes);
            };
        }
    }
}
