package org.ftlbuffer.syntax;

/**
 * A half-open range of character offsets into a source string.
 *
 * @param start The first offset, inclusive.
 * @param end   The last offset, exclusive.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * @param position The offset.
     * @return An empty span located at {@code position}.
     */
    public static Span at(int position) {
        return new Span(position, position);
    }

    public int length() {
        return end - start;
    }
}
