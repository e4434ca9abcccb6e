package org.ftlbuffer.syntax;

/**
 * Thrown when {@link Cursor#current()} is called at the end of the source.
 * <p>
 * This signals a bug in the calling grammar rule, never a problem with the parsed text.
 */
public class CursorEofException extends IllegalStateException {

    private final int position;

    /**
     * @param position The offset at which the character was requested.
     */
    public CursorEofException(int position) {
        super("No current character at end of input (position " + position + ")");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
