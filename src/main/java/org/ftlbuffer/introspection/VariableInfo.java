package org.ftlbuffer.introspection;

/**
 * A variable used by a message.
 *
 * @param name    The variable name without the {@code $}.
 * @param context Where the variable appears.
 */
public record VariableInfo(String name, Context context) {

    public enum Context {
        /** Directly in a placeable of the message text. */
        PATTERN,
        /** As the selector of a select expression. */
        SELECTOR,
        /** Inside the pattern of a select variant. */
        VARIANT,
        /** As an argument of a function call. */
        FUNCTION_ARG
    }
}
