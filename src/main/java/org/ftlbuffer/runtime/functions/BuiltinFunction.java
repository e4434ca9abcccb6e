package org.ftlbuffer.runtime.functions;

import java.util.Objects;

/**
 * A function shipped with the library, together with its calling convention.
 *
 * @param name           The FTL name, e.g. {@code NUMBER}.
 * @param function       The implementation.
 * @param requiresLocale Whether the resolver appends the locale code as the last positional argument.
 */
public record BuiltinFunction(String name, FluentFunction function, boolean requiresLocale) {

    public BuiltinFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
    }
}
