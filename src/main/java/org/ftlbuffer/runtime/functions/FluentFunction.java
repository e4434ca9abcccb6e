package org.ftlbuffer.runtime.functions;

import java.util.List;
import java.util.Map;

/**
 * A function callable from FTL, e.g. {@code { NUMBER($n, minimumFractionDigits: 2) }}.
 * <p>
 * Any exception thrown by an implementation is reported as a {@code FUNCTION_FAILED} diagnostic
 * and the call is replaced by a fallback; it never escapes message formatting.
 */
@FunctionalInterface
public interface FluentFunction {

    /**
     * @param positional The positional arguments in order. Elements may be {@code null}.
     * @param named      The named arguments, keyed by their FTL name (e.g. {@code minimumFractionDigits}).
     * @return The result, stringified by the resolver.
     * @throws Exception if the function cannot produce a result.
     */
    Object call(List<Object> positional, Map<String, Object> named) throws Exception;
}
