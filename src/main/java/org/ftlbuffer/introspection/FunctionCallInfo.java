package org.ftlbuffer.introspection;

import java.util.List;
import java.util.Set;

/**
 * A function call found in a message.
 *
 * @param name                The function name, e.g. {@code NUMBER}.
 * @param positionalVariables The names of the variables passed as positional arguments, in order.
 * @param namedArguments      The names of the named options passed to the call.
 */
public record FunctionCallInfo(String name, List<String> positionalVariables, Set<String> namedArguments) {

    public FunctionCallInfo {
        positionalVariables = List.copyOf(positionalVariables);
        namedArguments = Set.copyOf(namedArguments);
    }
}
