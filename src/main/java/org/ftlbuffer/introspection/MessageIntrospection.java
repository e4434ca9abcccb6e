package org.ftlbuffer.introspection;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a message needs in order to be formatted: its variables, the functions it calls and the
 * messages and terms it references. Covers the value and all attributes.
 *
 * @param messageId    The id of the introspected message or term.
 * @param variables    The variables with the contexts they appear in.
 * @param functions    The function calls.
 * @param references   The message and term references.
 * @param hasSelectors Whether the message contains at least one select expression.
 */
public record MessageIntrospection(String messageId, Set<VariableInfo> variables, Set<FunctionCallInfo> functions,
                                   Set<ReferenceInfo> references, boolean hasSelectors) {

    public MessageIntrospection {
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
        references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
    }

    /**
     * @return The distinct variable names in order of first appearance.
     */
    public Set<String> variableNames() {
        return variables.stream()
                .map(VariableInfo::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean requiresVariable(String name) {
        return variables.stream().anyMatch(v -> v.name().equals(name));
    }

    public Set<String> functionNames() {
        return functions.stream()
                .map(FunctionCallInfo::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
