package org.ftlbuffer.runtime.functions;

import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The functions available to FTL patterns, keyed by their upper-case names.
 * <p>
 * A registry remembers the built-in functions it was created with. A function registered later
 * under a built-in name replaces the built-in for calls and is no longer treated as built-in, so
 * the resolver stops appending the locale argument for it.
 * <p>
 * Not thread-safe; {@code FluentBundle} guards its registry with its own lock.
 */
public class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, BuiltinFunction> builtins;
    private final Map<String, FluentFunction> functions;

    /**
     * Creates an empty registry without built-in functions.
     */
    public FunctionRegistry() {
        this(Map.of(), new LinkedHashMap<>());
    }

    private FunctionRegistry(Map<String, BuiltinFunction> builtins, Map<String, FluentFunction> functions) {
        this.builtins = builtins;
        this.functions = functions;
    }

    /**
     * @return A registry holding NUMBER, DATETIME and CURRENCY.
     */
    public static FunctionRegistry withBuiltins() {
        Map<String, BuiltinFunction> builtins = new LinkedHashMap<>();
        Map<String, FluentFunction> functions = new LinkedHashMap<>();
        for (BuiltinFunction builtin : BuiltinFunctions.all()) {
            builtins.put(builtin.name(), builtin);
            functions.put(builtin.name(), builtin.function());
        }
        return new FunctionRegistry(Collections.unmodifiableMap(builtins), functions);
    }

    /**
     * Registers a function, replacing any function of the same name.
     * @param name     The FTL name.
     * @param function The implementation.
     */
    public void register(String name, FluentFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be empty");
        }
        functions.put(name, Objects.requireNonNull(function, "function"));
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    /**
     * @param name A function name.
     * @return {@code true} if the function registered under {@code name} is this registry's own built-in.
     */
    public boolean isBuiltin(String name) {
        BuiltinFunction builtin = builtins.get(name);
        return builtin != null && functions.get(name) == builtin.function();
    }

    /**
     * @param name A function name.
     * @return {@code true} if calls to {@code name} must receive the locale code as the last positional argument.
     */
    public boolean requiresLocale(String name) {
        return isBuiltin(name) && builtins.get(name).requiresLocale();
    }

    /**
     * Calls a function. Never throws for a failing function.
     *
     * @param name       The function name.
     * @param positional The positional arguments.
     * @param named      The named arguments.
     * @return The function's result, or a {@code FUNCTION_NOT_FOUND} / {@code FUNCTION_FAILED} failure.
     */
    public Outcome<Object> call(String name, List<Object> positional, Map<String, Object> named) {
        FluentFunction function = functions.get(name);
        if (function == null) {
            return Outcome.failure(ErrorTemplates.functionNotFound(name));
        }
        try {
            return Outcome.of(function.call(
                    Collections.unmodifiableList(new ArrayList<>(positional)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(named))));
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            LOG.debug("Function {} failed: {}", name, reason, e);
            return Outcome.failure(ErrorTemplates.functionFailed(name, reason));
        }
    }

    /**
     * @return The registered names in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(functions.keySet()));
    }

    /**
     * @return An independent registry with the same functions and the same built-ins.
     */
    public FunctionRegistry copy() {
        return new FunctionRegistry(builtins, new LinkedHashMap<>(functions));
    }
}
