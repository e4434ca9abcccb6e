package org.ftlbuffer.runtime;

import org.ftlbuffer.diagnostics.Diagnostic;
import org.ftlbuffer.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The mutable state of one top-level resolution: the arguments in scope, the keys of the
 * messages and terms currently being resolved and the collected diagnostics.
 * <p>
 * A term called with its own arguments gets a child context that shares the stack and the
 * diagnostics but sees only the term's arguments.
 */
final class ResolutionContext {

    /** The maximum number of messages and terms resolved inside each other. */
    static final int MAX_DEPTH = 100;

    private final Map<String, ?> args;
    private final Set<String> stack;
    private final DiagnosticsEngine diagnostics;

    ResolutionContext(Map<String, ?> args) {
        this(args == null ? Map.of() : args, new LinkedHashSet<>(), new DiagnosticsEngine());
    }

    private ResolutionContext(Map<String, ?> args, Set<String> stack, DiagnosticsEngine diagnostics) {
        this.args = args;
        this.stack = stack;
        this.diagnostics = diagnostics;
    }

    ResolutionContext withArgs(Map<String, ?> scopedArgs) {
        return new ResolutionContext(scopedArgs, stack, diagnostics);
    }

    boolean hasArg(String name) {
        return args.containsKey(name);
    }

    Object arg(String name) {
        return args.get(name);
    }

    boolean isResolving(String key) {
        return stack.contains(key);
    }

    /**
     * @param key The key about to be entered again.
     * @return The current stack followed by {@code key}.
     */
    List<String> cyclePath(String key) {
        List<String> path = new ArrayList<>(stack);
        path.add(key);
        return path;
    }

    int depth() {
        return stack.size();
    }

    void enter(String key) {
        stack.add(key);
    }

    void leave(String key) {
        stack.remove(key);
    }

    void report(Diagnostic diagnostic) {
        diagnostics.report(diagnostic);
    }

    List<Diagnostic> diagnostics() {
        return diagnostics.getDiagnostics();
    }
}
