package org.ftlbuffer.diagnostics.validation;

import org.ftlbuffer.diagnostics.Diagnostic;
import org.ftlbuffer.diagnostics.DiagnosticCode;
import org.ftlbuffer.diagnostics.SourceLocation;
import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.ast.Annotation;
import org.ftlbuffer.syntax.ast.Entry;
import org.ftlbuffer.syntax.ast.Junk;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.ast.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Checks a parsed resource for syntax errors and for problems that only show up when formatting:
 * duplicate ids, references to undefined messages or terms and circular references.
 * <p>
 * The check looks at the resource alone. A reference to a message defined in another resource
 * is reported as undefined.
 */
public class ResourceValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceValidator.class);

    private static final String DEFAULT_ERROR_MESSAGE = "Failed to parse FTL content";

    /**
     * Validates a resource.
     *
     * @param resource The parsed resource.
     * @param source   The source text the resource was parsed from, used for line and column numbers.
     * @return The errors and warnings.
     */
    public ValidationResult validate(Resource resource, String source) {
        List<ValidationError> errors = new ArrayList<>();
        for (Junk junk : resource.junk()) {
            errors.add(toError(junk, source));
        }

        List<ValidationWarning> warnings = new ArrayList<>();
        Map<String, ReferenceCollector> messages = new LinkedHashMap<>();
        Map<String, ReferenceCollector> terms = new LinkedHashMap<>();
        for (Entry entry : resource.entries()) {
            if (entry instanceof Message message) {
                String id = message.id().name();
                if (messages.containsKey(id)) {
                    warnings.add(new ValidationWarning(ValidationWarning.DUPLICATE_ID,
                            "Duplicate message ID '" + id + "' (later definition will overwrite earlier)", id));
                }
                messages.put(id, ReferenceCollector.of(message.value(), message.attributes()));
            } else if (entry instanceof Term term) {
                String id = term.id().name();
                if (terms.containsKey(id)) {
                    warnings.add(new ValidationWarning(ValidationWarning.DUPLICATE_ID,
                            "Duplicate term ID '" + id + "' (later definition will overwrite earlier)", id));
                }
                terms.put(id, ReferenceCollector.of(term.value(), term.attributes()));
            }
        }

        messages.forEach((id, refs) -> checkReferences("Message '" + id + "'", refs, messages, terms, warnings));
        terms.forEach((id, refs) -> checkReferences("Term '-" + id + "'", refs, messages, terms, warnings));

        findCycles(messages, ReferenceCollector::getMessageReferences, "", "Circular message reference: ", warnings);
        findCycles(terms, ReferenceCollector::getTermReferences, "-", "Circular term reference: ", warnings);

        LOG.debug("Validated resource: {} errors, {} warnings", errors.size(), warnings.size());
        return new ValidationResult(errors, warnings);
    }

    private static ValidationError toError(Junk junk, String source) {
        Span span = junk.span() != null ? junk.span() : Span.at(0);
        SourceLocation start = SourceLocation.of(source, span);
        String message = DEFAULT_ERROR_MESSAGE;
        Span errorSpan = span;
        if (!junk.annotations().isEmpty()) {
            Annotation annotation = junk.annotations().get(0);
            message = annotation.message();
            if (annotation.span() != null) {
                errorSpan = annotation.span();
            }
        }
        DiagnosticCode code = errorSpan.start() >= source.length()
                ? DiagnosticCode.UNEXPECTED_EOF
                : DiagnosticCode.EXPECTED_TOKEN;
        Diagnostic diagnostic = new Diagnostic(code, message).withLocation(SourceLocation.of(source, errorSpan));
        return new ValidationError(ValidationError.PARSE_ERROR, message, junk.content(),
                start.line(), start.column(), diagnostic);
    }

    private static void checkReferences(String owner, ReferenceCollector refs,
                                        Map<String, ReferenceCollector> messages,
                                        Map<String, ReferenceCollector> terms,
                                        List<ValidationWarning> warnings) {
        for (String ref : refs.getMessageReferences()) {
            if (!messages.containsKey(ref)) {
                warnings.add(new ValidationWarning(ValidationWarning.UNDEFINED_REFERENCE,
                        owner + " references undefined message '" + ref + "'", ref));
            }
        }
        for (String ref : refs.getTermReferences()) {
            if (!terms.containsKey(ref)) {
                warnings.add(new ValidationWarning(ValidationWarning.UNDEFINED_REFERENCE,
                        owner + " references undefined term '-" + ref + "'", "-" + ref));
            }
        }
    }

    private static void findCycles(Map<String, ReferenceCollector> graph,
                                   Function<ReferenceCollector, Set<String>> edges,
                                   String prefix, String title, List<ValidationWarning> warnings) {
        Set<String> visited = new HashSet<>();
        Set<Set<String>> reported = new HashSet<>();
        for (String start : graph.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            List<String> cycle = depthFirst(start, graph, edges, visited);
            if (cycle != null && reported.add(new TreeSet<>(cycle))) {
                List<String> path = new ArrayList<>();
                for (String id : cycle) {
                    path.add(prefix + id);
                }
                String rendered = String.join(" -> ", path);
                warnings.add(new ValidationWarning(ValidationWarning.CIRCULAR_REFERENCE, title + rendered, rendered));
            }
        }
    }

    /**
     * Walks the graph from {@code start} with an explicit stack; reference chains may be of any length.
     *
     * @return The first cycle reachable from {@code start}, starting and ending with the same id, or {@code null}.
     */
    private static List<String> depthFirst(String start, Map<String, ReferenceCollector> graph,
                                           Function<ReferenceCollector, Set<String>> edges,
                                           Set<String> visited) {
        List<String> path = new ArrayList<>();
        Map<String, Integer> onPath = new HashMap<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        visited.add(start);
        onPath.put(start, 0);
        path.add(start);
        pending.push(successors(start, graph, edges));

        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                onPath.remove(path.remove(path.size() - 1));
                continue;
            }
            String node = next.next();
            Integer index = onPath.get(node);
            if (index != null) {
                List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
                cycle.add(node);
                return cycle;
            }
            if (visited.add(node)) {
                onPath.put(node, path.size());
                path.add(node);
                pending.push(successors(node, graph, edges));
            }
        }
        return null;
    }

    private static Iterator<String> successors(String node, Map<String, ReferenceCollector> graph,
                                               Function<ReferenceCollector, Set<String>> edges) {
        ReferenceCollector refs = graph.get(node);
        return refs == null ? Collections.emptyIterator() : edges.apply(refs).iterator();
    }
}
