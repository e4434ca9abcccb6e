package org.ftlbuffer.runtime;

import com.typesafe.config.Config;
import org.ftlbuffer.diagnostics.Diagnostic;
import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.validation.ResourceValidator;
import org.ftlbuffer.diagnostics.validation.ValidationResult;
import org.ftlbuffer.introspection.MessageIntrospection;
import org.ftlbuffer.introspection.MessageIntrospector;
import org.ftlbuffer.runtime.cache.CacheStats;
import org.ftlbuffer.runtime.cache.FormatCache;
import org.ftlbuffer.runtime.functions.FluentFunction;
import org.ftlbuffer.runtime.functions.FunctionRegistry;
import org.ftlbuffer.runtime.plural.PluralRuleSelector;
import org.ftlbuffer.runtime.plural.PluralRules;
import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.ast.Entry;
import org.ftlbuffer.syntax.ast.Junk;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.Resource;
import org.ftlbuffer.syntax.ast.Term;
import org.ftlbuffer.syntax.parser.FluentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The messages and terms of one locale, ready to be formatted.
 * <p>
 * A bundle collects entries from any number of FTL resources. Later definitions of the same id
 * replace earlier ones. Formatting never throws: problems are returned as diagnostics next to
 * a best-effort text.
 * <p>
 * Thread-safe. Adding resources or functions takes a write lock, formatting a read lock.
 */
public class FluentBundle {

    private static final Logger LOG = LoggerFactory.getLogger(FluentBundle.class);
    private static final int JUNK_PREVIEW_LENGTH = 100;

    private final BundleOptions options;
    private final FluentParser parser = new FluentParser();
    private final ResourceValidator validator = new ResourceValidator();
    private final Map<String, Message> messages = new LinkedHashMap<>();
    private final Map<String, Term> terms = new LinkedHashMap<>();
    private final FunctionRegistry functions;
    private final FluentResolver resolver;
    private final FormatCache<ResolveResult> cache;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public FluentBundle(String locale) {
        this(BundleOptions.of(locale));
    }

    public FluentBundle(BundleOptions options) {
        this(options, new PluralRules());
    }

    /**
     * @param options     The bundle settings.
     * @param pluralRules The plural rules used by select expressions.
     */
    public FluentBundle(BundleOptions options, PluralRuleSelector pluralRules) {
        this.options = options;
        this.functions = FunctionRegistry.withBuiltins();
        this.resolver = new FluentResolver(options.locale(), messages, terms, functions, pluralRules,
                options.useIsolating());
        this.cache = options.cacheEnabled() ? new FormatCache<>(options.cacheSize()) : null;
        LOG.debug("Created bundle for locale {} (isolating: {}, cache: {})",
                options.locale(), options.useIsolating(), options.cacheEnabled() ? options.cacheSize() : "off");
    }

    /**
     * @param config A configuration holding an {@code ftlbuffer.bundle} section.
     * @return A bundle with the configured options.
     */
    public static FluentBundle fromConfig(Config config) {
        return new FluentBundle(BundleOptions.fromConfig(config));
    }

    public String getLocale() {
        return options.locale();
    }

    public BundleOptions getOptions() {
        return options;
    }

    public Resource addResource(String source) {
        return addResource(source, null);
    }

    /**
     * Parses FTL source and registers its messages and terms.
     * Entries that fail to parse are skipped and logged.
     *
     * @param source     The FTL source.
     * @param sourcePath Where the source came from, used in log messages, or {@code null}.
     * @return The parsed resource including comments and junk.
     */
    public Resource addResource(String source, String sourcePath) {
        Resource resource = parser.parse(source);
        int junkCount = 0;
        lock.writeLock().lock();
        try {
            for (Entry entry : resource.entries()) {
                if (entry instanceof Message message) {
                    messages.put(message.id().name(), message);
                } else if (entry instanceof Term term) {
                    terms.put(term.id().name(), term);
                } else if (entry instanceof Junk junk) {
                    junkCount++;
                    logJunk(junk, source, sourcePath);
                }
            }
            clearCacheLocked();
            LOG.info("Added resource {}: {} messages, {} terms, {} junk entries",
                    sourcePath != null ? sourcePath : "(inline)", messages.size(), terms.size(), junkCount);
        } finally {
            lock.writeLock().unlock();
        }
        return resource;
    }

    private static void logJunk(Junk junk, String source, String sourcePath) {
        String preview = junk.content().length() > JUNK_PREVIEW_LENGTH
                ? junk.content().substring(0, JUNK_PREVIEW_LENGTH)
                : junk.content();
        String reason = junk.annotations().isEmpty() ? "" : junk.annotations().get(0).message();
        if (sourcePath != null) {
            int line = junk.span() == null ? 0 : new Cursor(source, junk.span().start()).lineCol().line();
            LOG.warn("Syntax error in {} at line {}: {} ({})", sourcePath, line, reason, preview.strip());
        } else {
            LOG.debug("Junk entry: {} ({})", reason, preview.strip());
        }
    }

    /**
     * Checks FTL source without adding it to this bundle.
     * @param source The FTL source.
     * @return The syntax errors and semantic warnings.
     */
    public ValidationResult validateResource(String source) {
        return validator.validate(parser.parse(source), source);
    }

    public ResolveResult formatValue(String id, Map<String, ?> args) {
        return formatPattern(id, args, null);
    }

    /**
     * Formats a message value or attribute.
     *
     * @param id        The message id.
     * @param args      The arguments, may be {@code null}.
     * @param attribute The attribute name, or {@code null} for the value.
     * @return The text and any diagnostics. Never {@code null}.
     */
    public ResolveResult formatPattern(String id, Map<String, ?> args, String attribute) {
        if (id == null || id.isEmpty()) {
            LOG.warn("Invalid message ID: empty or null");
            return new ResolveResult(FluentResolver.GENERIC_FALLBACK, List.of(ErrorTemplates.invalidMessageId()));
        }
        lock.readLock().lock();
        try {
            if (cache != null) {
                Optional<ResolveResult> cached = cache.get(id, args, attribute, options.locale());
                if (cached.isPresent()) {
                    return cached.get();
                }
            }
            Message message = messages.get(id);
            if (message == null) {
                LOG.warn("Message '{}' not found", id);
                return new ResolveResult("{" + id + "}", List.of(ErrorTemplates.messageNotFound(id)));
            }
            ResolveResult result;
            try {
                result = resolver.resolve(message, args, attribute);
            } catch (RuntimeException e) {
                LOG.error("Unexpected error resolving message '{}'", id, e);
                return new ResolveResult("{" + id + "}", List.of(ErrorTemplates.unexpectedError(String.valueOf(e.getMessage()))));
            }
            if (result.hasErrors()) {
                LOG.warn("Message '{}' resolved with {} error(s)", id, result.diagnostics().size());
                for (Diagnostic diagnostic : result.diagnostics()) {
                    LOG.debug("{}", diagnostic.format());
                }
            }
            if (cache != null) {
                cache.put(id, args, attribute, options.locale(), result);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasMessage(String id) {
        lock.readLock().lock();
        try {
            return messages.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasTerm(String id) {
        lock.readLock().lock();
        try {
            return terms.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Message> getMessage(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(messages.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return The message ids in the order they were first added.
     */
    public List<String> getMessageIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(messages.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param id A message id.
     * @return The names of the variables the message uses.
     * @throws NoSuchElementException if the bundle has no such message.
     */
    public Set<String> getMessageVariables(String id) {
        return introspectMessage(id).variableNames();
    }

    /**
     * @return The variable names of every message, keyed by message id in insertion order.
     */
    public Map<String, Set<String>> getAllMessageVariables() {
        lock.readLock().lock();
        try {
            Map<String, Set<String>> result = new LinkedHashMap<>();
            messages.forEach((id, message) -> result.put(id, MessageIntrospector.introspect(message).variableNames()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param id A message id.
     * @return The variables, functions and references of the message.
     * @throws NoSuchElementException if the bundle has no such message.
     */
    public MessageIntrospection introspectMessage(String id) {
        Message message = getMessage(id)
                .orElseThrow(() -> new NoSuchElementException("Message '" + id + "' not found"));
        return MessageIntrospector.introspect(message);
    }

    /**
     * Registers a custom function. A function registered under a built-in name replaces the built-in.
     * @param name     The FTL function name, conventionally upper case.
     * @param function The implementation.
     */
    public void addFunction(String name, FluentFunction function) {
        lock.writeLock().lock();
        try {
            functions.register(name, function);
            clearCacheLocked();
            LOG.debug("Added function {}", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearCache() {
        lock.writeLock().lock();
        try {
            clearCacheLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return The cache statistics, or empty if caching is disabled.
     */
    public Optional<CacheStats> cacheStats() {
        return cache == null ? Optional.empty() : Optional.of(cache.stats());
    }

    private void clearCacheLocked() {
        if (cache != null) {
            cache.clear();
        }
    }
}
