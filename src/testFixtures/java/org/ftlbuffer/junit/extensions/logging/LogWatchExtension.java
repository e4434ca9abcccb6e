package org.ftlbuffer.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is permitted with {@link AllowLog}
 * or required with {@link ExpectLog}. Missing expected events fail the test as well.
 * <p>
 * One Logback turbo filter is installed per test class; method-level rules replace the class-level
 * ones before each test and captured events are cleared after each test.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            filter.rules = Rules.resolve(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = Rules.resolve(context);
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (event.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.permits(event)) {
                    unexpected.add(event.toString());
                }
            }
        }
        List<String> missing = new ArrayList<>();
        for (ExpectLog expect : rules.expects) {
            long count = events.stream()
                    .filter(e -> e.matches(expect.level(), expect.loggerPattern(), expect.messagePattern()))
                    .count();
            if (count < expect.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Event(String loggerName, Level level, String message) {

        boolean matches(LogLevel minLevel, String loggerPattern, String messagePattern) {
            return level.isGreaterOrEqual(toLogback(minLevel))
                    && Pattern.matches(loggerPattern, loggerName)
                    && Pattern.matches(messagePattern, message);
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        static Rules resolve(ExtensionContext context) {
            FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                    .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
            return new Rules(
                    fail != null ? fail.level() : LogLevel.WARN,
                    fail != null && fail.disabled(),
                    collect(context, AllowLog.class),
                    collect(context, ExpectLog.class));
        }

        /**
         * Class-level annotations first, then those of the current element.
         */
        private static <A extends Annotation> List<A> collect(ExtensionContext context, Class<A> type) {
            List<A> result = new ArrayList<>();
            Optional<Class<?>> testClass = context.getTestClass();
            testClass.ifPresent(c -> result.addAll(Arrays.asList(c.getAnnotationsByType(type))));
            Optional<AnnotatedElement> element = context.getElement();
            if (element.isPresent() && !element.equals(testClass.map(c -> (AnnotatedElement) c))) {
                result.addAll(Arrays.asList(element.get().getAnnotationsByType(type)));
            }
            return result;
        }

        boolean permits(Event event) {
            return allows.stream().anyMatch(a -> event.matches(a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> event.matches(e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // A null format is an isXxxEnabled() check, not an event.
            if (format == null || !level.isGreaterOrEqual(toLogback(rules.minLevel))) {
                return FilterReply.NEUTRAL;
            }
            Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            // Permitted events are kept out of the console output.
            return rules.permits(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
