package org.ftlbuffer.runtime;

import org.ftlbuffer.diagnostics.ErrorTemplates;
import org.ftlbuffer.diagnostics.Outcome;
import org.ftlbuffer.runtime.functions.FunctionRegistry;
import org.ftlbuffer.runtime.plural.PluralRuleSelector;
import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.Expression;
import org.ftlbuffer.syntax.ast.FunctionReference;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.InlineExpression;
import org.ftlbuffer.syntax.ast.Literal;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.NamedArgument;
import org.ftlbuffer.syntax.ast.NumberLiteral;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.PatternElement;
import org.ftlbuffer.syntax.ast.Placeable;
import org.ftlbuffer.syntax.ast.SelectExpression;
import org.ftlbuffer.syntax.ast.StringLiteral;
import org.ftlbuffer.syntax.ast.Term;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.ast.TextElement;
import org.ftlbuffer.syntax.ast.VariableReference;
import org.ftlbuffer.syntax.ast.Variant;
import org.ftlbuffer.util.NumericValues;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns messages into text by evaluating their patterns against caller-supplied arguments.
 * <p>
 * Resolution never throws for problems in the messages or arguments. Each problem is recorded as
 * a diagnostic and the failing placeable is replaced by a readable fallback, so the caller always
 * gets text back. Messages and terms nested more than {@value ResolutionContext#MAX_DEPTH} levels
 * deep fail the same way. The resolver keeps no per-call state; all of it lives in a
 * {@link ResolutionContext} created by {@link #resolve(Message, Map, String)}.
 * <p>
 * The message and term maps are read, never modified. The owner must not change them while a
 * resolution is running.
 */
public class FluentResolver {

    static final char FSI = '\u2068';
    static final char PDI = '\u2069';
    static final String GENERIC_FALLBACK = "{???}";

    private final String locale;
    private final Map<String, Message> messages;
    private final Map<String, Term> terms;
    private final FunctionRegistry functions;
    private final PluralRuleSelector pluralRules;
    private final boolean useIsolating;

    /**
     * @param locale       The locale code used for plural rules and locale-aware built-in functions.
     * @param messages     The messages by id.
     * @param terms        The terms by id, without the leading dash.
     * @param functions    The functions callable from patterns.
     * @param pluralRules  The plural rules used by select expressions over numbers.
     * @param useIsolating Whether placeable values are wrapped in Unicode bidi isolation marks.
     */
    public FluentResolver(String locale, Map<String, Message> messages, Map<String, Term> terms,
                          FunctionRegistry functions, PluralRuleSelector pluralRules, boolean useIsolating) {
        this.locale = Objects.requireNonNull(locale, "locale");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.terms = Objects.requireNonNull(terms, "terms");
        this.functions = Objects.requireNonNull(functions, "functions");
        this.pluralRules = Objects.requireNonNull(pluralRules, "pluralRules");
        this.useIsolating = useIsolating;
    }

    /**
     * Formats a message value or one of its attributes.
     *
     * @param message   The message to format.
     * @param args      The variables available as {@code $name}, may be {@code null}.
     * @param attribute The attribute to format, or {@code null} for the message value.
     * @return The text and all diagnostics reported on the way.
     */
    public ResolveResult resolve(Message message, Map<String, ?> args, String attribute) {
        ResolutionContext context = new ResolutionContext(args);
        Outcome<String> outcome = resolveMessage(message, attribute, context);
        String value;
        if (outcome instanceof Outcome.Failure<String> failure) {
            context.report(failure.diagnostic());
            value = "{" + key(message.id().name(), attribute) + "}";
        } else {
            value = ((Outcome.Value<String>) outcome).value();
        }
        return new ResolveResult(value, context.diagnostics());
    }

    public String getLocale() {
        return locale;
    }

    public boolean isUseIsolating() {
        return useIsolating;
    }

    private Outcome<String> resolveMessage(Message message, String attribute, ResolutionContext context) {
        String id = message.id().name();
        Pattern pattern;
        if (attribute != null) {
            Optional<Attribute> target = message.attribute(attribute);
            if (target.isEmpty()) {
                return Outcome.failure(ErrorTemplates.attributeNotFound(attribute, id));
            }
            pattern = target.get().value();
        } else {
            if (message.value() == null) {
                return Outcome.failure(ErrorTemplates.messageNoValue(id));
            }
            pattern = message.value();
        }
        return resolveGuarded(key(id, attribute), pattern, context);
    }

    private Outcome<String> resolveTerm(TermReference reference, ResolutionContext context) {
        String id = reference.id().name();
        Term term = terms.get(id);
        if (term == null) {
            return Outcome.failure(ErrorTemplates.termNotFound(id));
        }
        Pattern pattern = term.value();
        String attribute = null;
        if (reference.attribute() != null) {
            attribute = reference.attribute().name();
            Optional<Attribute> target = term.attribute(attribute);
            if (target.isEmpty()) {
                return Outcome.failure(ErrorTemplates.termAttributeNotFound(attribute, id));
            }
            pattern = target.get().value();
        }
        // Parameterized terms see only their own arguments.
        ResolutionContext scope = context;
        if (reference.arguments() != null) {
            Map<String, Object> termArgs = new LinkedHashMap<>();
            for (NamedArgument argument : reference.arguments().named()) {
                termArgs.put(argument.name().name(), literalValue(argument.value()));
            }
            scope = context.withArgs(termArgs);
        }
        return resolveGuarded("-" + key(id, attribute), pattern, scope);
    }

    private Outcome<String> resolveGuarded(String key, Pattern pattern, ResolutionContext context) {
        if (context.isResolving(key)) {
            return Outcome.failure(ErrorTemplates.cyclicReference(context.cyclePath(key)));
        }
        if (context.depth() >= ResolutionContext.MAX_DEPTH) {
            return Outcome.failure(ErrorTemplates.maxDepthExceeded(ResolutionContext.MAX_DEPTH, key));
        }
        context.enter(key);
        try {
            return Outcome.of(resolvePattern(pattern, context));
        } finally {
            context.leave(key);
        }
    }

    private String resolvePattern(Pattern pattern, ResolutionContext context) {
        StringBuilder result = new StringBuilder();
        for (PatternElement element : pattern.elements()) {
            if (element instanceof TextElement text) {
                result.append(text.value());
                continue;
            }
            Expression expression = ((Placeable) element).expression();
            Outcome<Object> outcome = resolveExpression(expression, context);
            if (outcome instanceof Outcome.Failure<Object> failure) {
                context.report(failure.diagnostic());
                result.append(fallback(expression));
                continue;
            }
            String formatted = stringify(((Outcome.Value<Object>) outcome).value());
            if (useIsolating) {
                result.append(FSI).append(formatted).append(PDI);
            } else {
                result.append(formatted);
            }
        }
        return result.toString();
    }

    private Outcome<Object> resolveExpression(Expression expression, ResolutionContext context) {
        if (expression instanceof SelectExpression select) {
            return widen(resolveSelect(select, context));
        }
        if (expression instanceof StringLiteral literal) {
            return Outcome.of(literal.value());
        }
        if (expression instanceof NumberLiteral literal) {
            return Outcome.of(literal.value());
        }
        if (expression instanceof VariableReference variable) {
            String name = variable.id().name();
            if (!context.hasArg(name)) {
                return Outcome.failure(ErrorTemplates.variableNotProvided(name));
            }
            return Outcome.of(context.arg(name));
        }
        if (expression instanceof MessageReference reference) {
            Message message = messages.get(reference.id().name());
            if (message == null) {
                return Outcome.failure(ErrorTemplates.messageNotFound(reference.id().name()));
            }
            String attribute = reference.attribute() == null ? null : reference.attribute().name();
            return widen(resolveMessage(message, attribute, context));
        }
        if (expression instanceof TermReference reference) {
            return widen(resolveTerm(reference, context));
        }
        if (expression instanceof FunctionReference call) {
            return resolveFunction(call, context);
        }
        return Outcome.failure(ErrorTemplates.unknownExpression(expression.getClass().getSimpleName()));
    }

    private Outcome<Object> resolveFunction(FunctionReference call, ResolutionContext context) {
        String name = call.id().name();
        List<Object> positional = new ArrayList<>();
        for (InlineExpression argument : call.arguments().positional()) {
            Outcome<Object> value = resolveExpression(argument, context);
            if (value instanceof Outcome.Failure<Object>) {
                return value;
            }
            positional.add(((Outcome.Value<Object>) value).value());
        }
        Map<String, Object> named = new LinkedHashMap<>();
        for (NamedArgument argument : call.arguments().named()) {
            named.put(argument.name().name(), literalValue(argument.value()));
        }
        if (functions.requiresLocale(name)) {
            positional.add(locale);
        }
        return functions.call(name, positional, named);
    }

    private Outcome<String> resolveSelect(SelectExpression select, ResolutionContext context) {
        Outcome<Object> selectorOutcome = resolveExpression(select.selector(), context);
        if (selectorOutcome instanceof Outcome.Failure<Object> failure) {
            return failure.retype();
        }
        Object selector = ((Outcome.Value<Object>) selectorOutcome).value();
        Variant chosen = findExactMatch(select.variants(), selector);
        if (chosen == null && NumericValues.isNumber(selector)) {
            String category = pluralRules.categoryFor((Number) selector, locale);
            chosen = findIdentifierKey(select.variants(), category);
        }
        if (chosen == null) {
            chosen = select.defaultVariant().orElse(null);
        }
        if (chosen == null && !select.variants().isEmpty()) {
            chosen = select.variants().get(0);
        }
        if (chosen == null) {
            return Outcome.failure(ErrorTemplates.noVariants());
        }
        return Outcome.of(resolvePattern(chosen.value(), context));
    }

    private static Variant findExactMatch(List<Variant> variants, Object selector) {
        String text = stringify(selector);
        Optional<BigDecimal> number = NumericValues.isNumber(selector)
                ? NumericValues.toBigDecimal(selector)
                : Optional.empty();
        for (Variant variant : variants) {
            if (variant.key() instanceof Identifier identifier) {
                if (identifier.name().equals(text)) {
                    return variant;
                }
            } else if (number.isPresent()
                    && ((NumberLiteral) variant.key()).value().compareTo(number.get()) == 0) {
                return variant;
            }
        }
        return null;
    }

    private static Variant findIdentifierKey(List<Variant> variants, String name) {
        for (Variant variant : variants) {
            if (variant.key() instanceof Identifier identifier && identifier.name().equals(name)) {
                return variant;
            }
        }
        return null;
    }

    private static Object literalValue(Literal literal) {
        if (literal instanceof StringLiteral string) {
            return string.value();
        }
        return ((NumberLiteral) literal).value();
    }

    @SuppressWarnings("unchecked")
    private static Outcome<Object> widen(Outcome<? extends Object> outcome) {
        return (Outcome<Object>) outcome;
    }

    /**
     * @param expression The expression that failed.
     * @return The text shown in place of the failed placeable.
     */
    static String fallback(Expression expression) {
        if (expression instanceof VariableReference variable) {
            return "{$" + variable.id().name() + "}";
        }
        if (expression instanceof MessageReference reference) {
            return "{" + key(reference.id().name(), attributeName(reference.attribute())) + "}";
        }
        if (expression instanceof TermReference reference) {
            return "{-" + key(reference.id().name(), attributeName(reference.attribute())) + "}";
        }
        if (expression instanceof FunctionReference call) {
            return "{" + call.id().name() + "(...)}";
        }
        return GENERIC_FALLBACK;
    }

    /**
     * Converts a resolved value to the text inserted into the pattern.
     * @param value The value, may be {@code null}.
     * @return The text.
     */
    static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String string) {
            return string;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    private static String attributeName(Identifier attribute) {
        return attribute == null ? null : attribute.name();
    }

    private static String key(String id, String attribute) {
        return attribute == null ? id : id + "." + attribute;
    }
}
