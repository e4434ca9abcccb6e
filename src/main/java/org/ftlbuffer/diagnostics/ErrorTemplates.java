package org.ftlbuffer.diagnostics;

import java.util.List;

/**
 * Factory methods for the diagnostics reported while formatting, with consistent wording,
 * hints and documentation links.
 */
public final class ErrorTemplates {

    static final String DOCS_BASE = "https://projectfluent.org/fluent/guide/";

    private ErrorTemplates() {
    }

    public static Diagnostic messageNotFound(String messageId) {
        return new Diagnostic(DiagnosticCode.MESSAGE_NOT_FOUND,
                "Message '" + messageId + "' not found", null,
                "Check that the message is defined in the loaded resources",
                DOCS_BASE + "messages.html");
    }

    /**
     * A lookup that failed in every locale of a fallback chain.
     */
    public static Diagnostic messageNotFoundInAnyLocale(String messageId) {
        return new Diagnostic(DiagnosticCode.MESSAGE_NOT_FOUND,
                "Message '" + messageId + "' not found in any locale", null,
                "Add the message to the resources of at least one locale",
                DOCS_BASE + "messages.html");
    }

    /**
     * A lookup with an empty or missing id.
     */
    public static Diagnostic invalidMessageId() {
        return new Diagnostic(DiagnosticCode.MESSAGE_NOT_FOUND, "Invalid message ID: empty or null", null,
                "Pass the id of a message defined in the loaded resources", DOCS_BASE + "messages.html");
    }

    public static Diagnostic attributeNotFound(String attribute, String messageId) {
        return new Diagnostic(DiagnosticCode.ATTRIBUTE_NOT_FOUND,
                "Attribute '" + attribute + "' not found in message '" + messageId + "'", null,
                "Check that message '" + messageId + "' has an attribute '." + attribute + "'",
                DOCS_BASE + "attributes.html");
    }

    public static Diagnostic termNotFound(String termId) {
        return new Diagnostic(DiagnosticCode.TERM_NOT_FOUND,
                "Term '-" + termId + "' not found", null,
                "Terms must be defined before they are referenced",
                DOCS_BASE + "terms.html");
    }

    public static Diagnostic termAttributeNotFound(String attribute, String termId) {
        return new Diagnostic(DiagnosticCode.TERM_ATTRIBUTE_NOT_FOUND,
                "Attribute '" + attribute + "' not found in term '-" + termId + "'", null,
                "Check that term '-" + termId + "' has an attribute '." + attribute + "'",
                DOCS_BASE + "terms.html");
    }

    public static Diagnostic variableNotProvided(String variable) {
        return new Diagnostic(DiagnosticCode.VARIABLE_NOT_PROVIDED,
                "Variable '$" + variable + "' not provided", null,
                "Pass '" + variable + "' in the arguments dictionary",
                DOCS_BASE + "variables.html");
    }

    public static Diagnostic messageNoValue(String messageId) {
        return new Diagnostic(DiagnosticCode.MESSAGE_NO_VALUE,
                "Message '" + messageId + "' has no value", null,
                "Message has only attributes; specify which attribute to format",
                DOCS_BASE + "messages.html");
    }

    /**
     * @param path The resolution path ending with the repeated key, e.g. {@code [a, b, a]}.
     */
    public static Diagnostic cyclicReference(List<String> path) {
        return new Diagnostic(DiagnosticCode.CYCLIC_REFERENCE,
                "Circular reference detected: " + String.join(" -> ", path), null,
                "Break the circular dependency by removing one of the references",
                DOCS_BASE + "references.html");
    }

    /**
     * @param maxDepth The limit that was reached.
     * @param key      The message or term key that would have been entered next.
     */
    public static Diagnostic maxDepthExceeded(int maxDepth, String key) {
        return new Diagnostic(DiagnosticCode.MAX_DEPTH_EXCEEDED,
                "Maximum resolution depth of " + maxDepth + " exceeded at '" + key + "'", null,
                "Reduce how deeply messages and terms reference each other",
                DOCS_BASE + "references.html");
    }

    public static Diagnostic noVariants() {
        return new Diagnostic(DiagnosticCode.NO_VARIANTS,
                "No variants in select expression", null,
                "Select expressions must have at least one variant",
                DOCS_BASE + "selectors.html");
    }

    public static Diagnostic functionNotFound(String functionName) {
        return new Diagnostic(DiagnosticCode.FUNCTION_NOT_FOUND,
                "Function '" + functionName + "' not found", null,
                "Built-in functions: NUMBER, DATETIME. Check spelling.",
                DOCS_BASE + "functions.html");
    }

    public static Diagnostic functionFailed(String functionName, String reason) {
        return new Diagnostic(DiagnosticCode.FUNCTION_FAILED,
                "Function '" + functionName + "' failed: " + reason, null,
                "Check the function arguments and their types",
                DOCS_BASE + "functions.html");
    }

    public static Diagnostic unknownExpression(String expressionType) {
        return new Diagnostic(DiagnosticCode.UNKNOWN_EXPRESSION,
                "Unknown expression type: " + expressionType, null,
                "This is likely a bug in the parser or resolver", null);
    }

    public static Diagnostic unexpectedError(String reason) {
        return new Diagnostic(DiagnosticCode.UNKNOWN_EXPRESSION, "Unexpected error: " + reason);
    }

    public static Diagnostic unexpectedEof(int position) {
        return new Diagnostic(DiagnosticCode.UNEXPECTED_EOF,
                "Unexpected EOF at position " + position, null,
                "Check for unclosed braces or incomplete syntax", null);
    }

    public static Diagnostic numberParseFailed(String kind, String value, String localeCode) {
        return new Diagnostic(DiagnosticCode.NUMBER_PARSE_FAILED,
                "Failed to parse " + kind + " '" + value + "' for locale '" + localeCode + "'", null,
                "Use the decimal and grouping separators of the locale", null);
    }

    public static Diagnostic currencyNotFound(String value) {
        return new Diagnostic(DiagnosticCode.CURRENCY_PARSE_FAILED,
                "No currency symbol or code found in '" + value + "'", null,
                "Include a currency symbol or an ISO 4217 code such as EUR", null);
    }

    public static Diagnostic unknownCurrency(String currency, String value) {
        return new Diagnostic(DiagnosticCode.CURRENCY_PARSE_FAILED,
                "Unknown currency '" + currency + "' in '" + value + "'");
    }

    public static Diagnostic currencyAmountParseFailed(String amount, String value) {
        return new Diagnostic(DiagnosticCode.CURRENCY_PARSE_FAILED,
                "Failed to parse amount '" + amount + "' from '" + value + "'");
    }

    public static Diagnostic ambiguousCurrency(String symbol, String value) {
        return new Diagnostic(DiagnosticCode.AMBIGUOUS_CURRENCY,
                "Ambiguous currency symbol '" + symbol + "' in '" + value + "'", null,
                "Pass a default currency, infer it from the locale, or use an ISO code such as USD", null);
    }

    public static Diagnostic noCurrencyForLocale(String symbol, String localeCode) {
        return new Diagnostic(DiagnosticCode.AMBIGUOUS_CURRENCY,
                "Ambiguous currency symbol '" + symbol + "' and no currency for locale '" + localeCode + "'", null,
                "Use a locale with a country, pass a default currency, or use an ISO code", null);
    }

    public static Diagnostic dateParseFailed(String kind, String value, String localeCode) {
        return new Diagnostic(DiagnosticCode.DATE_PARSE_FAILED,
                "Failed to parse " + kind + " '" + value + "' for locale '" + localeCode + "'", null,
                "Use ISO-8601 or one of the date formats of the locale", null);
    }
}
