package org.ftlbuffer.diagnostics;

/**
 * Defines unique, testable codes for all problems reported while parsing and formatting messages.
 * This decouples callers and tests from the wording of the messages.
 */
public enum DiagnosticCode {
    // region Reference Errors
    /** A message id is not defined in the bundle. */
    MESSAGE_NOT_FOUND(1001),
    /** A message exists but has no attribute of the requested name. */
    ATTRIBUTE_NOT_FOUND(1002),
    /** A referenced term is not defined. */
    TERM_NOT_FOUND(1003),
    /** A term exists but has no attribute of the requested name. */
    TERM_ATTRIBUTE_NOT_FOUND(1004),
    /** A pattern uses a variable that was not passed as an argument. */
    VARIABLE_NOT_PROVIDED(1005),
    /** The value of a message without a value was requested. */
    MESSAGE_NO_VALUE(1006),
    // endregion

    // region Resolution Errors
    /** Resolving a message or term led back to itself. */
    CYCLIC_REFERENCE(2001),
    /** A select expression has no variants to choose from. */
    NO_VARIANTS(2002),
    /** A called function is not registered. */
    FUNCTION_NOT_FOUND(2003),
    /** A called function threw an exception. */
    FUNCTION_FAILED(2004),
    /** An expression could not be evaluated for an unexpected reason. */
    UNKNOWN_EXPRESSION(2005),
    /** References were nested deeper than the resolver allows. */
    MAX_DEPTH_EXCEEDED(2006),
    // endregion

    // region Syntax Errors
    /** The source ended in the middle of an entry. */
    UNEXPECTED_EOF(3001),
    /** The source contains a character that is not allowed at its position. */
    INVALID_CHARACTER(3002),
    /** A required token is missing. */
    EXPECTED_TOKEN(3003),
    // endregion

    // region Value Parsing Errors
    /** A display string is not a number in the given locale. */
    NUMBER_PARSE_FAILED(4001),
    /** A display string has no recognizable currency or amount. */
    CURRENCY_PARSE_FAILED(4002),
    /** A currency symbol stands for several currencies and none was chosen. */
    AMBIGUOUS_CURRENCY(4003),
    /** A display string is not a date or date-time in the given locale. */
    DATE_PARSE_FAILED(4004);
    // endregion

    private final int code;

    DiagnosticCode(int code) {
        this.code = code;
    }

    /**
     * @return The numeric code, e.g. 1001.
     */
    public int code() {
        return code;
    }

    /**
     * @return The category, derived from the thousands digit of the code.
     */
    public Category category() {
        return switch (code / 1000) {
            case 1 -> Category.REFERENCE;
            case 2 -> Category.RESOLUTION;
            case 4 -> Category.VALUE_PARSING;
            default -> Category.SYNTAX;
        };
    }

    /**
     * The broad kind of problem a code belongs to.
     */
    public enum Category {
        REFERENCE,
        RESOLUTION,
        SYNTAX,
        VALUE_PARSING
    }
}
