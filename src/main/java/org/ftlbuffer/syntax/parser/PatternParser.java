package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.InlineExpression;
import org.ftlbuffer.syntax.ast.NumberLiteral;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.PatternElement;
import org.ftlbuffer.syntax.ast.Placeable;
import org.ftlbuffer.syntax.ast.SelectExpression;
import org.ftlbuffer.syntax.ast.TextElement;
import org.ftlbuffer.syntax.ast.Variant;
import org.ftlbuffer.syntax.ast.VariantKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.ftlbuffer.syntax.parser.Primitives.MAX_NESTING_DEPTH;
import static org.ftlbuffer.syntax.parser.Primitives.isDigit;
import static org.ftlbuffer.syntax.parser.Primitives.isLineEnd;
import static org.ftlbuffer.syntax.parser.Primitives.nestingTooDeep;
import static org.ftlbuffer.syntax.parser.Primitives.parseIdentifier;
import static org.ftlbuffer.syntax.parser.Primitives.parseNumber;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlank;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlankInline;
import static org.ftlbuffer.syntax.parser.Primitives.skipLineEnd;

/**
 * Parses patterns, placeables and select expressions.
 * <p>
 * A pattern runs to the end of its line unless the next line is an indented continuation.
 * Patterns come in two modes: entry values (message, term and attribute values) treat
 * {@code [} and {@code *} as text and reject a stray {@code }}, while variant values stop at
 * {@code [}, {@code *} and {@code }} so that several variants fit on one line.
 * <p>
 * Placeables nested deeper than {@value Primitives#MAX_NESTING_DEPTH} levels are rejected, which
 * turns the enclosing entry into junk.
 */
public class PatternParser {

    private final ExpressionParser expressions;

    /**
     * @param expressions The parser used for inline expressions inside placeables.
     */
    public PatternParser(ExpressionParser expressions) {
        this.expressions = Objects.requireNonNull(expressions, "expressions");
    }

    /**
     * Skips the blanks between {@code =} (or a variant key) and the first pattern character.
     * If the line ends there and the next line is an indented continuation, the pattern starts
     * on that line after its indentation.
     *
     * @param cursor    The position after {@code =} or {@code ]}.
     * @param inVariant Whether the pattern is a variant value.
     * @return The position where the pattern starts.
     */
    public Cursor skipPatternStart(Cursor cursor, boolean inVariant) {
        cursor = skipBlankInline(cursor);
        if (isLineEnd(cursor) && isIndentedContinuation(cursor, inVariant)) {
            return skipBlankInline(skipLineEnd(cursor));
        }
        return cursor;
    }

    /**
     * Decides whether the line after the line break at {@code cursor} continues the current pattern.
     * It does if it starts with at least one space followed by a character that is not a line
     * break and not one of {@code [}, {@code *} or {@code .} (nor {@code }} inside a variant).
     *
     * @param cursor    The position of a line break.
     * @param inVariant Whether the pattern is a variant value.
     * @return {@code true} for a continuation line.
     */
    public boolean isIndentedContinuation(Cursor cursor, boolean inVariant) {
        Cursor next = skipLineEnd(cursor);
        if (!next.is(' ')) {
            return false;
        }
        next = skipBlankInline(next);
        if (next.isEof() || isLineEnd(next)) {
            return false;
        }
        char c = next.current();
        if (c == '[' || c == '*' || c == '.') {
            return false;
        }
        return !(inVariant && c == '}');
    }

    /**
     * Parses a pattern starting at the cursor. An empty pattern is a valid result.
     *
     * @param cursor    The first pattern position, usually from {@link #skipPatternStart}.
     * @param inVariant Whether the pattern is a variant value.
     * @return The pattern, with trailing spaces trimmed, and the cursor at its end.
     */
    public ParseResult<Pattern> parsePattern(Cursor cursor, boolean inVariant) {
        return parsePattern(cursor, inVariant, 0);
    }

    private ParseResult<Pattern> parsePattern(Cursor cursor, boolean inVariant, int depth) {
        List<PatternElement> elements = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        while (!cursor.isEof()) {
            char c = cursor.current();
            if (c == '{') {
                ParseResult<Placeable> placeable = parsePlaceable(cursor, depth);
                if (placeable.isFailure()) {
                    return placeable.propagate();
                }
                flushText(text, elements);
                elements.add(placeable.value());
                cursor = placeable.cursor();
            } else if (c == '}') {
                if (inVariant) {
                    break;
                }
                return ParseResult.failure("Unbalanced closing brace in pattern", cursor);
            } else if (inVariant && (c == '[' || c == '*')) {
                break;
            } else if (isLineEnd(cursor)) {
                if (!isIndentedContinuation(cursor, inVariant)) {
                    break;
                }
                // A line break inside a pattern reads as a single space.
                text.append(' ');
                cursor = skipBlankInline(skipLineEnd(cursor));
            } else {
                text.append(c);
                cursor = cursor.advance();
            }
        }

        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ' ') {
            end--;
        }
        text.setLength(end);
        flushText(text, elements);
        return ParseResult.success(new Pattern(elements), cursor);
    }

    private static void flushText(StringBuilder text, List<PatternElement> elements) {
        if (text.length() > 0) {
            elements.add(new TextElement(text.toString()));
            text.setLength(0);
        }
    }

    /**
     * Parses {@code { expression }} or {@code { selector -> variants }}.
     * @param cursor The position of the opening brace.
     * @return The placeable and the cursor after the closing brace.
     */
    public ParseResult<Placeable> parsePlaceable(Cursor cursor) {
        return parsePlaceable(cursor, 0);
    }

    /**
     * @param depth The number of placeables enclosing this one.
     */
    private ParseResult<Placeable> parsePlaceable(Cursor cursor, int depth) {
        if (!cursor.is('{')) {
            return ParseResult.failure("Expected '{'", cursor, "{");
        }
        if (depth >= MAX_NESTING_DEPTH) {
            return nestingTooDeep(cursor);
        }
        cursor = skipBlank(cursor.advance());
        ParseResult<InlineExpression> expression = expressions.parseInlineExpression(cursor, depth + 1);
        if (expression.isFailure()) {
            return expression.propagate();
        }
        cursor = skipBlank(expression.cursor());

        if (cursor.is('-') && cursor.isAt(1, '>')) {
            ParseResult<SelectExpression> select =
                    parseSelectExpression(cursor.advance(2), expression.value(), depth + 1);
            if (select.isFailure()) {
                return select.propagate();
            }
            return closePlaceable(skipBlank(select.cursor()), new Placeable(select.value()));
        }
        return closePlaceable(cursor, new Placeable(expression.value()));
    }

    private static ParseResult<Placeable> closePlaceable(Cursor cursor, Placeable placeable) {
        if (!cursor.is('}')) {
            return ParseResult.failure("Expected '}'", cursor, "}");
        }
        return ParseResult.success(placeable, cursor.advance());
    }

    /**
     * Parses the variant list of a select expression and checks that exactly one variant is
     * the default.
     *
     * @param cursor   The position after {@code ->}.
     * @param selector The already parsed selector.
     * @param depth    The nesting depth of the variant values.
     * @return The select expression, with the cursor at the closing brace (not consumed).
     */
    private ParseResult<SelectExpression> parseSelectExpression(Cursor cursor, InlineExpression selector, int depth) {
        List<Variant> variants = new ArrayList<>();
        while (true) {
            cursor = skipBlank(cursor);
            if (cursor.isEof()) {
                return ParseResult.failure("Expected '}'", cursor, "}");
            }
            if (cursor.is('}')) {
                break;
            }
            if (!cursor.is('[') && !cursor.is('*')) {
                return ParseResult.failure("Expected '}'", cursor, "[", "*", "}");
            }
            ParseResult<Variant> variant = parseVariant(cursor, depth);
            if (variant.isFailure()) {
                return variant.propagate();
            }
            variants.add(variant.value());
            cursor = variant.cursor();
        }

        if (variants.isEmpty()) {
            return ParseResult.failure("Select expression must have at least one variant", cursor, "[", "*[");
        }
        long defaults = variants.stream().filter(Variant::isDefault).count();
        if (defaults == 0) {
            return ParseResult.failure("Select expression must have exactly one default variant (marked with *)",
                    cursor, "*[");
        }
        if (defaults > 1) {
            return ParseResult.failure("Select expression must have exactly one default variant, found multiple",
                    cursor);
        }
        return ParseResult.success(new SelectExpression(selector, variants), cursor);
    }

    private ParseResult<Variant> parseVariant(Cursor cursor, int depth) {
        boolean isDefault = cursor.is('*');
        if (isDefault) {
            cursor = cursor.advance();
        }
        if (!cursor.is('[')) {
            return ParseResult.failure("Expected '[' at start of variant", cursor, "[");
        }
        cursor = skipBlank(cursor.advance());

        ParseResult<? extends VariantKey> key;
        if (cursor.is('-') || (!cursor.isEof() && isDigit(cursor.current()))) {
            ParseResult<NumberLiteral> number = parseNumber(cursor);
            key = number;
        } else {
            ParseResult<Identifier> identifier = parseIdentifier(cursor);
            if (identifier.isFailure()) {
                return ParseResult.failure("Expected variant key (identifier or number)", cursor, "a-zA-Z", "0-9");
            }
            key = identifier;
        }
        if (key.isFailure()) {
            return key.propagate();
        }

        cursor = skipBlank(key.cursor());
        if (!cursor.is(']')) {
            return ParseResult.failure("Expected ']' after variant key", cursor, "]");
        }
        ParseResult<Pattern> value = parsePattern(skipPatternStart(cursor.advance(), true), true, depth);
        if (value.isFailure()) {
            return value.propagate();
        }
        return ParseResult.success(new Variant(key.value(), value.value(), isDefault), value.cursor());
    }
}
