package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.ast.CallArguments;
import org.ftlbuffer.syntax.ast.FunctionReference;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.InlineExpression;
import org.ftlbuffer.syntax.ast.Literal;
import org.ftlbuffer.syntax.ast.MessageReference;
import org.ftlbuffer.syntax.ast.NamedArgument;
import org.ftlbuffer.syntax.ast.TermReference;
import org.ftlbuffer.syntax.ast.VariableReference;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.ftlbuffer.syntax.parser.Primitives.MAX_NESTING_DEPTH;
import static org.ftlbuffer.syntax.parser.Primitives.isAsciiLetter;
import static org.ftlbuffer.syntax.parser.Primitives.isDigit;
import static org.ftlbuffer.syntax.parser.Primitives.nestingTooDeep;
import static org.ftlbuffer.syntax.parser.Primitives.parseIdentifier;
import static org.ftlbuffer.syntax.parser.Primitives.parseNumber;
import static org.ftlbuffer.syntax.parser.Primitives.parseStringLiteral;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlank;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlankInline;

/**
 * Parses inline expressions: literals, variable, message and term references, and function calls
 * with their argument lists.
 */
public class ExpressionParser {

    static final String FUNCTION_CLOSE_ERROR = "Expected ')' after function arguments";
    static final String TERM_CLOSE_ERROR = "Expected ')' after term arguments";

    /**
     * Parses one inline expression starting at the cursor.
     * @param cursor The position of the first character of the expression.
     * @return The expression and the cursor directly after it.
     */
    public ParseResult<InlineExpression> parseInlineExpression(Cursor cursor) {
        return parseInlineExpression(cursor, 0);
    }

    /**
     * @param cursor The position of the first character of the expression.
     * @param depth  The number of placeables and argument lists enclosing the expression.
     * @return The expression and the cursor directly after it.
     */
    ParseResult<InlineExpression> parseInlineExpression(Cursor cursor, int depth) {
        if (cursor.is('$')) {
            return parseIdentifier(cursor.advance()).map(VariableReference::new);
        }
        if (cursor.is('"')) {
            return parseStringLiteral(cursor).map(literal -> literal);
        }
        if (cursor.is('-')) {
            // The character after the dash decides between a term reference and a negative number.
            if (cursor.peek(1).map(Primitives::isAsciiLetter).orElse(false)) {
                return parseTermReference(cursor, depth).map(reference -> reference);
            }
            return parseNumber(cursor).map(literal -> literal);
        }
        if (!cursor.isEof() && isDigit(cursor.current())) {
            return parseNumber(cursor).map(literal -> literal);
        }
        if (!cursor.isEof() && isAsciiLetter(cursor.current())) {
            return parseIdentifierExpression(cursor, depth);
        }
        return ParseResult.failure("Expected variable ($var), string (\"\"), number, or function call",
                cursor, "$", "\"", "0-9", "-", "a-zA-Z");
    }

    private ParseResult<InlineExpression> parseIdentifierExpression(Cursor cursor, int depth) {
        ParseResult<Identifier> id = parseIdentifier(cursor);
        if (id.isFailure()) {
            return id.propagate();
        }
        Cursor afterBlank = skipBlankInline(id.cursor());
        if (afterBlank.is('(')) {
            String name = id.value().name();
            if (!isFunctionName(name)) {
                return ParseResult.failure("Function name must be uppercase: '" + name + "'", id.cursor());
            }
            ParseResult<CallArguments> arguments = parseCallArguments(afterBlank, FUNCTION_CLOSE_ERROR, depth);
            if (arguments.isFailure()) {
                return arguments.propagate();
            }
            return ParseResult.success(new FunctionReference(id.value(), arguments.value()), arguments.cursor());
        }
        ParseResult<Identifier> attribute = parseAttributeAccessor(id.cursor());
        if (attribute.isFailure()) {
            return attribute.propagate();
        }
        return ParseResult.success(new MessageReference(id.value(), attribute.value()), attribute.cursor());
    }

    /**
     * Parses {@code -identifier(.attribute)? (arguments)?}.
     * @param cursor The position of the dash.
     * @param depth  The nesting depth of the reference.
     * @return The term reference.
     */
    private ParseResult<TermReference> parseTermReference(Cursor cursor, int depth) {
        if (!cursor.is('-')) {
            return ParseResult.failure("Expected '-' at start of term reference", cursor, "-");
        }
        ParseResult<Identifier> id = parseIdentifier(cursor.advance());
        if (id.isFailure()) {
            return id.propagate();
        }
        ParseResult<Identifier> attribute = parseAttributeAccessor(id.cursor());
        if (attribute.isFailure()) {
            return attribute.propagate();
        }
        Cursor afterBlank = skipBlankInline(attribute.cursor());
        if (!afterBlank.is('(')) {
            return ParseResult.success(new TermReference(id.value(), attribute.value(), null), attribute.cursor());
        }
        ParseResult<CallArguments> arguments = parseCallArguments(afterBlank, TERM_CLOSE_ERROR, depth);
        if (arguments.isFailure()) {
            return arguments.propagate();
        }
        return ParseResult.success(
                new TermReference(id.value(), attribute.value(), arguments.value()), arguments.cursor());
    }

    /**
     * Parses an optional {@code .attribute} directly after a reference name.
     * @return A success holding {@code null} if there is no dot.
     */
    private ParseResult<Identifier> parseAttributeAccessor(Cursor cursor) {
        if (!cursor.is('.')) {
            return ParseResult.success(null, cursor);
        }
        return parseIdentifier(cursor.advance());
    }

    /**
     * Parses a parenthesized argument list including both parentheses.
     * Arguments may be separated by commas and may span several lines.
     *
     * @param cursor     The position of the opening parenthesis.
     * @param closeError The error reported when the closing parenthesis is missing.
     * @param depth      The nesting depth of the call.
     * @return The arguments and the cursor after the closing parenthesis.
     */
    private ParseResult<CallArguments> parseCallArguments(Cursor cursor, String closeError, int depth) {
        if (!cursor.is('(')) {
            return ParseResult.failure("Expected '('", cursor, "(");
        }
        if (depth >= MAX_NESTING_DEPTH) {
            return nestingTooDeep(cursor);
        }
        cursor = cursor.advance();
        List<InlineExpression> positional = new ArrayList<>();
        List<NamedArgument> named = new ArrayList<>();
        Set<String> names = new HashSet<>();

        while (true) {
            cursor = skipBlank(cursor);
            if (cursor.isEof()) {
                return ParseResult.failure(closeError, cursor, ")");
            }
            if (cursor.is(')')) {
                break;
            }
            Cursor argumentStart = cursor;
            ParseResult<InlineExpression> argument = parseInlineExpression(cursor, depth + 1);
            if (argument.isFailure()) {
                return argument.propagate();
            }
            cursor = skipBlank(argument.cursor());

            if (cursor.is(':')) {
                if (!(argument.value() instanceof MessageReference reference) || reference.attribute() != null) {
                    return ParseResult.failure("Named argument name must be an identifier", argumentStart);
                }
                String name = reference.id().name();
                if (!names.add(name)) {
                    return ParseResult.failure("Duplicate named argument: '" + name + "'", argumentStart);
                }
                cursor = skipBlank(cursor.advance());
                if (cursor.isEof() || cursor.is(')') || cursor.is(',')) {
                    return ParseResult.failure("Expected value after ':'", cursor, "\"", "0-9");
                }
                Cursor valueStart = cursor;
                ParseResult<InlineExpression> value = parseInlineExpression(cursor, depth + 1);
                if (value.isFailure()) {
                    return value.propagate();
                }
                if (!(value.value() instanceof Literal literal)) {
                    return ParseResult.failure("Named argument '" + name + "' must be a string or number literal;"
                            + " named argument values cannot be references. Move the logic into a select"
                            + " expression instead, e.g. { $var -> [a] ... *[b] ... }", valueStart, "\"", "0-9");
                }
                named.add(new NamedArgument(reference.id(), literal));
                cursor = value.cursor();
            } else {
                if (!named.isEmpty()) {
                    return ParseResult.failure("Positional arguments must come before named arguments", argumentStart);
                }
                positional.add(argument.value());
            }

            cursor = skipBlank(cursor);
            if (cursor.is(',')) {
                cursor = cursor.advance();
            }
        }
        return ParseResult.success(new CallArguments(positional, named), cursor.advance());
    }

    /**
     * @param name An identifier.
     * @return {@code true} if it matches {@code [A-Z][A-Z0-9_-]*}.
     */
    static boolean isFunctionName(String name) {
        if (name.isEmpty() || name.charAt(0) < 'A' || name.charAt(0) > 'Z') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!((c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '-')) {
                return false;
            }
        }
        return true;
    }
}
