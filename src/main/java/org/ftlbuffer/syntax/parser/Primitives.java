package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.NumberLiteral;
import org.ftlbuffer.syntax.ast.StringLiteral;

/**
 * Character classes, whitespace handling and the lexical rules shared by all grammar parts.
 */
final class Primitives {

    /** How deeply placeables and call argument lists may be nested inside each other. */
    static final int MAX_NESTING_DEPTH = 100;

    private Primitives() {
    }

    static <T> ParseResult<T> nestingTooDeep(Cursor cursor) {
        return ParseResult.failure("Maximum nesting depth of " + MAX_NESTING_DEPTH + " exceeded", cursor);
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierPart(char c) {
        return isAsciiLetter(c) || isDigit(c) || c == '-' || c == '_';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * @param cursor The position.
     * @return {@code true} if a line break ({@code \n}, {@code \r\n} or a lone {@code \r}) starts here.
     */
    static boolean isLineEnd(Cursor cursor) {
        return cursor.is('\n') || cursor.is('\r');
    }

    /**
     * Skips one line break, treating {@code \r\n} as a single break.
     * @param cursor The position, expected at a line break.
     * @return The cursor at the start of the next line, or unchanged if there is no line break.
     */
    static Cursor skipLineEnd(Cursor cursor) {
        if (cursor.is('\r')) {
            cursor = cursor.advance();
            return cursor.is('\n') ? cursor.advance() : cursor;
        }
        return cursor.is('\n') ? cursor.advance() : cursor;
    }

    /**
     * Skips to the first line break (or the end of the source) without consuming it.
     */
    static Cursor skipToLineEnd(Cursor cursor) {
        while (!cursor.isEof() && !isLineEnd(cursor)) {
            cursor = cursor.advance();
        }
        return cursor;
    }

    /**
     * Skips spaces. Tabs are not blank in FTL.
     */
    static Cursor skipBlankInline(Cursor cursor) {
        while (cursor.is(' ')) {
            cursor = cursor.advance();
        }
        return cursor;
    }

    /**
     * Skips spaces and line breaks.
     */
    static Cursor skipBlank(Cursor cursor) {
        while (cursor.is(' ') || isLineEnd(cursor)) {
            cursor = cursor.advance();
        }
        return cursor;
    }

    /**
     * Parses {@code [A-Za-z][A-Za-z0-9_-]*}.
     */
    static ParseResult<Identifier> parseIdentifier(Cursor cursor) {
        if (cursor.isEof() || !isAsciiLetter(cursor.current())) {
            return ParseResult.failure("Expected identifier", cursor, "a-zA-Z");
        }
        int start = cursor.pos();
        cursor = cursor.advance();
        while (!cursor.isEof() && isIdentifierPart(cursor.current())) {
            cursor = cursor.advance();
        }
        return ParseResult.success(new Identifier(cursor.slice(start, cursor.pos())), cursor);
    }

    /**
     * Parses {@code -?[0-9]+(\.[0-9]+)?}, keeping the raw text.
     */
    static ParseResult<NumberLiteral> parseNumber(Cursor cursor) {
        int start = cursor.pos();
        if (cursor.is('-')) {
            cursor = cursor.advance();
        }
        if (cursor.isEof() || !isDigit(cursor.current())) {
            return ParseResult.failure("Expected number", cursor, "0-9");
        }
        while (!cursor.isEof() && isDigit(cursor.current())) {
            cursor = cursor.advance();
        }
        if (cursor.is('.')) {
            cursor = cursor.advance();
            if (cursor.isEof() || !isDigit(cursor.current())) {
                return ParseResult.failure("Expected digit after decimal point", cursor, "0-9");
            }
            while (!cursor.isEof() && isDigit(cursor.current())) {
                cursor = cursor.advance();
            }
        }
        return ParseResult.success(NumberLiteral.of(cursor.slice(start, cursor.pos())), cursor);
    }

    /**
     * Parses a double-quoted string literal and resolves its escape sequences.
     */
    static ParseResult<StringLiteral> parseStringLiteral(Cursor cursor) {
        if (!cursor.is('"')) {
            return ParseResult.failure("Expected string literal", cursor, "\"");
        }
        cursor = cursor.advance();
        StringBuilder value = new StringBuilder();
        while (!cursor.isEof()) {
            char c = cursor.current();
            if (c == '"') {
                return ParseResult.success(new StringLiteral(value.toString()), cursor.advance());
            }
            if (isLineEnd(cursor)) {
                break;
            }
            if (c == '\\') {
                ParseResult<Cursor> escape = parseEscape(cursor.advance(), value);
                if (escape.isFailure()) {
                    return escape.propagate();
                }
                cursor = escape.value();
            } else {
                value.append(c);
                cursor = cursor.advance();
            }
        }
        return ParseResult.failure("Unterminated string literal", cursor, "\"");
    }

    /**
     * Resolves one escape sequence, appending the result to {@code value}.
     * @param cursor The position after the backslash.
     * @return The cursor after the sequence, both as the value and as the cursor of the result.
     */
    private static ParseResult<Cursor> parseEscape(Cursor cursor, StringBuilder value) {
        if (cursor.isEof()) {
            return ParseResult.failure("Unterminated string literal", cursor, "\"");
        }
        char c = cursor.current();
        switch (c) {
            case '"', '\\' -> value.append(c);
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'u', 'U' -> {
                int digits = c == 'u' ? 4 : 6;
                Cursor hexStart = cursor.advance();
                Cursor hexEnd = hexStart;
                for (int i = 0; i < digits; i++) {
                    if (hexEnd.isEof() || !isHexDigit(hexEnd.current())) {
                        return ParseResult.failure(
                                "Invalid Unicode escape (expected " + digits + " hex digits)", hexEnd, "0-9a-fA-F");
                    }
                    hexEnd = hexEnd.advance();
                }
                String hex = hexStart.sliceTo(hexEnd.pos());
                int codePoint = Integer.parseInt(hex, 16);
                if (codePoint > Character.MAX_CODE_POINT) {
                    return ParseResult.failure(
                            "Invalid Unicode code point: U+" + hex.toUpperCase() + " (max U+10FFFF)", hexStart);
                }
                value.appendCodePoint(codePoint);
                return ParseResult.success(hexEnd, hexEnd);
            }
            default -> {
                return ParseResult.failure("Invalid escape sequence: \\" + c, cursor, "\"", "\\", "n", "t", "u", "U");
            }
        }
        Cursor next = cursor.advance();
        return ParseResult.success(next, next);
    }
}
