package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.ast.Attribute;
import org.ftlbuffer.syntax.ast.Comment;
import org.ftlbuffer.syntax.ast.Identifier;
import org.ftlbuffer.syntax.ast.Message;
import org.ftlbuffer.syntax.ast.Pattern;
import org.ftlbuffer.syntax.ast.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.ftlbuffer.syntax.parser.Primitives.isLineEnd;
import static org.ftlbuffer.syntax.parser.Primitives.parseIdentifier;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlankInline;
import static org.ftlbuffer.syntax.parser.Primitives.skipLineEnd;
import static org.ftlbuffer.syntax.parser.Primitives.skipToLineEnd;

/**
 * Parses the top-level entries: messages, terms and comments, including attributes.
 * Every rule stops at the end of the entry's last line without consuming the line break.
 */
public class EntryParser {

    private final PatternParser patterns;

    /**
     * @param patterns The parser used for entry and attribute values.
     */
    public EntryParser(PatternParser patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    /**
     * Parses {@code id = pattern} followed by any attributes.
     * @param cursor The position of the identifier.
     * @return The message.
     */
    public ParseResult<Message> parseMessage(Cursor cursor) {
        int start = cursor.pos();
        ParseResult<Identifier> id = parseIdentifier(cursor);
        if (id.isFailure()) {
            return id.propagate();
        }
        cursor = skipBlankInline(id.cursor());
        if (!cursor.is('=')) {
            return ParseResult.failure("Expected '=' after message ID", cursor, "=");
        }
        ParseResult<Pattern> value = patterns.parsePattern(patterns.skipPatternStart(cursor.advance(), false), false);
        if (value.isFailure()) {
            return value.propagate();
        }
        ParseResult<List<Attribute>> attributes = parseAttributes(value.cursor());
        if (attributes.isFailure()) {
            return attributes.propagate();
        }
        if (value.value().isEmpty() && attributes.value().isEmpty()) {
            return ParseResult.failure("Message \"" + id.value().name()
                    + "\" must have either a value or at least one attribute", attributes.cursor());
        }
        Pattern pattern = value.value().isEmpty() ? null : value.value();
        Cursor end = attributes.cursor();
        return ParseResult.success(
                new Message(id.value(), pattern, attributes.value(), new Span(start, end.pos())), end);
    }

    /**
     * Parses {@code -id = pattern} followed by any attributes. Terms must have a value.
     * @param cursor The position of the dash.
     * @return The term.
     */
    public ParseResult<Term> parseTerm(Cursor cursor) {
        int start = cursor.pos();
        if (!cursor.is('-')) {
            return ParseResult.failure("Expected '-' at start of term", cursor, "-");
        }
        ParseResult<Identifier> id = parseIdentifier(cursor.advance());
        if (id.isFailure()) {
            return id.propagate();
        }
        cursor = skipBlankInline(id.cursor());
        if (!cursor.is('=')) {
            return ParseResult.failure("Expected '=' after term ID", cursor, "=");
        }
        ParseResult<Pattern> value = patterns.parsePattern(patterns.skipPatternStart(cursor.advance(), false), false);
        if (value.isFailure()) {
            return value.propagate();
        }
        if (value.value().isEmpty()) {
            return ParseResult.failure("Expected term \"-" + id.value().name() + "\" to have a value", value.cursor());
        }
        ParseResult<List<Attribute>> attributes = parseAttributes(value.cursor());
        if (attributes.isFailure()) {
            return attributes.propagate();
        }
        Cursor end = attributes.cursor();
        return ParseResult.success(
                new Term(id.value(), value.value(), attributes.value(), new Span(start, end.pos())), end);
    }

    /**
     * Collects the indented {@code .attr = pattern} lines following an entry value.
     * @param cursor The end of the entry value, at a line break or the end of the source.
     * @return The attributes, possibly none, and the end of the last one.
     */
    private ParseResult<List<Attribute>> parseAttributes(Cursor cursor) {
        List<Attribute> attributes = new ArrayList<>();
        while (isLineEnd(cursor)) {
            Cursor lineStart = skipLineEnd(cursor);
            if (!lineStart.is(' ')) {
                break;
            }
            Cursor dot = skipBlankInline(lineStart);
            if (!dot.is('.')) {
                break;
            }
            ParseResult<Attribute> attribute = parseAttribute(dot);
            if (attribute.isFailure()) {
                return attribute.propagate();
            }
            attributes.add(attribute.value());
            cursor = attribute.cursor();
        }
        return ParseResult.success(attributes, cursor);
    }

    private ParseResult<Attribute> parseAttribute(Cursor cursor) {
        if (!cursor.is('.')) {
            return ParseResult.failure("Expected '.' at start of attribute", cursor, ".");
        }
        ParseResult<Identifier> id = parseIdentifier(cursor.advance());
        if (id.isFailure()) {
            return id.propagate();
        }
        cursor = skipBlankInline(id.cursor());
        if (!cursor.is('=')) {
            return ParseResult.failure("Expected '=' after attribute identifier", cursor, "=");
        }
        ParseResult<Pattern> value = patterns.parsePattern(patterns.skipPatternStart(cursor.advance(), false), false);
        if (value.isFailure()) {
            return value.propagate();
        }
        if (value.value().isEmpty()) {
            return ParseResult.failure(
                    "Expected attribute \"." + id.value().name() + "\" to have a value", value.cursor());
        }
        return ParseResult.success(new Attribute(id.value(), value.value()), value.cursor());
    }

    /**
     * Parses one comment line: one to three hashes, an optional space, and the rest of the line.
     * The line break is consumed.
     *
     * @param cursor The position of the first hash.
     * @return The comment.
     */
    public ParseResult<Comment> parseComment(Cursor cursor) {
        int start = cursor.pos();
        int hashes = 0;
        while (cursor.is('#')) {
            hashes++;
            cursor = cursor.advance();
        }
        if (hashes == 0 || hashes > 3) {
            return ParseResult.failure(
                    "Invalid comment: expected 1-3 '#' characters, found " + hashes, cursor, "#");
        }
        if (cursor.is(' ')) {
            cursor = cursor.advance();
        }
        Cursor end = skipToLineEnd(cursor);
        Comment comment = new Comment(cursor.sliceTo(end.pos()), Comment.Kind.ofLevel(hashes), new Span(start, end.pos()));
        return ParseResult.success(comment, skipLineEnd(end));
    }
}
