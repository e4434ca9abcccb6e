package org.ftlbuffer.syntax.parser;

import org.ftlbuffer.syntax.Cursor;
import org.ftlbuffer.syntax.Span;
import org.ftlbuffer.syntax.ast.Annotation;
import org.ftlbuffer.syntax.ast.Entry;
import org.ftlbuffer.syntax.ast.Junk;
import org.ftlbuffer.syntax.ast.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.ftlbuffer.syntax.parser.Primitives.isAsciiLetter;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlank;
import static org.ftlbuffer.syntax.parser.Primitives.skipBlankInline;
import static org.ftlbuffer.syntax.parser.Primitives.skipLineEnd;
import static org.ftlbuffer.syntax.parser.Primitives.skipToLineEnd;

/**
 * The entry point for parsing FTL source text into a {@link Resource}.
 * <p>
 * Parsing never fails: an entry that does not match the grammar is kept as {@link Junk} with an
 * annotation describing the error, and parsing resumes at the next line that can start an entry.
 * Instances hold no mutable state and can be shared between threads.
 */
public class FluentParser {

    private static final Logger LOG = LoggerFactory.getLogger(FluentParser.class);

    private final EntryParser entries;

    public FluentParser() {
        this.entries = new EntryParser(new PatternParser(new ExpressionParser()));
    }

    /**
     * Parses a complete FTL document.
     * @param source The FTL text.
     * @return The resource with all entries in source order.
     */
    public Resource parse(String source) {
        Objects.requireNonNull(source, "source");
        List<Entry> result = new ArrayList<>();
        Cursor cursor = Cursor.of(source);

        while (true) {
            cursor = skipBlank(cursor);
            if (cursor.isEof()) {
                break;
            }
            ParseResult<? extends Entry> entry = parseEntry(cursor);
            if (!entry.isFailure() && entry.cursor().pos() > cursor.pos()) {
                result.add(entry.value());
                cursor = entry.cursor();
            } else {
                Cursor junkEnd = skipJunk(cursor);
                result.add(createJunk(cursor, junkEnd, entry));
                cursor = junkEnd;
            }
        }
        return new Resource(result);
    }

    private ParseResult<? extends Entry> parseEntry(Cursor cursor) {
        if (cursor.is('#')) {
            return entries.parseComment(cursor);
        }
        if (cursor.is('-')) {
            return entries.parseTerm(cursor);
        }
        return entries.parseMessage(cursor);
    }

    /**
     * Consumes the first line unconditionally, then every line that cannot start an entry.
     * A line can start an entry if its first non-space character is {@code #}, {@code -} or an
     * ASCII letter.
     */
    private static Cursor skipJunk(Cursor cursor) {
        cursor = skipLineEnd(skipToLineEnd(cursor));
        while (!cursor.isEof()) {
            Cursor firstChar = skipBlankInline(cursor);
            if (firstChar.isEof()) {
                return firstChar;
            }
            char c = firstChar.current();
            if (c == '#' || c == '-' || isAsciiLetter(c)) {
                break;
            }
            cursor = skipLineEnd(skipToLineEnd(firstChar));
        }
        return cursor;
    }

    private static Junk createJunk(Cursor start, Cursor end, ParseResult<? extends Entry> failed) {
        ParseError error = failed.isFailure()
                ? failed.error()
                : new ParseError("Entry did not consume any input", start);
        if (LOG.isDebugEnabled()) {
            Cursor.LineCol position = error.cursor().lineCol();
            LOG.debug("Creating junk at line {}, column {}: {} (expected: {})",
                    position.line(), position.column(), error.message(),
                    error.expected().isEmpty() ? "-" : String.join(", ", error.expected()));
        }
        Annotation annotation = new Annotation(Annotation.PARSE_ERROR_CODE, error.message(),
                Span.at(error.cursor().pos()));
        return new Junk(start.sliceTo(end.pos()), List.of(annotation), new Span(start.pos(), end.pos()));
    }
}
