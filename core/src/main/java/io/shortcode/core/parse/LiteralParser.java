package io.shortcode.core.parse;

import io.shortcode.core.model.Literal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes argument literals with ordered-choice semantics: boolean, string, float, int, array.
 * The first alternative whose complete lexical form matches wins; a failing alternative restores
 * the cursor before the next one is tried. Once an alternative has matched it is not revisited,
 * so {@code truex} matches the boolean {@code true} and leaves {@code x} to the caller.
 *
 * <p>Numbers are validated lexically before conversion. A digit sequence that does not fit a
 * {@code long} (or a float that is not finite as a {@code double}) fails its alternative instead
 * of raising an error.
 *
 * <p>Thread-safe and stateless; all methods are static.
 */
public final class LiteralParser {

    private static final Logger LOG = LoggerFactory.getLogger(LiteralParser.class);

    /** Array nesting beyond this depth fails the literal rather than risking stack exhaustion. */
    static final int MAX_ARRAY_DEPTH = 256;

    private LiteralParser() {}

    /**
     * Parses {@code text} as exactly one literal with nothing before or after it.
     *
     * @param text candidate literal source, e.g. {@code [1, "a", true,]}
     * @return the literal, or empty if {@code text} is not a single well-formed literal
     */
    public static Optional<Literal> parse(String text) {
        Cursor cursor = new Cursor(text, 0);
        Literal literal = literal(cursor);
        if (literal == null || !cursor.atEnd()) {
            return Optional.empty();
        }
        return Optional.of(literal);
    }

    /** Parses a literal at the cursor, or returns {@code null} with the cursor unchanged. */
    static Literal literal(Cursor cursor) {
        return literal(cursor, 0);
    }

    private static Literal literal(Cursor cursor, int depth) {
        int start = cursor.pos();
        Literal result = bool(cursor);
        if (result == null) {
            cursor.reset(start);
            result = string(cursor);
        }
        if (result == null) {
            cursor.reset(start);
            result = floating(cursor);
        }
        if (result == null) {
            cursor.reset(start);
            result = integer(cursor);
        }
        if (result == null) {
            cursor.reset(start);
            result = array(cursor, depth);
        }
        if (result == null) {
            cursor.reset(start);
        }
        return result;
    }

    private static Literal bool(Cursor cursor) {
        if (cursor.accept("true")) {
            return Literal.Bool.TRUE;
        }
        if (cursor.accept("false")) {
            return Literal.Bool.FALSE;
        }
        return null;
    }

    private static Literal string(Cursor cursor) {
        char quote = cursor.peek();
        if (quote != '"' && quote != '\'' && quote != '`') {
            return null;
        }
        cursor.advance(1);
        int contentStart = cursor.pos();
        int close = cursor.indexOf(quote);
        if (close < 0) {
            return null;
        }
        cursor.reset(close + 1);
        return new Literal.Str(cursor.slice(contentStart, close));
    }

    private static Literal floating(Cursor cursor) {
        int start = cursor.pos();
        if (!integerPart(cursor) || !cursor.accept('.') || cursor.skipDigits() == 0) {
            return null;
        }
        String token = cursor.slice(start, cursor.pos());
        double value = Double.parseDouble(token);
        if (!Double.isFinite(value)) {
            LOG.debug("Float literal out of range at offset {}: {}", start, token);
            return null;
        }
        return new Literal.Float(value);
    }

    private static Literal integer(Cursor cursor) {
        int start = cursor.pos();
        if (!integerPart(cursor)) {
            return null;
        }
        String token = cursor.slice(start, cursor.pos());
        try {
            return new Literal.Int(Long.parseLong(token));
        } catch (NumberFormatException e) {
            LOG.debug("Integer literal out of range at offset {}: {}", start, token);
            return null;
        }
    }

    /** {@code -?(0|[1-9][0-9]*)} */
    private static boolean integerPart(Cursor cursor) {
        cursor.accept('-');
        if (cursor.accept('0')) {
            return true;
        }
        char c = cursor.peek();
        if (c < '1' || c > '9') {
            return false;
        }
        cursor.skipDigits();
        return true;
    }

    private static Literal array(Cursor cursor, int depth) {
        if (!cursor.accept('[')) {
            return null;
        }
        if (depth >= MAX_ARRAY_DEPTH) {
            LOG.debug("Array literal nested deeper than {} at offset {}", MAX_ARRAY_DEPTH, cursor.pos() - 1);
            return null;
        }
        List<Literal> elements = new ArrayList<>();
        cursor.skipWhitespace();
        if (cursor.accept(']')) {
            return new Literal.Array(elements);
        }
        while (true) {
            Literal element = literal(cursor, depth + 1);
            if (element == null) {
                return null;
            }
            elements.add(element);
            cursor.skipWhitespace();
            if (cursor.accept(']')) {
                return new Literal.Array(elements);
            }
            if (!cursor.accept(',')) {
                return null;
            }
            cursor.skipWhitespace();
            // single trailing comma
            if (cursor.accept(']')) {
                return new Literal.Array(elements);
            }
        }
    }
}
