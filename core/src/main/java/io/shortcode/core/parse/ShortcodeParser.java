package io.shortcode.core.parse;

import io.shortcode.core.model.Argument;
import io.shortcode.core.model.Document;
import io.shortcode.core.model.Literal;
import io.shortcode.core.model.Node;
import io.shortcode.core.model.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits document text into literal text runs and directive calls.
 *
 * <p>
 * Directive syntax:
 *
 * <pre>
 * {{ ws name ws ( ws [arg (ws , ws arg)*] ws ) ws }}
 * arg = name ws = ws literal
 * </pre>
 *
 * where {@code ws} is any run of space, tab, CR or LF and {@code literal} is
 * recognized by {@link LiteralParser}. The argument list takes no trailing
 * comma, unlike array literals.
 *
 * <p>
 * Parsing is total: every input yields a {@link Document}. At each
 * <code>{{</code> the parser attempts a complete call; if any part of it fails the
 * opener is kept as literal text, one character at a time, and scanning
 * resumes at the next character. Malformed directives therefore reappear
 * verbatim in the output instead of failing the document.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class ShortcodeParser {

    private static final Logger LOG = LoggerFactory.getLogger(ShortcodeParser.class);

    static final String OPEN = "{{";
    static final String CLOSE = "}}";

    private ShortcodeParser() {}

    /**
     * Parses the given document source. Never fails for non-null input.
     *
     * @param input document text
     * @return the node sequence; its spans tile {@code input} exactly
     */
    public static Document parse(String input) {
        Objects.requireNonNull(input, "input must not be null");
        if (input.isEmpty()) {
            return Document.empty();
        }

        List<Node> nodes = new ArrayList<>();
        int textStart = 0;
        int pos = input.indexOf(OPEN);
        while (pos >= 0) {
            Node.Call call = tryCall(input, pos);
            if (call == null) {
                LOG.debug("Unparsed directive opener at offset {} kept as text", pos);
                pos = input.indexOf(OPEN, pos + 1);
                continue;
            }
            if (pos > textStart) {
                nodes.add(text(input, textStart, pos));
            }
            nodes.add(call);
            textStart = call.span().end();
            pos = input.indexOf(OPEN, textStart);
        }
        if (textStart < input.length()) {
            nodes.add(text(input, textStart, input.length()));
        }
        return new Document(nodes);
    }

    private static Node.Text text(String input, int start, int end) {
        return new Node.Text(input.substring(start, end), new SourceSpan(start, end));
    }

    /** Attempts a complete call starting at {@code start}; {@code null} if it does not match in full. */
    private static Node.Call tryCall(String input, int start) {
        Cursor cursor = new Cursor(input, start);
        if (!cursor.accept(OPEN)) {
            return null;
        }
        cursor.skipWhitespace();
        String name = identifier(cursor);
        if (name == null) {
            return null;
        }
        cursor.skipWhitespace();
        if (!cursor.accept('(')) {
            return null;
        }
        cursor.skipWhitespace();

        List<Argument> arguments = new ArrayList<>();
        if (!cursor.accept(')')) {
            while (true) {
                Argument argument = argument(cursor);
                if (argument == null) {
                    return null;
                }
                arguments.add(argument);
                cursor.skipWhitespace();
                if (cursor.accept(')')) {
                    break;
                }
                if (!cursor.accept(',')) {
                    return null;
                }
                cursor.skipWhitespace();
            }
        }

        cursor.skipWhitespace();
        if (!cursor.accept(CLOSE)) {
            return null;
        }
        int end = cursor.pos();
        return new Node.Call(name, arguments, input.substring(start, end), new SourceSpan(start, end));
    }

    private static Argument argument(Cursor cursor) {
        String name = identifier(cursor);
        if (name == null) {
            return null;
        }
        cursor.skipWhitespace();
        if (!cursor.accept('=')) {
            return null;
        }
        cursor.skipWhitespace();
        Literal value = LiteralParser.literal(cursor);
        if (value == null) {
            return null;
        }
        return new Argument(name, value);
    }

    /** {@code [A-Za-z_][A-Za-z0-9_]*} */
    static String identifier(Cursor cursor) {
        int start = cursor.pos();
        if (!Cursor.isIdentStart(cursor.peek())) {
            return null;
        }
        cursor.advance(1);
        while (!cursor.atEnd() && Cursor.isIdentPart(cursor.peek())) {
            cursor.advance(1);
        }
        return cursor.slice(start, cursor.pos());
    }

    /** Returns {@code true} if {@code name} is a valid directive or argument identifier. */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        Cursor cursor = new Cursor(name, 0);
        return identifier(cursor) != null && cursor.atEnd();
    }
}
