package io.shortcode.core.parse;

/**
 * Mutable read position over a document source. Backtracking is done by saving {@link #pos()}
 * and restoring it with {@link #reset(int)}.
 *
 * <p>Not thread-safe, one cursor per parse.
 */
final class Cursor {

    private final String input;
    private int pos;

    Cursor(String input, int pos) {
        this.input = input;
        this.pos = pos;
    }

    int pos() {
        return pos;
    }

    void reset(int pos) {
        this.pos = pos;
    }

    boolean atEnd() {
        return pos >= input.length();
    }

    /** Current character, or {@code 0} at end of input. */
    char peek() {
        return pos < input.length() ? input.charAt(pos) : 0;
    }

    void advance(int count) {
        pos += count;
    }

    /** Consumes {@code c} if it is the current character. */
    boolean accept(char c) {
        if (pos < input.length() && input.charAt(pos) == c) {
            pos++;
            return true;
        }
        return false;
    }

    /** Consumes {@code token} if the input continues with it. */
    boolean accept(String token) {
        if (input.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    /** Skips space, tab, carriage return and line feed. */
    void skipWhitespace() {
        while (pos < input.length() && isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    /** Consumes a run of ASCII digits and returns how many were consumed. */
    int skipDigits() {
        int start = pos;
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            pos++;
        }
        return pos - start;
    }

    /** Index of the next {@code c} at or after the current position, or -1. */
    int indexOf(char c) {
        return input.indexOf(c, pos);
    }

    String slice(int start, int end) {
        return input.substring(start, end);
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}
