package io.shortcode.core.model;

/**
 * Half-open character range {@code [start, end)} into the document source.
 *
 * @param start inclusive start offset
 * @param end   exclusive end offset
 */
public record SourceSpan(int start, int end) {

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
