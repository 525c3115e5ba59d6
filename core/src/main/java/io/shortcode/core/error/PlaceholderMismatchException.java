package io.shortcode.core.error;

/**
 * Thrown when deferred rendering finds placeholders other than the ones it inserted: in the
 * document text before deferral, or in a different number in the processed text, e.g. because the
 * intermediate processor dropped or duplicated one.
 */
public final class PlaceholderMismatchException extends ShortcodeRenderException {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int found;

    public PlaceholderMismatchException(int expected, int found) {
        this(String.format("Expected %d placeholder(s) in processed text, found %d", expected, found), expected, found);
    }

    public PlaceholderMismatchException(String message, int expected, int found) {
        super(message, null, null);
        this.expected = expected;
        this.found = found;
    }

    public int expected() {
        return expected;
    }

    public int found() {
        return found;
    }
}
