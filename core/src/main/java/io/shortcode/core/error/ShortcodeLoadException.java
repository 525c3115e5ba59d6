package io.shortcode.core.error;

/**
 * Abstract parent for load-time configuration errors. Carries an additional {@code source} field
 * identifying the file or resource that caused the error.
 */
public abstract class ShortcodeLoadException extends ShortcodeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ShortcodeLoadException(String message, String source) {
        super(message, null, Phase.LOAD);
        this.source = source;
    }

    protected ShortcodeLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
