package io.shortcode.core.error;

/** Thrown when renderer configuration is missing, malformed or holds an invalid value. */
public final class ConfigLoadException extends ShortcodeLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
