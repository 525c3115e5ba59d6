package io.shortcode.core.error;

/**
 * Abstract base for all shortcode engine exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ShortcodeLoadException} or {@link ShortcodeRenderException}.
 *
 * <p>Malformed directive syntax is never reported through this hierarchy: the parser absorbs it
 * into literal text.
 */
public abstract class ShortcodeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        RENDER
    }

    private final String directive;
    private final Phase phase;

    protected ShortcodeException(String message, String directive, Phase phase) {
        super(message);
        this.directive = directive;
        this.phase = phase;
    }

    protected ShortcodeException(String message, Throwable cause, String directive, Phase phase) {
        super(message, cause);
        this.directive = directive;
        this.phase = phase;
    }

    /** The directive that triggered the error, or {@code null} if not tied to one. */
    public String directive() {
        return directive;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
