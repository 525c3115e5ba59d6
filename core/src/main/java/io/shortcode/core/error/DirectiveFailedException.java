package io.shortcode.core.error;

/**
 * Thrown when a directive handler reports failure (missing or mistyped argument, internal error).
 * The handler's exception is preserved as the cause.
 */
public final class DirectiveFailedException extends ShortcodeRenderException {

    private static final long serialVersionUID = 1L;

    public DirectiveFailedException(String directive, Throwable cause, Integer nodeIndex) {
        super(
                "Directive '" + directive + "' failed: " + (cause != null ? cause.getMessage() : "unknown error"),
                cause,
                directive,
                nodeIndex);
    }
}
