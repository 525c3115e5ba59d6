package io.shortcode.core.error;

/**
 * Thrown when a handler invocation exceeds {@code max-handler-ms} or the rendered output exceeds
 * {@code max-output-chars}.
 */
public final class RenderBudgetExceededException extends ShortcodeRenderException {

    private static final long serialVersionUID = 1L;

    public RenderBudgetExceededException(String message, String directive, Integer nodeIndex) {
        super(message, directive, nodeIndex);
    }
}
