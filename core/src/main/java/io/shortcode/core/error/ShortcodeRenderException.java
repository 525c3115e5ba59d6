package io.shortcode.core.error;

/**
 * Abstract parent for render-time errors. Any of these aborts rendering of the whole document;
 * the embedder decides whether to substitute a fallback. Carries the index of the document node
 * being evaluated when the error occurred.
 */
public abstract class ShortcodeRenderException extends ShortcodeException {

    private static final long serialVersionUID = 1L;

    private final Integer nodeIndex;

    protected ShortcodeRenderException(String message, String directive, Integer nodeIndex) {
        super(message, directive, Phase.RENDER);
        this.nodeIndex = nodeIndex;
    }

    protected ShortcodeRenderException(String message, Throwable cause, String directive, Integer nodeIndex) {
        super(message, cause, directive, Phase.RENDER);
        this.nodeIndex = nodeIndex;
    }

    /** The 0-based index of the offending node, or {@code null} if unknown. */
    public Integer nodeIndex() {
        return nodeIndex;
    }
}
