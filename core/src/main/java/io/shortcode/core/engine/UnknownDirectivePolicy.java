package io.shortcode.core.engine;

/**
 * What the renderer does with a call whose name has no registered handler.
 *
 * <ul>
 * <li>{@link #FAIL}: abort rendering with an
 * {@link io.shortcode.core.error.UnknownDirectiveException} (default).</li>
 * <li>{@link #PRESERVE}: emit the directive's source text unchanged and log a
 * warning.</li>
 * </ul>
 */
public enum UnknownDirectivePolicy {
    /** Abort rendering of the document (default). */
    FAIL,

    /** Keep the directive text in the output. */
    PRESERVE
}
