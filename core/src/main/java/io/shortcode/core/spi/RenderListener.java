package io.shortcode.core.spi;

/**
 * SPI interface for observability hooks around directive dispatch.
 *
 * <p>
 * Embedders provide concrete implementations that bridge to their metrics or
 * tracing system. All methods receive immutable event objects. Implementations
 * MUST be thread-safe and non-blocking. Exceptions thrown by listeners are
 * caught by the renderer and logged; they do NOT affect rendering.
 */
public interface RenderListener {

    /**
     * Called before a handler is invoked.
     *
     * @param event contains directive name, node index, argument count
     */
    default void onDirectiveStarted(DirectiveStartedEvent event) {}

    /**
     * Called after a handler returned successfully.
     *
     * @param event contains directive name, node index, duration, output length
     */
    default void onDirectiveCompleted(DirectiveCompletedEvent event) {}

    /**
     * Called when a directive could not be rendered (unknown name, handler
     * failure, budget exceeded).
     *
     * @param event contains directive name, node index, duration, error detail
     */
    default void onDirectiveFailed(DirectiveFailedEvent event) {}

    /**
     * Called once per successfully rendered document.
     *
     * @param event contains node count, call count, duration, output length
     */
    default void onDocumentRendered(DocumentRenderedEvent event) {}

    // --- Event records ---

    /** Event emitted before a handler is invoked. */
    record DirectiveStartedEvent(String directive, int nodeIndex, int argumentCount) {}

    /** Event emitted when a handler completes successfully. */
    record DirectiveCompletedEvent(String directive, int nodeIndex, long durationMs, int outputLength) {}

    /** Event emitted when a directive fails. */
    record DirectiveFailedEvent(String directive, int nodeIndex, long durationMs, String errorDetail) {}

    /** Event emitted when a whole document has been rendered. */
    record DocumentRenderedEvent(int nodeCount, int callCount, long durationMs, int outputLength) {}
}
