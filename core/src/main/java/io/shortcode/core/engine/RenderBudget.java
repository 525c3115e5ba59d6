package io.shortcode.core.engine;

/**
 * Rendering budgets. Enforces a wall-clock limit per handler invocation and a
 * size limit on the rendered document to guard against runaway handlers.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxHandlerMs   maximum wall-clock time in milliseconds for a single
 *                       handler invocation (default: 1000ms)
 * @param maxOutputChars maximum length of the rendered output in characters
 *                       (default: 16M)
 */
public record RenderBudget(long maxHandlerMs, int maxOutputChars) {

    /** Default budget: 1s per handler, 16M characters of output. */
    public static final RenderBudget DEFAULT = new RenderBudget(1000, 16 * 1024 * 1024);

    public RenderBudget {
        if (maxHandlerMs <= 0) {
            throw new IllegalArgumentException("maxHandlerMs must be positive, got: " + maxHandlerMs);
        }
        if (maxOutputChars <= 0) {
            throw new IllegalArgumentException("maxOutputChars must be positive, got: " + maxOutputChars);
        }
    }
}
