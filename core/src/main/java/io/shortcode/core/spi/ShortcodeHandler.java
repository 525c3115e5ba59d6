package io.shortcode.core.spi;

import io.shortcode.core.model.Arguments;

/**
 * Renders one directive call to text. Handlers are registered by name with a
 * {@link io.shortcode.core.engine.ShortcodeRegistry}.
 *
 * <p>The engine performs no arity or type checking: the handler validates presence and type of
 * the arguments it expects (see the {@code require*} accessors on {@link Arguments}) and throws to
 * report failure. Any exception thrown here reaches the embedder wrapped in a {@link
 * io.shortcode.core.error.DirectiveFailedException}.
 *
 * <p>Implementations SHOULD be thread-safe: one handler instance serves every document rendered
 * by a renderer.
 */
@FunctionalInterface
public interface ShortcodeHandler {

    /**
     * Renders the directive.
     *
     * @param arguments the call's arguments exactly as parsed
     * @return rendered text, spliced into the output verbatim; must not be null
     */
    String render(Arguments arguments);
}
