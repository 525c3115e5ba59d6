package io.shortcode.core.engine;

import io.shortcode.core.error.UnknownDirectiveException;
import io.shortcode.core.parse.ShortcodeParser;
import io.shortcode.core.spi.ShortcodeHandler;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of directive handlers, keyed by directive name. Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class ShortcodeRegistry {

    private final Map<String, ShortcodeHandler> handlers;

    public ShortcodeRegistry() {
        this.handlers = new ConcurrentHashMap<>();
    }

    private ShortcodeRegistry(Map<String, ShortcodeHandler> handlers) {
        this.handlers = new ConcurrentHashMap<>(handlers);
    }

    /**
     * Registers a handler. If a handler with the same name is already
     * registered, it is replaced (last-write-wins semantics).
     *
     * @param name    directive name; must be a valid identifier
     * @param handler the handler to register
     * @return this registry, for chaining
     * @throws NullPointerException     if handler is null
     * @throws IllegalArgumentException if name is not a valid identifier
     */
    public ShortcodeRegistry register(String name, ShortcodeHandler handler) {
        if (handler == null) {
            throw new NullPointerException("handler must not be null");
        }
        if (!ShortcodeParser.isIdentifier(name)) {
            throw new IllegalArgumentException("Directive name must be an identifier, got: '" + name + "'");
        }
        handlers.put(name, handler);
        return this;
    }

    /**
     * Removes a handler.
     *
     * @return {@code true} if a handler was registered under {@code name}
     */
    public boolean unregister(String name) {
        return name != null && handlers.remove(name) != null;
    }

    /**
     * Looks up a handler by directive name.
     *
     * @return the handler, or empty if not registered
     */
    public Optional<ShortcodeHandler> getHandler(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(handlers.get(name));
    }

    /**
     * Looks up a handler, throwing if not found.
     *
     * @throws UnknownDirectiveException if no handler is registered under {@code name}
     */
    public ShortcodeHandler requireHandler(String name) {
        return getHandler(name).orElseThrow(() -> new UnknownDirectiveException(name, null));
    }

    /** Returns {@code true} if a handler with the given name is registered. */
    public boolean hasHandler(String name) {
        return name != null && handlers.containsKey(name);
    }

    /** Returns the number of registered handlers. */
    public int size() {
        return handlers.size();
    }

    /** Registered directive names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(handlers.keySet());
    }

    /** Returns an independent copy; later changes to either registry do not affect the other. */
    public ShortcodeRegistry snapshot() {
        return new ShortcodeRegistry(handlers);
    }
}
