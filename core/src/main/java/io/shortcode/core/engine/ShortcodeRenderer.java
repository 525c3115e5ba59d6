package io.shortcode.core.engine;

import io.shortcode.core.error.DirectiveFailedException;
import io.shortcode.core.error.PlaceholderMismatchException;
import io.shortcode.core.error.RenderBudgetExceededException;
import io.shortcode.core.error.UnknownDirectiveException;
import io.shortcode.core.model.Arguments;
import io.shortcode.core.model.Document;
import io.shortcode.core.model.Node;
import io.shortcode.core.parse.ShortcodeParser;
import io.shortcode.core.spi.RenderListener;
import io.shortcode.core.spi.ShortcodeHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates parsed documents by dispatching each directive call to its
 * registered {@link ShortcodeHandler}.
 *
 * <p>
 * Text nodes are copied verbatim. For a call, the handler is looked up by name
 * and invoked with the call's {@link Arguments}; its result is spliced into the
 * output without escaping. An unknown name (under
 * {@link UnknownDirectivePolicy#FAIL}), a failing handler or an exceeded
 * {@link RenderBudget} aborts the whole document with a
 * {@link io.shortcode.core.error.ShortcodeRenderException}; no partial output
 * reaches the caller.
 *
 * <p>
 * Rendering is sequential and deterministic: output order equals node order.
 *
 * <p>
 * Thread-safe as long as the registry and handlers are. The renderer itself
 * holds no per-document state.
 */
public final class ShortcodeRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ShortcodeRenderer.class);

    private final ShortcodeRegistry registry;
    private final RenderOptions options;
    private final RenderListener listener;

    /**
     * Creates a renderer with default options.
     *
     * @param registry the handlers to dispatch into
     */
    public ShortcodeRenderer(ShortcodeRegistry registry) {
        this(registry, RenderOptions.DEFAULT, null);
    }

    /**
     * Creates a renderer with custom options.
     *
     * @param registry the handlers to dispatch into
     * @param options  budget and policies
     */
    public ShortcodeRenderer(ShortcodeRegistry registry, RenderOptions options) {
        this(registry, options, null);
    }

    /**
     * Creates a renderer with all configuration options.
     *
     * @param registry the handlers to dispatch into
     * @param options  budget and policies
     * @param listener optional listener for dispatch events, may be
     *                 {@code null}
     */
    public ShortcodeRenderer(ShortcodeRegistry registry, RenderOptions options, RenderListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.listener = listener; // nullable
    }

    /** Parses and renders the given document source. */
    public String render(String source) {
        return render(ShortcodeParser.parse(source));
    }

    /**
     * Renders a parsed document.
     *
     * @param document the parsed document
     * @return the rendered text
     * @throws UnknownDirectiveException     if a call has no handler and the
     *                                       policy is {@code FAIL}
     * @throws DirectiveFailedException      if a handler throws or returns
     *                                       {@code null}
     * @throws RenderBudgetExceededException if a handler or the output exceeds
     *                                       the budget
     */
    public String render(Document document) {
        Objects.requireNonNull(document, "document must not be null");

        long startNanos = System.nanoTime();
        StringBuilder out = new StringBuilder();
        List<Node> nodes = document.nodes();
        int callCount = 0;
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node instanceof Node.Text text) {
                append(out, text.content(), null, i);
            } else if (node instanceof Node.Call call) {
                callCount++;
                append(out, renderCall(call, i), call.name(), i);
            }
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        LOG.info(
                "Rendered document: nodes={}, calls={}, output_chars={}, duration_ms={}",
                nodes.size(),
                callCount,
                out.length(),
                elapsedMs);
        notifyDocumentRendered(nodes.size(), callCount, elapsedMs, out.length());
        return out.toString();
    }

    /**
     * Replaces every call with the configured placeholder, keeping the calls
     * aside for {@link #complete(String, DeferredDocument)}. Handlers are not
     * invoked.
     *
     * @throws PlaceholderMismatchException if the document text already
     *                                      contains the placeholder, including
     *                                      one formed across a text/call
     *                                      boundary
     */
    public DeferredDocument defer(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        String placeholder = options.placeholder();
        StringBuilder text = new StringBuilder();
        List<Node.Call> calls = new ArrayList<>();
        List<Integer> nodeIndices = new ArrayList<>();
        List<Integer> inserted = new ArrayList<>();
        List<Node> nodes = document.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node instanceof Node.Text t) {
                text.append(t.content());
            } else if (node instanceof Node.Call call) {
                calls.add(call);
                nodeIndices.add(i);
                inserted.add(text.length());
                text.append(placeholder);
            }
        }

        String deferredText = text.toString();
        List<Integer> found = placeholderPositions(deferredText, placeholder);
        if (!found.equals(inserted)) {
            int k = 0;
            while (k < found.size() && k < inserted.size() && found.get(k).equals(inserted.get(k))) {
                k++;
            }
            int offset = k < found.size() ? found.get(k) : inserted.get(k);
            throw new PlaceholderMismatchException(
                    String.format(
                            "Document text already contains the placeholder '%s' at deferred offset %d",
                            placeholder, offset),
                    inserted.size(),
                    found.size());
        }
        return new DeferredDocument(deferredText, placeholder, calls, nodeIndices);
    }

    /** Parses the source and defers its calls. */
    public DeferredDocument defer(String source) {
        return defer(ShortcodeParser.parse(source));
    }

    /**
     * Renders the deferred calls and substitutes them, in order, for the
     * placeholders in {@code processedText}. Errors carry the call's node index
     * in the original document.
     *
     * @param processedText the deferred text after external processing
     * @param deferred      the result of {@link #defer(Document)}
     * @return the completed text
     * @throws PlaceholderMismatchException if the number of placeholders in
     *                                      {@code processedText} differs from
     *                                      the number of deferred calls
     */
    public String complete(String processedText, DeferredDocument deferred) {
        Objects.requireNonNull(processedText, "processedText must not be null");
        Objects.requireNonNull(deferred, "deferred must not be null");

        String placeholder = deferred.placeholder();
        List<Integer> positions = placeholderPositions(processedText, placeholder);
        if (positions.size() != deferred.calls().size()) {
            throw new PlaceholderMismatchException(deferred.calls().size(), positions.size());
        }

        StringBuilder out = new StringBuilder();
        int copied = 0;
        for (int i = 0; i < positions.size(); i++) {
            int position = positions.get(i);
            Node.Call call = deferred.calls().get(i);
            int nodeIndex = deferred.nodeIndices().get(i);
            append(out, processedText.substring(copied, position), null, null);
            append(out, renderCall(call, nodeIndex), call.name(), nodeIndex);
            copied = position + placeholder.length();
        }
        append(out, processedText.substring(copied), null, null);
        LOG.debug("Completed deferred document: calls={}, output_chars={}", positions.size(), out.length());
        return out.toString();
    }

    /** Left-to-right, non-overlapping occurrences of {@code placeholder}. */
    private static List<Integer> placeholderPositions(String text, String placeholder) {
        List<Integer> positions = new ArrayList<>();
        int at = text.indexOf(placeholder);
        while (at >= 0) {
            positions.add(at);
            at = text.indexOf(placeholder, at + placeholder.length());
        }
        return positions;
    }

    /** Returns the options this renderer was created with. */
    public RenderOptions options() {
        return options;
    }

    private String renderCall(Node.Call call, int index) {
        Optional<ShortcodeHandler> handler = registry.getHandler(call.name());
        if (handler.isEmpty()) {
            if (options.unknownDirectivePolicy() == UnknownDirectivePolicy.PRESERVE) {
                LOG.warn("Unknown directive kept as text: name={}, offset={}", call.name(), call.span().start());
                return call.source();
            }
            notifyDirectiveFailed(call.name(), index, 0, "Unknown directive");
            throw new UnknownDirectiveException(call.name(), index);
        }

        notifyDirectiveStarted(call, index);
        long startNanos = System.nanoTime();
        String rendered;
        try {
            Arguments arguments = Arguments.of(call.arguments(), options.duplicateArgumentPolicy());
            rendered = handler.get().render(arguments);
        } catch (RuntimeException e) {
            long failedMs = (System.nanoTime() - startNanos) / 1_000_000;
            notifyDirectiveFailed(call.name(), index, failedMs, e.getMessage());
            throw new DirectiveFailedException(call.name(), e, index);
        }
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;

        if (rendered == null) {
            notifyDirectiveFailed(call.name(), index, elapsedMs, "Handler returned null");
            throw new DirectiveFailedException(call.name(), new IllegalStateException("Handler returned null"), index);
        }

        if (elapsedMs > options.budget().maxHandlerMs()) {
            notifyDirectiveFailed(call.name(), index, elapsedMs, "Time budget exceeded");
            throw new RenderBudgetExceededException(
                    String.format(
                            "Directive '%s' exceeded time budget: %dms > %dms",
                            call.name(), elapsedMs, options.budget().maxHandlerMs()),
                    call.name(),
                    index);
        }

        LOG.debug(
                "Rendered directive: name={}, node_index={}, arguments={}, duration_ms={}",
                call.name(),
                index,
                call.arguments().size(),
                elapsedMs);
        notifyDirectiveCompleted(call.name(), index, elapsedMs, rendered.length());
        return rendered;
    }

    private void append(StringBuilder out, String chunk, String directive, Integer index) {
        int max = options.budget().maxOutputChars();
        if ((long) out.length() + chunk.length() > max) {
            throw new RenderBudgetExceededException(
                    String.format("Rendered output exceeds %d characters", max), directive, index);
        }
        out.append(chunk);
    }

    // --- Listener notifications ---

    private void notifyDirectiveStarted(Node.Call call, int index) {
        if (listener == null) return;
        try {
            listener.onDirectiveStarted(new RenderListener.DirectiveStartedEvent(
                    call.name(), index, call.arguments().size()));
        } catch (Exception e) {
            LOG.warn("RenderListener.onDirectiveStarted failed", e);
        }
    }

    private void notifyDirectiveCompleted(String directive, int index, long durationMs, int outputLength) {
        if (listener == null) return;
        try {
            listener.onDirectiveCompleted(
                    new RenderListener.DirectiveCompletedEvent(directive, index, durationMs, outputLength));
        } catch (Exception e) {
            LOG.warn("RenderListener.onDirectiveCompleted failed", e);
        }
    }

    private void notifyDirectiveFailed(String directive, int index, long durationMs, String detail) {
        if (listener == null) return;
        try {
            listener.onDirectiveFailed(new RenderListener.DirectiveFailedEvent(directive, index, durationMs, detail));
        } catch (Exception e) {
            LOG.warn("RenderListener.onDirectiveFailed failed", e);
        }
    }

    private void notifyDocumentRendered(int nodeCount, int callCount, long durationMs, int outputLength) {
        if (listener == null) return;
        try {
            listener.onDocumentRendered(
                    new RenderListener.DocumentRenderedEvent(nodeCount, callCount, durationMs, outputLength));
        } catch (Exception e) {
            LOG.warn("RenderListener.onDocumentRendered failed", e);
        }
    }
}
