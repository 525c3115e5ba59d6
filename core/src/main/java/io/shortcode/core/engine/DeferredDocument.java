package io.shortcode.core.engine;

import io.shortcode.core.model.Node;
import java.util.List;
import java.util.Objects;

/**
 * A document whose calls have been replaced by a placeholder so that the text
 * can pass through another processor (typically Markdown) before the calls are
 * rendered and spliced back with
 * {@link ShortcodeRenderer#complete(String, DeferredDocument)}.
 *
 * @param text        document text with one placeholder per call
 * @param placeholder the marker used
 * @param calls       the replaced calls, in document order
 * @param nodeIndices the node index of each call in the source document
 */
public record DeferredDocument(String text, String placeholder, List<Node.Call> calls, List<Integer> nodeIndices) {

    public DeferredDocument {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(placeholder, "placeholder must not be null");
        calls = List.copyOf(calls);
        nodeIndices = List.copyOf(nodeIndices);
        if (calls.size() != nodeIndices.size()) {
            throw new IllegalArgumentException(
                    "Expected one node index per call, got " + nodeIndices.size() + " for " + calls.size() + " calls");
        }
    }
}
