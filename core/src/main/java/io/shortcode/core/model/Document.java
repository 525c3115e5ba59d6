package io.shortcode.core.model;

import java.util.List;

/**
 * Ordered sequence of {@link Node}s produced by parsing one document. May be
 * empty. Immutable.
 */
public record Document(List<Node> nodes) {

    private static final Document EMPTY = new Document(List.of());

    public Document {
        nodes = List.copyOf(nodes);
    }

    public static Document empty() {
        return EMPTY;
    }

    /** Directive calls in document order. */
    public List<Node.Call> calls() {
        return nodes.stream()
                .filter(Node.Call.class::isInstance)
                .map(Node.Call.class::cast)
                .toList();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Concatenates the source text of every node, equal to the parsed input. */
    public String source() {
        StringBuilder sb = new StringBuilder();
        nodes.forEach(n -> sb.append(n.sourceText()));
        return sb.toString();
    }
}
