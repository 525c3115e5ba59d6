package io.shortcode.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Unit of parsed document structure: either a run of literal text or a
 * directive call.
 *
 * <p>
 * Every node remembers the exact source characters it was built from, so that
 * concatenating {@link #sourceText()} over a {@link Document} reproduces the
 * input.
 */
public sealed interface Node {

    /** Range of the document source covered by this node. */
    SourceSpan span();

    /** The exact source characters covered by this node. */
    String sourceText();

    /** Non-empty run of literal document characters, emitted verbatim. */
    record Text(String content, SourceSpan span) implements Node {
        public Text {
            Objects.requireNonNull(content, "content must not be null");
            Objects.requireNonNull(span, "span must not be null");
            if (content.isEmpty()) {
                throw new IllegalArgumentException("Text node must not be empty");
            }
        }

        @Override
        public String sourceText() {
            return content;
        }
    }

    /**
     * A well-formed directive call {@code {{ name(arg=value, ...) }}}.
     *
     * @param name      directive name
     * @param arguments arguments in source order
     * @param source    the exact directive text, delimiters included
     * @param span      range of the directive in the document
     */
    record Call(String name, List<Argument> arguments, String source, SourceSpan span) implements Node {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(span, "span must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public String sourceText() {
            return source;
        }
    }
}
