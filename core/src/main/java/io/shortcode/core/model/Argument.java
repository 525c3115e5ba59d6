package io.shortcode.core.model;

import java.util.Objects;

/**
 * A single {@code name=value} pair of a directive call. Names are not unique
 * within a call; see {@link Arguments} for how duplicates are resolved.
 *
 * @param name  identifier, case-sensitive
 * @param value the parsed literal
 */
public record Argument(String name, Literal value) {

    public Argument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
