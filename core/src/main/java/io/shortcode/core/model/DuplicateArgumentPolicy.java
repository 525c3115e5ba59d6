package io.shortcode.core.model;

/**
 * How {@link Arguments} resolves an argument name that occurs more than once in a call. The parser
 * keeps every occurrence; only the by-name view is affected.
 *
 * <ul>
 * <li>{@link #LAST_WINS}: the last occurrence is visible (default).</li>
 * <li>{@link #FIRST_WINS}: the first occurrence is visible.</li>
 * <li>{@link #REJECT}: the call fails with an argument error.</li>
 * </ul>
 */
public enum DuplicateArgumentPolicy {
    LAST_WINS,
    FIRST_WINS,
    REJECT
}
