package io.shortcode.core.engine;

import io.shortcode.core.model.DuplicateArgumentPolicy;
import java.util.Objects;

/**
 * Renderer configuration. Use {@link #builder()} to construct instances; all
 * fields have defaults.
 *
 * @param budget                  handler time and output size limits
 * @param unknownDirectivePolicy  fail or preserve calls with no handler
 * @param duplicateArgumentPolicy how repeated argument names are resolved
 * @param placeholder             marker substituted for calls by deferred
 *                                rendering
 */
public record RenderOptions(
        RenderBudget budget,
        UnknownDirectivePolicy unknownDirectivePolicy,
        DuplicateArgumentPolicy duplicateArgumentPolicy,
        String placeholder) {

    public static final String DEFAULT_PLACEHOLDER = "@@SHORTCODE@@";

    public static final RenderOptions DEFAULT = builder().build();

    public RenderOptions {
        Objects.requireNonNull(budget, "budget must not be null");
        Objects.requireNonNull(unknownDirectivePolicy, "unknownDirectivePolicy must not be null");
        Objects.requireNonNull(duplicateArgumentPolicy, "duplicateArgumentPolicy must not be null");
        if (placeholder == null || placeholder.isEmpty()) {
            throw new IllegalArgumentException("placeholder must not be null or empty");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RenderOptions}. */
    public static final class Builder {
        private RenderBudget budget = RenderBudget.DEFAULT;
        private UnknownDirectivePolicy unknownDirectivePolicy = UnknownDirectivePolicy.FAIL;
        private DuplicateArgumentPolicy duplicateArgumentPolicy = DuplicateArgumentPolicy.LAST_WINS;
        private String placeholder = DEFAULT_PLACEHOLDER;

        Builder() {}

        public Builder budget(RenderBudget budget) {
            this.budget = budget;
            return this;
        }

        public Builder unknownDirectivePolicy(UnknownDirectivePolicy unknownDirectivePolicy) {
            this.unknownDirectivePolicy = unknownDirectivePolicy;
            return this;
        }

        public Builder duplicateArgumentPolicy(DuplicateArgumentPolicy duplicateArgumentPolicy) {
            this.duplicateArgumentPolicy = duplicateArgumentPolicy;
            return this;
        }

        public Builder placeholder(String placeholder) {
            this.placeholder = placeholder;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(budget, unknownDirectivePolicy, duplicateArgumentPolicy, placeholder);
        }
    }
}
