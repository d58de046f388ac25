package io.atprose.lexicon.config;

import io.atprose.types.Did;
import java.util.Objects;
import java.util.Set;

/**
 * Tunables for parsing lexicons and validating instances. Use {@link #builder()} to construct
 * instances; {@link #DEFAULTS} is what an empty configuration file yields.
 *
 * @param strictHandles      require at least two labels, a letter-initial top-level label and a
 *                           non-reserved top-level domain in {@code handle} values
 * @param didMaxLength       DID length ceiling in characters
 * @param didAllowedMethods  registered DID methods; empty accepts any syntactically valid method
 * @param unionOpenByDefault whether unions that do not say {@code closed} accept unknown
 *                           {@code $type} tags
 * @param strictKeys         reject unrecognized keys inside definitions
 * @param maxDepth           maximum nesting of objects and arrays in an instance
 */
public record LexiconConfig(
        boolean strictHandles,
        int didMaxLength,
        Set<String> didAllowedMethods,
        boolean unionOpenByDefault,
        boolean strictKeys,
        int maxDepth) {

    public static final LexiconConfig DEFAULTS = builder().build();

    public LexiconConfig {
        if (didMaxLength <= 0) {
            throw new IllegalArgumentException("didMaxLength must be positive, got: " + didMaxLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        didAllowedMethods = Set.copyOf(Objects.requireNonNull(didAllowedMethods, "didAllowedMethods must not be null"));
    }

    /** The DID rules these settings describe. */
    public Did.Policy didPolicy() {
        return new Did.Policy(didMaxLength, didAllowedMethods);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with the documented defaults. */
    public static final class Builder {
        private boolean strictHandles = true;
        private int didMaxLength = Did.DEFAULT_MAX_LENGTH;
        private Set<String> didAllowedMethods = Set.of();
        private boolean unionOpenByDefault = false;
        private boolean strictKeys = true;
        private int maxDepth = 128;

        Builder() {}

        public Builder strictHandles(boolean strictHandles) {
            this.strictHandles = strictHandles;
            return this;
        }

        public Builder didMaxLength(int didMaxLength) {
            this.didMaxLength = didMaxLength;
            return this;
        }

        public Builder didAllowedMethods(Set<String> didAllowedMethods) {
            this.didAllowedMethods = didAllowedMethods;
            return this;
        }

        public Builder unionOpenByDefault(boolean unionOpenByDefault) {
            this.unionOpenByDefault = unionOpenByDefault;
            return this;
        }

        public Builder strictKeys(boolean strictKeys) {
            this.strictKeys = strictKeys;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public LexiconConfig build() {
            return new LexiconConfig(
                    strictHandles, didMaxLength, didAllowedMethods, unionOpenByDefault, strictKeys, maxDepth);
        }
    }
}
