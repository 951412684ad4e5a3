package com.resourceiterator.config;

import java.util.OptionalInt;

/**
 * Caller tuning for one iterator.
 *
 * @param limit maximum number of items to yield in total
 * @param pageSize preferred number of items per request
 * @param maxEmptyPages maximum number of consecutive empty pages that still carry a continuation
 *        token before the iterator gives up; unbounded when absent
 * @param keys key overrides applied over the registered configuration of the operation
 */
public record IteratorOptions(
        OptionalInt limit,
        OptionalInt pageSize,
        OptionalInt maxEmptyPages,
        PaginationConfig keys
) {

    private static final IteratorOptions DEFAULTS = builder().build();

    public IteratorOptions {
        requirePositive(limit, "limit");
        requirePositive(pageSize, "pageSize");
        requirePositive(maxEmptyPages, "maxEmptyPages");
        keys = keys != null ? keys : PaginationConfig.defaults();
    }

    public static IteratorOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of these options carrying {@code keys} as overrides.
     */
    public IteratorOptions withKeys(PaginationConfig keys) {
        return new IteratorOptions(limit, pageSize, maxEmptyPages, keys);
    }

    private static void requirePositive(OptionalInt value, String name) {
        if (value.isPresent() && value.getAsInt() <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value.getAsInt());
        }
    }

    public static final class Builder {
        private OptionalInt limit = OptionalInt.empty();
        private OptionalInt pageSize = OptionalInt.empty();
        private OptionalInt maxEmptyPages = OptionalInt.empty();
        private PaginationConfig keys = PaginationConfig.defaults();

        private Builder() {
        }

        /**
         * Sets the maximum number of items to yield in total.
         *
         * @param limit a positive item count
         * @return this builder
         */
        public Builder limit(int limit) {
            this.limit = OptionalInt.of(limit);
            return this;
        }

        /**
         * Sets the preferred number of items per request. Only applied when the operation already
         * carries a numeric value for its limit key.
         *
         * @param pageSize a positive item count
         * @return this builder
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = OptionalInt.of(pageSize);
            return this;
        }

        /**
         * Bounds the number of consecutive empty pages with a continuation token.
         *
         * @param maxEmptyPages a positive page count
         * @return this builder
         */
        public Builder maxEmptyPages(int maxEmptyPages) {
            this.maxEmptyPages = OptionalInt.of(maxEmptyPages);
            return this;
        }

        /**
         * Sets keys that override the registered configuration of the operation.
         *
         * @param keys the overrides; absent keys keep the registered values
         * @return this builder
         */
        public Builder keys(PaginationConfig keys) {
            this.keys = keys;
            return this;
        }

        /**
         * Returns the options.
         *
         * @throws IllegalArgumentException if a value set is not positive
         */
        public IteratorOptions build() {
            return new IteratorOptions(limit, pageSize, maxEmptyPages, keys);
        }
    }
}
