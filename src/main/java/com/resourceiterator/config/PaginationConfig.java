package com.resourceiterator.config;

import java.util.Optional;

/**
 * The keys that describe how one operation pages through its results.
 *
 * <p>Every key is optional. An absent key disables the behavior it drives:
 * <ul>
 *   <li>{@code inputToken}: request parameter(s) that receive the continuation token</li>
 *   <li>{@code outputToken}: response path(s) holding the next continuation token</li>
 *   <li>{@code limitKey}: request parameter holding the per-request item limit</li>
 *   <li>{@code resultKey}: response path holding the items of a page</li>
 *   <li>{@code moreResults}: response path of a flag telling whether more pages exist</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * PaginationConfig listObjects = PaginationConfig.builder()
 *     .inputToken("Marker")
 *     .outputToken("NextMarker")
 *     .limitKey("MaxKeys")
 *     .resultKey("Contents")
 *     .moreResults("IsTruncated")
 *     .build();
 * }</pre>
 */
public record PaginationConfig(
        Optional<TokenKey> inputToken,
        Optional<TokenKey> outputToken,
        Optional<String> limitKey,
        Optional<String> resultKey,
        Optional<String> moreResults
) {

    private static final PaginationConfig DEFAULTS = new PaginationConfig(
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());

    /**
     * Returns the configuration with every key absent.
     */
    public static PaginationConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration that takes each key from {@code overrides} when present there and
     * from this configuration otherwise.
     */
    public PaginationConfig overriddenBy(PaginationConfig overrides) {
        return new PaginationConfig(
                overrides.inputToken.or(() -> inputToken),
                overrides.outputToken.or(() -> outputToken),
                overrides.limitKey.or(() -> limitKey),
                overrides.resultKey.or(() -> resultKey),
                overrides.moreResults.or(() -> moreResults)
        );
    }

    /**
     * Builder for {@link PaginationConfig}. Keys that are never set stay absent.
     */
    public static final class Builder {
        private TokenKey inputToken;
        private TokenKey outputToken;
        private String limitKey;
        private String resultKey;
        private String moreResults;

        private Builder() {
        }

        /**
         * Sets a single request parameter that receives the continuation token.
         *
         * @param name the parameter name
         * @return this builder
         */
        public Builder inputToken(String name) {
            return inputToken(TokenKey.single(name));
        }

        /**
         * Sets the request parameter(s) that receive the continuation token.
         *
         * @param key a single or composite key
         * @return this builder
         */
        public Builder inputToken(TokenKey key) {
            this.inputToken = key;
            return this;
        }

        /**
         * Sets a single response path holding the next continuation token.
         *
         * @param path a dotted response path
         * @return this builder
         */
        public Builder outputToken(String path) {
            return outputToken(TokenKey.single(path));
        }

        /**
         * Sets the response path(s) holding the next continuation token.
         *
         * @param key a single or composite key, with as many parts as the input token
         * @return this builder
         */
        public Builder outputToken(TokenKey key) {
            this.outputToken = key;
            return this;
        }

        /**
         * Sets the request parameter holding the per-request item limit.
         *
         * @param limitKey the parameter name
         * @return this builder
         */
        public Builder limitKey(String limitKey) {
            this.limitKey = limitKey;
            return this;
        }

        /**
         * Sets the response path holding the items of a page.
         *
         * @param resultKey a dotted response path
         * @return this builder
         */
        public Builder resultKey(String resultKey) {
            this.resultKey = resultKey;
            return this;
        }

        /**
         * Sets the response path of the flag telling whether more pages exist.
         *
         * @param moreResults a dotted response path
         * @return this builder
         */
        public Builder moreResults(String moreResults) {
            this.moreResults = moreResults;
            return this;
        }

        /**
         * Returns the configuration, with every key that was not set absent.
         */
        public PaginationConfig build() {
            return new PaginationConfig(
                    Optional.ofNullable(inputToken),
                    Optional.ofNullable(outputToken),
                    Optional.ofNullable(limitKey),
                    Optional.ofNullable(resultKey),
                    Optional.ofNullable(moreResults)
            );
        }
    }
}
