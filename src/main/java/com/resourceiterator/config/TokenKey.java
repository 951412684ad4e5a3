package com.resourceiterator.config;

import java.util.List;
import java.util.Objects;

/**
 * Names of the request parameters or response paths that carry a continuation token.
 *
 * <p>A single key carries a scalar token. A composite key carries a token made of several
 * parts, matched to the names by position. A composite key stays composite even when it lists
 * only one name.
 *
 * @param names the parameter names or response paths, in token order
 * @param composite whether the token has one part per name
 */
public record TokenKey(List<String> names, boolean composite) {

    public TokenKey {
        names = List.copyOf(names);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("A token key needs at least one name");
        }
        if (!composite && names.size() != 1) {
            throw new IllegalArgumentException("A single token key has exactly one name: " + names);
        }
    }

    public static TokenKey single(String name) {
        return new TokenKey(List.of(Objects.requireNonNull(name, "name")), false);
    }

    public static TokenKey composite(List<String> names) {
        return new TokenKey(names, true);
    }

    public static TokenKey composite(String... names) {
        return composite(List.of(names));
    }

    /**
     * Returns the only name of a single key.
     *
     * @throws IllegalStateException if this key is composite
     */
    public String name() {
        if (composite) {
            throw new IllegalStateException("Composite token key has no single name: " + names);
        }
        return names.get(0);
    }

    public int arity() {
        return names.size();
    }

    @Override
    public String toString() {
        return composite ? names.toString() : names.get(0);
    }
}
