package com.resourceiterator.iterator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An opaque continuation marker read from one response and sent with the next request.
 *
 * <p>A scalar token holds one value. A composite token holds one part per configured token name;
 * individual parts may be {@code null} when the response did not carry them.
 */
public final class ContinuationToken {

    private final List<Object> parts;
    private final boolean composite;

    private ContinuationToken(List<Object> parts, boolean composite) {
        this.parts = parts;
        this.composite = composite;
    }

    public static ContinuationToken scalar(Object value) {
        return new ContinuationToken(List.of(Objects.requireNonNull(value, "value")), false);
    }

    public static ContinuationToken composite(List<?> parts) {
        return new ContinuationToken(Collections.unmodifiableList(new ArrayList<Object>(parts)), true);
    }

    public boolean isComposite() {
        return composite;
    }

    /**
     * Returns the parts of the token, in order. A scalar token has exactly one part.
     */
    public List<Object> parts() {
        return parts;
    }

    /**
     * Returns the token as a single parameter value: the scalar itself, or the list of parts of
     * a composite token.
     */
    public Object value() {
        return composite ? parts : parts.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContinuationToken)) {
            return false;
        }
        ContinuationToken that = (ContinuationToken) o;
        return composite == that.composite && parts.equals(that.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parts, composite);
    }

    @Override
    public String toString() {
        return String.valueOf(value());
    }
}
