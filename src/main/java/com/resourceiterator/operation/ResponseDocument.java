package com.resourceiterator.operation;

import java.util.Optional;

/**
 * A decoded response that supports path based field lookup.
 */
public interface ResponseDocument {

    /**
     * Returns the value found at {@code path}.
     *
     * @param path a dotted path such as {@code "Result.NextMarker"}
     * @return the value, or empty when the path is missing or holds null
     */
    Optional<Object> getPath(String path);
}
