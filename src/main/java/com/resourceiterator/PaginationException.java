package com.resourceiterator;

/**
 * Base class for failures raised by the pagination engine itself.
 *
 * <p>Failures raised by an {@link com.resourceiterator.operation.Operation} while executing a
 * request are not wrapped in this type; they reach the caller unchanged.
 */
public class PaginationException extends RuntimeException {

    public PaginationException(String message) {
        super(message);
    }

    public PaginationException(String message, Throwable cause) {
        super(message, cause);
    }
}
