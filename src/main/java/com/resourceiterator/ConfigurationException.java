package com.resourceiterator;

/**
 * Thrown when no iterator can be built for an operation, or when iterator
 * definitions cannot be loaded.
 */
public class ConfigurationException extends PaginationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
