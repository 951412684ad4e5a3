package com.resourceiterator.factory;

import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.iterator.ResourceIterator;
import com.resourceiterator.operation.Operation;

/**
 * Creates iterators for paged operations.
 */
public interface ResourceIteratorFactory {

    /**
     * Builds an iterator over the results of {@code operation}. The operation is used as a
     * template and is not modified.
     *
     * @throws com.resourceiterator.ConfigurationException if this factory cannot build an iterator
     *         for the operation
     */
    ResourceIterator<Object> build(Operation operation, IteratorOptions options);

    /**
     * Returns whether {@link #build} would succeed for {@code operation}. Never sends a request
     * and never creates an iterator.
     */
    boolean canBuild(Operation operation);
}
