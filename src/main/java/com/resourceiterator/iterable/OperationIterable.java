package com.resourceiterator.iterable;

import com.resourceiterator.ConfigurationException;
import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.factory.ResourceIteratorFactory;
import com.resourceiterator.iterator.ResourceIterator;
import com.resourceiterator.operation.Operation;

/**
 * A lazy Iterable over the results of an operation.
 *
 * <p>Each call to {@link #iterator()} builds a fresh iterator from the factory, starting again
 * from the first page. Iterators themselves cannot be restarted, so this is the way to walk the
 * same results more than once.
 *
 * <p>Example usage:
 * <pre>{@code
 * OperationIterable objects = new OperationIterable(factory, listObjects);
 *
 * for (Object object : objects) {
 *     process(object);
 *     if (shouldStop(object)) {
 *         break; // No more pages fetched
 *     }
 * }
 * }</pre>
 *
 * <p><b>Side effects:</b> every iteration sends its own requests. The factory resolves the
 * operation eagerly in the constructor, so an operation without an iterator fails fast.
 */
public class OperationIterable implements Iterable<Object> {

    private final ResourceIteratorFactory factory;
    private final Operation operation;
    private final IteratorOptions options;

    public OperationIterable(ResourceIteratorFactory factory, Operation operation) {
        this(factory, operation, IteratorOptions.defaults());
    }

    /**
     * @throws ConfigurationException if the factory cannot build an iterator
     *         for the operation
     */
    public OperationIterable(ResourceIteratorFactory factory, Operation operation, IteratorOptions options) {
        if (!factory.canBuild(operation)) {
            throw new ConfigurationException("Iterator was not found for " + operation.getName());
        }
        this.factory = factory;
        this.operation = operation.copy();
        this.options = options;
    }

    /**
     * Returns a new iterator that starts from the first page.
     */
    @Override
    public ResourceIterator<Object> iterator() {
        return factory.build(operation, options);
    }
}
