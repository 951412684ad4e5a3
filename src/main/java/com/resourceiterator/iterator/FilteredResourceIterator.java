package com.resourceiterator.iterator;

import com.resourceiterator.operation.ResponseDocument;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Skips the items of another iterator that do not match a predicate.
 *
 * <p>{@link #hasNext()} looks ahead by one item, which may make the source fetch the next page.
 */
final class FilteredResourceIterator<T> implements ResourceIterator<T> {

    private final ResourceIterator<T> source;
    private final Predicate<? super T> predicate;

    private T nextItem;
    private boolean nextItemReady = false;

    FilteredResourceIterator(ResourceIterator<T> source, Predicate<? super T> predicate) {
        this.source = source;
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public boolean hasNext() {
        while (!nextItemReady && source.hasNext()) {
            T candidate = source.next();
            if (predicate.test(candidate)) {
                nextItem = candidate;
                nextItemReady = true;
            }
        }
        return nextItemReady;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items available");
        }
        T item = nextItem;
        nextItem = null;
        nextItemReady = false;
        return item;
    }

    @Override
    public Optional<ResponseDocument> getLastResult() {
        return source.getLastResult();
    }

    @Override
    public int getRequestCount() {
        return source.getRequestCount();
    }

    /**
     * Returns the number of items taken from the source, matching or not.
     */
    @Override
    public int getRetrievedCount() {
        return source.getRetrievedCount();
    }
}
