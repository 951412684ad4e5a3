package com.resourceiterator.iterator;

import com.resourceiterator.operation.ResponseDocument;

import java.util.Iterator;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An {@link Iterator} over the items of a paged operation.
 *
 * <p>Pages are requested lazily: a request is only sent once every item of the previous page
 * has been consumed. An iterator is single use; build a new one to iterate again.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResourceIterator<Object> objects = factory.build(listObjects, IteratorOptions.defaults());
 *
 * while (objects.hasNext()) {
 *     Object object = objects.next();
 *     // Process object
 * }
 *
 * objects.getLastResult().flatMap(result -> result.getPath("Owner"));
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Implementations are NOT thread-safe.
 *
 * @param <T> the type of items
 */
public interface ResourceIterator<T> extends Iterator<T> {

    /**
     * Returns the most recent response received, or empty before the first request.
     */
    Optional<ResponseDocument> getLastResult();

    /**
     * Returns the number of requests sent so far, including requests repeated after an empty page.
     */
    int getRequestCount();

    /**
     * Returns the number of items returned by {@link #next()} so far.
     */
    int getRetrievedCount();

    /**
     * Returns an iterator that applies {@code mapper} to each item of this iterator.
     */
    default <R> ResourceIterator<R> map(Function<? super T, ? extends R> mapper) {
        return new MappedResourceIterator<>(this, mapper);
    }

    /**
     * Returns an iterator over the items of this iterator that match {@code predicate}.
     */
    default ResourceIterator<T> filter(Predicate<? super T> predicate) {
        return new FilteredResourceIterator<>(this, predicate);
    }

    /**
     * Returns a sequential stream over the remaining items. Consuming the stream consumes this
     * iterator.
     */
    default Stream<T> stream() {
        return StreamSupport.stream(new ResourceSpliterator<>(this), false);
    }
}
