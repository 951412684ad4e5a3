package com.resourceiterator.iterator;

import com.resourceiterator.operation.ResponseDocument;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Applies a function to every item of another iterator.
 */
final class MappedResourceIterator<T, R> implements ResourceIterator<R> {

    private final ResourceIterator<T> source;
    private final Function<? super T, ? extends R> mapper;

    MappedResourceIterator(ResourceIterator<T> source, Function<? super T, ? extends R> mapper) {
        this.source = source;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public R next() {
        return mapper.apply(source.next());
    }

    @Override
    public Optional<ResponseDocument> getLastResult() {
        return source.getLastResult();
    }

    @Override
    public int getRequestCount() {
        return source.getRequestCount();
    }

    @Override
    public int getRetrievedCount() {
        return source.getRetrievedCount();
    }
}
