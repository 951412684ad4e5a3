package com.resourceiterator.iterator;

import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * A Spliterator view of a {@link ResourceIterator}, used by {@link ResourceIterator#stream()}.
 *
 * <p>Each {@link #tryAdvance} pulls one item, so pages are still fetched one at a time and only
 * when the stream needs them. Short-circuiting operations such as {@code limit()} or
 * {@code findFirst()} stop further requests.
 *
 * @param <T> the type of items
 */
final class ResourceSpliterator<T> implements Spliterator<T> {

    private final ResourceIterator<T> iterator;

    ResourceSpliterator(ResourceIterator<T> iterator) {
        this.iterator = iterator;
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
        if (!iterator.hasNext()) {
            return false;
        }
        action.accept(iterator.next());
        return true;
    }

    /**
     * Returns null: pages are chained by continuation tokens and must be fetched in order.
     */
    @Override
    public Spliterator<T> trySplit() {
        return null;
    }

    /**
     * Returns MAX_VALUE since the total count is unknown until the last page.
     */
    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
        return ORDERED;
    }
}
