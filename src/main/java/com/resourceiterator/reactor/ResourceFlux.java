package com.resourceiterator.reactor;

import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.factory.ResourceIteratorFactory;
import com.resourceiterator.iterator.ResourceIterator;
import com.resourceiterator.operation.Operation;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;

import java.util.function.Supplier;

/**
 * Exposes paged results as a Reactor {@link Flux}.
 *
 * <p>Uses {@link Flux#generate} so that one item is pulled from the iterator per downstream
 * request. Pages are fetched on the subscribing thread, and only when demand reaches the end of
 * the current page. Each subscription builds its own iterator.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResourceFlux.from(factory, listObjects, IteratorOptions.defaults())
 *     .filter(object -> isLarge(object))
 *     .take(10)  // Only fetches pages until 10 matching items found
 *     .subscribe(System.out::println);
 * }</pre>
 */
public final class ResourceFlux {

    private ResourceFlux() {
    }

    /**
     * Returns a Flux over the results of {@code operation}. The iterator is built on subscription,
     * so configuration errors are signalled as {@code onError}.
     */
    public static Flux<Object> from(ResourceIteratorFactory factory, Operation operation, IteratorOptions options) {
        Operation template = operation.copy();
        return from(() -> factory.build(template, options));
    }

    /**
     * Returns a Flux over the items of iterators obtained from {@code iteratorSupplier}, one per
     * subscription.
     */
    public static <T> Flux<T> from(Supplier<ResourceIterator<T>> iteratorSupplier) {
        return Flux.<T, ResourceIterator<T>>generate(iteratorSupplier::get, ResourceFlux::emitNextItem);
    }

    private static <T> ResourceIterator<T> emitNextItem(ResourceIterator<T> iterator, SynchronousSink<T> sink) {
        if (iterator.hasNext()) {
            sink.next(iterator.next());
        } else {
            sink.complete();
        }
        return iterator;
    }
}
