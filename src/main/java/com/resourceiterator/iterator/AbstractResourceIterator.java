package com.resourceiterator.iterator;

import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.operation.Operation;
import com.resourceiterator.operation.ResponseDocument;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Base class for iterators that page through the results of an {@link Operation}.
 *
 * <p>Subclasses implement {@link #sendRequest()}, which sends one or more requests with the
 * {@linkplain #getOperation() working copy} of the operation and returns the next items to yield.
 * This class takes care of:
 * <ul>
 *   <li>Fetching lazily, only once the current page is exhausted</li>
 *   <li>Stopping when no continuation token is left after a page</li>
 *   <li>Stopping once the total item {@linkplain IteratorOptions#limit() limit} is reached</li>
 *   <li>Keeping the last response and the request and item counters</li>
 * </ul>
 *
 * <p>The operation passed to the constructor is never modified. The iterator works on a copy and
 * can {@linkplain #resetOperation() start over} from a fresh copy at any time.
 *
 * @param <T> the type of items
 */
public abstract class AbstractResourceIterator<T> implements ResourceIterator<T> {

    private final Operation originalOperation;
    private final IteratorOptions options;

    private Operation operation;
    private ContinuationToken nextToken;
    private ResponseDocument lastResult;
    private Iterator<T> currentPageIterator;
    private int requestCount = 0;
    private int retrievedCount = 0;
    private boolean finished = false;

    protected AbstractResourceIterator(Operation operation, IteratorOptions options) {
        this.originalOperation = operation;
        this.options = options;
        this.operation = operation.copy();
    }

    /**
     * Sends the request(s) for the next page and updates the continuation token.
     *
     * @return the items of the page; an empty list only when no continuation token is left
     */
    protected abstract List<T> sendRequest();

    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (isLimitReached()) {
            finished = true;
            return false;
        }

        while (!hasCurrentItem()) {
            if (requestCount > 0 && nextToken == null) {
                finished = true;
                return false;
            }
            currentPageIterator = sendRequest().iterator();
        }
        return true;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items available");
        }
        retrievedCount++;
        return currentPageIterator.next();
    }

    @Override
    public Optional<ResponseDocument> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    @Override
    public int getRequestCount() {
        return requestCount;
    }

    @Override
    public int getRetrievedCount() {
        return retrievedCount;
    }

    /**
     * Returns the continuation token for the next request, or empty when none is pending.
     */
    public Optional<ContinuationToken> getNextToken() {
        return Optional.ofNullable(nextToken);
    }

    protected void setNextToken(Optional<ContinuationToken> token) {
        this.nextToken = token.orElse(null);
    }

    protected IteratorOptions getOptions() {
        return options;
    }

    /**
     * Returns the working copy of the operation that the next request is sent with.
     */
    protected Operation getOperation() {
        return operation;
    }

    /**
     * Replaces the working copy with a fresh copy of the operation the iterator was created with,
     * discarding every parameter set since.
     */
    protected void resetOperation() {
        this.operation = originalOperation.copy();
    }

    /**
     * Executes the working copy and records the response.
     */
    protected ResponseDocument execute() {
        ResponseDocument result = operation.execute();
        requestCount++;
        lastResult = result;
        return result;
    }

    /**
     * Returns the number of items the next request should ask for, or empty to leave the request
     * as configured. The page size hint is capped by the items still allowed under the total limit.
     */
    protected OptionalInt calculatePageSize() {
        OptionalInt pageSize = options.pageSize();
        OptionalInt limit = options.limit();
        if (pageSize.isEmpty()) {
            return OptionalInt.empty();
        }
        if (limit.isPresent()) {
            int remaining = Math.max(1, limit.getAsInt() - retrievedCount);
            return OptionalInt.of(Math.min(pageSize.getAsInt(), remaining));
        }
        return pageSize;
    }

    private boolean isLimitReached() {
        return options.limit().isPresent() && retrievedCount >= options.limit().getAsInt();
    }

    private boolean hasCurrentItem() {
        return currentPageIterator != null && currentPageIterator.hasNext();
    }
}
