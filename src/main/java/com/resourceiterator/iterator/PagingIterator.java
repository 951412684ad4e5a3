package com.resourceiterator.iterator;

import com.resourceiterator.PaginationException;
import com.resourceiterator.TokenShapeException;
import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.config.PaginationConfig;
import com.resourceiterator.config.TokenKey;
import com.resourceiterator.operation.Operation;
import com.resourceiterator.operation.ResponseDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The generic iterator driven entirely by a {@link PaginationConfig}.
 *
 * <p>For every page it:
 * <ol>
 *   <li>Negotiates the page size: when the {@code limitKey} parameter already holds a number and a
 *       page size can be {@linkplain #calculatePageSize() calculated}, the smaller of the two is
 *       sent</li>
 *   <li>Applies the pending continuation token to the {@code inputToken} parameter(s)</li>
 *   <li>Tags the request with {@value #ITERATOR_TAG} and executes it</li>
 *   <li>Reads the items at {@code resultKey}; a missing or null value is an empty page</li>
 *   <li>Reads the next token at {@code outputToken}, unless {@code moreResults} is configured and
 *       does not hold a true value</li>
 * </ol>
 *
 * <p>A page with no items that still carries a continuation token is not the end of the results.
 * The iterator starts over from a fresh copy of the original operation, applies the token and
 * requests again before yielding anything. There is no bound on the number of such requests
 * unless {@link IteratorOptions#maxEmptyPages()} is set; a backend that keeps answering with
 * empty pages and a token keeps the iterator requesting.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe.
 */
public class PagingIterator extends AbstractResourceIterator<Object> {

    private static final Logger log = LoggerFactory.getLogger(PagingIterator.class);

    /**
     * Value appended to {@link Operation#USER_AGENT_OPTION} on every request sent by an iterator.
     */
    public static final String ITERATOR_TAG = "ITR";

    private final PaginationConfig config;

    /**
     * Creates an iterator over the results of {@code operation}. Nothing is sent until the first
     * call to {@link #hasNext()} or {@link #next()}.
     *
     * @param operation the request template, copied and never modified
     * @param config the keys describing how the operation pages
     * @param options the caller tuning: total limit, page size hint and empty page bound
     */
    public PagingIterator(Operation operation, PaginationConfig config, IteratorOptions options) {
        super(operation, options);
        this.config = config;
    }

    /**
     * Returns the keys this iterator pages with.
     *
     * @return the resolved configuration, caller overrides included
     */
    public PaginationConfig getConfig() {
        return config;
    }

    @Override
    protected List<Object> sendRequest() {
        int emptyPages = 0;
        while (true) {
            prepareRequest();
            getNextToken().ifPresent(this::applyNextToken);

            getOperation().add(Operation.USER_AGENT_OPTION, ITERATOR_TAG);
            ResponseDocument result = execute();
            List<Object> items = handleResults(result);
            setNextToken(determineNextToken(result));

            log.debug("{} request #{} returned {} item(s), next token: {}",
                    getOperation().getName(), getRequestCount(), items.size(), getNextToken().orElse(null));

            if (!items.isEmpty() || getNextToken().isEmpty()) {
                return items;
            }

            emptyPages++;
            OptionalInt maxEmptyPages = getOptions().maxEmptyPages();
            if (maxEmptyPages.isPresent() && emptyPages > maxEmptyPages.getAsInt()) {
                log.warn("{} returned {} consecutive empty pages with a continuation token, giving up",
                        getOperation().getName(), emptyPages);
                throw new PaginationException(getOperation().getName() + " returned " + emptyPages
                        + " consecutive empty pages with a continuation token");
            }
            log.debug("{} returned an empty page with a continuation token, requesting again",
                    getOperation().getName());
            resetOperation();
        }
    }

    /**
     * Lowers the request limit to the calculated page size when both are known.
     */
    protected void prepareRequest() {
        config.limitKey().ifPresent(limitKey -> {
            OptionalInt requestLimit = Values.asLimit(getOperation().get(limitKey));
            OptionalInt pageSize = calculatePageSize();
            if (requestLimit.isPresent() && pageSize.isPresent()) {
                getOperation().set(limitKey, Math.min(requestLimit.getAsInt(), pageSize.getAsInt()));
            }
        });
    }

    /**
     * Writes the token into the input token parameter(s) of the working operation.
     *
     * @throws TokenShapeException if the input token is composite and the token does not have
     *         one part per parameter
     */
    protected void applyNextToken(ContinuationToken token) {
        Optional<TokenKey> inputToken = config.inputToken();
        if (inputToken.isEmpty()) {
            return;
        }

        TokenKey key = inputToken.get();
        if (!key.composite()) {
            getOperation().set(key.name(), token.value());
            return;
        }

        if (!token.isComposite() || token.parts().size() != key.arity()) {
            throw new TokenShapeException(key.names(), token.value());
        }
        List<String> params = key.names();
        List<Object> parts = token.parts();
        for (int i = 0; i < params.size(); i++) {
            getOperation().set(params.get(i), parts.get(i));
        }
    }

    /**
     * Returns the items of a page.
     */
    protected List<Object> handleResults(ResponseDocument result) {
        return config.resultKey()
                .flatMap(result::getPath)
                .map(Values::toItems)
                .orElseGet(ArrayList::new);
    }

    /**
     * Reads the continuation token for the next request from a response.
     *
     * <p>A scalar token that is missing, null, empty, zero or {@code "0"} means there are no more
     * pages. A composite token is kept as long as at least one of its parts is present.
     */
    protected Optional<ContinuationToken> determineNextToken(ResponseDocument result) {
        Optional<String> moreResults = config.moreResults();
        if (moreResults.isPresent() && !Values.isTruthy(result.getPath(moreResults.get()).orElse(null))) {
            return Optional.empty();
        }

        Optional<TokenKey> outputToken = config.outputToken();
        if (outputToken.isEmpty()) {
            return Optional.empty();
        }

        TokenKey key = outputToken.get();
        if (!key.composite()) {
            return result.getPath(key.name())
                    .filter(value -> !Values.isAbsentToken(value))
                    .map(ContinuationToken::scalar);
        }

        List<Object> parts = new ArrayList<>(key.arity());
        boolean anyPresent = false;
        for (String path : key.names()) {
            Object part = result.getPath(path).orElse(null);
            anyPresent |= !Values.isAbsentToken(part);
            parts.add(part);
        }
        return anyPresent ? Optional.of(ContinuationToken.composite(parts)) : Optional.empty();
    }
}
