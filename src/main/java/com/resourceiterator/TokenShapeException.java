package com.resourceiterator;

import java.util.List;

/**
 * Thrown when a composite input token definition and the continuation token
 * read from the previous response have different shapes.
 */
public class TokenShapeException extends PaginationException {

    private final List<String> tokenParams;
    private final Object tokenValue;

    public TokenShapeException(List<String> tokenParams, Object tokenValue) {
        super("The definition of the iterator's token parameter and the actual token value are not compatible: "
                + tokenParams + " vs " + tokenValue);
        this.tokenParams = List.copyOf(tokenParams);
        this.tokenValue = tokenValue;
    }

    public List<String> getTokenParams() {
        return tokenParams;
    }

    public Object getTokenValue() {
        return tokenValue;
    }
}
