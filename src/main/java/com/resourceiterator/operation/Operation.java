package com.resourceiterator.operation;

/**
 * One invocable request of a paged list API.
 *
 * <p>An operation is a mutable command: parameters are read and written by name and
 * {@link #execute()} sends the request as currently configured. Iterators never mutate the
 * operation handed to them; they work on {@link #copy() copies}.
 */
public interface Operation {

    /**
     * Multi-valued option used to tag a request with extra User-Agent fragments.
     */
    String USER_AGENT_OPTION = "ua.append";

    /**
     * Returns the operation name used to look up its iterator definition.
     */
    String getName();

    /**
     * Returns the current value of a request parameter, or {@code null} if it is not set.
     */
    Object get(String param);

    /**
     * Sets a request parameter, replacing any previous value.
     */
    void set(String param, Object value);

    /**
     * Appends a value to a multi-valued request option without replacing earlier values.
     */
    void add(String option, Object value);

    /**
     * Sends the request and returns the decoded response.
     *
     * <p>Transport failures are reported as unchecked exceptions and are not retried by callers
     * in this library.
     */
    ResponseDocument execute();

    /**
     * Returns an independent copy of this operation. Changes to the copy do not affect this
     * instance and vice versa.
     */
    Operation copy();
}
