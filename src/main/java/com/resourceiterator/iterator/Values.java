package com.resourceiterator.iterator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Loose interpretation of values read from response documents and request parameters.
 */
final class Values {

    private Values() {
    }

    /**
     * Returns whether a "more results" flag value means that more pages exist.
     *
     * <p>{@code null}, {@code false}, zero, empty strings, {@code "0"}, {@code "false"} and empty
     * collections are false; everything else is true.
     */
    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            return !text.isEmpty() && !"0".equals(text) && !"false".equalsIgnoreCase(text);
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    /**
     * Returns whether a token value read from a response marks the end of the results:
     * {@code null}, {@code false}, zero, an empty string or {@code "0"}.
     */
    static boolean isAbsentToken(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return true;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0;
        }
        if (value instanceof CharSequence) {
            String text = value.toString();
            return text.isEmpty() || "0".equals(text);
        }
        return false;
    }

    /**
     * Reads a positive integer limit from a request parameter value.
     */
    static OptionalInt asLimit(Object value) {
        long limit;
        if (value instanceof Number) {
            limit = ((Number) value).longValue();
        } else if (value instanceof CharSequence) {
            try {
                limit = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        } else {
            return OptionalInt.empty();
        }
        if (limit <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) Math.min(limit, Integer.MAX_VALUE));
    }

    /**
     * Turns the value at a result path into the items of a page. Collections and arrays yield
     * their elements, objects yield their values in document order, and any other value is a
     * single item.
     */
    static List<Object> toItems(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value instanceof Map) {
            return new ArrayList<>(((Map<?, ?>) value).values());
        }
        if (value instanceof Object[]) {
            return new ArrayList<>(Arrays.asList((Object[]) value));
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }
}
