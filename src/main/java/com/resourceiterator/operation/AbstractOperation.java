package com.resourceiterator.operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for operations that keep their parameters in memory.
 *
 * <p>Parameters set with {@link #set} are single valued; options appended with {@link #add}
 * accumulate. {@link #copy()} copies both maps, so a copy can be mutated freely.
 */
public abstract class AbstractOperation implements Operation {

    private final String name;
    private final Map<String, Object> params;
    private final Map<String, List<Object>> options;

    protected AbstractOperation(String name) {
        this(name, new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    protected AbstractOperation(AbstractOperation source) {
        this(source.name, new LinkedHashMap<>(source.params), copyOptions(source.options));
    }

    private AbstractOperation(String name, Map<String, Object> params, Map<String, List<Object>> options) {
        this.name = name;
        this.params = params;
        this.options = options;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Object get(String param) {
        return params.get(param);
    }

    @Override
    public void set(String param, Object value) {
        if (value == null) {
            params.remove(param);
        } else {
            params.put(param, value);
        }
    }

    @Override
    public void add(String option, Object value) {
        options.computeIfAbsent(option, key -> new ArrayList<>()).add(value);
    }

    /**
     * Returns a read-only view of the parameters, in insertion order.
     */
    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * Returns the values appended for {@code option}, oldest first.
     */
    public List<Object> getOption(String option) {
        return Collections.unmodifiableList(options.getOrDefault(option, List.of()));
    }

    private static Map<String, List<Object>> copyOptions(Map<String, List<Object>> source) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, new ArrayList<>(values)));
        return copy;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", params=" + params + "]";
    }
}
