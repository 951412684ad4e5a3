package com.resourceiterator.factory;

import com.resourceiterator.ConfigurationException;
import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.config.PaginationConfig;
import com.resourceiterator.config.PaginationConfigLoader;
import com.resourceiterator.iterator.PagingIterator;
import com.resourceiterator.iterator.ResourceIterator;
import com.resourceiterator.operation.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link PagingIterator}s from per-operation {@link PaginationConfig}s.
 *
 * <p>A primary factory may be supplied to handle operations that need a more specific iterator.
 * It is always asked first; this factory only builds a generic iterator when there is no primary
 * factory, or the primary cannot build one, and the operation name is registered.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResourceIteratorFactory factory = new ConfiguredIteratorFactory(Map.of(
 *     "ListObjects", PaginationConfig.builder()
 *         .inputToken("Marker")
 *         .outputToken("NextMarker")
 *         .resultKey("Contents")
 *         .build()
 * ));
 *
 * ResourceIterator<Object> objects = factory.build(listObjects, IteratorOptions.defaults());
 * }</pre>
 */
public class ConfiguredIteratorFactory implements ResourceIteratorFactory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredIteratorFactory.class);

    private final Map<String, PaginationConfig> configs;
    private final ResourceIteratorFactory primaryFactory;

    public ConfiguredIteratorFactory(Map<String, PaginationConfig> configs) {
        this(configs, null);
    }

    /**
     * @param configs iterator configuration by operation name
     * @param primaryFactory factory asked first, may be {@code null}
     */
    public ConfiguredIteratorFactory(Map<String, PaginationConfig> configs, ResourceIteratorFactory primaryFactory) {
        Map<String, PaginationConfig> merged = new LinkedHashMap<>();
        configs.forEach((name, config) -> merged.put(name, PaginationConfig.defaults().overriddenBy(config)));
        this.configs = Collections.unmodifiableMap(merged);
        this.primaryFactory = primaryFactory;
    }

    /**
     * Creates a factory from iterator definitions stored in a classpath resource.
     *
     * @see PaginationConfigLoader
     */
    public static ConfiguredIteratorFactory fromResource(String resource) {
        return new ConfiguredIteratorFactory(new PaginationConfigLoader().loadResource(resource));
    }

    @Override
    public ResourceIterator<Object> build(Operation operation, IteratorOptions options) {
        String name = operation.getName();
        PaginationConfig registered = configs.get(name);

        // Caller keys take precedence over the registered ones
        PaginationConfig resolved = registered != null
                ? registered.overriddenBy(options.keys())
                : options.keys();
        IteratorOptions merged = options.withKeys(resolved);

        if (primaryFactory != null && primaryFactory.canBuild(operation)) {
            log.debug("Delegating iterator for {} to {}", name, primaryFactory.getClass().getSimpleName());
            return primaryFactory.build(operation, merged);
        }
        if (registered == null) {
            throw new ConfigurationException("Iterator was not found for " + name);
        }
        return new PagingIterator(operation, resolved, merged);
    }

    /**
     * Returns true when the primary factory can build the operation or its name is registered,
     * matching the cases in which {@link #build} succeeds.
     */
    @Override
    public boolean canBuild(Operation operation) {
        if (primaryFactory != null && primaryFactory.canBuild(operation)) {
            return true;
        }
        return configs.containsKey(operation.getName());
    }

    /**
     * Returns the configuration registered for an operation name.
     */
    public Optional<PaginationConfig> getConfig(String operationName) {
        return Optional.ofNullable(configs.get(operationName));
    }
}
