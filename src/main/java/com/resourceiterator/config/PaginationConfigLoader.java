package com.resourceiterator.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resourceiterator.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads iterator definitions from JSON.
 *
 * <p>The document maps operation names to their keys, optionally nested under a top-level
 * {@code "iterators"} object as in service descriptions:
 * <pre>{@code
 * {
 *   "iterators": {
 *     "ListObjects": {
 *       "input_token": "Marker",
 *       "output_token": "NextMarker",
 *       "limit_key": "MaxKeys",
 *       "result_key": "Contents",
 *       "more_results": "IsTruncated"
 *     },
 *     "ListObjectVersions": {
 *       "input_token": ["KeyMarker", "VersionIdMarker"],
 *       "output_token": ["NextKeyMarker", "NextVersionIdMarker"]
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>Token keys may be a string (single) or an array of strings (composite). Unknown keys are
 * rejected.
 */
public class PaginationConfigLoader {

    private final ObjectMapper objectMapper;

    public PaginationConfigLoader() {
        this(new ObjectMapper());
    }

    public PaginationConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads definitions from a classpath resource.
     *
     * @throws ConfigurationException if the resource is missing or malformed
     */
    public Map<String, PaginationConfig> loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = PaginationConfigLoader.class.getClassLoader();
        }
        InputStream in = classLoader.getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Iterator definitions not found on classpath: " + resource);
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read iterator definitions from " + resource, e);
        }
    }

    /**
     * Loads definitions from a file.
     */
    public Map<String, PaginationConfig> load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read iterator definitions from " + path, e);
        }
    }

    /**
     * Loads definitions from a stream. The stream is not closed.
     */
    public Map<String, PaginationConfig> load(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed iterator definitions", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Iterator definitions must be a JSON object");
        }
        if (root.has("iterators")) {
            root = root.get("iterators");
            if (!root.isObject()) {
                throw new ConfigurationException("\"iterators\" must be a JSON object");
            }
        }

        Map<String, PaginationConfig> configs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            configs.put(field.getKey(), toConfig(field.getKey(), field.getValue()));
        }
        return configs;
    }

    private PaginationConfig toConfig(String operation, JsonNode node) {
        IteratorDefinition definition;
        try {
            definition = objectMapper.treeToValue(node, IteratorDefinition.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid iterator definition for " + operation, e);
        }

        PaginationConfig.Builder builder = PaginationConfig.builder()
                .limitKey(definition.limitKey())
                .resultKey(definition.resultKey())
                .moreResults(definition.moreResults());
        if (isPresent(definition.inputToken())) {
            builder.inputToken(toTokenKey(operation, "input_token", definition.inputToken()));
        }
        if (isPresent(definition.outputToken())) {
            builder.outputToken(toTokenKey(operation, "output_token", definition.outputToken()));
        }
        return builder.build();
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    private static TokenKey toTokenKey(String operation, String field, JsonNode node) {
        if (node.isTextual()) {
            return TokenKey.single(node.asText());
        }
        if (node.isArray() && node.size() > 0) {
            List<String> names = new ArrayList<>();
            for (JsonNode element : node) {
                if (!element.isTextual()) {
                    throw new ConfigurationException(
                            operation + "." + field + " must only contain strings: " + node);
                }
                names.add(element.asText());
            }
            return TokenKey.composite(names);
        }
        throw new ConfigurationException(
                operation + "." + field + " must be a string or a non-empty array of strings: " + node);
    }

    private record IteratorDefinition(
            @JsonProperty("input_token") JsonNode inputToken,
            @JsonProperty("output_token") JsonNode outputToken,
            @JsonProperty("limit_key") String limitKey,
            @JsonProperty("result_key") String resultKey,
            @JsonProperty("more_results") String moreResults
    ) {
    }
}
