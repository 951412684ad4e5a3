package com.resourceiterator.operation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link ResponseDocument} backed by a Jackson tree.
 *
 * <p>Paths are dot separated. A numeric segment indexes into an array and {@code *} projects the
 * rest of the path over every element of an array, skipping elements where it is missing:
 * <pre>{@code
 * {"Result": {"Items": [{"Id": 1}, {"Id": 2}], "Next": "m1"}}
 *
 * getPath("Result.Next")        -> "m1"
 * getPath("Result.Items.0.Id")  -> 1
 * getPath("Result.Items.*.Id")  -> [1, 2]
 * }</pre>
 *
 * <p>Values are returned as plain Java objects ({@code Map}, {@code List}, {@code String},
 * numbers, {@code Boolean}). Missing paths and JSON {@code null} are both reported as empty.
 */
public final class JsonResponseDocument implements ResponseDocument {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    private final JsonNode root;
    private final ObjectMapper objectMapper;

    public JsonResponseDocument(JsonNode root) {
        this(root, DEFAULT_MAPPER);
    }

    public JsonResponseDocument(JsonNode root, ObjectMapper objectMapper) {
        this.root = Objects.requireNonNull(root, "root");
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a JSON string into a document.
     *
     * @throws UncheckedIOException if the string is not valid JSON
     */
    public static JsonResponseDocument parse(String json) {
        try {
            return new JsonResponseDocument(DEFAULT_MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse response document", e);
        }
    }

    /**
     * Reads a JSON document from a stream using the given mapper.
     */
    public static JsonResponseDocument read(InputStream in, ObjectMapper objectMapper) throws IOException {
        JsonNode node = objectMapper.readTree(in);
        return new JsonResponseDocument(node == null ? JsonNodeFactory.instance.missingNode() : node, objectMapper);
    }

    /**
     * Builds a document from plain Java values, typically maps and lists.
     */
    public static JsonResponseDocument of(Object value) {
        return new JsonResponseDocument(DEFAULT_MAPPER.valueToTree(value));
    }

    @Override
    public Optional<Object> getPath(String path) {
        JsonNode node = resolve(root, path.split("\\."), 0);
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(objectMapper.convertValue(node, Object.class));
    }

    private static JsonNode resolve(JsonNode node, String[] segments, int index) {
        if (index == segments.length) {
            return node;
        }
        if (node == null) {
            return null;
        }
        String segment = segments[index];

        if ("*".equals(segment)) {
            if (!node.isArray()) {
                return null;
            }
            ArrayNode projected = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                JsonNode value = resolve(element, segments, index + 1);
                if (value != null && !value.isMissingNode() && !value.isNull()) {
                    projected.add(value);
                }
            }
            return projected;
        }

        if (node.isArray() && isIndex(segment)) {
            return resolve(node.get(Integer.parseInt(segment)), segments, index + 1);
        }
        return resolve(node.get(segment), segments, index + 1);
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
