package com.resourceiterator.config;

import com.resourceiterator.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for reading iterator definitions from JSON.
 */
class PaginationConfigLoaderTest {

    private final PaginationConfigLoader loader = new PaginationConfigLoader();

    @Test
    @DisplayName("Should load single and composite keys from a classpath resource")
    void shouldLoadResource() {
        Map<String, PaginationConfig> configs = loader.loadResource("iterators.json");

        assertThat(configs).containsKeys("ListObjects", "ListObjectVersions", "ListItems", "DescribeTables");

        PaginationConfig listObjects = configs.get("ListObjects");
        assertThat(listObjects.inputToken()).contains(TokenKey.single("Marker"));
        assertThat(listObjects.outputToken()).contains(TokenKey.single("NextMarker"));
        assertThat(listObjects.limitKey()).contains("MaxKeys");
        assertThat(listObjects.resultKey()).contains("Contents");
        assertThat(listObjects.moreResults()).contains("IsTruncated");

        PaginationConfig versions = configs.get("ListObjectVersions");
        assertThat(versions.inputToken()).contains(TokenKey.composite("KeyMarker", "VersionIdMarker"));
        assertThat(versions.outputToken()).contains(TokenKey.composite("NextKeyMarker", "NextVersionIdMarker"));
    }

    @Test
    @DisplayName("Should leave keys that are not defined absent")
    void shouldLeaveMissingKeysAbsent() {
        PaginationConfig describe = loader.loadResource("iterators.json").get("DescribeTables");

        assertThat(describe.resultKey()).contains("Tables");
        assertThat(describe.inputToken()).isEmpty();
        assertThat(describe.outputToken()).isEmpty();
        assertThat(describe.limitKey()).isEmpty();
        assertThat(describe.moreResults()).isEmpty();
    }

    @Test
    @DisplayName("Should accept definitions without the iterators wrapper, and null keys")
    void shouldLoadUnwrappedDefinitions() {
        Map<String, PaginationConfig> configs = loader.load(json(
                "{\"Scan\": {\"input_token\": \"ExclusiveStartKey\", \"output_token\": \"LastEvaluatedKey\","
                        + " \"result_key\": \"Items\", \"limit_key\": null}}"));

        PaginationConfig scan = configs.get("Scan");
        assertThat(scan.inputToken()).contains(TokenKey.single("ExclusiveStartKey"));
        assertThat(scan.limitKey()).isEmpty();
    }

    @Test
    @DisplayName("Should load definitions from a file")
    void shouldLoadFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("iterators.json");
        Files.writeString(file, "{\"List\": {\"result_key\": \"Items\"}}");

        assertThat(loader.load(file).get("List").resultKey()).contains("Items");
    }

    @Test
    @DisplayName("Should reject unknown keys, bad token shapes and malformed JSON")
    void shouldRejectInvalidDefinitions() {
        assertThatThrownBy(() -> loader.load(json("{\"List\": {\"result_keys\": \"Items\"}}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("List");
        assertThatThrownBy(() -> loader.load(json("{\"List\": {\"input_token\": 5}}")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("input_token");
        assertThatThrownBy(() -> loader.load(json("{\"List\": {\"output_token\": []}}")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> loader.load(json("{\"List\": ")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> loader.load(json("[]")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should report a missing classpath resource")
    void shouldReportMissingResource() {
        assertThatThrownBy(() -> loader.loadResource("missing-iterators.json"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing-iterators.json");
    }

    private static InputStream json(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
