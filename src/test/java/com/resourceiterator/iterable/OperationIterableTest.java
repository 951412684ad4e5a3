package com.resourceiterator.iterable;

import com.resourceiterator.ConfigurationException;
import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.config.PaginationConfig;
import com.resourceiterator.factory.ConfiguredIteratorFactory;
import com.resourceiterator.support.ScriptedOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.resourceiterator.support.ScriptedOperation.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationIterableTest {

    private final ConfiguredIteratorFactory factory = new ConfiguredIteratorFactory(Map.of(
            "List", PaginationConfig.builder()
                    .inputToken("Marker")
                    .outputToken("NextMarker")
                    .resultKey("Items")
                    .build()));

    @Test
    @DisplayName("Should start from the first page on every for-each loop")
    void shouldRestartOnEachIteration() {
        // Given: a script long enough for two full iterations
        ScriptedOperation list = ScriptedOperation.of("List",
                page("Items", List.of("a"), "NextMarker", "m1"),
                page("Items", List.of("b")),
                page("Items", List.of("a"), "NextMarker", "m1"),
                page("Items", List.of("b")));
        OperationIterable iterable = new OperationIterable(factory, list);

        // When
        List<Object> first = new ArrayList<>();
        for (Object item : iterable) {
            first.add(item);
        }
        List<Object> second = new ArrayList<>();
        iterable.forEach(second::add);

        // Then: both iterations see everything, and the second one starts without a marker
        assertThat(first).containsExactly("a", "b");
        assertThat(second).containsExactly("a", "b");
        assertThat(list.requests()).hasSize(4);
        assertThat(list.requests().get(2).params()).doesNotContainKey("Marker");
    }

    @Test
    @DisplayName("Should stop fetching when the loop breaks early")
    void shouldStopOnBreak() {
        ScriptedOperation list = ScriptedOperation.of("List",
                page("Items", List.of("a", "b"), "NextMarker", "m1"),
                page("Items", List.of("never")));

        for (Object item : new OperationIterable(factory, list, IteratorOptions.defaults())) {
            if ("a".equals(item)) {
                break;
            }
        }

        assertThat(list.requests()).hasSize(1);
    }

    @Test
    @DisplayName("Should fail fast for an operation without an iterator")
    void shouldFailFastForUnknownOperation() {
        ScriptedOperation other = ScriptedOperation.of("Other");

        assertThatThrownBy(() -> new OperationIterable(factory, other))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Other");
    }
}
