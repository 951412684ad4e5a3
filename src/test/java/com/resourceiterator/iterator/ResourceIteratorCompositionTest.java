package com.resourceiterator.iterator;

import com.resourceiterator.config.IteratorOptions;
import com.resourceiterator.config.PaginationConfig;
import com.resourceiterator.support.ScriptedOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static com.resourceiterator.support.ScriptedOperation.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the views layered over a ResourceIterator: map(), filter() and stream().
 * None of them changes when or how pages are fetched.
 */
class ResourceIteratorCompositionTest {

    private static final PaginationConfig CONFIG = PaginationConfig.builder()
            .inputToken("Marker")
            .outputToken("NextMarker")
            .resultKey("Items")
            .build();

    private ScriptedOperation threePages() {
        return ScriptedOperation.of("List",
                page("Items", List.of(1, 2, 3), "NextMarker", "m1"),
                page("Items", List.of(4, 5), "NextMarker", "m2"),
                page("Items", List.of(6), "NextMarker", null));
    }

    @Test
    @DisplayName("Should map every item across pages")
    void shouldMapItems() {
        ScriptedOperation list = threePages();

        ResourceIterator<String> mapped = new PagingIterator(list, CONFIG, IteratorOptions.defaults())
                .map(item -> "#" + item);

        List<String> items = new ArrayList<>();
        mapped.forEachRemaining(items::add);

        assertThat(items).containsExactly("#1", "#2", "#3", "#4", "#5", "#6");
        assertThat(mapped.getRequestCount()).isEqualTo(3);
        assertThat(mapped.getRetrievedCount()).isEqualTo(6);
        assertThat(mapped.getLastResult()).isPresent();
    }

    @Test
    @DisplayName("Should filter items across page boundaries")
    void shouldFilterItems() {
        ScriptedOperation list = threePages();

        ResourceIterator<Object> evens = new PagingIterator(list, CONFIG, IteratorOptions.defaults())
                .filter(item -> ((Integer) item) % 2 == 0);

        List<Object> items = new ArrayList<>();
        evens.forEachRemaining(items::add);

        assertThat(items).containsExactly(2, 4, 6);
        assertThatThrownBy(evens::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("Should chain map and filter")
    void shouldChainMapAndFilter() {
        ResourceIterator<Integer> chained = new PagingIterator(threePages(), CONFIG, IteratorOptions.defaults())
                .map(item -> (Integer) item * 10)
                .filter(value -> value > 30);

        List<Integer> items = new ArrayList<>();
        chained.forEachRemaining(items::add);

        assertThat(items).containsExactly(40, 50, 60);
    }

    @Test
    @DisplayName("Should stream lazily and stop fetching on short-circuit")
    void shouldStreamLazily() {
        ScriptedOperation list = threePages();
        PagingIterator iterator = new PagingIterator(list, CONFIG, IteratorOptions.defaults());

        List<Object> firstTwo = iterator.stream().limit(2).collect(Collectors.toList());

        assertThat(firstTwo).containsExactly(1, 2);
        assertThat(list.requests()).hasSize(1);
    }

    @Test
    @DisplayName("Should stream every item when fully consumed")
    void shouldStreamEverything() {
        int sum = new PagingIterator(threePages(), CONFIG, IteratorOptions.defaults())
                .map(item -> (Integer) item)
                .stream()
                .mapToInt(Integer::intValue)
                .sum();

        assertThat(sum).isEqualTo(21);
    }
}
