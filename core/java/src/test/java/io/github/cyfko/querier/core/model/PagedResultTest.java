package io.github.cyfko.querier.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PagedResultTest {

    @Test
    void shouldDeriveNavigation() {
        PagedResult<String> first = new PagedResult<>(List.of("a", "b"), 5, 1, 2);
        assertEquals(3, first.totalPages());
        assertTrue(first.hasNext());
        assertFalse(first.hasPrevious());

        PagedResult<String> last = new PagedResult<>(List.of("e"), 5, 3, 2);
        assertFalse(last.hasNext());
        assertTrue(last.hasPrevious());
    }

    @Test
    void emptyResultShouldHaveNoPages() {
        PagedResult<String> empty = new PagedResult<>(List.of(), 0, 1, 20);
        assertEquals(0, empty.totalPages());
        assertFalse(empty.hasNext());
    }

    @Test
    void mapShouldKeepMetadata() {
        PagedResult<Integer> lengths = new PagedResult<>(List.of("ab", "c"), 12, 2, 2).map(String::length);
        assertEquals(List.of(2, 1), lengths.items());
        assertEquals(12, lengths.totalCount());
        assertEquals(2, lengths.page());
    }

    @Test
    void shouldRejectInvalidMetadata() {
        assertThrows(IllegalArgumentException.class, () -> new PagedResult<>(List.of(), 0, 0, 20));
        assertThrows(IllegalArgumentException.class, () -> new PagedResult<>(List.of(), 0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new PagedResult<>(List.of(), -1, 1, 20));
    }
}
