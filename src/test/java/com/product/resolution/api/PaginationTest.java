package com.product.resolution.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PaginationTest {

    @Nested
    @DisplayName("PageRequest")
    class PageRequestTests {

        @Test
        @DisplayName("Should create page request from page and size")
        void testOf() {
            PageRequest request = PageRequest.of(2, 10);
            assertEquals(20, request.offset());
            assertEquals(10, request.limit());
            assertEquals(2, request.pageNumber());
            assertEquals(GoldenRecordSort.byId(), request.sort());
        }

        @Test
        @DisplayName("Should create first page request")
        void testFirst() {
            PageRequest request = PageRequest.first(25);
            assertEquals(0, request.offset());
            assertEquals(25, request.limit());
            assertEquals(0, request.pageNumber());
        }

        @Test
        @DisplayName("Should default a null sort to id order")
        void testNullSort() {
            assertEquals(GoldenRecordSort.byId(), new PageRequest(0, 10, null).sort());
        }

        @Test
        @DisplayName("Should keep an explicit sort")
        void testWithSort() {
            PageRequest request = PageRequest.of(0, 10, GoldenRecordSort.bySizeDescending());
            assertEquals(GoldenRecordSort.Field.SIZE, request.sort().field());
            assertEquals(GoldenRecordSort.Direction.DESC, request.sort().direction());
        }

        @Test
        @DisplayName("Should reject negative offset")
        void testNegativeOffset() {
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(-1, 10, null));
        }

        @Test
        @DisplayName("Should reject zero limit")
        void testZeroLimit() {
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 0, null));
        }

        @Test
        @DisplayName("Should reject limit exceeding maximum")
        void testExcessiveLimit() {
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 10_001, null));
        }

        @Test
        @DisplayName("Should reject negative page number")
        void testNegativePage() {
            assertThrows(IllegalArgumentException.class, () -> PageRequest.of(-1, 10));
        }

        @Test
        @DisplayName("Should reject page numbers whose offset overflows")
        void testOverflowingPage() {
            assertThrows(IllegalArgumentException.class, () -> PageRequest.of(Integer.MAX_VALUE, 10));
        }
    }

    @Nested
    @DisplayName("Page")
    class PageTests {

        private final List<Integer> numbers = IntStream.range(0, 25).boxed().toList();

        @Test
        @DisplayName("Should slice the requested window")
        void testSlice() {
            Page<Integer> page = Page.slice(numbers, PageRequest.of(1, 10));

            assertEquals(IntStream.range(10, 20).boxed().toList(), page.content());
            assertEquals(25, page.totalElements());
            assertEquals(1, page.pageNumber());
            assertEquals(3, page.totalPages());
            assertTrue(page.hasNext());
            assertTrue(page.hasPrevious());
        }

        @Test
        @DisplayName("Should return a short last page")
        void testLastPage() {
            Page<Integer> page = Page.slice(numbers, PageRequest.of(2, 10));

            assertEquals(5, page.numberOfElements());
            assertFalse(page.hasNext());
        }

        @Test
        @DisplayName("Should return an empty page past the end")
        void testPastEnd() {
            Page<Integer> page = Page.slice(numbers, PageRequest.of(5, 10));

            assertFalse(page.hasContent());
            assertEquals(25, page.totalElements());
            assertFalse(page.hasNext());
        }

        @Test
        @DisplayName("Should create empty page")
        void testEmpty() {
            Page<String> page = Page.empty(PageRequest.first(10));

            assertTrue(page.content().isEmpty());
            assertEquals(0, page.totalElements());
            assertEquals(0, page.totalPages());
            assertFalse(page.hasPrevious());
        }

        @Test
        @DisplayName("Should map content and keep paging data")
        void testMap() {
            Page<String> page = Page.slice(numbers, PageRequest.first(3)).map(i -> "n" + i);

            assertEquals(List.of("n0", "n1", "n2"), page.content());
            assertEquals(25, page.totalElements());
            assertEquals(3, page.pageSize());
        }

        @Test
        @DisplayName("Should copy content defensively")
        void testDefensiveCopy() {
            Page<Integer> page = new Page<>(numbers.subList(0, 2), 2, 0, 10);
            assertThrows(UnsupportedOperationException.class, () -> page.content().add(3));
        }

        @Test
        @DisplayName("Should reject negative total")
        void testNegativeTotal() {
            assertThrows(IllegalArgumentException.class, () -> new Page<>(List.of(), -1, 0, 10));
        }
    }
}
