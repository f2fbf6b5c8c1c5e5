package com.product.resolution.api;

import com.product.resolution.ProductFixtures;
import com.product.resolution.core.model.GoldenRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoldenRecordFilterTest {

    private final GoldenRecord eatonPair = ProductFixtures.golden("Eaton", "r1", "r2");
    private final GoldenRecord siemens = ProductFixtures.golden("Siemens", "r3");
    private final GoldenRecord abbTriple = ProductFixtures.golden("ABB", "r4", "r5", "r6");

    @Nested
    @DisplayName("Filter")
    class FilterTests {

        @Test
        @DisplayName("Should match everything when no criteria are set")
        void testNone() {
            assertTrue(GoldenRecordFilter.none().test(eatonPair));
            assertTrue(GoldenRecordFilter.none().test(siemens));
        }

        @Test
        @DisplayName("Should match canonical manufacturer ignoring case")
        void testManufacturer() {
            GoldenRecordFilter filter = GoldenRecordFilter.builder().manufacturer("eaton").build();

            assertTrue(filter.test(eatonPair));
            assertFalse(filter.test(siemens));
        }

        @Test
        @DisplayName("Should normalize the manufacturer before matching")
        void testManufacturerNormalized() {
            GoldenRecordFilter filter = GoldenRecordFilter.builder().manufacturer("3M Company").build();

            assertEquals("3M", filter.getManufacturer());
            assertTrue(filter.test(ProductFixtures.golden("3M", "r7")));
            assertFalse(filter.test(eatonPair));
        }

        @Test
        @DisplayName("Should match UNSPSC prefix")
        void testUnspscPrefix() {
            assertTrue(GoldenRecordFilter.builder().unspscPrefix("3912").build().test(eatonPair));
            assertFalse(GoldenRecordFilter.builder().unspscPrefix("4010").build().test(eatonPair));
        }

        @Test
        @DisplayName("Should match size range inclusively")
        void testSizeRange() {
            GoldenRecordFilter filter = GoldenRecordFilter.builder().sizeRange(2, 2).build();

            assertTrue(filter.test(eatonPair));
            assertFalse(filter.test(siemens));
            assertFalse(filter.test(abbTriple));
        }

        @Test
        @DisplayName("Should match text in title or part number")
        void testText() {
            assertTrue(GoldenRecordFilter.builder().text("title R1").build().test(eatonPair));
            assertTrue(GoldenRecordFilter.builder().text("pn-r3").build().test(siemens));
            assertFalse(GoldenRecordFilter.builder().text("breaker").build().test(siemens));
        }

        @Test
        @DisplayName("Should match source key")
        void testSourceKey() {
            assertTrue(GoldenRecordFilter.builder().sourceKey("catalog-a").build().test(eatonPair));
            assertFalse(GoldenRecordFilter.builder().sourceKey("catalog-b").build().test(eatonPair));
        }

        @Test
        @DisplayName("Should combine criteria with AND")
        void testCombined() {
            GoldenRecordFilter filter = GoldenRecordFilter.builder()
                    .manufacturer("ABB")
                    .minSize(2)
                    .build();

            assertTrue(filter.test(abbTriple));
            assertFalse(filter.test(eatonPair));
            assertEquals("ABB", filter.getManufacturer());
            assertEquals(2, filter.getMinSize());
            assertEquals(Integer.MAX_VALUE, filter.getMaxSize());
            assertNull(filter.getSourceKey());
        }

        @Test
        @DisplayName("Should treat blank values as unset")
        void testBlankValues() {
            GoldenRecordFilter filter = GoldenRecordFilter.builder()
                    .manufacturer("  ")
                    .text("")
                    .unspscPrefix(null)
                    .build();

            assertNull(filter.getManufacturer());
            assertNull(filter.getText());
            assertNull(filter.getUnspscPrefix());
            assertTrue(filter.test(siemens));
        }

        @ParameterizedTest
        @ValueSource(strings = {"39A1", "391216011", "-39"})
        @DisplayName("Should reject malformed UNSPSC prefixes")
        void testInvalidUnspscPrefix(String prefix) {
            assertThrows(IllegalArgumentException.class,
                    () -> GoldenRecordFilter.builder().unspscPrefix(prefix));
        }

        @Test
        @DisplayName("Should reject inverted size range")
        void testInvertedRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> GoldenRecordFilter.builder().sizeRange(5, 2).build());
            assertThrows(IllegalArgumentException.class,
                    () -> GoldenRecordFilter.builder().minSize(-1));
        }
    }

    @Nested
    @DisplayName("Sort")
    class SortTests {

        @Test
        @DisplayName("Should order by id")
        void testById() {
            List<GoldenRecord> sorted = List.of(eatonPair, siemens, abbTriple).stream()
                    .sorted(GoldenRecordSort.byId().comparator())
                    .toList();

            for (int i = 1; i < sorted.size(); i++) {
                assertTrue(sorted.get(i - 1).id().compareTo(sorted.get(i).id()) < 0);
            }
        }

        @Test
        @DisplayName("Should order by size descending")
        void testBySizeDescending() {
            List<GoldenRecord> sorted = List.of(siemens, eatonPair, abbTriple).stream()
                    .sorted(GoldenRecordSort.bySizeDescending().comparator())
                    .toList();

            assertEquals(List.of(abbTriple, eatonPair, siemens), sorted);
        }

        @Test
        @DisplayName("Should order by manufacturer")
        void testByManufacturer() {
            List<GoldenRecord> sorted = List.of(siemens, eatonPair, abbTriple).stream()
                    .sorted(GoldenRecordSort.byManufacturer().comparator())
                    .toList();

            assertEquals(List.of(abbTriple, eatonPair, siemens), sorted);
        }

        @Test
        @DisplayName("Should break ties by ascending id")
        void testTieBreak() {
            GoldenRecord first = ProductFixtures.golden("Eaton", "a1");
            GoldenRecord second = ProductFixtures.golden("Eaton", "a2");
            GoldenRecord lower = first.id().compareTo(second.id()) < 0 ? first : second;
            GoldenRecord higher = lower == first ? second : first;

            List<GoldenRecord> sorted = List.of(higher, lower).stream()
                    .sorted(GoldenRecordSort.bySizeDescending().comparator())
                    .toList();

            assertEquals(List.of(lower, higher), sorted);
        }

        @Test
        @DisplayName("Should require field and direction")
        void testRequired() {
            assertThrows(NullPointerException.class,
                    () -> new GoldenRecordSort(null, GoldenRecordSort.Direction.ASC));
        }
    }
}
