package com.product.resolution.api;

import com.product.resolution.ProductFixtures;
import com.product.resolution.core.model.GoldenRecord;
import com.product.resolution.core.model.PairScore;
import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.scoring.PairScorer;
import com.product.resolution.store.InMemoryRecordSource;
import com.product.resolution.store.InMemoryResolutionStore;
import com.product.resolution.store.RecordSource;
import com.product.resolution.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResolutionQueryServiceTest {

    private InMemoryResolutionStore store;
    private ResolutionQueryService service;
    private GoldenRecord eaton;
    private GoldenRecord siemens;
    private GoldenRecord ghost;

    @BeforeEach
    void setUp() {
        List<ProductRecord> records = List.of(
                ProductFixtures.full("r1").build(),
                ProductFixtures.full("r2").sourceKey("catalog-b").build(),
                ProductFixtures.record("r3", "Siemens", "5SY4106-7"),
                ProductFixtures.record("r4", "ABB", "S201-C16"));
        store = new InMemoryResolutionStore();
        service = new ResolutionQueryService(new InMemoryRecordSource(records), store,
                ProductFixtures.extractor(), new PairScorer());

        eaton = ProductFixtures.golden("Eaton", "r1", "r2");
        siemens = ProductFixtures.golden("Siemens", "r3");
        ghost = ProductFixtures.golden("Acme", "gone");
        store.begin("run-1");
        store.writePairScores(List.of(ProductFixtures.pairScore("r1", "r2", 0.9)));
        store.writeGoldenRecords(List.of(eaton, siemens, ghost));
        store.commit("run-1");
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("Should return a record from the source")
        void testGetRecord() {
            assertEquals("r3", service.getRecord("r3").id());
        }

        @Test
        @DisplayName("Should report unknown records")
        void testUnknownRecord() {
            NotFoundException e = assertThrows(NotFoundException.class, () -> service.getRecord("nope"));
            assertEquals(NotFoundException.ResourceType.RECORD, e.getResourceType());
            assertEquals("nope", e.getId());
        }

        @Test
        @DisplayName("Should validate ids before lookup")
        void testInvalidId() {
            assertThrows(IllegalArgumentException.class, () -> service.getRecord(" "));
            assertThrows(IllegalArgumentException.class, () -> service.getGoldenRecord(null));
        }

        @Test
        @DisplayName("Should list the records of one source in id order")
        void testListRecordsBySourceKey() {
            assertEquals(List.of("r2"), service.listRecordsBySourceKey("catalog-b").stream()
                    .map(ProductRecord::id).toList());
            assertTrue(service.listRecordsBySourceKey("unknown-contract").isEmpty());
            assertThrows(IllegalArgumentException.class, () -> service.listRecordsBySourceKey(""));
        }

        @Test
        @DisplayName("Should find a record only within its own source")
        void testFindRecordInSource() {
            assertEquals("r2", service.findRecordInSource("catalog-b", "r2").orElseThrow().id());
            assertEquals(Optional.empty(), service.findRecordInSource("catalog-a", "r2"));
            assertEquals(Optional.empty(), service.findRecordInSource("catalog-b", "nope"));
        }

        @Test
        @DisplayName("Should wrap source failures when listing by source")
        void testListRecordsSourceFailure() {
            RecordSource failing = mock(RecordSource.class);
            when(failing.streamAll()).thenThrow(new UncheckedIOException(new IOException("disk gone")));
            ResolutionQueryService broken = new ResolutionQueryService(failing, store,
                    ProductFixtures.extractor(), new PairScorer());

            StoreException e = assertThrows(StoreException.class, () -> broken.listRecordsBySourceKey("catalog-a"));
            assertInstanceOf(IOException.class, e.getCause());
        }

        @Test
        @DisplayName("Should return a golden record by id")
        void testGetGoldenRecord() {
            assertEquals(eaton, service.getGoldenRecord(eaton.id()));
        }

        @Test
        @DisplayName("Should report unknown golden records")
        void testUnknownGoldenRecord() {
            NotFoundException e = assertThrows(NotFoundException.class, () -> service.getGoldenRecord("gr-missing"));
            assertEquals(NotFoundException.ResourceType.GOLDEN_RECORD, e.getResourceType());
        }

        @Test
        @DisplayName("Should find the golden record of a member")
        void testFindGoldenRecordForRecord() {
            assertEquals(Optional.of(eaton), service.findGoldenRecordForRecord("r2"));
        }

        @Test
        @DisplayName("Should return empty for a known record outside the published run")
        void testRecordNotPublished() {
            assertTrue(service.findGoldenRecordForRecord("r4").isEmpty());
        }

        @Test
        @DisplayName("Should report records that exist nowhere")
        void testRecordUnknownEverywhere() {
            assertThrows(NotFoundException.class, () -> service.findGoldenRecordForRecord("nope"));
        }

        @Test
        @DisplayName("Should return members in id order")
        void testGetMembers() {
            List<ProductRecord> members = service.getMembers(eaton.id());
            assertEquals(List.of("r1", "r2"), members.stream().map(ProductRecord::id).toList());
        }

        @Test
        @DisplayName("Should skip members missing from the source")
        void testMissingMembers() {
            assertTrue(service.getMembers(ghost.id()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Listings")
    class Listings {

        @Test
        @DisplayName("Should list all golden records in id order by default")
        void testListAll() {
            Page<GoldenRecord> page = service.listGoldenRecords(null, PageRequest.first(10));

            assertEquals(3, page.totalElements());
            List<String> ids = page.content().stream().map(GoldenRecord::id).toList();
            assertEquals(ids.stream().sorted().toList(), ids);
        }

        @Test
        @DisplayName("Should filter and page")
        void testFilterAndPage() {
            GoldenRecordFilter singletons = GoldenRecordFilter.builder().maxSize(1).build();

            Page<GoldenRecord> first = service.listGoldenRecords(singletons, PageRequest.first(1));
            Page<GoldenRecord> second = service.listGoldenRecords(singletons, PageRequest.of(1, 1));

            assertEquals(2, first.totalElements());
            assertTrue(first.hasNext());
            assertFalse(second.hasNext());
            assertNotEquals(first.content(), second.content());
        }

        @Test
        @DisplayName("Should stream with a custom order")
        void testStreamSorted() {
            List<GoldenRecord> sorted = service.streamGoldenRecords(GoldenRecordFilter.none(),
                    GoldenRecordSort.bySizeDescending()).toList();

            assertEquals(eaton, sorted.get(0));
        }

        @Test
        @DisplayName("Should read the newly committed generation")
        void testNewGeneration() {
            store.begin("run-2");
            store.writePairScores(List.of());
            store.writeGoldenRecords(List.of(siemens));
            store.commit("run-2");

            assertEquals(1, service.listGoldenRecords(null, PageRequest.first(10)).totalElements());
        }

        @Test
        @DisplayName("Should compute statistics over the current generation")
        void testStatistics() {
            ResolutionStatistics stats = service.statistics();

            assertEquals(3, stats.goldenRecordCount());
            assertEquals(4, stats.recordCount());
            assertEquals(2, stats.singletonCount());
        }
    }

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @Test
        @DisplayName("Should return the published score of a scored pair")
        void testPublishedScore() {
            PairScore score = service.compare("r2", "r1");
            assertEquals(0.9, score.overallScore());
        }

        @Test
        @DisplayName("Should compute the score of an unscored pair")
        void testOnDemandScore() {
            PairScore score = service.compare("r1", "r3");

            assertEquals("r1", score.pair().idA());
            assertTrue(score.overallScore() < 0.65);
        }

        @Test
        @DisplayName("Should reject comparing a record with itself")
        void testSelfComparison() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.compare("r1", "r1"));
            assertEquals("Cannot compare record r1 with itself", e.getMessage());
        }

        @Test
        @DisplayName("Should report unknown records in a comparison")
        void testUnknownRecord() {
            assertThrows(NotFoundException.class, () -> service.compare("r1", "nope"));
        }

        @Test
        @DisplayName("Should report sides in the order asked")
        void testDetailedOrder() {
            ComparisonResult result = service.compareDetailed("r3", "r1");

            assertEquals("r3", result.productA().id());
            assertEquals("r1", result.productB().id());
            assertEquals("Siemens", result.comparison().manufacturer().rawA());
            assertEquals("Eaton", result.comparison().manufacturer().rawB());
        }
    }
}
