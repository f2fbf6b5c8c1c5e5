package com.product.resolution.store;

import com.product.resolution.ProductFixtures;
import com.product.resolution.core.model.CandidatePair;
import com.product.resolution.core.model.GoldenRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryResolutionStore Tests")
class InMemoryResolutionStoreTest {

    private InMemoryResolutionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryResolutionStore();
    }

    @Nested
    @DisplayName("Run lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("nothing is visible before commit")
        void stagedUntilCommit() {
            store.begin("run-1");
            store.writeGoldenRecords(List.of(ProductFixtures.golden("Eaton", "r1", "r2")));
            store.writePairScores(List.of(ProductFixtures.pairScore("r1", "r2", 0.9)));

            assertTrue(store.current().isEmpty());

            store.commit("run-1");

            ResolutionSnapshot snapshot = store.current();
            assertEquals("run-1", snapshot.getRunId());
            assertEquals(1, snapshot.getGoldenRecords().size());
            assertEquals(1, snapshot.pairScoreCount());
        }

        @Test
        @DisplayName("abort keeps the previous generation")
        void abortKeepsPrevious() {
            store.begin("run-1");
            store.writeGoldenRecords(List.of(ProductFixtures.golden("Eaton", "r1")));
            store.commit("run-1");

            store.begin("run-2");
            store.writeGoldenRecords(List.of(ProductFixtures.golden("Siemens", "r2")));
            store.abort("run-2");

            assertEquals("run-1", store.current().getRunId());
            assertTrue(store.current().getGoldenRecordForRecord("r2").isEmpty());
        }

        @Test
        @DisplayName("a second begin while a run is open fails")
        void doubleBegin() {
            store.begin("run-1");

            assertThrows(StoreException.class, () -> store.begin("run-2"));
        }

        @Test
        @DisplayName("writes and commits need the open run")
        void requiresOpenRun() {
            assertThrows(StoreException.class, () -> store.writePairScores(List.of()));
            store.begin("run-1");
            assertThrows(StoreException.class, () -> store.commit("run-2"));
        }

        @Test
        @DisplayName("aborting an unknown run is ignored")
        void abortUnknown() {
            assertDoesNotThrow(() -> store.abort("nope"));
            store.begin("run-1");
            store.abort("other");
            assertThrows(StoreException.class, () -> store.begin("run-2"));
        }
    }

    @Nested
    @DisplayName("Snapshot")
    class Snapshot {

        @Test
        @DisplayName("indexes golden records by id, member and pair")
        void lookups() {
            GoldenRecord eaton = ProductFixtures.golden("Eaton", "r2", "r1");
            GoldenRecord siemens = ProductFixtures.golden("Siemens", "r3");
            ResolutionSnapshot snapshot = new ResolutionSnapshot("run-1", List.of(siemens, eaton),
                    List.of(ProductFixtures.pairScore("r2", "r1", 0.8)));

            assertEquals(eaton, snapshot.getGoldenRecord(eaton.id()).orElseThrow());
            assertEquals(siemens, snapshot.getGoldenRecordForRecord("r3").orElseThrow());
            assertEquals(0.8, snapshot.getPairScore(CandidatePair.of("r1", "r2")).orElseThrow().overallScore());
            assertTrue(snapshot.getPairScore(CandidatePair.of("r1", "r3")).isEmpty());
            assertTrue(snapshot.getGoldenRecord("GR-missing").isEmpty());
        }

        @Test
        @DisplayName("golden records are listed in id order")
        void ordering() {
            GoldenRecord a = ProductFixtures.golden("Eaton", "r1");
            GoldenRecord b = ProductFixtures.golden("Siemens", "r2");
            List<GoldenRecord> expected = a.id().compareTo(b.id()) < 0 ? List.of(a, b) : List.of(b, a);

            assertEquals(expected, new ResolutionSnapshot("run", List.of(b, a), List.of()).getGoldenRecords());
            assertEquals(expected, new ResolutionSnapshot("run", List.of(a, b), List.of()).getGoldenRecords());
        }

        @Test
        @DisplayName("empty snapshot")
        void empty() {
            assertTrue(ResolutionSnapshot.empty().isEmpty());
            assertEquals(0, ResolutionSnapshot.empty().pairScoreCount());
        }
    }

    @Test
    @DisplayName("in-memory record source rejects duplicate ids")
    void recordSource() {
        InMemoryRecordSource source = new InMemoryRecordSource(List.of(
                ProductFixtures.record("r1", "Eaton", "A1"), ProductFixtures.record("r2", "Eaton", "A2")));

        assertEquals(2, source.size());
        assertEquals(2, source.streamAll().count());
        assertTrue(source.get("r1").isPresent());
        assertTrue(source.get("r9").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new InMemoryRecordSource(List.of(
                ProductFixtures.record("r1", "Eaton", "A1"), ProductFixtures.record("r1", "Eaton", "A2"))));
    }
}
