package com.naag.docsync.store;

import com.naag.docsync.embed.SparseVector;
import com.naag.docsync.embed.SparseVectorizer;
import com.naag.docsync.store.payload.DocumentPagePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InMemoryHybridStoreTest {

    private static final String COLLECTION = "others_documents";

    private final SparseVectorizer vectorizer = new SparseVectorizer();
    private InMemoryHybridStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryHybridStore();
        store.ensureCollection(COLLECTION, 2);
    }

    private IndexedRecord record(String id, List<Double> dense, String text, String sourceFileId, String lastModified) {
        return new IndexedRecord(id, dense, vectorizer.vectorize(text),
                new DocumentPagePayload(text, 1, 0, 1, lastModified, sourceFileId, sourceFileId + ".pdf", null, text));
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("Should replace a record wholly when the id is reused")
        void shouldReplaceOnSameId() {
            store.upsert(COLLECTION, record("r1", List.of(1.0, 0.0), "first version", "f1", "2024-01-01T00:00:00Z"));
            store.upsert(COLLECTION, record("r1", List.of(0.0, 1.0), "second version", "f1", "2024-02-01T00:00:00Z"));

            assertThat(store.stats(COLLECTION).pointsCount()).isEqualTo(1);
            assertThat(store.getLastModified(COLLECTION, "r1")).contains("2024-02-01T00:00:00Z");
            assertThat(store.getPayload(COLLECTION, "r1").orElseThrow()).containsEntry("content", "second version");
        }

        @Test
        @DisplayName("Should reject vectors of the wrong dimension without writing anything")
        void shouldRejectDimensionMismatch() {
            List<IndexedRecord> batch = List.of(
                    record("ok", List.of(1.0, 0.0), "fine", "f1", "2024-01-01T00:00:00Z"),
                    record("bad", List.of(1.0, 0.0, 0.0), "wrong", "f1", "2024-01-01T00:00:00Z"));

            assertThatThrownBy(() -> store.upsertAll(COLLECTION, batch))
                    .isInstanceOf(VectorDimensionMismatchException.class);
            assertThat(store.stats(COLLECTION).pointsCount()).isZero();
        }

        @Test
        @DisplayName("Should store the record id and source fields in the payload")
        void shouldStoreBookkeepingFields() {
            store.upsert(COLLECTION, record("r1", List.of(1.0, 0.0), "text", "f1", "2024-01-01T00:00:00Z"));

            assertThat(store.getPayload(COLLECTION, "r1").orElseThrow())
                    .containsEntry(PayloadFields.RECORD_ID, "r1")
                    .containsEntry(PayloadFields.SOURCE_FILE_ID, "f1")
                    .containsEntry(PayloadFields.LAST_MODIFIED, "2024-01-01T00:00:00Z");
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("Should find last_modified by source file and delete by source file")
        void shouldLookupAndDeleteBySource() {
            store.upsert(COLLECTION, record("p1", List.of(1.0, 0.0), "page one", "f1", "2024-01-01T00:00:00Z"));
            store.upsert(COLLECTION, record("p2", List.of(1.0, 0.0), "page two", "f1", "2024-01-01T00:00:00Z"));
            store.upsert(COLLECTION, record("q1", List.of(1.0, 0.0), "other", "f2", "2024-01-05T00:00:00Z"));

            assertThat(store.getLastModifiedBySource(COLLECTION, "f1")).contains("2024-01-01T00:00:00Z");

            store.deleteBySource(COLLECTION, "f1");

            assertThat(store.getLastModifiedBySource(COLLECTION, "f1")).isEmpty();
            assertThat(store.stats(COLLECTION).pointsCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Missing collections behave as empty")
        void missingCollection() {
            assertThat(store.getLastModified("nope", "r1")).isEmpty();
            assertThat(store.getLastModifiedBySource("nope", "f1")).isEmpty();
            assertThat(store.stats("nope").exists()).isFalse();
            store.deleteBySource("nope", "f1");
        }
    }

    @Nested
    @DisplayName("Hybrid query")
    class HybridQuery {

        @Test
        @DisplayName("Should surface both a dense-only match and a keyword-only match")
        void shouldFuseDenseAndSparse() {
            // A is close in embedding space but shares no terms with the query
            store.upsert(COLLECTION, record("A", List.of(1.0, 0.0), "shipment clearance overview", "fa", "2024-01-01T00:00:00Z"));
            // B is orthogonal in embedding space but contains the exact keyword
            store.upsert(COLLECTION, record("B", List.of(0.0, 1.0), "form PIB-2024 instructions", "fb", "2024-01-01T00:00:00Z"));
            // C matches neither
            store.upsert(COLLECTION, record("C", List.of(-1.0, 0.0), "holiday calendar", "fc", "2024-01-01T00:00:00Z"));

            List<ScoredRecord> hits = store.queryHybrid(COLLECTION, List.of(1.0, 0.0), vectorizer.vectorize("PIB-2024"), 2);

            assertThat(hits).extracting(ScoredRecord::id).containsExactlyInAnyOrder("A", "B");
        }

        @Test
        @DisplayName("Should fall back to dense ranking when the sparse query is empty")
        void shouldFallBackToDense() {
            store.upsert(COLLECTION, record("A", List.of(1.0, 0.0), "alpha text", "fa", "2024-01-01T00:00:00Z"));
            store.upsert(COLLECTION, record("B", List.of(0.0, 1.0), "bravo text", "fb", "2024-01-01T00:00:00Z"));

            List<ScoredRecord> hits = store.queryHybrid(COLLECTION, List.of(0.0, 1.0), SparseVector.EMPTY, 1);

            assertThat(hits).extracting(ScoredRecord::id).containsExactly("B");
            assertThat(hits.get(0).score()).isCloseTo(1.0 / 61, within(1e-12));
        }

        @Test
        @DisplayName("Dense-only scores are rank based, not raw cosine")
        void shouldScoreDenseOnlyByRank() {
            // near-orthogonal record, cosine just under 0.1
            store.upsert(COLLECTION, record("HS", List.of(0.0999, 0.995), "tariff chapter", "fh", "2024-01-01T00:00:00Z"));

            List<ScoredRecord> hits = store.queryHybrid(COLLECTION, List.of(1.0, 0.0), SparseVector.EMPTY, 5);

            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).score()).isCloseTo(1.0 / 61, within(1e-12));
            assertThat(hits.get(0).score()).isLessThan(2.0 / 61);
        }

        @Test
        @DisplayName("Should return an empty list for an empty collection")
        void shouldReturnEmptyForEmptyCollection() {
            store.ensureCollection("insw_regulations", 2);

            assertThat(store.queryHybrid("insw_regulations", List.of(1.0, 0.0), vectorizer.vectorize("export permit"), 5))
                    .isEmpty();
            assertThat(store.queryHybrid("missing", List.of(1.0, 0.0), vectorizer.vectorize("export permit"), 5))
                    .isEmpty();
        }
    }
}
