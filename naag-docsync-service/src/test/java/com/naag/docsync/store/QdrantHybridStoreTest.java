package com.naag.docsync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naag.docsync.embed.SparseVector;
import com.naag.docsync.store.payload.CasePayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QdrantHybridStoreTest {

    @Nested
    @DisplayName("Request bodies")
    class RequestBodies {

        @Test
        @DisplayName("Collection definition declares a named dense vector and a sparse vector")
        void collectionBody() {
            ObjectNode body = QdrantHybridStore.createCollectionBody(768, "Cosine");

            assertThat(body.at("/vectors/dense/size").asInt()).isEqualTo(768);
            assertThat(body.at("/vectors/dense/distance").asText()).isEqualTo("Cosine");
            assertThat(body.at("/sparse_vectors").has("bm25")).isTrue();
        }

        @Test
        @DisplayName("Sparse query targets the bm25 vector and asks for payloads")
        void sparseQueryBody() {
            ObjectNode body = QdrantHybridStore.sparseQueryBody(new SparseVector(List.of(3, 9), List.of(1.0, 2.0)), 10);

            assertThat(body.get("using").asText()).isEqualTo("bm25");
            assertThat(body.at("/query/indices/1").asInt()).isEqualTo(9);
            assertThat(body.at("/query/values/1").asDouble()).isEqualTo(2.0);
            assertThat(body.get("limit").asInt()).isEqualTo(10);
            assertThat(body.get("with_payload").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("Points carry the original record id and snake_case payload fields")
        void pointBody() {
            IndexedRecord record = new IndexedRecord("12", List.of(1.0), new SparseVector(List.of(1), List.of(1.0)),
                    new CasePayload("12", "2024-01-02", "q", "a", "full", "2024-01-02T00:00:00Z", "wb-1",
                            "cases.xlsx", null, "Q: q A: a"));

            ObjectNode point = QdrantHybridStore.toPoint(record);

            assertThat(point.get("id").isNumber()).isTrue();
            assertThat(point.get("id").asLong()).isEqualTo(12L);
            assertThat(point.at("/payload/record_id").asText()).isEqualTo("12");
            assertThat(point.at("/payload/case_no").asText()).isEqualTo("12");
            assertThat(point.at("/payload/source_file_id").asText()).isEqualTo("wb-1");
            assertThat(point.at("/vector/bm25/indices/0").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("Points without sparse terms omit the sparse vector")
        void pointWithoutSparse() {
            IndexedRecord record = new IndexedRecord("x", List.of(1.0), SparseVector.EMPTY,
                    new CasePayload("1", "", "", "", "", "2024-01-02T00:00:00Z", "wb-1", "c.xlsx", null, ""));

            JsonNode vector = QdrantHybridStore.toPoint(record).get("vector");

            assertThat(vector.has("dense")).isTrue();
            assertThat(vector.has("bm25")).isFalse();
        }
    }

    @Nested
    @DisplayName("Responses")
    class Responses {

        @Test
        @DisplayName("Query results map back to record ids from the payload")
        void parseQueryResults() {
            String json = """
                    {"result": {"points": [
                        {"id": "8f9e...", "score": 0.42, "payload": {"record_id": "SOP-1", "title": "Export"}},
                        {"id": 17, "score": 0.11, "payload": {}}
                    ]}, "status": "ok"}
                    """;

            List<ScoredRecord> records = QdrantHybridStore.parseQueryResults(json);

            assertThat(records).extracting(ScoredRecord::id).containsExactly("SOP-1", "17");
            assertThat(records.get(0).score()).isEqualTo(0.42);
            assertThat(records.get(0).payload()).containsEntry("title", "Export");
        }

        @Test
        @DisplayName("Reads the dense size from named and unnamed vector configs")
        void readDenseSize() {
            String named = """
                    {"result": {"config": {"params": {"vectors": {"dense": {"size": 768, "distance": "Cosine"}}}}}}
                    """;
            String unnamed = """
                    {"result": {"config": {"params": {"vectors": {"size": 384, "distance": "Cosine"}}}}}
                    """;

            assertThat(QdrantHybridStore.readDenseSize(named)).contains(768);
            assertThat(QdrantHybridStore.readDenseSize(unnamed)).contains(384);
        }
    }

    @Nested
    @DisplayName("Point ids")
    class PointIdMapping {

        @Test
        @DisplayName("Canonical numeric ids stay numeric")
        void numeric() {
            assertThat(PointIds.toPointId("10121")).isEqualTo(10121L);
        }

        @Test
        @DisplayName("Leading zeros are significant and do not collide with the plain number")
        void leadingZeros() {
            Object padded = PointIds.toPointId("010121");

            assertThat(padded).isInstanceOf(String.class);
            assertThat(padded).isNotEqualTo(PointIds.toPointId("10121"));
        }

        @Test
        @DisplayName("UUIDs pass through lower-cased")
        void uuid() {
            String uuid = "3F2504E0-4F89-11D3-9A0C-0305E82C3301";
            assertThat(PointIds.toPointId(uuid)).isEqualTo(uuid.toLowerCase());
        }

        @Test
        @DisplayName("Other ids map to a stable name-based UUID")
        void other() {
            Object first = PointIds.toPointId("d41d8cd98f00b204e9800998ecf8427e");
            Object second = PointIds.toPointId("d41d8cd98f00b204e9800998ecf8427e");

            assertThat(first).isEqualTo(second);
            assertThat(UUID.fromString(first.toString())).isNotNull();
        }

        @Test
        @DisplayName("Blank ids are rejected")
        void blank() {
            assertThatThrownBy(() -> PointIds.toPointId(" ")).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
