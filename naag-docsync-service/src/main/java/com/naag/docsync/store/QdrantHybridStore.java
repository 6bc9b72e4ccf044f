package com.naag.docsync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naag.docsync.embed.SparseVector;
import com.naag.docsync.http.Http;
import com.naag.docsync.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hybrid collections in Qdrant over its REST API: a named dense vector plus a named sparse
 * vector per point. Dense and sparse candidates are fetched with two Query API calls and fused
 * with {@link RankFusion}, so scores are on the same scale as {@link InMemoryHybridStore}.
 */
public final class QdrantHybridStore implements HybridVectorStore {
    private static final Logger log = LoggerFactory.getLogger(QdrantHybridStore.class);

    public static final String DENSE_VECTOR = "dense";
    public static final String SPARSE_VECTOR = "bm25";

    private final String baseUrl;
    private final String apiKey;
    private final int defaultDimension;
    private final String distance;
    private final RankFusion rankFusion;

    // collection -> dense size, filled once a collection is known to exist
    private final Map<String, Integer> dimensions = new ConcurrentHashMap<>();

    public QdrantHybridStore(String baseUrl, String apiKey, int defaultDimension, String distance, RankFusion rankFusion) {
        this.baseUrl = baseUrl;
        this.rankFusion = rankFusion;
        this.apiKey = apiKey;
        this.defaultDimension = defaultDimension;
        this.distance = (distance == null || distance.isBlank()) ? "Cosine" : distance;
    }

    @Override
    public void ensureCollection(String collection, int denseDimension) {
        if (dimensions.containsKey(collection)) return;
        synchronized (this) {
            if (dimensions.containsKey(collection)) return;

            HttpResponse<String> getResp = send(request("/collections/" + enc(collection), Duration.ofSeconds(10)).GET(),
                    "GET collection");
            if (getResp.statusCode() == 200) {
                int existing = readDenseSize(getResp.body()).orElse(denseDimension);
                if (existing != denseDimension) {
                    log.warn("Collection {} exists with dense size {} but {} is configured", collection, existing, denseDimension);
                }
                dimensions.put(collection, existing);
                return;
            }
            if (getResp.statusCode() != 404) {
                throw new VectorStoreException("Qdrant GET collection HTTP " + getResp.statusCode() + ": " + getResp.body());
            }

            ObjectNode body = createCollectionBody(denseDimension, distance);
            HttpResponse<String> putResp = send(request("/collections/" + enc(collection), Duration.ofSeconds(30))
                    .PUT(HttpRequest.BodyPublishers.ofString(write(body))), "CREATE collection");
            if (putResp.statusCode() / 100 != 2) {
                throw new VectorStoreException("Qdrant CREATE collection HTTP " + putResp.statusCode() + ": " + putResp.body());
            }

            ObjectNode index = Json.MAPPER.createObjectNode()
                    .put("field_name", PayloadFields.SOURCE_FILE_ID)
                    .put("field_schema", "keyword");
            HttpResponse<String> indexResp = send(request("/collections/" + enc(collection) + "/index?wait=true", Duration.ofSeconds(30))
                    .PUT(HttpRequest.BodyPublishers.ofString(write(index))), "CREATE payload index");
            if (indexResp.statusCode() / 100 != 2) {
                log.warn("Payload index on {} not created: HTTP {} {}", collection, indexResp.statusCode(), indexResp.body());
            }

            log.info("Created Qdrant collection {} (dense={} {}, sparse={})", collection, denseDimension, distance, SPARSE_VECTOR);
            dimensions.put(collection, denseDimension);
        }
    }

    @Override
    public void upsertAll(String collection, List<IndexedRecord> records) {
        if (records.isEmpty()) return;
        ensureCollection(collection, defaultDimension);
        int expected = dimensions.get(collection);

        ArrayNode points = Json.MAPPER.createArrayNode();
        for (IndexedRecord r : records) {
            int actual = r.denseVector() == null ? 0 : r.denseVector().size();
            if (actual != expected) {
                throw new VectorDimensionMismatchException(collection, r.id(), expected, actual);
            }
            points.add(toPoint(r));
        }

        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("points", points);

        long start = System.currentTimeMillis();
        HttpResponse<String> resp = send(request("/collections/" + enc(collection) + "/points?wait=true", Duration.ofSeconds(60))
                .PUT(HttpRequest.BodyPublishers.ofString(write(body))), "upsert");
        if (resp.statusCode() / 100 != 2) {
            throw new VectorStoreException("Qdrant upsert HTTP " + resp.statusCode() + ": " + resp.body());
        }
        log.debug("[QDRANT TIMING] upsert collection={} points={} took={}ms", collection, records.size(),
                System.currentTimeMillis() - start);
    }

    @Override
    public Optional<String> getLastModified(String collection, String recordId) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        ArrayNode ids = body.putArray("ids");
        addId(ids, PointIds.toPointId(recordId));
        body.putArray("with_payload").add(PayloadFields.LAST_MODIFIED);
        body.put("with_vector", false);

        HttpResponse<String> resp = send(request("/collections/" + enc(collection) + "/points", Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(write(body))), "retrieve");
        if (resp.statusCode() == 404) return Optional.empty();
        if (resp.statusCode() / 100 != 2) {
            throw new VectorStoreException("Qdrant retrieve HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return firstLastModified(read(resp.body()).path("result"));
    }

    @Override
    public Optional<String> getLastModifiedBySource(String collection, String sourceFileId) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("filter", sourceFilter(sourceFileId));
        body.put("limit", 1);
        body.putArray("with_payload").add(PayloadFields.LAST_MODIFIED);
        body.put("with_vector", false);

        HttpResponse<String> resp = send(request("/collections/" + enc(collection) + "/points/scroll", Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(write(body))), "scroll");
        if (resp.statusCode() == 404) return Optional.empty();
        if (resp.statusCode() / 100 != 2) {
            throw new VectorStoreException("Qdrant scroll HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return firstLastModified(read(resp.body()).path("result").path("points"));
    }

    @Override
    public void deleteBySource(String collection, String sourceFileId) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("filter", sourceFilter(sourceFileId));

        HttpResponse<String> resp = send(request("/collections/" + enc(collection) + "/points/delete?wait=true", Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(write(body))), "delete");
        if (resp.statusCode() == 404) return;
        if (resp.statusCode() / 100 != 2) {
            throw new VectorStoreException("Qdrant delete HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }

    @Override
    public List<ScoredRecord> queryHybrid(String collection, List<Double> denseQuery, SparseVector sparseQuery, int limit) {
        if (limit <= 0) return List.of();
        int candidates = limit * 2;
        List<ScoredRecord> dense = query(collection, denseQueryBody(denseQuery, candidates), "dense query");
        List<ScoredRecord> sparse = List.of();
        if (sparseQuery != null && !sparseQuery.isEmpty()) {
            try {
                sparse = query(collection, sparseQueryBody(sparseQuery, candidates), "sparse query");
            } catch (VectorStoreException e) {
                log.warn("Sparse query on {} failed, ranking dense results only: {}", collection, e.getMessage());
            }
        }
        return rankFusion.fuseRecords(dense, sparse, limit);
    }

    @Override
    public CollectionStats stats(String collection) {
        HttpResponse<String> resp = send(request("/collections/" + enc(collection), Duration.ofSeconds(10)).GET(), "GET collection");
        if (resp.statusCode() == 404) return CollectionStats.missing(collection);
        if (resp.statusCode() / 100 != 2) {
            throw new VectorStoreException("Qdrant GET collection HTTP " + resp.statusCode() + ": " + resp.body());
        }
        JsonNode result = read(resp.body()).path("result");
        return new CollectionStats(collection, true, result.path("points_count").asLong(0), result.path("status").asText("unknown"));
    }

    private List<ScoredRecord> query(String collection, ObjectNode body, String what) {
        long start = System.currentTimeMillis();
        HttpResponse<String> resp = send(request("/collections/" + enc(collection) + "/points/query", Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(write(body))), what);
        if (resp.statusCode() == 404) {
            log.debug("Collection {} not found, returning no results", collection);
            return List.of();
        }
        if (resp.statusCode() / 100 != 2) {
            throw new VectorStoreException("Qdrant " + what + " HTTP " + resp.statusCode() + ": " + resp.body());
        }
        List<ScoredRecord> results = parseQueryResults(resp.body());
        log.debug("[QDRANT TIMING] {} collection={} hits={} took={}ms", what, collection, results.size(),
                System.currentTimeMillis() - start);
        return results;
    }

    static ObjectNode createCollectionBody(int denseDimension, String distance) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.putObject("vectors").putObject(DENSE_VECTOR)
                .put("size", denseDimension)
                .put("distance", distance);
        body.putObject("sparse_vectors").putObject(SPARSE_VECTOR);
        return body;
    }

    static ObjectNode toPoint(IndexedRecord r) {
        ObjectNode point = Json.MAPPER.createObjectNode();
        Object pointId = PointIds.toPointId(r.id());
        if (pointId instanceof Long numeric) {
            point.put("id", numeric);
        } else {
            point.put("id", pointId.toString());
        }
        ObjectNode vector = point.putObject("vector");
        vector.set(DENSE_VECTOR, toArray(r.denseVector()));
        if (r.sparseVector() != null && !r.sparseVector().isEmpty()) {
            vector.set(SPARSE_VECTOR, toSparse(r.sparseVector()));
        }
        point.set("payload", Json.PAYLOAD_MAPPER.valueToTree(PayloadFields.toMap(r.id(), r.payload())));
        return point;
    }

    static ObjectNode sparseQueryBody(SparseVector sparse, int limit) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("query", toSparse(sparse));
        body.put("using", SPARSE_VECTOR);
        body.put("limit", limit);
        body.put("with_payload", true);
        return body;
    }

    static ObjectNode denseQueryBody(List<Double> dense, int limit) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.set("query", toArray(dense));
        body.put("using", DENSE_VECTOR);
        body.put("limit", limit);
        body.put("with_payload", true);
        return body;
    }

    @SuppressWarnings("unchecked")
    static List<ScoredRecord> parseQueryResults(String json) {
        JsonNode points = read(json).path("result").path("points");
        List<ScoredRecord> out = new ArrayList<>();
        for (JsonNode p : points) {
            Map<String, Object> payload = p.has("payload")
                    ? Json.MAPPER.convertValue(p.get("payload"), Map.class)
                    : Map.of();
            Object recordId = payload.get(PayloadFields.RECORD_ID);
            String id = recordId != null ? recordId.toString() : p.path("id").asText();
            out.add(new ScoredRecord(id, p.path("score").asDouble(), payload));
        }
        return out;
    }

    static Optional<Integer> readDenseSize(String json) {
        JsonNode vectors = read(json).path("result").path("config").path("params").path("vectors");
        if (vectors.has("size")) return Optional.of(vectors.get("size").asInt());
        if (vectors.path(DENSE_VECTOR).has("size")) return Optional.of(vectors.path(DENSE_VECTOR).get("size").asInt());
        return Optional.empty();
    }

    private static Optional<String> firstLastModified(JsonNode points) {
        if (!points.isArray() || points.size() == 0) return Optional.empty();
        JsonNode value = points.get(0).path("payload").get(PayloadFields.LAST_MODIFIED);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
    }

    private static ObjectNode sourceFilter(String sourceFileId) {
        ObjectNode condition = Json.MAPPER.createObjectNode().put("key", PayloadFields.SOURCE_FILE_ID);
        condition.putObject("match").put("value", sourceFileId);
        ObjectNode filter = Json.MAPPER.createObjectNode();
        filter.putArray("must").add(condition);
        return filter;
    }

    private static void addId(ArrayNode ids, Object pointId) {
        if (pointId instanceof Long numeric) {
            ids.add(numeric);
        } else {
            ids.add(pointId.toString());
        }
    }

    private static ArrayNode toArray(List<Double> v) {
        ArrayNode a = Json.MAPPER.createArrayNode();
        for (Double d : v) a.add(d);
        return a;
    }

    private static ObjectNode toSparse(SparseVector v) {
        ObjectNode node = Json.MAPPER.createObjectNode();
        ArrayNode indices = node.putArray("indices");
        v.indices().forEach(indices::add);
        ArrayNode values = node.putArray("values");
        v.values().forEach(values::add);
        return node;
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            b.header("api-key", apiKey);
        }
        return b;
    }

    private static HttpResponse<String> send(HttpRequest.Builder builder, String what) {
        try {
            return Http.CLIENT.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VectorStoreException("Qdrant " + what + " interrupted", e);
        } catch (Exception e) {
            throw new VectorStoreException("Qdrant " + what + " failed: " + e.getMessage(), e);
        }
    }

    private static String write(JsonNode node) {
        try {
            return Json.MAPPER.writeValueAsString(node);
        } catch (Exception e) {
            throw new VectorStoreException("Failed to serialize Qdrant request", e);
        }
    }

    private static JsonNode read(String json) {
        try {
            return Json.MAPPER.readTree(json);
        } catch (Exception e) {
            throw new VectorStoreException("Bad Qdrant response JSON", e);
        }
    }

    private static String enc(String collection) {
        return URLEncoder.encode(collection, StandardCharsets.UTF_8);
    }
}
