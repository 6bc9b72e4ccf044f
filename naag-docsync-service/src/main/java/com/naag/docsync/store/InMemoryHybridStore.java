package com.naag.docsync.store;

import com.naag.docsync.embed.SparseVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local hybrid store: brute-force cosine for the dense side, dot product for the
 * sparse side, fused with {@link RankFusion}. Used for local runs without Qdrant.
 */
@Slf4j
public class InMemoryHybridStore implements HybridVectorStore {

    private final Map<String, MemoryCollection> collections = new ConcurrentHashMap<>();
    private final RankFusion rankFusion;

    public InMemoryHybridStore() {
        this(new RankFusion());
    }

    public InMemoryHybridStore(RankFusion rankFusion) {
        this.rankFusion = rankFusion;
    }

    private record StoredRecord(List<Double> dense, SparseVector sparse, Map<String, Object> payload) {}

    private static final class MemoryCollection {
        final int dimension;
        final Map<String, StoredRecord> records = new LinkedHashMap<>();

        MemoryCollection(int dimension) {
            this.dimension = dimension;
        }
    }

    @Override
    public void ensureCollection(String collection, int denseDimension) {
        collections.computeIfAbsent(collection, name -> {
            log.info("Created in-memory collection {} (dim={})", name, denseDimension);
            return new MemoryCollection(denseDimension);
        });
    }

    @Override
    public void upsertAll(String collection, List<IndexedRecord> records) {
        if (records.isEmpty()) return;
        MemoryCollection target = collections.get(collection);
        if (target == null) {
            ensureCollection(collection, records.get(0).denseVector().size());
            target = collections.get(collection);
        }
        synchronized (target) {
            for (IndexedRecord r : records) {
                if (r.denseVector() == null || r.denseVector().size() != target.dimension) {
                    throw new VectorDimensionMismatchException(collection, r.id(), target.dimension,
                            r.denseVector() == null ? 0 : r.denseVector().size());
                }
            }
            for (IndexedRecord r : records) {
                target.records.put(r.id(), new StoredRecord(
                        List.copyOf(r.denseVector()),
                        r.sparseVector() == null ? SparseVector.EMPTY : r.sparseVector(),
                        PayloadFields.toMap(r.id(), r.payload())));
            }
        }
    }

    @Override
    public Optional<String> getLastModified(String collection, String recordId) {
        MemoryCollection target = collections.get(collection);
        if (target == null) return Optional.empty();
        synchronized (target) {
            StoredRecord stored = target.records.get(recordId);
            return stored == null ? Optional.empty() : lastModified(stored);
        }
    }

    @Override
    public Optional<String> getLastModifiedBySource(String collection, String sourceFileId) {
        MemoryCollection target = collections.get(collection);
        if (target == null) return Optional.empty();
        synchronized (target) {
            return target.records.values().stream()
                    .filter(r -> Objects.equals(r.payload().get(PayloadFields.SOURCE_FILE_ID), sourceFileId))
                    .findFirst()
                    .flatMap(InMemoryHybridStore::lastModified);
        }
    }

    @Override
    public void deleteBySource(String collection, String sourceFileId) {
        MemoryCollection target = collections.get(collection);
        if (target == null) return;
        synchronized (target) {
            target.records.values().removeIf(r ->
                    Objects.equals(r.payload().get(PayloadFields.SOURCE_FILE_ID), sourceFileId));
        }
    }

    @Override
    public List<ScoredRecord> queryHybrid(String collection, List<Double> denseQuery, SparseVector sparseQuery, int limit) {
        MemoryCollection target = collections.get(collection);
        if (target == null || limit <= 0) return List.of();

        Map<String, StoredRecord> snapshot;
        synchronized (target) {
            snapshot = new LinkedHashMap<>(target.records);
        }
        if (snapshot.isEmpty()) return List.of();

        int candidates = limit * 2;
        List<RankFusion.Ranked> dense = new ArrayList<>();
        snapshot.forEach((id, r) -> dense.add(new RankFusion.Ranked(id, cosine(denseQuery, r.dense()))));
        dense.sort(Comparator.comparingDouble(RankFusion.Ranked::score).reversed());

        List<RankFusion.Ranked> sparse = new ArrayList<>();
        if (sparseQuery != null && !sparseQuery.isEmpty()) {
            snapshot.forEach((id, r) -> {
                double score = sparseQuery.dot(r.sparse());
                if (score > 0) sparse.add(new RankFusion.Ranked(id, score));
            });
            sparse.sort(Comparator.comparingDouble(RankFusion.Ranked::score).reversed());
        }

        return rankFusion.fuse(
                        dense.subList(0, Math.min(candidates, dense.size())),
                        sparse.subList(0, Math.min(candidates, sparse.size())),
                        limit)
                .stream()
                .map(f -> new ScoredRecord(f.id(), f.score(), snapshot.get(f.id()).payload()))
                .toList();
    }

    @Override
    public CollectionStats stats(String collection) {
        MemoryCollection target = collections.get(collection);
        if (target == null) return CollectionStats.missing(collection);
        synchronized (target) {
            return new CollectionStats(collection, true, target.records.size(), "green");
        }
    }

    /** Stored payload for a record, or empty when absent. */
    public Optional<Map<String, Object>> getPayload(String collection, String recordId) {
        MemoryCollection target = collections.get(collection);
        if (target == null) return Optional.empty();
        synchronized (target) {
            StoredRecord stored = target.records.get(recordId);
            return stored == null ? Optional.empty() : Optional.of(stored.payload());
        }
    }

    private static Optional<String> lastModified(StoredRecord stored) {
        Object value = stored.payload().get(PayloadFields.LAST_MODIFIED);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    private static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.size() != b.size()) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            na += x * x;
            nb += y * y;
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
