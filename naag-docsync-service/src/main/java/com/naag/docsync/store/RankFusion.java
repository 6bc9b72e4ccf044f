package com.naag.docsync.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion over a dense and a sparse ranking.
 *
 * <p>Each list contributes {@code 1 / (k + rank)} per id, with 1-based ranks, and contributions
 * are summed. Only ranks matter, so the two lists' raw scores need not be comparable. Ties keep
 * first-seen order, dense before sparse.
 *
 * <p>A single ranking (sparse side empty or unavailable) is scored the same way, so dense-only
 * results share the fused scale: a first-ranked record scores {@code 1 / (k + 1)} from one list
 * and {@code 2 / (k + 1)} when first in both.
 */
public class RankFusion {

    private static final Logger log = LoggerFactory.getLogger(RankFusion.class);

    public static final double DEFAULT_K = 60.0;

    private final double k;

    public RankFusion() {
        this(DEFAULT_K);
    }

    public RankFusion(double k) {
        this.k = k;
    }

    public record Ranked(String id, double score) {}

    public record Fused(String id, double score, boolean inDense, boolean inSparse) {}

    public List<Fused> fuse(List<Ranked> dense, List<Ranked> sparse, int limit) {
        Map<String, double[]> scores = new LinkedHashMap<>();
        Map<String, boolean[]> sources = new LinkedHashMap<>();

        for (int rank = 0; rank < dense.size(); rank++) {
            String id = dense.get(rank).id();
            scores.computeIfAbsent(id, x -> new double[1])[0] += 1.0 / (k + rank + 1);
            sources.computeIfAbsent(id, x -> new boolean[2])[0] = true;
        }
        for (int rank = 0; rank < sparse.size(); rank++) {
            String id = sparse.get(rank).id();
            scores.computeIfAbsent(id, x -> new double[1])[0] += 1.0 / (k + rank + 1);
            sources.computeIfAbsent(id, x -> new boolean[2])[1] = true;
        }

        List<Fused> all = new ArrayList<>(scores.size());
        scores.forEach((id, s) -> {
            boolean[] in = sources.get(id);
            all.add(new Fused(id, s[0], in[0], in[1]));
        });
        // stable sort keeps insertion order on ties
        all.sort((a, b) -> Double.compare(b.score(), a.score()));
        List<Fused> results = all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;

        if (log.isDebugEnabled()) {
            long both = results.stream().filter(r -> r.inDense() && r.inSparse()).count();
            long denseOnly = results.stream().filter(r -> r.inDense() && !r.inSparse()).count();
            long sparseOnly = results.stream().filter(r -> !r.inDense() && r.inSparse()).count();
            log.debug("RRF fusion: {} results (both={}, denseOnly={}, sparseOnly={})",
                    results.size(), both, denseOnly, sparseOnly);
        }
        return results;
    }

    /**
     * Fuses two ranked hit lists, keeping the first payload seen for each id.
     */
    public List<ScoredRecord> fuseRecords(List<ScoredRecord> dense, List<ScoredRecord> sparse, int limit) {
        Map<String, Map<String, Object>> payloads = new HashMap<>();
        dense.forEach(r -> payloads.putIfAbsent(r.id(), r.payload()));
        sparse.forEach(r -> payloads.putIfAbsent(r.id(), r.payload()));
        return fuse(ranked(dense), ranked(sparse), limit).stream()
                .map(f -> new ScoredRecord(f.id(), f.score(), payloads.get(f.id())))
                .toList();
    }

    private static List<Ranked> ranked(List<ScoredRecord> records) {
        return records.stream().map(r -> new Ranked(r.id(), r.score())).toList();
    }
}
