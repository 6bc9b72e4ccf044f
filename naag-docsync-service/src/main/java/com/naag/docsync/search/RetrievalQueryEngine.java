package com.naag.docsync.search;

import com.naag.docsync.embed.HybridEmbedder;
import com.naag.docsync.embed.SparseVector;
import com.naag.docsync.metrics.IngestionMetrics;
import com.naag.docsync.service.SearchCallLogService;
import com.naag.docsync.store.HybridVectorStore;
import com.naag.docsync.store.ScoredRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Hybrid search across one or more collections with a confidence gate and bounded query
 * widening. Store scores are reciprocal-rank sums, so hits from different collections compare
 * directly against the threshold.
 */
@Slf4j
public class RetrievalQueryEngine {

    static final int MAX_WIDENING_CAP = 3;

    private final HybridEmbedder embedder;
    private final HybridVectorStore store;
    private final QueryExpansion expansion;
    private final SearchCallLogService callLog;
    private final IngestionMetrics metrics;
    private final Clock clock;
    private final double confidenceThreshold;
    private final int maxWideningAttempts;
    private final int defaultLimit;

    public RetrievalQueryEngine(HybridEmbedder embedder, HybridVectorStore store, QueryExpansion expansion,
                                SearchCallLogService callLog, IngestionMetrics metrics, Clock clock,
                                double confidenceThreshold, int maxWideningAttempts, int defaultLimit) {
        this.embedder = embedder;
        this.store = store;
        this.expansion = expansion;
        this.callLog = callLog;
        this.metrics = metrics;
        this.clock = clock;
        this.confidenceThreshold = confidenceThreshold;
        this.maxWideningAttempts = Math.max(0, Math.min(maxWideningAttempts, MAX_WIDENING_CAP));
        this.defaultLimit = defaultLimit > 0 ? defaultLimit : 5;
    }

    /**
     * Single attempt, no widening.
     */
    public SearchOutcome search(String query, List<String> collections, int limit) {
        return run(query, collections, limit, false);
    }

    /**
     * Searches, then re-issues an expanded query while the result is not confident, up to
     * the configured number of widening attempts.
     */
    public SearchOutcome searchWithWidening(String query, List<String> collections, int limit) {
        return run(query, collections, limit, true);
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getMaxWideningAttempts() {
        return maxWideningAttempts;
    }

    private SearchOutcome run(String query, List<String> collections, int limit, boolean widen) {
        if (query == null || query.isBlank() || collections == null || collections.isEmpty()) {
            return SearchOutcome.empty(query);
        }
        int effectiveLimit = limit > 0 ? limit : defaultLimit;
        long start = clock.millis();

        String current = query.trim();
        SearchOutcome outcome = attempt(current, collections, effectiveLimit, 1);
        int widenings = 0;
        while (widen && !outcome.confident() && widenings < maxWideningAttempts) {
            widenings++;
            String expanded = expansion.expand(query.trim(), widenings);
            if (expanded.equals(current)) {
                break;
            }
            current = expanded;
            log.debug("Widening search (attempt {}): '{}'", widenings + 1, current);
            SearchOutcome widened = attempt(current, collections, effectiveLimit, widenings + 1);
            outcome = widened.topScore() >= outcome.topScore()
                    ? widened
                    : new SearchOutcome(outcome.query(), outcome.hits(), outcome.topScore(), outcome.confident(), widened.attempts());
        }

        long latency = clock.millis() - start;
        log.info("Search '{}' over {} -> {} hits, top={}, confident={}, attempts={}, {}ms",
                query, collections, outcome.hits().size(), String.format("%.3f", outcome.topScore()),
                outcome.confident(), outcome.attempts(), latency);
        callLog.record(query, collections, outcome.hits().size(),
                outcome.hits().isEmpty() ? null : outcome.topScore(),
                outcome.confident(), outcome.attempts(), latency, null);
        metrics.recordSearch(latency, outcome.confident(), outcome.attempts());
        return outcome;
    }

    private SearchOutcome attempt(String query, List<String> collections, int limit, int attemptNumber) {
        List<Double> dense = embedder.embedQuery(query);
        SparseVector sparse = embedder.sparse(query);

        List<SearchHit> hits = new ArrayList<>();
        for (String collection : collections) {
            try {
                for (ScoredRecord r : store.queryHybrid(collection, dense, sparse, limit)) {
                    hits.add(new SearchHit(collection, r.id(), r.score(), r.payload()));
                }
            } catch (RuntimeException e) {
                log.warn("Search in collection {} failed: {}", collection, e.getMessage());
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
        List<SearchHit> top = hits.size() > limit ? hits.subList(0, limit) : hits;

        double topScore = top.isEmpty() ? 0.0 : top.get(0).score();
        boolean confident = !top.isEmpty() && topScore >= confidenceThreshold;
        return new SearchOutcome(query, top, topScore, confident, attemptNumber);
    }
}
