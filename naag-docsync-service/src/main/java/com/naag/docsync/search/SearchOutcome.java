package com.naag.docsync.search;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a search, possibly after widening.
 *
 * @param query    the query text of the last attempt
 * @param topScore best hit score, 0 when there are no hits
 */
public record SearchOutcome(String query, List<SearchHit> hits, double topScore, boolean confident, int attempts) {

    public SearchOutcome {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static SearchOutcome empty(String query) {
        return new SearchOutcome(query, List.of(), 0.0, false, 0);
    }

    /** True when callers should answer "not enough evidence" rather than use the hits. */
    @JsonProperty("insufficientEvidence")
    public boolean insufficientEvidence() {
        return !confident;
    }
}
