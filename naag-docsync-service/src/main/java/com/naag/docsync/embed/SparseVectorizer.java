package com.naag.docsync.embed;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Term-frequency sparse vectors with hashed term ids. No idf weighting; distinct terms may
 * collide on the same index and their frequencies are then summed.
 */
public class SparseVectorizer {

    public static final int DEFAULT_MODULUS = 1_000_000;

    private final int modulus;

    public SparseVectorizer() {
        this(DEFAULT_MODULUS);
    }

    public SparseVectorizer(int modulus) {
        if (modulus <= 0) {
            throw new IllegalArgumentException("modulus must be positive: " + modulus);
        }
        this.modulus = modulus;
    }

    public SparseVector vectorize(String text) {
        if (text == null || text.isBlank()) {
            return SparseVector.EMPTY;
        }

        Map<String, Integer> termFrequency = new TreeMap<>();
        for (String token : tokens(text)) {
            termFrequency.merge(token, 1, Integer::sum);
        }

        // TreeMap keeps indices sorted; Qdrant rejects duplicates so collisions are merged
        Map<Integer, Double> weights = new TreeMap<>();
        termFrequency.forEach((term, freq) -> weights.merge(termId(term), freq.doubleValue(), Double::sum));

        return new SparseVector(new ArrayList<>(weights.keySet()), new ArrayList<>(weights.values()));
    }

    public int termId(String term) {
        return Math.floorMod(term.hashCode(), modulus);
    }

    List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (token.length() > 2) out.add(token);
        }
        return out;
    }
}
