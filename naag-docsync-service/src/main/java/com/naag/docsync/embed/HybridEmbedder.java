package com.naag.docsync.embed;

import com.naag.docsync.llm.EmbeddingsClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;

/**
 * Produces the dense and sparse halves of a hybrid vector. Ingestion and query paths differ in
 * how they treat a dense embedding failure.
 */
@Slf4j
public class HybridEmbedder {

    private final EmbeddingsClient embeddingsClient;
    private final SparseVectorizer sparseVectorizer;
    private final int dimension;

    public HybridEmbedder(EmbeddingsClient embeddingsClient, SparseVectorizer sparseVectorizer, int dimension) {
        this.embeddingsClient = embeddingsClient;
        this.sparseVectorizer = sparseVectorizer;
        this.dimension = dimension;
    }

    /** Ingestion path: any failure propagates and fails the item. */
    public List<Double> embedDocument(String text) {
        List<Double> vector = embeddingsClient.embed(text);
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingException("Embedding service returned an empty vector");
        }
        return vector;
    }

    /** Query path: substitutes a zero vector so a search degrades instead of failing. */
    public List<Double> embedQuery(String text) {
        try {
            return embedDocument(text);
        } catch (RuntimeException e) {
            log.warn("Query embedding failed, using zero vector: {}", e.getMessage());
            return Collections.nCopies(dimension, 0.0);
        }
    }

    public SparseVector sparse(String text) {
        return sparseVectorizer.vectorize(text);
    }
}
