package com.naag.docsync.store;

import com.naag.docsync.embed.SparseVector;

import java.util.List;
import java.util.Optional;

/**
 * Collections of records holding a dense vector, a sparse vector and a payload, keyed by a
 * stable record id. A write with an existing id replaces the record wholly.
 */
public interface HybridVectorStore {

    /** Idempotent; a no-op when the collection already exists. */
    void ensureCollection(String collection, int denseDimension);

    default void upsert(String collection, IndexedRecord record) {
        upsertAll(collection, List.of(record));
    }

    /**
     * @throws VectorDimensionMismatchException when a dense vector does not match the collection
     */
    void upsertAll(String collection, List<IndexedRecord> records);

    /** Stored {@code last_modified} for a record id; empty when absent or the collection is missing. */
    Optional<String> getLastModified(String collection, String recordId);

    /** Stored {@code last_modified} of any record produced from the given source file. */
    Optional<String> getLastModifiedBySource(String collection, String sourceFileId);

    void deleteBySource(String collection, String sourceFileId);

    /**
     * Fused dense + sparse query. Takes {@code limit * 2} candidates from each side, fuses them by
     * reciprocal rank and returns the top {@code limit}. When the sparse side is empty or unavailable
     * the dense ranking alone is scored by reciprocal rank, so every score is on the fused scale.
     * A missing collection yields an empty list.
     */
    List<ScoredRecord> queryHybrid(String collection, List<Double> denseQuery,
                                   SparseVector sparseQuery, int limit);

    CollectionStats stats(String collection);
}
