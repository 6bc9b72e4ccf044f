package com.naag.docsync.store;

public record CollectionStats(String collection, boolean exists, long pointsCount, String status) {

    public static CollectionStats missing(String collection) {
        return new CollectionStats(collection, false, 0, "missing");
    }
}
