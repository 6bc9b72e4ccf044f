package com.naag.docsync.store;

public class VectorDimensionMismatchException extends VectorStoreException {

    public VectorDimensionMismatchException(String collection, String id, int expected, int actual) {
        super("Vector dimension mismatch for id=" + id + " in " + collection
                + " expected=" + expected + " got=" + actual);
    }
}
