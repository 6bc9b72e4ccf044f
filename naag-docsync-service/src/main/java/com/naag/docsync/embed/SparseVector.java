package com.naag.docsync.embed;

import java.util.List;

/**
 * Lexical vector as parallel index/value lists, indices ascending and unique.
 */
public record SparseVector(List<Integer> indices, List<Double> values) {

    public static final SparseVector EMPTY = new SparseVector(List.of(), List.of());

    public SparseVector {
        if (indices.size() != values.size()) {
            throw new IllegalArgumentException("indices and values differ in length: "
                    + indices.size() + " vs " + values.size());
        }
        indices = List.copyOf(indices);
        values = List.copyOf(values);
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    public double dot(SparseVector other) {
        double sum = 0;
        int i = 0, j = 0;
        while (i < indices.size() && j < other.indices.size()) {
            int a = indices.get(i);
            int b = other.indices.get(j);
            if (a == b) {
                sum += values.get(i) * other.values.get(j);
                i++;
                j++;
            } else if (a < b) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }
}
