package com.adlanda.citedsearch.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lexical term weights keyed by token id.
 *
 * Entries are kept sorted by token id so that two vectors built from the same
 * input compare equal and serialize identically.
 *
 * @param weights Token id to weight; zero weights are never stored
 */
public record SparseVector(Map<Integer, Double> weights) {

    private static final SparseVector EMPTY = new SparseVector(Map.of());

    public SparseVector {
        TreeMap<Integer, Double> sorted = new TreeMap<>();
        if (weights != null) {
            weights.forEach((tokenId, weight) -> {
                if (weight != null && weight != 0.0) {
                    sorted.put(tokenId, weight);
                }
            });
        }
        weights = Collections.unmodifiableSortedMap(sorted);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    public Set<Integer> tokenIds() {
        return weights.keySet();
    }

    public double weight(int tokenId) {
        return weights.getOrDefault(tokenId, 0.0);
    }

    /**
     * Dot product over the shared token ids.
     */
    public double dot(SparseVector other) {
        if (other == null || isEmpty() || other.isEmpty()) {
            return 0.0;
        }
        SparseVector smaller = size() <= other.size() ? this : other;
        SparseVector larger = smaller == this ? other : this;

        double sum = 0.0;
        for (Map.Entry<Integer, Double> entry : smaller.weights.entrySet()) {
            sum += entry.getValue() * larger.weight(entry.getKey());
        }
        return sum;
    }
}
