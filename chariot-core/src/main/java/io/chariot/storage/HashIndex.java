package io.chariot.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Secondary index from a column value to the rows holding it, in insertion order.
 * Null keys are never indexed.
 */
public final class HashIndex<K> {
    private static final int[] NO_ROWS = new int[0];

    private final Map<K, List<Integer>> index = new HashMap<>();

    public void add(K key, int row) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        if (row < 0) {
            throw new IllegalArgumentException("row must be non-negative");
        }
        index.computeIfAbsent(key, ignored -> new ArrayList<>(2)).add(row);
    }

    public int[] lookup(K key) {
        if (key == null) {
            return NO_ROWS;
        }
        List<Integer> rows = index.get(key);
        if (rows == null) {
            return NO_ROWS;
        }
        int[] result = new int[rows.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = rows.get(i);
        }
        return result;
    }

    public boolean contains(K key) {
        return key != null && index.containsKey(key);
    }

    public int size() {
        return index.size();
    }
}
