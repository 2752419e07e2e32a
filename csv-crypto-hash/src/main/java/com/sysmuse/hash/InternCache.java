package com.sysmuse.hash;

import java.util.HashMap;
import java.util.Map;

/**
 * Folds equal strings onto one instance for the duration of a single retrieval pass.
 * <p>
 * Field names and digests repeat on every row that is streamed out of a mapping store.
 * Routing them through one cache keeps memory proportional to the number of distinct
 * values. A cache belongs to one pass and is dropped with it, never shared process wide.
 */
public class InternCache {

    private final Map<String, String> folded = new HashMap<>();

    /**
     * @return an instance equal to {@code s}; the same instance for every equal argument.
     *         null is returned unchanged.
     */
    public String intern(String s) {
        if (s == null) {
            return null;
        }
        String existing = folded.putIfAbsent(s, s);
        return existing != null ? existing : s;
    }

    public int size() {
        return folded.size();
    }

    public void clear() {
        folded.clear();
    }
}
