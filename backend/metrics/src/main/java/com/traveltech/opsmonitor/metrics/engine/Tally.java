package com.traveltech.opsmonitor.metrics.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered key to count map. Rankings sort by count descending and keep
 * first-insertion order among equal counts.
 */
public final class Tally<K> {
    private final Map<K, Integer> counts = new LinkedHashMap<>();

    public void increment(K key) {
        counts.merge(key, 1, Integer::sum);
    }

    public void addAll(Collection<? extends K> keys) {
        for (K key : keys) {
            increment(key);
        }
    }

    public int get(K key) {
        return counts.getOrDefault(key, 0);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int size() {
        return counts.size();
    }

    public Map<K, Integer> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    /**
     * Keys of this tally whose count exceeds the other's, mapped to the excess.
     * Keys that only appear in {@code other} are never included.
     */
    public Tally<K> positiveDifference(Tally<K> other) {
        Tally<K> difference = new Tally<>();
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            int delta = entry.getValue() - other.get(entry.getKey());
            if (delta > 0) {
                difference.counts.put(entry.getKey(), delta);
            }
        }
        return difference;
    }

    public List<Map.Entry<K, Integer>> ranked(int limit) {
        List<Map.Entry<K, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so ties keep insertion order
        entries.sort(Map.Entry.<K, Integer>comparingByValue(Comparator.reverseOrder()));
        List<Map.Entry<K, Integer>> top = new ArrayList<>(Math.min(limit, entries.size()));
        for (Map.Entry<K, Integer> entry : entries) {
            if (top.size() >= limit) {
                break;
            }
            top.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        return top;
    }

    public int countAbove(int threshold) {
        int matching = 0;
        for (int count : counts.values()) {
            if (count > threshold) {
                matching++;
            }
        }
        return matching;
    }

    public List<K> keysWithCountAbove(int threshold, int limit) {
        return ranked(limit).stream()
                .filter(entry -> entry.getValue() > threshold)
                .map(Map.Entry::getKey)
                .toList();
    }
}
