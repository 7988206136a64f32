package com.raditha.inductive.cuts;

import com.raditha.inductive.model.VariantLog;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Minimum self-distance of the activities of a variant log.
 * The self-distance of {@code a} in {@code <a,b,c,a>} is 2; the activities in between,
 * {@code b} and {@code c}, are its witnesses. Two activities linked this way cannot be concurrent.
 */
public final class MinimumSelfDistance {

    private MinimumSelfDistance() {
    }

    /**
     * Smallest number of events between two consecutive occurrences, for activities that repeat.
     */
    public static Map<String, Integer> distances(VariantLog log) {
        Map<String, Integer> distances = new TreeMap<>();
        for (List<String> trace : log.variants().keySet()) {
            Map<String, Integer> lastSeen = new HashMap<>();
            for (int i = 0; i < trace.size(); i++) {
                String activity = trace.get(i);
                Integer previous = lastSeen.put(activity, i);
                if (previous != null) {
                    distances.merge(activity, i - previous - 1, Math::min);
                }
            }
        }
        return distances;
    }

    /**
     * Activities seen between two occurrences of an activity at its minimum self-distance.
     * Activities that never repeat, or that repeat back to back, have no witnesses.
     */
    public static Map<String, SortedSet<String>> witnesses(VariantLog log) {
        Map<String, Integer> distances = distances(log);
        Map<String, SortedSet<String>> witnesses = new TreeMap<>();
        for (List<String> trace : log.variants().keySet()) {
            Map<String, Integer> lastSeen = new HashMap<>();
            for (int i = 0; i < trace.size(); i++) {
                String activity = trace.get(i);
                Integer previous = lastSeen.put(activity, i);
                if (previous == null || i - previous - 1 != distances.get(activity)) {
                    continue;
                }
                SortedSet<String> between = witnesses.computeIfAbsent(activity, k -> new TreeSet<>());
                between.addAll(trace.subList(previous + 1, i));
            }
        }
        witnesses.values().removeIf(SortedSet::isEmpty);
        return witnesses;
    }
}
