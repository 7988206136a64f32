package com.raditha.inductive.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Weighted directly-follows graph with weighted start and end activities.
 * All maps are sorted so iteration order never depends on insertion order.
 *
 * @param edges           (source, target) to frequency
 * @param startActivities activity to number of traces it starts
 * @param endActivities   activity to number of traces it ends
 */
public record DirectlyFollowsGraph(
        SortedMap<Edge, Integer> edges,
        SortedMap<String, Integer> startActivities,
        SortedMap<String, Integer> endActivities) {

    private static final DirectlyFollowsGraph EMPTY = builder().build();

    /**
     * A directly-follows pair: {@code target} was observed immediately after {@code source}.
     */
    public record Edge(String source, String target) implements Comparable<Edge> {

        private static final Comparator<Edge> ORDER = Comparator
                .comparing(Edge::source)
                .thenComparing(Edge::target);

        public Edge {
            checkLabel(source);
            checkLabel(target);
        }

        @Override
        public int compareTo(Edge other) {
            return ORDER.compare(this, other);
        }

        @Override
        public String toString() {
            return source + "->" + target;
        }
    }

    public DirectlyFollowsGraph {
        edges = checkedCopy(edges, "edge");
        startActivities = checkedCopy(startActivities, "start activity");
        endActivities = checkedCopy(endActivities, "end activity");
    }

    private static <K extends Comparable<K>> SortedMap<K, Integer> checkedCopy(Map<K, Integer> source, String what) {
        SortedMap<K, Integer> copy = new TreeMap<>();
        if (source == null) {
            return Collections.unmodifiableSortedMap(copy);
        }
        for (Map.Entry<K, Integer> entry : source.entrySet()) {
            K key = entry.getKey();
            if (key == null) {
                throw new MalformedAbstractionException("Null " + what);
            }
            if (key instanceof String label) {
                checkLabel(label);
            }
            Integer weight = entry.getValue();
            if (weight == null || weight <= 0) {
                throw new MalformedAbstractionException(
                        "Weight of " + what + " " + key + " must be positive, got " + weight);
            }
            copy.put(key, weight);
        }
        return Collections.unmodifiableSortedMap(copy);
    }

    private static void checkLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new MalformedAbstractionException("Activity label must not be blank");
        }
    }

    public static DirectlyFollowsGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Union of the labels used by start activities, end activities and edge endpoints.
     */
    public SortedSet<String> alphabet() {
        SortedSet<String> alphabet = new TreeSet<>(startActivities.keySet());
        alphabet.addAll(endActivities.keySet());
        for (Edge edge : edges.keySet()) {
            alphabet.add(edge.source());
            alphabet.add(edge.target());
        }
        return alphabet;
    }

    public boolean isEmpty() {
        return edges.isEmpty() && startActivities.isEmpty() && endActivities.isEmpty();
    }

    public boolean hasEdge(String source, String target) {
        return edges.containsKey(new Edge(source, target));
    }

    public int weight(String source, String target) {
        return edges.getOrDefault(new Edge(source, target), 0);
    }

    public boolean isStart(String activity) {
        return startActivities.containsKey(activity);
    }

    public boolean isEnd(String activity) {
        return endActivities.containsKey(activity);
    }

    public SortedSet<String> successors(String activity) {
        SortedSet<String> result = new TreeSet<>();
        for (Edge edge : edges.keySet()) {
            if (edge.source().equals(activity)) {
                result.add(edge.target());
            }
        }
        return result;
    }

    public SortedSet<String> predecessors(String activity) {
        SortedSet<String> result = new TreeSet<>();
        for (Edge edge : edges.keySet()) {
            if (edge.target().equals(activity)) {
                result.add(edge.source());
            }
        }
        return result;
    }

    /**
     * Adjacency lists of all activities, activities without successors included.
     */
    public Map<String, SortedSet<String>> successorMap() {
        Map<String, SortedSet<String>> result = new TreeMap<>();
        for (String activity : alphabet()) {
            result.put(activity, new TreeSet<>());
        }
        for (Edge edge : edges.keySet()) {
            result.get(edge.source()).add(edge.target());
        }
        return result;
    }

    /**
     * Sub-graph induced by a group: edges with both ends inside, start and end weights inside.
     */
    public DirectlyFollowsGraph induced(Set<String> group) {
        Builder builder = builder();
        edges.forEach((edge, weight) -> {
            if (group.contains(edge.source()) && group.contains(edge.target())) {
                builder.addEdge(edge.source(), edge.target(), weight);
            }
        });
        startActivities.forEach((activity, weight) -> {
            if (group.contains(activity)) {
                builder.addStart(activity, weight);
            }
        });
        endActivities.forEach((activity, weight) -> {
            if (group.contains(activity)) {
                builder.addEnd(activity, weight);
            }
        });
        return builder.build();
    }

    /**
     * Sub-graph of a group as seen from inside it: edges with both ends inside, the start and end
     * weights inside, plus targets of edges entering the group as start activities and sources of
     * edges leaving it as end activities. Every group activity that occurs in this graph stays.
     */
    public DirectlyFollowsGraph projected(Set<String> group) {
        Builder builder = builder();
        startActivities.forEach((activity, weight) -> {
            if (group.contains(activity)) {
                builder.addStart(activity, weight);
            }
        });
        endActivities.forEach((activity, weight) -> {
            if (group.contains(activity)) {
                builder.addEnd(activity, weight);
            }
        });
        edges.forEach((edge, weight) -> {
            boolean sourceIn = group.contains(edge.source());
            boolean targetIn = group.contains(edge.target());
            if (sourceIn && targetIn) {
                builder.addEdge(edge.source(), edge.target(), weight);
            } else if (targetIn) {
                builder.addStart(edge.target(), weight);
            } else if (sourceIn) {
                builder.addEnd(edge.source(), weight);
            }
        });
        return builder.build();
    }

    /**
     * Sum of all edge, start and end weights.
     */
    public long totalWeight() {
        return sum(edges) + sum(startActivities) + sum(endActivities);
    }

    private static long sum(Map<?, Integer> weights) {
        return weights.values().stream().mapToLong(Integer::longValue).sum();
    }

    /**
     * Accumulates weights; repeated additions of the same key add up.
     * A sum beyond {@code Integer.MAX_VALUE} is rejected.
     */
    public static class Builder {
        private final SortedMap<Edge, Integer> edges = new TreeMap<>();
        private final SortedMap<String, Integer> starts = new TreeMap<>();
        private final SortedMap<String, Integer> ends = new TreeMap<>();

        public Builder addEdge(String source, String target, int weight) {
            edges.merge(new Edge(source, target), weight, (w1, w2) -> checkedSum(w1, w2, source + " -> " + target));
            return this;
        }

        public Builder addEdge(String source, String target) {
            return addEdge(source, target, 1);
        }

        public Builder addStart(String activity, int weight) {
            starts.merge(activity, weight, (w1, w2) -> checkedSum(w1, w2, "start activity " + activity));
            return this;
        }

        public Builder addStart(String activity) {
            return addStart(activity, 1);
        }

        public Builder addEnd(String activity, int weight) {
            ends.merge(activity, weight, (w1, w2) -> checkedSum(w1, w2, "end activity " + activity));
            return this;
        }

        public Builder addEnd(String activity) {
            return addEnd(activity, 1);
        }

        public DirectlyFollowsGraph build() {
            return new DirectlyFollowsGraph(edges, starts, ends);
        }

        private static int checkedSum(int w1, int w2, String what) {
            try {
                return Math.addExact(w1, w2);
            } catch (ArithmeticException e) {
                throw new MalformedAbstractionException("Weight of " + what + " exceeds " + Integer.MAX_VALUE);
            }
        }
    }
}
