package com.raditha.inductive.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Multiset of traces: each distinct activity sequence with its multiplicity.
 * Variants are kept in lexicographic trace order so that iteration, and every
 * projection built from it, is reproducible.
 *
 * @param variants trace to multiplicity, multiplicities strictly positive
 */
public record VariantLog(SortedMap<List<String>, Integer> variants) implements LogAbstraction {

    /**
     * Lexicographic order on traces; a proper prefix sorts first.
     */
    public static final Comparator<List<String>> TRACE_ORDER = (t1, t2) -> {
        int common = Math.min(t1.size(), t2.size());
        for (int i = 0; i < common; i++) {
            int cmp = t1.get(i).compareTo(t2.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(t1.size(), t2.size());
    };

    private static final VariantLog EMPTY = new VariantLog(new TreeMap<>(TRACE_ORDER));

    public VariantLog {
        if (variants == null) {
            throw new MalformedAbstractionException("variants cannot be null");
        }
        SortedMap<List<String>, Integer> copy = new TreeMap<>(TRACE_ORDER);
        for (Map.Entry<List<String>, Integer> entry : variants.entrySet()) {
            List<String> trace = checkTrace(entry.getKey());
            Integer count = entry.getValue();
            if (count == null || count <= 0) {
                throw new MalformedAbstractionException(
                        "Multiplicity of trace " + trace + " must be positive, got " + count);
            }
            copy.merge(trace, count, (c1, c2) -> checkedSum(c1, c2, trace));
        }
        variants = Collections.unmodifiableSortedMap(copy);
    }

    public static VariantLog empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Variant log where every given trace occurs once.
     */
    public static VariantLog ofTraces(List<List<String>> traces) {
        Builder builder = builder();
        traces.forEach(t -> builder.add(t, 1));
        return builder.build();
    }

    private static List<String> checkTrace(List<String> trace) {
        if (trace == null) {
            throw new MalformedAbstractionException("Trace cannot be null");
        }
        for (String activity : trace) {
            if (activity == null || activity.isBlank()) {
                throw new MalformedAbstractionException("Trace " + trace + " contains a blank activity label");
            }
        }
        return List.copyOf(trace);
    }

    /**
     * Total number of traces, the sum of all multiplicities.
     */
    public long totalTraces() {
        return variants.values().stream().mapToLong(Integer::longValue).sum();
    }

    public int multiplicity(List<String> trace) {
        return variants.getOrDefault(trace, 0);
    }

    @Override
    public SortedSet<String> alphabet() {
        SortedSet<String> alphabet = new TreeSet<>();
        variants.keySet().forEach(alphabet::addAll);
        return alphabet;
    }

    @Override
    public DirectlyFollowsGraph directlyFollowsGraph() {
        DirectlyFollowsGraph.Builder builder = DirectlyFollowsGraph.builder();
        for (Map.Entry<List<String>, Integer> entry : variants.entrySet()) {
            List<String> trace = entry.getKey();
            int count = entry.getValue();
            if (trace.isEmpty()) {
                continue;
            }
            builder.addStart(trace.get(0), count);
            builder.addEnd(trace.get(trace.size() - 1), count);
            for (int i = 1; i < trace.size(); i++) {
                builder.addEdge(trace.get(i - 1), trace.get(i), count);
            }
        }
        return builder.build();
    }

    @Override
    public boolean containsEmptyTraces() {
        return variants.containsKey(List.of());
    }

    @Override
    public boolean isEmpty() {
        return variants.isEmpty();
    }

    /**
     * Whether every trace of a non-empty log is the empty trace.
     */
    public boolean onlyEmptyTraces() {
        return variants.size() == 1 && containsEmptyTraces();
    }

    public VariantLog withoutEmptyTraces() {
        if (!containsEmptyTraces()) {
            return this;
        }
        SortedMap<List<String>, Integer> copy = new TreeMap<>(variants);
        copy.remove(List.of());
        return new VariantLog(copy);
    }

    /**
     * Projects every trace on the activities accepted by the filter.
     * Traces that become equal are merged; traces that become empty are kept as empty traces.
     */
    public VariantLog filter(Predicate<String> keep) {
        Builder builder = builder();
        for (Map.Entry<List<String>, Integer> entry : variants.entrySet()) {
            List<String> projected = entry.getKey().stream().filter(keep).toList();
            builder.add(projected, entry.getValue());
        }
        return builder.build();
    }

    public VariantLog project(Set<String> activities) {
        return filter(activities::contains);
    }

    private static int checkedSum(int c1, int c2, List<String> trace) {
        try {
            return Math.addExact(c1, c2);
        } catch (ArithmeticException e) {
            throw new MalformedAbstractionException(
                    "Multiplicity of trace " + trace + " exceeds " + Integer.MAX_VALUE);
        }
    }

    /**
     * Total number of events, each trace length times its multiplicity.
     */
    public long totalEvents() {
        return variants.entrySet().stream()
                .mapToLong(e -> (long) e.getKey().size() * e.getValue())
                .sum();
    }

    /**
     * Accumulates traces; equal traces add up their multiplicities.
     */
    public static class Builder {
        private final SortedMap<List<String>, Integer> variants = new TreeMap<>(TRACE_ORDER);

        public Builder add(List<String> trace, int count) {
            List<String> checked = checkTrace(trace);
            if (count <= 0) {
                throw new MalformedAbstractionException(
                        "Multiplicity of trace " + checked + " must be positive, got " + count);
            }
            variants.merge(checked, count, (c1, c2) -> checkedSum(c1, c2, checked));
            return this;
        }

        public Builder add(int count, String... activities) {
            return add(Arrays.asList(activities), count);
        }

        public Builder add(String... activities) {
            return add(1, activities);
        }

        public boolean isEmpty() {
            return variants.isEmpty();
        }

        public VariantLog build() {
            return new VariantLog(variants);
        }
    }

    /**
     * Traces expanded by multiplicity, in variant order. Intended for small logs.
     */
    public List<List<String>> expand() {
        List<List<String>> traces = new ArrayList<>();
        variants.forEach((trace, count) -> {
            for (int i = 0; i < count; i++) {
                traces.add(trace);
            }
        });
        return traces;
    }
}
