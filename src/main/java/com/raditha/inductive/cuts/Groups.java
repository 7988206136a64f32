package com.raditha.inductive.cuts;

import com.raditha.inductive.model.DirectlyFollowsGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partition helpers shared by the cuts. All results are in a deterministic order.
 */
public final class Groups {

    /**
     * Groups ordered by their smallest label.
     */
    public static final Comparator<SortedSet<String>> BY_FIRST_LABEL = Comparator.comparing((SortedSet<String> group) -> group.first());

    private Groups() {
    }

    /**
     * Connected components of the undirected graph over {@code nodes}.
     * Only edges with both endpoints among the nodes are followed.
     */
    public static List<SortedSet<String>> connectedComponents(Collection<String> nodes, DirectlyFollowsGraph graph) {
        UnionFind components = new UnionFind(nodes);
        for (DirectlyFollowsGraph.Edge edge : graph.edges().keySet()) {
            if (components.contains(edge.source()) && components.contains(edge.target())) {
                components.union(edge.source(), edge.target());
            }
        }
        return components.groups();
    }

    /**
     * Transitive reachability over the directly-follows edges.
     * An activity reaches itself only when it lies on a cycle.
     */
    public static Map<String, Set<String>> reachability(DirectlyFollowsGraph graph) {
        Map<String, SortedSet<String>> successors = graph.successorMap();
        Map<String, Set<String>> reach = new HashMap<>();
        for (String activity : successors.keySet()) {
            Set<String> seen = new TreeSet<>();
            Deque<String> queue = new ArrayDeque<>(successors.get(activity));
            while (!queue.isEmpty()) {
                String next = queue.poll();
                if (seen.add(next)) {
                    queue.addAll(successors.getOrDefault(next, new TreeSet<>()));
                }
            }
            reach.put(activity, seen);
        }
        return reach;
    }

    /**
     * Replaces groups {@code from..to} (inclusive) by their union, placed at {@code from}.
     */
    public static List<SortedSet<String>> mergeRange(List<SortedSet<String>> groups, int from, int to) {
        List<SortedSet<String>> result = new ArrayList<>(groups.subList(0, from));
        SortedSet<String> merged = new TreeSet<>();
        for (int i = from; i <= to; i++) {
            merged.addAll(groups.get(i));
        }
        result.add(merged);
        result.addAll(groups.subList(to + 1, groups.size()));
        return result;
    }

    public static int indexOf(List<SortedSet<String>> groups, String activity) {
        for (int i = 0; i < groups.size(); i++) {
            if (groups.get(i).contains(activity)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Disjoint-set forest over activity labels.
     */
    public static class UnionFind {
        private final Map<String, String> parent = new TreeMap<>();

        public UnionFind(Collection<String> elements) {
            for (String element : elements) {
                parent.put(element, element);
            }
        }

        public boolean contains(String element) {
            return parent.containsKey(element);
        }

        public String find(String element) {
            String root = element;
            while (!parent.get(root).equals(root)) {
                root = parent.get(root);
            }
            String current = element;
            while (!current.equals(root)) {
                String next = parent.get(current);
                parent.put(current, root);
                current = next;
            }
            return root;
        }

        public void union(String a, String b) {
            String rootA = find(a);
            String rootB = find(b);
            if (rootA.equals(rootB)) {
                return;
            }
            // smaller label stays root
            if (rootA.compareTo(rootB) < 0) {
                parent.put(rootB, rootA);
            } else {
                parent.put(rootA, rootB);
            }
        }

        /**
         * Current groups ordered by their smallest label.
         */
        public List<SortedSet<String>> groups() {
            Map<String, SortedSet<String>> byRoot = new TreeMap<>();
            for (String element : parent.keySet()) {
                byRoot.computeIfAbsent(find(element), k -> new TreeSet<>()).add(element);
            }
            List<SortedSet<String>> result = new ArrayList<>(byRoot.values());
            result.sort(BY_FIRST_LABEL);
            return result;
        }
    }
}
