package com.raditha.inductive.cuts;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Groups activities that are not observed in both orders.
 * Activities in different groups follow each other directly in both directions, and every
 * group holds at least one start and one end activity of the log.
 */
public abstract class ConcurrencyCut<T extends LogAbstraction> extends AbstractCut<T> {

    public static Cut<VariantLog> overVariants(boolean minimumSelfDistance) {
        return new OverVariants(minimumSelfDistance);
    }

    public static Cut<DirectlyFollowsLog> overGraph() {
        return new OverGraph();
    }

    @Override
    public MiningStep step() {
        return MiningStep.CONCURRENCY_CUT;
    }

    @Override
    protected Operator operator() {
        return Operator.CONCURRENT;
    }

    /**
     * Additional activity pairs that must share a group, beyond missing directly-follows pairs.
     */
    protected void mergeDependent(T abstraction, Groups.UnionFind groups) {
    }

    @Override
    protected List<SortedSet<String>> partition(T abstraction) {
        DirectlyFollowsGraph graph = abstraction.directlyFollowsGraph();
        List<String> activities = new ArrayList<>(abstraction.alphabet());
        Groups.UnionFind merged = new Groups.UnionFind(activities);
        for (int i = 0; i < activities.size(); i++) {
            for (int j = i + 1; j < activities.size(); j++) {
                String a = activities.get(i);
                String b = activities.get(j);
                if (!graph.hasEdge(a, b) || !graph.hasEdge(b, a)) {
                    merged.union(a, b);
                }
            }
        }
        mergeDependent(abstraction, merged);

        List<SortedSet<String>> groups = new ArrayList<>(merged.groups());
        groups.sort(Comparator.comparingInt((SortedSet<String> g) -> g.size()).thenComparing(Groups.BY_FIRST_LABEL));
        return absorbGroupsWithoutBoundary(groups, graph);
    }

    /**
     * A group without a start or without an end activity cannot run on its own; it is merged
     * into the group before it, or the one after it when it comes first.
     */
    private static List<SortedSet<String>> absorbGroupsWithoutBoundary(List<SortedSet<String>> groups,
                                                                       DirectlyFollowsGraph graph) {
        List<SortedSet<String>> result = new ArrayList<>(groups);
        int i = 0;
        while (i < result.size() && result.size() > 1) {
            SortedSet<String> group = result.get(i);
            if (touches(group, graph.startActivities().keySet()) && touches(group, graph.endActivities().keySet())) {
                i++;
                continue;
            }
            int target = i == 0 ? 1 : i - 1;
            SortedSet<String> union = new TreeSet<>(result.get(target));
            union.addAll(group);
            result.set(target, union);
            result.remove(i);
            i = 0;
        }
        return result;
    }

    private static boolean touches(SortedSet<String> group, Set<String> boundary) {
        for (String activity : boundary) {
            if (group.contains(activity)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Projects every trace on each group; minimum self-distance witnesses share a group.
     */
    static final class OverVariants extends ConcurrencyCut<VariantLog> {

        private final boolean minimumSelfDistance;

        OverVariants(boolean minimumSelfDistance) {
            this.minimumSelfDistance = minimumSelfDistance;
        }

        @Override
        protected void mergeDependent(VariantLog log, Groups.UnionFind groups) {
            if (!minimumSelfDistance) {
                return;
            }
            for (Map.Entry<String, SortedSet<String>> entry : MinimumSelfDistance.witnesses(log).entrySet()) {
                for (String witness : entry.getValue()) {
                    groups.union(entry.getKey(), witness);
                }
            }
        }

        @Override
        protected List<VariantLog> project(VariantLog log, List<SortedSet<String>> groups) {
            return groups.stream().map(log::project).toList();
        }
    }

    static final class OverGraph extends ConcurrencyCut<DirectlyFollowsLog> {

        @Override
        protected List<DirectlyFollowsLog> project(DirectlyFollowsLog log, List<SortedSet<String>> groups) {
            return groups.stream()
                    .map(group -> new DirectlyFollowsLog(log.graph().projected(group), false))
                    .toList();
        }
    }
}
