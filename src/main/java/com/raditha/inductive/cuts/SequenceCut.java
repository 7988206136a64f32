package com.raditha.inductive.cuts;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Orders the alphabet into groups such that control only ever flows from earlier groups to later ones.
 * <p>
 * Activities that reach each other, or that cannot reach each other in either direction, end up in
 * the same group. The candidate is accepted only if every activity of an earlier group reaches every
 * activity of a later group and is never reached back.
 * <p>
 * In the strict form the groups are further merged so that every start activity of the log lies in
 * the first group and every end activity in the last. The relaxed form leaves skipped groups to the
 * projection, which makes them optional.
 */
public abstract class SequenceCut<T extends LogAbstraction> extends AbstractCut<T> {

    private final boolean strict;

    protected SequenceCut(boolean strict) {
        this.strict = strict;
    }

    public static Cut<VariantLog> overVariants(boolean strict) {
        return new OverVariants(strict);
    }

    public static Cut<DirectlyFollowsLog> overGraph(boolean strict) {
        return new OverGraph(strict);
    }

    @Override
    public MiningStep step() {
        return MiningStep.SEQUENCE_CUT;
    }

    @Override
    protected Operator operator() {
        return Operator.SEQUENCE;
    }

    @Override
    protected List<SortedSet<String>> partition(T abstraction) {
        SortedSet<String> alphabet = abstraction.alphabet();
        DirectlyFollowsGraph graph = abstraction.directlyFollowsGraph();
        Map<String, Set<String>> reach = Groups.reachability(graph);

        Groups.UnionFind merged = new Groups.UnionFind(alphabet);
        List<String> activities = new ArrayList<>(alphabet);
        for (int i = 0; i < activities.size(); i++) {
            for (int j = i + 1; j < activities.size(); j++) {
                String a = activities.get(i);
                String b = activities.get(j);
                if (reaches(reach, a, b) == reaches(reach, b, a)) {
                    merged.union(a, b);
                }
            }
        }
        List<SortedSet<String>> groups = new ArrayList<>(merged.groups());
        if (groups.size() < 2) {
            return List.of();
        }
        groups.sort(Comparator.comparingInt((SortedSet<String> g) -> reachedFromOutside(g, alphabet, reach))
                .thenComparing(Groups.BY_FIRST_LABEL));
        if (!isOrdered(groups, reach)) {
            return List.of();
        }
        return strict ? keepBoundariesOutside(groups, graph) : groups;
    }

    private static boolean reaches(Map<String, Set<String>> reach, String from, String to) {
        return reach.getOrDefault(from, Set.of()).contains(to);
    }

    private static int reachedFromOutside(SortedSet<String> group, Set<String> alphabet, Map<String, Set<String>> reach) {
        int count = 0;
        for (String activity : alphabet) {
            if (group.contains(activity)) {
                continue;
            }
            for (String member : group) {
                if (reaches(reach, activity, member)) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }

    private static boolean isOrdered(List<SortedSet<String>> groups, Map<String, Set<String>> reach) {
        for (int i = 0; i < groups.size(); i++) {
            for (int j = i + 1; j < groups.size(); j++) {
                for (String earlier : groups.get(i)) {
                    for (String later : groups.get(j)) {
                        if (!reaches(reach, earlier, later) || reaches(reach, later, earlier)) {
                            return false;
                        }
                    }
                }
            }
        }
        return true;
    }

    /**
     * Merges leading groups until no start activity is left behind the first group,
     * and trailing groups until no end activity is left before the last.
     */
    private static List<SortedSet<String>> keepBoundariesOutside(List<SortedSet<String>> groups,
                                                                 DirectlyFollowsGraph graph) {
        int lastWithStart = 0;
        for (String start : graph.startActivities().keySet()) {
            lastWithStart = Math.max(lastWithStart, Groups.indexOf(groups, start));
        }
        List<SortedSet<String>> result = lastWithStart > 0 ? Groups.mergeRange(groups, 0, lastWithStart) : groups;

        int firstWithEnd = result.size() - 1;
        for (String end : graph.endActivities().keySet()) {
            firstWithEnd = Math.min(firstWithEnd, Groups.indexOf(result, end));
        }
        if (firstWithEnd < result.size() - 1) {
            result = Groups.mergeRange(result, firstWithEnd, result.size() - 1);
        }
        return result;
    }

    /**
     * Splits every trace at the cheapest positions, one slice per group.
     */
    static final class OverVariants extends SequenceCut<VariantLog> {

        OverVariants(boolean strict) {
            super(strict);
        }

        @Override
        protected List<VariantLog> project(VariantLog log, List<SortedSet<String>> groups) {
            List<VariantLog.Builder> builders = new ArrayList<>();
            groups.forEach(g -> builders.add(VariantLog.builder()));
            for (Map.Entry<List<String>, Integer> entry : log.variants().entrySet()) {
                List<String> trace = entry.getKey();
                Set<String> ignore = new HashSet<>();
                int position = 0;
                for (int i = 0; i < groups.size(); i++) {
                    SortedSet<String> group = groups.get(i);
                    int split = i == groups.size() - 1
                            ? trace.size()
                            : findSplitPoint(trace, group, position, ignore);
                    List<String> slice = trace.subList(position, split).stream().filter(group::contains).toList();
                    builders.get(i).add(slice, entry.getValue());
                    ignore.addAll(group);
                    position = split;
                }
            }
            return builders.stream().map(VariantLog.Builder::build).toList();
        }

        /**
         * Position after which the trace no longer belongs to {@code group}.
         * A group event lowers the cost, an event of a later group raises it; events of
         * earlier groups are free.
         */
        static int findSplitPoint(List<String> trace, Set<String> group, int start, Set<String> ignore) {
            int leastCost = 0;
            int cost = 0;
            int split = start;
            for (int i = start; i < trace.size(); i++) {
                String activity = trace.get(i);
                if (group.contains(activity)) {
                    cost--;
                } else if (!ignore.contains(activity)) {
                    cost++;
                }
                if (cost < leastCost) {
                    leastCost = cost;
                    split = i + 1;
                }
            }
            return split;
        }
    }

    /**
     * Induced sub-graphs whose boundary activities include those entered from, or leaving to,
     * other groups.
     */
    static final class OverGraph extends SequenceCut<DirectlyFollowsLog> {

        OverGraph(boolean strict) {
            super(strict);
        }

        @Override
        protected List<DirectlyFollowsLog> project(DirectlyFollowsLog log, List<SortedSet<String>> groups) {
            DirectlyFollowsGraph graph = log.graph();
            List<DirectlyFollowsLog> result = new ArrayList<>();
            for (int i = 0; i < groups.size(); i++) {
                SortedSet<String> group = groups.get(i);
                result.add(new DirectlyFollowsLog(graph.projected(group), isSkippable(graph, groups, i)));
            }
            return result;
        }

        private static boolean isSkippable(DirectlyFollowsGraph graph, List<SortedSet<String>> groups, int i) {
            for (String start : graph.startActivities().keySet()) {
                if (Groups.indexOf(groups, start) > i) {
                    return true;
                }
            }
            for (String end : graph.endActivities().keySet()) {
                if (Groups.indexOf(groups, end) < i) {
                    return true;
                }
            }
            for (DirectlyFollowsGraph.Edge edge : graph.edges().keySet()) {
                if (Groups.indexOf(groups, edge.source()) < i && Groups.indexOf(groups, edge.target()) > i) {
                    return true;
                }
            }
            return false;
        }
    }
}
