package com.raditha.inductive.cuts;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Separates a body, which holds every start and end activity, from redo groups that are only
 * entered from end activities and only left towards start activities.
 * The body is always the first group; each remaining group is a redo alternative.
 */
public abstract class LoopCut<T extends LogAbstraction> extends AbstractCut<T> {

    public static Cut<VariantLog> overVariants() {
        return new OverVariants();
    }

    public static Cut<DirectlyFollowsLog> overGraph() {
        return new OverGraph();
    }

    @Override
    public MiningStep step() {
        return MiningStep.LOOP_CUT;
    }

    @Override
    protected Operator operator() {
        return Operator.LOOP;
    }

    @Override
    protected List<SortedSet<String>> partition(T abstraction) {
        DirectlyFollowsGraph graph = abstraction.directlyFollowsGraph();
        Set<String> starts = graph.startActivities().keySet();
        Set<String> ends = graph.endActivities().keySet();

        SortedSet<String> body = new TreeSet<>(starts);
        body.addAll(ends);
        SortedSet<String> rest = new TreeSet<>(abstraction.alphabet());
        rest.removeAll(body);
        if (body.isEmpty() || rest.isEmpty()) {
            return List.of();
        }

        List<SortedSet<String>> groups = new ArrayList<>();
        groups.add(body);
        groups.addAll(Groups.connectedComponents(rest, graph));

        absorbEnteredFromStart(groups, graph, starts, ends);
        absorbLeavingToEnd(groups, graph, starts, ends);
        absorbIncompleteRedo(groups, graph, starts, ends);

        groups.removeIf(SortedSet::isEmpty);
        return groups.size() < 2 ? List.of() : groups;
    }

    private static void absorbEnteredFromStart(List<SortedSet<String>> groups, DirectlyFollowsGraph graph,
                                               Set<String> starts, Set<String> ends) {
        for (String start : starts) {
            if (ends.contains(start)) {
                continue;
            }
            for (String next : graph.successors(start)) {
                absorbIntoBody(groups, Groups.indexOf(groups, next));
            }
        }
    }

    private static void absorbLeavingToEnd(List<SortedSet<String>> groups, DirectlyFollowsGraph graph,
                                           Set<String> starts, Set<String> ends) {
        for (String end : ends) {
            if (starts.contains(end)) {
                continue;
            }
            for (String previous : graph.predecessors(end)) {
                absorbIntoBody(groups, Groups.indexOf(groups, previous));
            }
        }
    }

    /**
     * A redo activity that jumps back to some but not all start activities, or that is entered
     * from some but not all end activities, belongs to the body.
     */
    private static void absorbIncompleteRedo(List<SortedSet<String>> groups, DirectlyFollowsGraph graph,
                                             Set<String> starts, Set<String> ends) {
        for (int i = 1; i < groups.size(); i++) {
            for (String activity : groups.get(i)) {
                if (isIncomplete(activity, starts, graph, true) || isIncomplete(activity, ends, graph, false)) {
                    absorbIntoBody(groups, i);
                    break;
                }
            }
        }
    }

    private static boolean isIncomplete(String activity, Set<String> boundary, DirectlyFollowsGraph graph,
                                        boolean outgoing) {
        boolean any = false;
        boolean all = true;
        for (String b : boundary) {
            boolean connected = outgoing ? graph.hasEdge(activity, b) : graph.hasEdge(b, activity);
            any |= connected;
            all &= connected;
        }
        return any && !all;
    }

    private static void absorbIntoBody(List<SortedSet<String>> groups, int index) {
        if (index <= 0) {
            return;
        }
        groups.get(0).addAll(groups.get(index));
        groups.get(index).clear();
    }

    /**
     * Cuts every trace into alternating body and redo slices.
     */
    static final class OverVariants extends LoopCut<VariantLog> {

        @Override
        protected List<VariantLog> project(VariantLog log, List<SortedSet<String>> groups) {
            SortedSet<String> body = groups.get(0);
            List<VariantLog.Builder> builders = new ArrayList<>();
            groups.forEach(g -> builders.add(VariantLog.builder()));
            for (Map.Entry<List<String>, Integer> entry : log.variants().entrySet()) {
                int count = entry.getValue();
                List<String> slice = new ArrayList<>();
                boolean inBody = true;
                for (String activity : entry.getKey()) {
                    boolean bodyActivity = body.contains(activity);
                    if (bodyActivity != inBody) {
                        emit(slice, inBody, groups, builders, count);
                        slice = new ArrayList<>();
                        inBody = bodyActivity;
                    }
                    slice.add(activity);
                }
                emit(slice, inBody, groups, builders, count);
                if (!inBody) {
                    builders.get(0).add(List.of(), count);
                }
            }
            return builders.stream().map(VariantLog.Builder::build).toList();
        }

        private static void emit(List<String> slice, boolean inBody, List<SortedSet<String>> groups,
                                 List<VariantLog.Builder> builders, int count) {
            if (inBody) {
                builders.get(0).add(slice, count);
                return;
            }
            int best = 1;
            long bestOverlap = -1;
            for (int i = 1; i < groups.size(); i++) {
                SortedSet<String> group = groups.get(i);
                long overlap = slice.stream().filter(group::contains).count();
                if (overlap >= bestOverlap) {
                    best = i;
                    bestOverlap = overlap;
                }
            }
            SortedSet<String> chosen = groups.get(best);
            builders.get(best).add(slice.stream().filter(chosen::contains).toList(), count);
        }
    }

    /**
     * Body keeps the log's start and end activities; redo groups start where the body is left
     * and end where the body is re-entered.
     */
    static final class OverGraph extends LoopCut<DirectlyFollowsLog> {

        @Override
        protected List<DirectlyFollowsLog> project(DirectlyFollowsLog log, List<SortedSet<String>> groups) {
            DirectlyFollowsGraph graph = log.graph();
            SortedSet<String> body = groups.get(0);
            List<DirectlyFollowsLog> result = new ArrayList<>();
            result.add(new DirectlyFollowsLog(graph.induced(body), false));

            boolean directRepeat = false;
            for (String end : graph.endActivities().keySet()) {
                for (String start : graph.startActivities().keySet()) {
                    directRepeat |= graph.hasEdge(end, start);
                }
            }

            for (int i = 1; i < groups.size(); i++) {
                SortedSet<String> group = groups.get(i);
                DirectlyFollowsGraph.Builder builder = DirectlyFollowsGraph.builder();
                graph.edges().forEach((edge, w) -> {
                    boolean sourceIn = group.contains(edge.source());
                    boolean targetIn = group.contains(edge.target());
                    if (sourceIn && targetIn) {
                        builder.addEdge(edge.source(), edge.target(), w);
                    } else if (targetIn && body.contains(edge.source())) {
                        builder.addStart(edge.target(), w);
                    } else if (sourceIn && body.contains(edge.target())) {
                        builder.addEnd(edge.source(), w);
                    }
                });
                result.add(new DirectlyFollowsLog(builder.build(), i == 1 && directRepeat));
            }
            return result;
        }
    }
}
