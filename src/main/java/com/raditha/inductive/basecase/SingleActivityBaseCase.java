package com.raditha.inductive.basecase;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;
import com.raditha.inductive.model.VariantLog;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Detects a sub-problem made of one activity that occurs at most once per trace.
 * Repetitions such as {@code <a,a,a>} do not qualify; they are left to the loop cut.
 */
public final class SingleActivityBaseCase {

    private SingleActivityBaseCase() {
    }

    public static BaseCase<VariantLog> overVariants() {
        return new OverVariants();
    }

    public static BaseCase<DirectlyFollowsLog> overGraph() {
        return new OverGraph();
    }

    /**
     * Alphabet of size one and every trace either empty or exactly that activity.
     */
    static final class OverVariants implements BaseCase<VariantLog> {

        @Override
        public MiningStep step() {
            return MiningStep.SINGLE_ACTIVITY;
        }

        @Override
        public Optional<ProcessTree> apply(VariantLog log) {
            SortedSet<String> alphabet = log.alphabet();
            if (alphabet.size() != 1) {
                return Optional.empty();
            }
            String activity = alphabet.first();
            for (List<String> trace : log.variants().keySet()) {
                if (trace.size() > 1) {
                    return Optional.empty();
                }
            }
            return Optional.of(ProcessTree.activity(activity));
        }
    }

    /**
     * No edges and a single activity among the start and end activities.
     */
    static final class OverGraph implements BaseCase<DirectlyFollowsLog> {

        @Override
        public MiningStep step() {
            return MiningStep.SINGLE_ACTIVITY;
        }

        @Override
        public Optional<ProcessTree> apply(DirectlyFollowsLog log) {
            DirectlyFollowsGraph graph = log.graph();
            if (!graph.edges().isEmpty()) {
                return Optional.empty();
            }
            SortedSet<String> boundary = new TreeSet<>(graph.startActivities().keySet());
            boundary.addAll(graph.endActivities().keySet());
            if (boundary.size() != 1) {
                return Optional.empty();
            }
            return Optional.of(ProcessTree.activity(boundary.first()));
        }
    }
}
