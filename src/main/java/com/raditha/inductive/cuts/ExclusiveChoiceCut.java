package com.raditha.inductive.cuts;

import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Splits the alphabet into the connected components of the undirected directly-follows graph.
 * Two activities in different components never occur in the same trace.
 */
public abstract class ExclusiveChoiceCut<T extends LogAbstraction> extends AbstractCut<T> {

    public static Cut<VariantLog> overVariants() {
        return new OverVariants();
    }

    public static Cut<DirectlyFollowsLog> overGraph() {
        return new OverGraph();
    }

    @Override
    public MiningStep step() {
        return MiningStep.EXCLUSIVE_CHOICE_CUT;
    }

    @Override
    protected Operator operator() {
        return Operator.EXCLUSIVE_CHOICE;
    }

    @Override
    protected List<SortedSet<String>> partition(T abstraction) {
        return Groups.connectedComponents(abstraction.alphabet(), abstraction.directlyFollowsGraph());
    }

    /**
     * Every trace goes, whole, to the group holding most of its events.
     */
    static final class OverVariants extends ExclusiveChoiceCut<VariantLog> {

        @Override
        protected List<VariantLog> project(VariantLog log, List<SortedSet<String>> groups) {
            List<VariantLog.Builder> builders = new ArrayList<>();
            groups.forEach(g -> builders.add(VariantLog.builder()));
            for (Map.Entry<List<String>, Integer> entry : log.variants().entrySet()) {
                List<String> trace = entry.getKey();
                int best = 0;
                int bestCount = -1;
                for (int i = 0; i < groups.size(); i++) {
                    SortedSet<String> group = groups.get(i);
                    int count = (int) trace.stream().filter(group::contains).count();
                    if (count > bestCount) {
                        best = i;
                        bestCount = count;
                    }
                }
                SortedSet<String> chosen = groups.get(best);
                builders.get(best).add(trace.stream().filter(chosen::contains).toList(), entry.getValue());
            }
            return builders.stream().map(VariantLog.Builder::build).toList();
        }
    }

    /**
     * Each branch keeps the sub-graph induced by its component.
     */
    static final class OverGraph extends ExclusiveChoiceCut<DirectlyFollowsLog> {

        @Override
        protected List<DirectlyFollowsLog> project(DirectlyFollowsLog log, List<SortedSet<String>> groups) {
            return groups.stream()
                    .map(group -> new DirectlyFollowsLog(log.graph().induced(group), false))
                    .toList();
        }
    }
}
