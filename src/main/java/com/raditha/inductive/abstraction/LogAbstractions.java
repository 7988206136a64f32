package com.raditha.inductive.abstraction;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.VariantLog;

import java.util.Collection;
import java.util.List;

/**
 * Conversions from raw traces into the abstractions consumed by the miner.
 */
public final class LogAbstractions {

    private LogAbstractions() {
    }

    /**
     * Variant log of the given traces, each counted once.
     */
    public static VariantLog fromTraces(Collection<? extends List<String>> traces) {
        VariantLog.Builder builder = VariantLog.builder();
        for (List<String> trace : traces) {
            builder.add(trace, 1);
        }
        return builder.build();
    }

    /**
     * Directly-follows summary of a variant log.
     * The skip flag records whether the log held the empty trace.
     */
    public static DirectlyFollowsLog toDirectlyFollows(VariantLog log) {
        return new DirectlyFollowsLog(log.directlyFollowsGraph(), log.containsEmptyTraces());
    }

    public static DirectlyFollowsLog toDirectlyFollows(Collection<? extends List<String>> traces) {
        return toDirectlyFollows(fromTraces(traces));
    }

    /**
     * Graph with every activity both a start and an end activity and no edges.
     * This is the redo part of a directly-follows flower model.
     */
    public static DirectlyFollowsLog isolatedActivities(Collection<String> activities) {
        DirectlyFollowsGraph.Builder builder = DirectlyFollowsGraph.builder();
        for (String activity : activities) {
            builder.addStart(activity).addEnd(activity);
        }
        return new DirectlyFollowsLog(builder.build(), false);
    }
}
