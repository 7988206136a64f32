package com.raditha.inductive.model;

import java.util.SortedSet;

/**
 * Directly-follows abstraction of a log.
 * Empty traces leave no trace in the graph, so they are recorded by a separate flag.
 *
 * @param graph               the directly-follows graph with start and end weights
 * @param containsEmptyTraces whether the summarised log holds at least one empty trace
 */
public record DirectlyFollowsLog(DirectlyFollowsGraph graph, boolean containsEmptyTraces)
        implements LogAbstraction {

    public DirectlyFollowsLog {
        if (graph == null) {
            throw new MalformedAbstractionException("graph cannot be null");
        }
    }

    public DirectlyFollowsLog(DirectlyFollowsGraph graph) {
        this(graph, false);
    }

    public static DirectlyFollowsLog empty() {
        return new DirectlyFollowsLog(DirectlyFollowsGraph.empty(), false);
    }

    @Override
    public SortedSet<String> alphabet() {
        return graph.alphabet();
    }

    @Override
    public DirectlyFollowsGraph directlyFollowsGraph() {
        return graph;
    }

    @Override
    public boolean isEmpty() {
        return graph.isEmpty() && !containsEmptyTraces;
    }

    public DirectlyFollowsLog withoutEmptyTraces() {
        return containsEmptyTraces ? new DirectlyFollowsLog(graph, false) : this;
    }
}
