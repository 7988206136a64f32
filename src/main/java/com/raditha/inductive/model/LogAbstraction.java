package com.raditha.inductive.model;

import java.util.SortedSet;

/**
 * Canonical log representation consumed by the miner.
 * The set of forms is closed: a multiset of traces, or a directly-follows summary.
 */
public sealed interface LogAbstraction permits VariantLog, DirectlyFollowsLog {

    /**
     * Distinct activity labels, in label order.
     */
    SortedSet<String> alphabet();

    /**
     * Directly-follows summary of this abstraction.
     * For a variant log it is derived from the traces.
     */
    DirectlyFollowsGraph directlyFollowsGraph();

    /**
     * Whether at least one recorded trace is empty.
     */
    boolean containsEmptyTraces();

    /**
     * Whether the abstraction holds no behaviour at all, not even empty traces.
     */
    boolean isEmpty();
}
