package com.raditha.inductive.fallthrough;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cuts traces where a start activity comes back, and loops over the pieces with a silent redo.
 * The strict form only cuts where the previous activity is also an end activity.
 * Applies when cutting yields more pieces than there were traces.
 */
public class TauLoopFallThrough implements FallThrough<VariantLog> {

    private final boolean strict;

    public TauLoopFallThrough(boolean strict) {
        this.strict = strict;
    }

    public static TauLoopFallThrough strict() {
        return new TauLoopFallThrough(true);
    }

    public static TauLoopFallThrough relaxed() {
        return new TauLoopFallThrough(false);
    }

    @Override
    public MiningStep step() {
        return strict ? MiningStep.STRICT_TAU_LOOP : MiningStep.TAU_LOOP;
    }

    @Override
    public Optional<CutResult<VariantLog>> apply(VariantLog log) {
        DirectlyFollowsGraph graph = log.directlyFollowsGraph();
        VariantLog.Builder pieces = VariantLog.builder();
        for (Map.Entry<List<String>, Integer> entry : log.variants().entrySet()) {
            List<String> trace = entry.getKey();
            List<String> piece = new ArrayList<>();
            for (int i = 0; i < trace.size(); i++) {
                if (i > 0 && isBoundary(graph, trace.get(i - 1), trace.get(i))) {
                    pieces.add(piece, entry.getValue());
                    piece = new ArrayList<>();
                }
                piece.add(trace.get(i));
            }
            pieces.add(piece, entry.getValue());
        }
        VariantLog projected = pieces.build();
        if (projected.totalTraces() <= log.totalTraces()) {
            return Optional.empty();
        }
        return Optional.of(new CutResult<>(Operator.LOOP, List.of(projected, VariantLog.empty()), step()));
    }

    private boolean isBoundary(DirectlyFollowsGraph graph, String previous, String current) {
        return graph.isStart(current) && (!strict || graph.isEnd(previous));
    }
}
