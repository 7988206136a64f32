package com.raditha.inductive.fallthrough;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.List;
import java.util.Optional;

/**
 * Makes the observed behaviour optional when empty traces occur next to non-empty ones:
 * exclusive choice between an empty log, mined to a silent step, and the rest of the log.
 */
public final class EmptyTracesFallThrough {

    private EmptyTracesFallThrough() {
    }

    public static FallThrough<VariantLog> overVariants() {
        return new OverVariants();
    }

    public static FallThrough<DirectlyFollowsLog> overGraph() {
        return new OverGraph();
    }

    static final class OverVariants implements FallThrough<VariantLog> {

        @Override
        public MiningStep step() {
            return MiningStep.EMPTY_TRACES;
        }

        @Override
        public Optional<CutResult<VariantLog>> apply(VariantLog log) {
            if (!log.containsEmptyTraces() || log.onlyEmptyTraces()) {
                return Optional.empty();
            }
            return Optional.of(new CutResult<>(Operator.EXCLUSIVE_CHOICE,
                    List.of(VariantLog.empty(), log.withoutEmptyTraces()), step()));
        }
    }

    static final class OverGraph implements FallThrough<DirectlyFollowsLog> {

        @Override
        public MiningStep step() {
            return MiningStep.EMPTY_TRACES;
        }

        @Override
        public Optional<CutResult<DirectlyFollowsLog>> apply(DirectlyFollowsLog log) {
            if (!log.containsEmptyTraces() || log.graph().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new CutResult<>(Operator.EXCLUSIVE_CHOICE,
                    List.of(DirectlyFollowsLog.empty(), log.withoutEmptyTraces()), step()));
        }
    }
}
