package com.raditha.inductive.fallthrough;

import com.raditha.inductive.abstraction.LogAbstractions;
import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.List;
import java.util.Optional;

/**
 * Last resort: every activity may occur any number of times, in any order.
 * Produces {@code loop(silent, choice over all activities)} and always applies to a non-empty alphabet.
 */
public final class FlowerModelFallThrough {

    private FlowerModelFallThrough() {
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
            return MiningStep.FLOWER_MODEL;
        }

        @Override
        public Optional<CutResult<VariantLog>> apply(VariantLog log) {
            if (log.alphabet().isEmpty()) {
                return Optional.empty();
            }
            VariantLog.Builder redo = VariantLog.builder();
            log.alphabet().forEach(activity -> redo.add(List.of(activity), 1));
            return Optional.of(new CutResult<>(Operator.LOOP, List.of(VariantLog.empty(), redo.build()), step()));
        }
    }

    static final class OverGraph implements FallThrough<DirectlyFollowsLog> {

        @Override
        public MiningStep step() {
            return MiningStep.FLOWER_MODEL;
        }

        @Override
        public Optional<CutResult<DirectlyFollowsLog>> apply(DirectlyFollowsLog log) {
            if (log.alphabet().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new CutResult<>(Operator.LOOP,
                    List.of(DirectlyFollowsLog.empty(), LogAbstractions.isolatedActivities(log.alphabet())), step()));
        }
    }
}
