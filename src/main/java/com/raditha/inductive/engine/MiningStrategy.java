package com.raditha.inductive.engine;

import com.raditha.inductive.basecase.BaseCaseEvaluator;
import com.raditha.inductive.config.MinerConfig;
import com.raditha.inductive.cuts.CutFinder;
import com.raditha.inductive.fallthrough.EmptyTracesFallThrough;
import com.raditha.inductive.fallthrough.FallThrough;
import com.raditha.inductive.fallthrough.FallThroughResolver;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.VariantLog;

import java.util.function.Predicate;

/**
 * The components the recursion uses for one abstraction form.
 *
 * @param baseCases       terminal sub-problem detectors
 * @param cutFinder       structural cuts in priority order
 * @param fallThroughs    heuristics for when no cut applies
 * @param emptyTraces     split applied before anything else when empty traces are present
 * @param onlyEmptyTraces whether an abstraction holds empty traces and nothing else
 * @param <T>             abstraction form
 */
public record MiningStrategy<T extends LogAbstraction>(
        BaseCaseEvaluator<T> baseCases,
        CutFinder<T> cutFinder,
        FallThroughResolver<T> fallThroughs,
        FallThrough<T> emptyTraces,
        Predicate<T> onlyEmptyTraces) {

    public static MiningStrategy<VariantLog> forVariants(MinerConfig config) {
        CutFinder<VariantLog> cutFinder = CutFinder.forVariants(config.strictSequenceCut(),
                config.minimumSelfDistance());
        return new MiningStrategy<>(
                BaseCaseEvaluator.forVariants(),
                cutFinder,
                FallThroughResolver.forVariants(cutFinder, config.disableFallThroughs()),
                EmptyTracesFallThrough.overVariants(),
                VariantLog::onlyEmptyTraces);
    }

    public static MiningStrategy<DirectlyFollowsLog> forGraphs(MinerConfig config) {
        return new MiningStrategy<>(
                BaseCaseEvaluator.forGraphs(),
                CutFinder.forGraphs(config.strictSequenceCut()),
                FallThroughResolver.forGraphs(config.disableFallThroughs()),
                EmptyTracesFallThrough.overGraph(),
                log -> log.containsEmptyTraces() && log.graph().isEmpty());
    }
}
