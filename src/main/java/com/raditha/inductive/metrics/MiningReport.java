package com.raditha.inductive.metrics;

import com.raditha.inductive.config.MinerVariant;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Result of a mining run: the tree plus how it was obtained.
 *
 * @param tree         the discovered process tree
 * @param variant      abstraction that was mined
 * @param alphabetSize number of distinct activities in the input
 * @param steps        number of times each step was applied
 * @param maxDepth     deepest recursion level
 * @param elapsed      wall-clock mining time
 * @param timestamp    when mining finished
 */
public record MiningReport(
        ProcessTree tree,
        MinerVariant variant,
        int alphabetSize,
        Map<MiningStep, Integer> steps,
        int maxDepth,
        Duration elapsed,
        LocalDateTime timestamp) {

    public MiningReport {
        steps = Map.copyOf(steps);
    }

    public static MiningReport of(ProcessTree tree, MinerVariant variant, int alphabetSize,
                                  MiningStatistics statistics, Duration elapsed) {
        return new MiningReport(tree, variant, alphabetSize, statistics.snapshot(), statistics.maxDepth(),
                elapsed, LocalDateTime.now());
    }

    public int count(MiningStep step) {
        return steps.getOrDefault(step, 0);
    }

    public int count(MiningStep.Kind kind) {
        return steps.entrySet().stream()
                .filter(e -> e.getKey().kind() == kind)
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    public boolean usedFlowerModel() {
        return count(MiningStep.FLOWER_MODEL) > 0;
    }
}
