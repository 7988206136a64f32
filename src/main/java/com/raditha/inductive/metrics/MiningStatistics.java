package com.raditha.inductive.metrics;

import com.raditha.inductive.model.MiningStep;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts the steps taken while mining one abstraction.
 * Safe to update from several worker threads.
 */
public class MiningStatistics {

    private final Map<MiningStep, AtomicInteger> counts = new ConcurrentHashMap<>();
    private final AtomicInteger maxDepth = new AtomicInteger();

    public void record(MiningStep step, int depth) {
        counts.computeIfAbsent(step, s -> new AtomicInteger()).incrementAndGet();
        maxDepth.accumulateAndGet(depth, Math::max);
    }

    public int count(MiningStep step) {
        AtomicInteger count = counts.get(step);
        return count == null ? 0 : count.get();
    }

    public int count(MiningStep.Kind kind) {
        int total = 0;
        for (MiningStep step : MiningStep.values()) {
            if (step.kind() == kind) {
                total += count(step);
            }
        }
        return total;
    }

    public int total() {
        return counts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    /**
     * Deepest recursion level reached; the root call is level 0.
     */
    public int maxDepth() {
        return maxDepth.get();
    }

    /**
     * Counts of every step, zero counts included, in declaration order.
     */
    public Map<MiningStep, Integer> snapshot() {
        Map<MiningStep, Integer> result = new EnumMap<>(MiningStep.class);
        for (MiningStep step : MiningStep.values()) {
            result.put(step, count(step));
        }
        return result;
    }

    /**
     * Whether the model needed the flower fallback anywhere.
     */
    public boolean usedFlowerModel() {
        return count(MiningStep.FLOWER_MODEL) > 0;
    }
}
