package com.raditha.inductive.engine;

import com.raditha.inductive.basecase.BaseCaseEvaluator;
import com.raditha.inductive.metrics.MiningStatistics;
import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Recursive discovery for one abstraction form.
 * <p>
 * Each call splits off empty traces, then tries the base cases, then the cuts, then the
 * fall-throughs, and mines every resulting sub-abstraction the same way. Sub-trees are folded
 * into canonical form as they are assembled.
 * <p>
 * In forking mode sibling sub-abstractions are mined as fork/join tasks; the caller must then
 * start from {@link #task(LogAbstraction)} inside a {@link java.util.concurrent.ForkJoinPool}.
 */
class RecursionEngine<T extends LogAbstraction> {

    private static final Logger logger = LoggerFactory.getLogger(RecursionEngine.class);

    private final MiningStrategy<T> strategy;
    private final MiningStatistics statistics;
    private final boolean forking;

    RecursionEngine(MiningStrategy<T> strategy, MiningStatistics statistics, boolean forking) {
        this.strategy = strategy;
        this.statistics = statistics;
        this.forking = forking;
    }

    ProcessTree mine(T abstraction) {
        return mine(abstraction, 0);
    }

    RecursiveTask<ProcessTree> task(T abstraction) {
        return new MiningTask(abstraction, 0);
    }

    private ProcessTree mine(T abstraction, int depth) {
        if (abstraction.containsEmptyTraces() && strategy.onlyEmptyTraces().test(abstraction)) {
            record(MiningStep.EMPTY_TRACES, depth, abstraction);
            return ProcessTree.silent();
        }

        CutResult<T> split = null;
        if (abstraction.containsEmptyTraces()) {
            split = strategy.emptyTraces().apply(abstraction).orElse(null);
        }
        if (split == null) {
            Optional<BaseCaseEvaluator.Hit> hit = strategy.baseCases().evaluate(abstraction);
            if (hit.isPresent()) {
                record(hit.get().step(), depth, abstraction);
                return hit.get().leaf();
            }
            split = strategy.cutFinder().find(abstraction)
                    .orElseGet(() -> strategy.fallThroughs().resolve(abstraction));
        }
        record(split.step(), depth, abstraction);

        List<ProcessTree> children = mineChildren(split.children(), depth + 1);
        return ModelAssembler.fold(split.operator(), children);
    }

    private List<ProcessTree> mineChildren(List<T> children, int depth) {
        List<ProcessTree> trees = new ArrayList<>();
        if (forking && children.size() > 1) {
            List<MiningTask> tasks = new ArrayList<>();
            for (T child : children) {
                tasks.add(new MiningTask(child, depth));
            }
            ForkJoinTask.invokeAll(tasks);
            for (MiningTask task : tasks) {
                trees.add(task.join());
            }
            return trees;
        }
        for (T child : children) {
            trees.add(mine(child, depth));
        }
        return trees;
    }

    private void record(MiningStep step, int depth, T abstraction) {
        statistics.record(step, depth);
        if (logger.isDebugEnabled()) {
            logger.debug("{}{} over {} activities", "  ".repeat(depth), step.displayName(),
                    abstraction.alphabet().size());
        }
    }

    private class MiningTask extends RecursiveTask<ProcessTree> {
        private final transient T abstraction;
        private final int depth;

        MiningTask(T abstraction, int depth) {
            this.abstraction = abstraction;
            this.depth = depth;
        }

        @Override
        protected ProcessTree compute() {
            return mine(abstraction, depth);
        }
    }
}
