package com.raditha.inductive.engine;

import com.raditha.inductive.abstraction.AbstractionValidator;
import com.raditha.inductive.abstraction.LogAbstractions;
import com.raditha.inductive.config.MinerConfig;
import com.raditha.inductive.config.MinerVariant;
import com.raditha.inductive.metrics.MiningReport;
import com.raditha.inductive.metrics.MiningStatistics;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.ProcessTree;
import com.raditha.inductive.model.VariantLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ForkJoinPool;

/**
 * Discovers a process tree from a log abstraction.
 * <p>
 * The abstraction is validated once, then handed to the recursion for the configured variant:
 * <ul>
 *   <li>{@link MinerVariant#IM} mines a {@link VariantLog}; a {@link DirectlyFollowsLog} is rejected</li>
 *   <li>{@link MinerVariant#IMD} mines a {@link DirectlyFollowsLog}; a {@link VariantLog} is first
 *       summarised into its directly-follows graph</li>
 * </ul>
 * Instances are immutable and may be shared between threads.
 */
public class InductiveMiner {

    private static final Logger logger = LoggerFactory.getLogger(InductiveMiner.class);

    private final MinerConfig config;

    public InductiveMiner() {
        this(MinerConfig.defaults());
    }

    public InductiveMiner(MinerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public MinerConfig config() {
        return config;
    }

    /**
     * Mine an abstraction into a process tree.
     *
     * @throws com.raditha.inductive.model.MalformedAbstractionException if the abstraction is not well formed
     * @throws UnsupportedAbstractionException if the configured variant cannot mine this abstraction
     */
    public ProcessTree mine(LogAbstraction abstraction) {
        return mineWithReport(abstraction).tree();
    }

    /**
     * Mine an abstraction and report how the tree was obtained.
     */
    public MiningReport mineWithReport(LogAbstraction abstraction) {
        AbstractionValidator.validate(abstraction);
        long start = System.nanoTime();
        MiningStatistics statistics = new MiningStatistics();

        ProcessTree tree;
        if (config.variant() == MinerVariant.IM) {
            if (!(abstraction instanceof VariantLog log)) {
                throw new UnsupportedAbstractionException(
                        "The IM variant needs a variant log; use IMD to mine a directly-follows graph");
            }
            tree = run(MiningStrategy.forVariants(config), log, statistics);
        } else {
            DirectlyFollowsLog graph = abstraction instanceof VariantLog log
                    ? LogAbstractions.toDirectlyFollows(log)
                    : (DirectlyFollowsLog) abstraction;
            tree = run(MiningStrategy.forGraphs(config), graph, statistics);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        logger.info("Mined {} activities into a tree of {} nodes in {} ms ({} steps)",
                abstraction.alphabet().size(), tree.size(), elapsed.toMillis(), statistics.total());
        return MiningReport.of(tree, config.variant(), abstraction.alphabet().size(), statistics, elapsed);
    }

    private <T extends LogAbstraction> ProcessTree run(MiningStrategy<T> strategy, T abstraction,
                                                       MiningStatistics statistics) {
        if (!config.isParallel()) {
            return new RecursionEngine<>(strategy, statistics, false).mine(abstraction);
        }
        RecursionEngine<T> engine = new RecursionEngine<>(strategy, statistics, true);
        ForkJoinPool pool = new ForkJoinPool(config.parallelism());
        try {
            return pool.invoke(engine.task(abstraction));
        } finally {
            pool.shutdown();
        }
    }
}
