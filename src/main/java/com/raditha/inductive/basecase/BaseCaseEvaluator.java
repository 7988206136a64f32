package com.raditha.inductive.basecase;

import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;
import com.raditha.inductive.model.VariantLog;

import java.util.List;
import java.util.Optional;

/**
 * Applies the base cases in order and stops at the first that produces a leaf.
 * The empty-log rule always comes before the single-activity rule.
 *
 * @param <T> abstraction form
 */
public class BaseCaseEvaluator<T extends LogAbstraction> {

    private final List<BaseCase<T>> baseCases;

    public BaseCaseEvaluator(List<BaseCase<T>> baseCases) {
        this.baseCases = List.copyOf(baseCases);
    }

    public static BaseCaseEvaluator<VariantLog> forVariants() {
        List<BaseCase<VariantLog>> rules = List.of(new EmptyLogBaseCase<VariantLog>(), SingleActivityBaseCase.overVariants());
        return new BaseCaseEvaluator<>(rules);
    }

    public static BaseCaseEvaluator<DirectlyFollowsLog> forGraphs() {
        List<BaseCase<DirectlyFollowsLog>> rules = List.of(new EmptyLogBaseCase<DirectlyFollowsLog>(), SingleActivityBaseCase.overGraph());
        return new BaseCaseEvaluator<>(rules);
    }

    /**
     * @return the leaf and the rule that produced it, or empty if no rule holds
     */
    public Optional<Hit> evaluate(T abstraction) {
        for (BaseCase<T> baseCase : baseCases) {
            Optional<ProcessTree> leaf = baseCase.apply(abstraction);
            if (leaf.isPresent()) {
                return Optional.of(new Hit(leaf.get(), baseCase.step()));
            }
        }
        return Optional.empty();
    }

    public List<BaseCase<T>> baseCases() {
        return baseCases;
    }

    /**
     * A leaf produced by a base case.
     */
    public record Hit(ProcessTree leaf, MiningStep step) {
    }
}
