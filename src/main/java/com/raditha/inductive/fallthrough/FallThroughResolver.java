package com.raditha.inductive.fallthrough;

import com.raditha.inductive.cuts.CutFinder;
import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.VariantLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies the fall-throughs in order; the flower model at the end always applies.
 *
 * @param <T> abstraction form
 */
public class FallThroughResolver<T extends LogAbstraction> {

    private final List<FallThrough<T>> fallThroughs;

    public FallThroughResolver(List<FallThrough<T>> fallThroughs) {
        this.fallThroughs = List.copyOf(fallThroughs);
    }

    /**
     * Fall-throughs for variant logs.
     *
     * @param cutFinder cut chain used to test whether removing an activity helps
     * @param flowerOnly whether every heuristic but the flower model is disabled
     */
    public static FallThroughResolver<VariantLog> forVariants(CutFinder<VariantLog> cutFinder, boolean flowerOnly) {
        List<FallThrough<VariantLog>> chain = new ArrayList<>();
        if (!flowerOnly) {
            chain.add(EmptyTracesFallThrough.overVariants());
            chain.add(new ActivityOncePerTraceFallThrough());
            chain.add(new ActivityConcurrentFallThrough(cutFinder));
            chain.add(TauLoopFallThrough.strict());
            chain.add(TauLoopFallThrough.relaxed());
        }
        chain.add(FlowerModelFallThrough.overVariants());
        return new FallThroughResolver<>(chain);
    }

    public static FallThroughResolver<DirectlyFollowsLog> forGraphs(boolean flowerOnly) {
        List<FallThrough<DirectlyFollowsLog>> chain = new ArrayList<>();
        if (!flowerOnly) {
            chain.add(EmptyTracesFallThrough.overGraph());
        }
        chain.add(FlowerModelFallThrough.overGraph());
        return new FallThroughResolver<>(chain);
    }

    /**
     * @throws IllegalStateException if no fall-through applies, which only happens for an empty alphabet
     */
    public CutResult<T> resolve(T abstraction) {
        for (FallThrough<T> fallThrough : fallThroughs) {
            Optional<CutResult<T>> result = fallThrough.apply(abstraction);
            if (result.isPresent()) {
                return result.get();
            }
        }
        throw new IllegalStateException("No fall-through applies to an abstraction over " + abstraction.alphabet());
    }

    public List<FallThrough<T>> fallThroughs() {
        return fallThroughs;
    }
}
