package com.raditha.inductive.cuts;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.VariantLog;

import java.util.List;
import java.util.Optional;

/**
 * Tries the cuts in priority order: exclusive choice, sequence, concurrency, loop.
 * The first cut that applies wins and the remaining ones are not evaluated.
 *
 * @param <T> abstraction form
 */
public class CutFinder<T extends LogAbstraction> {

    private final List<Cut<T>> cuts;

    public CutFinder(List<Cut<T>> cuts) {
        this.cuts = List.copyOf(cuts);
    }

    /**
     * Cut chain for variant logs.
     *
     * @param strictSequence      whether start and end activities must stay in the outer sequence groups
     * @param minimumSelfDistance whether self-distance witnesses prevent concurrency
     */
    public static CutFinder<VariantLog> forVariants(boolean strictSequence, boolean minimumSelfDistance) {
        return new CutFinder<>(List.of(
                ExclusiveChoiceCut.overVariants(),
                SequenceCut.overVariants(strictSequence),
                ConcurrencyCut.overVariants(minimumSelfDistance),
                LoopCut.overVariants()));
    }

    public static CutFinder<DirectlyFollowsLog> forGraphs(boolean strictSequence) {
        return new CutFinder<>(List.of(
                ExclusiveChoiceCut.overGraph(),
                SequenceCut.overGraph(strictSequence),
                ConcurrencyCut.overGraph(),
                LoopCut.overGraph()));
    }

    public Optional<CutResult<T>> find(T abstraction) {
        for (Cut<T> cut : cuts) {
            Optional<CutResult<T>> result = cut.apply(abstraction);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    public List<Cut<T>> cuts() {
        return cuts;
    }
}
