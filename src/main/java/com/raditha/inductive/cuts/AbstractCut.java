package com.raditha.inductive.cuts;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.Operator;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Common shape of the four cuts: find an ordered partition, then project the abstraction on it.
 * Subclasses per abstraction form only differ in how they project.
 */
public abstract class AbstractCut<T extends LogAbstraction> implements Cut<T> {

    protected abstract Operator operator();

    /**
     * Ordered groups of the partition; fewer than two groups means the cut does not apply.
     */
    protected abstract List<SortedSet<String>> partition(T abstraction);

    /**
     * One sub-abstraction per group, in group order.
     */
    protected abstract List<T> project(T abstraction, List<SortedSet<String>> groups);

    @Override
    public Optional<CutResult<T>> apply(T abstraction) {
        List<SortedSet<String>> groups = partition(abstraction);
        if (groups.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new CutResult<>(operator(), project(abstraction, groups), step()));
    }
}
