package com.raditha.inductive.basecase;

import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;

import java.util.Optional;

/**
 * A terminal sub-problem detector.
 *
 * @param <T> abstraction form the detector understands
 */
public interface BaseCase<T extends LogAbstraction> {

    MiningStep step();

    /**
     * @return the leaf for this sub-problem, or empty if the rule does not hold
     */
    Optional<ProcessTree> apply(T abstraction);
}
