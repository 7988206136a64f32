package com.raditha.inductive.basecase;

import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;

import java.util.Optional;

/**
 * A log without traces, or a graph without any activity, is mined to a silent leaf.
 */
public class EmptyLogBaseCase<T extends LogAbstraction> implements BaseCase<T> {

    @Override
    public MiningStep step() {
        return MiningStep.EMPTY_LOG;
    }

    @Override
    public Optional<ProcessTree> apply(T abstraction) {
        if (abstraction.isEmpty()) {
            return Optional.of(ProcessTree.silent());
        }
        return Optional.empty();
    }
}
