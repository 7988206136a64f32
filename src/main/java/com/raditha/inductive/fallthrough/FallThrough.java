package com.raditha.inductive.fallthrough;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;

import java.util.Optional;

/**
 * A heuristic used when no structural cut applies.
 *
 * @param <T> abstraction form
 */
public interface FallThrough<T extends LogAbstraction> {

    MiningStep step();

    Optional<CutResult<T>> apply(T abstraction);
}
