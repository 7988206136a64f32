package com.raditha.inductive.cuts;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MiningStep;

import java.util.Optional;

/**
 * A structural partition of the activity alphabet.
 * A cut never throws when its precondition does not hold; it returns empty instead.
 *
 * @param <T> abstraction form, kept by the projection
 */
public interface Cut<T extends LogAbstraction> {

    MiningStep step();

    Optional<CutResult<T>> apply(T abstraction);
}
