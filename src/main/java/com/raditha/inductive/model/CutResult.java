package com.raditha.inductive.model;

import java.util.List;

/**
 * Operator chosen for a sub-problem together with the projected child abstractions.
 * Child {@code i} of the resulting tree is mined from {@code children().get(i)}.
 *
 * @param operator the operator of the node to build
 * @param children projected abstractions, one per partition group, in child order
 * @param step     the base case, cut or fall-through that produced this result
 * @param <T>      abstraction form, preserved by every projection
 */
public record CutResult<T extends LogAbstraction>(Operator operator, List<T> children, MiningStep step) {

    public CutResult {
        if (operator == null) {
            throw new IllegalArgumentException("operator cannot be null");
        }
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("A cut needs at least one child abstraction");
        }
        children = List.copyOf(children);
    }
}
