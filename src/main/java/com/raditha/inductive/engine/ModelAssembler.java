package com.raditha.inductive.engine;

import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.ProcessTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Puts discovered trees into canonical form.
 * <ul>
 *   <li>nested sequence, choice and concurrency nodes of the same operator are flattened</li>
 *   <li>silent children of sequence and concurrency nodes are dropped</li>
 *   <li>a choice keeps at most one silent child</li>
 *   <li>non-loop operators with a single child are replaced by that child</li>
 *   <li>choice and concurrency children are sorted by their text form, a silent child first</li>
 * </ul>
 * Loop nodes keep all their children, silent ones included.
 */
public final class ModelAssembler {

    private static final Comparator<ProcessTree> CANONICAL_ORDER = Comparator
            .comparing((ProcessTree t) -> !t.isSilent())
            .thenComparing(ProcessTree::toString);

    private ModelAssembler() {
    }

    /**
     * Canonical form of a whole tree.
     */
    public static ProcessTree assemble(ProcessTree tree) {
        if (tree.isLeaf()) {
            return tree;
        }
        List<ProcessTree> children = new ArrayList<>();
        for (ProcessTree child : tree.children()) {
            children.add(assemble(child));
        }
        return fold(tree.operator(), children);
    }

    /**
     * Builds a node from children that are already in canonical form.
     */
    public static ProcessTree fold(Operator operator, List<ProcessTree> children) {
        if (operator == Operator.LOOP) {
            return ProcessTree.of(operator, children);
        }
        List<ProcessTree> flat = new ArrayList<>();
        boolean silentSeen = false;
        for (ProcessTree child : children) {
            if (child.operator() == operator) {
                flat.addAll(child.children());
            } else {
                flat.add(child);
            }
        }

        List<ProcessTree> kept = new ArrayList<>();
        for (ProcessTree child : flat) {
            if (!child.isSilent()) {
                kept.add(child);
            } else if (operator == Operator.EXCLUSIVE_CHOICE && !silentSeen) {
                kept.add(child);
                silentSeen = true;
            }
        }
        if (kept.isEmpty()) {
            return ProcessTree.silent();
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        if (!operator.isOrderSignificant()) {
            kept.sort(CANONICAL_ORDER);
        }
        return ProcessTree.of(operator, kept);
    }
}
