package com.raditha.inductive.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable process tree node.
 * A leaf carries an activity label, or no label for a silent step.
 * An operator node carries an operator and a non-empty, ordered list of children.
 *
 * @param operator operator of an internal node, {@code null} for leaves
 * @param label    activity label of a visible leaf, {@code null} for silent leaves and operators
 * @param children ordered children, empty for leaves
 */
public record ProcessTree(Operator operator, String label, List<ProcessTree> children) {

    private static final ProcessTree SILENT = new ProcessTree(null, null, List.of());

    public ProcessTree {
        children = children == null ? List.of() : List.copyOf(children);
        if (operator == null && !children.isEmpty()) {
            throw new IllegalArgumentException("A leaf cannot have children");
        }
        if (operator != null && children.isEmpty()) {
            throw new IllegalArgumentException("Operator " + operator + " needs at least one child");
        }
        if (operator != null && label != null) {
            throw new IllegalArgumentException("Operator nodes carry no label");
        }
    }

    public static ProcessTree silent() {
        return SILENT;
    }

    public static ProcessTree activity(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Activity label must not be blank");
        }
        return new ProcessTree(null, label, List.of());
    }

    public static ProcessTree of(Operator operator, List<ProcessTree> children) {
        return new ProcessTree(operator, null, children);
    }

    public static ProcessTree of(Operator operator, ProcessTree... children) {
        return of(operator, Arrays.asList(children));
    }

    public boolean isLeaf() {
        return operator == null;
    }

    public boolean isSilent() {
        return operator == null && label == null;
    }

    /**
     * Labels of all visible leaves below (and including) this node.
     */
    public SortedSet<String> activities() {
        SortedSet<String> result = new TreeSet<>();
        collectActivities(this, result);
        return result;
    }

    /**
     * Visible leaf labels in depth-first order, duplicates kept.
     */
    public List<String> leafLabels() {
        List<String> result = new ArrayList<>();
        collectLabels(this, result);
        return result;
    }

    /**
     * Number of nodes in this subtree.
     */
    public int size() {
        return 1 + children.stream().mapToInt(ProcessTree::size).sum();
    }

    private static void collectActivities(ProcessTree node, SortedSet<String> result) {
        if (node.label != null) {
            result.add(node.label);
        }
        node.children.forEach(child -> collectActivities(child, result));
    }

    private static void collectLabels(ProcessTree node, List<String> result) {
        if (node.label != null) {
            result.add(node.label);
        }
        node.children.forEach(child -> collectLabels(child, result));
    }

    /**
     * Canonical text form, e.g. {@code ->( 'a', X( tau, 'b' ) )}.
     */
    @Override
    public String toString() {
        if (isSilent()) {
            return "tau";
        }
        if (isLeaf()) {
            return "'" + label + "'";
        }
        return children.stream()
                .map(ProcessTree::toString)
                .collect(Collectors.joining(", ", operator.symbol() + "( ", " )"));
    }
}
