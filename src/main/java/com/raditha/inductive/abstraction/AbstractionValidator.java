package com.raditha.inductive.abstraction;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.LogAbstraction;
import com.raditha.inductive.model.MalformedAbstractionException;
import com.raditha.inductive.model.VariantLog;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Checks an abstraction once, before mining starts.
 * Label and weight checks already happen when the records are built; this adds the
 * checks that need the whole abstraction or a caller-declared alphabet.
 */
public final class AbstractionValidator {

    private AbstractionValidator() {
    }

    /**
     * Validate an abstraction without a declared alphabet.
     *
     * @throws MalformedAbstractionException if the abstraction cannot be mined
     */
    public static void validate(LogAbstraction abstraction) {
        validate(abstraction, null);
    }

    /**
     * Validate an abstraction against the alphabet declared by the caller.
     *
     * @param abstraction      the abstraction to check
     * @param declaredAlphabet labels the caller expects, or {@code null} to skip this check
     * @throws MalformedAbstractionException if the abstraction cannot be mined
     */
    public static void validate(LogAbstraction abstraction, Set<String> declaredAlphabet) {
        if (abstraction == null) {
            throw new MalformedAbstractionException("abstraction cannot be null");
        }
        if (abstraction instanceof DirectlyFollowsLog dfl) {
            checkGraph(dfl.graph());
        }
        checkCapacity(abstraction);
        if (declaredAlphabet != null) {
            checkDeclaredAlphabet(abstraction.alphabet(), declaredAlphabet);
        }
    }

    private static void checkGraph(DirectlyFollowsGraph graph) {
        if (graph.isEmpty()) {
            return;
        }
        if (graph.startActivities().isEmpty()) {
            throw new MalformedAbstractionException("Directly-follows graph has activities but no start activity");
        }
        if (graph.endActivities().isEmpty()) {
            throw new MalformedAbstractionException("Directly-follows graph has activities but no end activity");
        }
    }

    /**
     * Every count the recursion derives (a projected multiplicity, a sub-graph weight) is bounded
     * by these totals, so mining can never overflow once they fit in an int.
     */
    private static void checkCapacity(LogAbstraction abstraction) {
        long total;
        if (abstraction instanceof VariantLog log) {
            total = log.totalTraces() + log.totalEvents();
        } else {
            total = abstraction.directlyFollowsGraph().totalWeight();
        }
        if (total > Integer.MAX_VALUE) {
            throw new MalformedAbstractionException(
                    "Log too large: " + total + " traces, events and weights exceed " + Integer.MAX_VALUE);
        }
    }

    private static void checkDeclaredAlphabet(SortedSet<String> used, Set<String> declared) {
        SortedSet<String> undeclared = new TreeSet<>(used);
        undeclared.removeAll(declared);
        if (!undeclared.isEmpty()) {
            throw new MalformedAbstractionException("Activities " + undeclared + " are not in the declared alphabet");
        }
        SortedSet<String> unused = new TreeSet<>(declared);
        unused.removeAll(used);
        if (!unused.isEmpty()) {
            throw new MalformedAbstractionException("Declared activities " + unused + " never occur");
        }
    }
}
