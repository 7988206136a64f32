package com.raditha.inductive.fallthrough;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Splits off, concurrently, an activity that occurs exactly once in every trace.
 * The first such activity in label order is chosen.
 */
public class ActivityOncePerTraceFallThrough implements FallThrough<VariantLog> {

    @Override
    public MiningStep step() {
        return MiningStep.ACTIVITY_ONCE_PER_TRACE;
    }

    @Override
    public Optional<CutResult<VariantLog>> apply(VariantLog log) {
        if (log.alphabet().size() < 2) {
            return Optional.empty();
        }
        SortedSet<String> candidates = null;
        for (List<String> trace : log.variants().keySet()) {
            Set<String> once = occurringOnce(trace);
            if (candidates == null) {
                candidates = new TreeSet<>(once);
            } else {
                candidates.retainAll(once);
            }
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
        }
        if (candidates == null) {
            return Optional.empty();
        }
        String activity = candidates.first();
        return Optional.of(new CutResult<>(Operator.CONCURRENT,
                List.of(log.project(Set.of(activity)), log.filter(a -> !a.equals(activity))), step()));
    }

    private static Set<String> occurringOnce(List<String> trace) {
        Map<String, Integer> counts = new HashMap<>();
        trace.forEach(a -> counts.merge(a, 1, Integer::sum));
        Set<String> once = new TreeSet<>();
        counts.forEach((a, c) -> {
            if (c == 1) {
                once.add(a);
            }
        });
        return once;
    }
}
