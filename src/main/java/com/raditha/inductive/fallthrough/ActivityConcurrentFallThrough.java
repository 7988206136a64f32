package com.raditha.inductive.fallthrough;

import com.raditha.inductive.cuts.CutFinder;
import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Looks for an activity whose removal lets a structural cut succeed on the remaining log,
 * and puts that activity in parallel with the rest.
 */
public class ActivityConcurrentFallThrough implements FallThrough<VariantLog> {

    private final CutFinder<VariantLog> cutFinder;

    public ActivityConcurrentFallThrough(CutFinder<VariantLog> cutFinder) {
        this.cutFinder = cutFinder;
    }

    @Override
    public MiningStep step() {
        return MiningStep.ACTIVITY_CONCURRENT;
    }

    @Override
    public Optional<CutResult<VariantLog>> apply(VariantLog log) {
        if (log.alphabet().size() < 2) {
            return Optional.empty();
        }
        for (String activity : log.alphabet()) {
            VariantLog rest = log.filter(a -> !a.equals(activity));
            if (cutFinder.find(rest).isPresent()) {
                return Optional.of(new CutResult<>(Operator.CONCURRENT,
                        List.of(log.project(Set.of(activity)), rest), step()));
            }
        }
        return Optional.empty();
    }
}
