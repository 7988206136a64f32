package com.raditha.inductive.cuts;

import com.raditha.inductive.abstraction.LogAbstractions;
import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyCutTest {

    @Test
    void testInterleavedActivities() {
        VariantLog log = VariantLog.builder().add(2, "a", "b").add(2, "b", "a").build();

        CutResult<VariantLog> cut = ConcurrencyCut.overVariants(true).apply(log).orElseThrow();

        assertEquals(Operator.CONCURRENT, cut.operator());
        assertEquals(2, cut.children().size());
        assertEquals(4, cut.children().get(0).multiplicity(List.of("a")));
        assertEquals(4, cut.children().get(1).multiplicity(List.of("b")));
    }

    @Test
    void testOneDirectionOnlyIsNotConcurrent() {
        VariantLog log = VariantLog.builder().add("a", "b").build();
        assertTrue(ConcurrencyCut.overVariants(true).apply(log).isEmpty());
    }

    @Test
    void testSelfDistanceWitnessPreventsConcurrency() {
        VariantLog log = VariantLog.builder().add("a", "b", "a").add("b", "a", "b").build();

        assertTrue(ConcurrencyCut.overVariants(true).apply(log).isEmpty());
        assertTrue(ConcurrencyCut.overVariants(false).apply(log).isPresent());
    }

    @Test
    void testGroupWithoutStartIsAbsorbed() {
        VariantLog log = VariantLog.builder()
                .add("a", "b", "c")
                .add("b", "a", "c")
                .add("a", "c", "b")
                .add("b", "c", "a")
                .build();

        CutResult<VariantLog> cut = ConcurrencyCut.overVariants(true).apply(log).orElseThrow();

        assertEquals(2, cut.children().size());
        assertEquals(Set.of("a"), cut.children().get(0).alphabet());
        assertEquals(Set.of("b", "c"), cut.children().get(1).alphabet());
    }

    @Test
    void testGraphProjection() {
        DirectlyFollowsLog dfl = LogAbstractions.toDirectlyFollows(
                VariantLog.builder().add("a", "b").add("b", "a").build());

        CutResult<DirectlyFollowsLog> cut = ConcurrencyCut.overGraph().apply(dfl).orElseThrow();

        assertEquals(2, cut.children().size());
        DirectlyFollowsLog left = cut.children().get(0);
        assertTrue(left.graph().edges().isEmpty());
        assertEquals(Set.of("a"), left.graph().startActivities().keySet());
        assertEquals(Set.of("a"), left.graph().endActivities().keySet());
    }

    @Test
    void testGraphProjectionKeepsActivitiesReachedOnlyFromOtherGroups() {
        DirectlyFollowsLog dfl = LogAbstractions.toDirectlyFollows(
                VariantLog.builder().add("a", "b", "c", "b", "a").add("b", "a", "b").build());

        CutResult<DirectlyFollowsLog> cut = ConcurrencyCut.overGraph().apply(dfl).orElseThrow();

        assertEquals(2, cut.children().size());
        assertEquals(Set.of("b"), cut.children().get(0).alphabet());
        DirectlyFollowsLog choice = cut.children().get(1);
        assertEquals(Set.of("a", "c"), choice.alphabet());
        assertTrue(choice.graph().isStart("c"));
        assertTrue(choice.graph().isEnd("c"));
    }
}
