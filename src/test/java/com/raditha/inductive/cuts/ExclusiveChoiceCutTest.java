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

class ExclusiveChoiceCutTest {

    @Test
    void testDisconnectedActivitiesAreAlternatives() {
        VariantLog log = VariantLog.builder()
                .add(2, "c", "d")
                .add("a", "b")
                .add("e")
                .build();

        CutResult<VariantLog> cut = ExclusiveChoiceCut.overVariants().apply(log).orElseThrow();

        assertEquals(Operator.EXCLUSIVE_CHOICE, cut.operator());
        assertEquals(3, cut.children().size());
        assertEquals(Set.of("a", "b"), cut.children().get(0).alphabet());
        assertEquals(Set.of("c", "d"), cut.children().get(1).alphabet());
        assertEquals(Set.of("e"), cut.children().get(2).alphabet());
        assertEquals(2, cut.children().get(1).multiplicity(List.of("c", "d")));
    }

    @Test
    void testConnectedLogHasNoChoice() {
        VariantLog log = VariantLog.builder().add("a", "b").add("b", "c").build();
        assertTrue(ExclusiveChoiceCut.overVariants().apply(log).isEmpty());
    }

    @Test
    void testSingleActivityHasNoChoice() {
        VariantLog log = VariantLog.builder().add("a", "a").build();
        assertTrue(ExclusiveChoiceCut.overVariants().apply(log).isEmpty());
    }

    @Test
    void testGraphProjectionKeepsInducedGraphs() {
        DirectlyFollowsLog dfl = LogAbstractions.toDirectlyFollows(
                VariantLog.builder().add(3, "a", "b").add("c").build());

        CutResult<DirectlyFollowsLog> cut = ExclusiveChoiceCut.overGraph().apply(dfl).orElseThrow();

        assertEquals(2, cut.children().size());
        DirectlyFollowsLog left = cut.children().get(0);
        assertEquals(3, left.graph().weight("a", "b"));
        assertEquals(Set.of("a"), left.graph().startActivities().keySet());
        assertEquals(Set.of("b"), left.graph().endActivities().keySet());
        assertEquals(Set.of("c"), cut.children().get(1).alphabet());
        assertFalse(cut.children().get(1).containsEmptyTraces());
    }
}
