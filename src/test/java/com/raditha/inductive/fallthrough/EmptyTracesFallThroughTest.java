package com.raditha.inductive.fallthrough;

import com.raditha.inductive.abstraction.LogAbstractions;
import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmptyTracesFallThroughTest {

    @Test
    void testSplitsOffEmptyTraces() {
        VariantLog log = VariantLog.builder().add(List.of(), 2).add("a", "b").build();

        CutResult<VariantLog> result = EmptyTracesFallThrough.overVariants().apply(log).orElseThrow();

        assertEquals(Operator.EXCLUSIVE_CHOICE, result.operator());
        assertTrue(result.children().get(0).isEmpty());
        assertEquals(VariantLog.builder().add("a", "b").build(), result.children().get(1));
    }

    @Test
    void testNotApplicable() {
        assertTrue(EmptyTracesFallThrough.overVariants()
                .apply(VariantLog.builder().add("a").build()).isEmpty());
        assertTrue(EmptyTracesFallThrough.overVariants()
                .apply(VariantLog.builder().add(List.of(), 1).build()).isEmpty());
    }

    @Test
    void testGraphSkipFlag() {
        DirectlyFollowsLog dfl = LogAbstractions.toDirectlyFollows(
                VariantLog.builder().add(List.of(), 1).add("a").build());

        CutResult<DirectlyFollowsLog> result = EmptyTracesFallThrough.overGraph().apply(dfl).orElseThrow();

        assertTrue(result.children().get(0).isEmpty());
        assertFalse(result.children().get(1).containsEmptyTraces());
        assertEquals(dfl.graph(), result.children().get(1).graph());
    }
}
