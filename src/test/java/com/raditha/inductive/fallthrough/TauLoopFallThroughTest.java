package com.raditha.inductive.fallthrough;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TauLoopFallThroughTest {

    @Test
    void testStrictTauLoopOnRepetition() {
        VariantLog log = VariantLog.builder().add("a", "a", "a").build();

        CutResult<VariantLog> result = TauLoopFallThrough.strict().apply(log).orElseThrow();

        assertEquals(Operator.LOOP, result.operator());
        assertEquals(MiningStep.STRICT_TAU_LOOP, result.step());
        assertEquals(3, result.children().get(0).multiplicity(List.of("a")));
        assertTrue(result.children().get(1).isEmpty());
    }

    @Test
    void testRelaxedCutsAtEveryStartActivity() {
        VariantLog log = VariantLog.builder().add("a", "b", "a", "c").build();

        assertTrue(TauLoopFallThrough.strict().apply(log).isEmpty());

        CutResult<VariantLog> result = TauLoopFallThrough.relaxed().apply(log).orElseThrow();
        assertEquals(MiningStep.TAU_LOOP, result.step());
        VariantLog pieces = result.children().get(0);
        assertEquals(1, pieces.multiplicity(List.of("a", "b")));
        assertEquals(1, pieces.multiplicity(List.of("a", "c")));
    }

    @Test
    void testNoRepetition() {
        VariantLog log = VariantLog.builder().add("a", "b").build();
        assertTrue(TauLoopFallThrough.strict().apply(log).isEmpty());
        assertTrue(TauLoopFallThrough.relaxed().apply(log).isEmpty());
    }
}
