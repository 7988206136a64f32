package com.raditha.inductive.cuts;

import com.raditha.inductive.model.CutResult;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.Operator;
import com.raditha.inductive.model.VariantLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CutFinderTest {

    private Cut<VariantLog> first;
    private Cut<VariantLog> second;
    private Cut<VariantLog> third;
    private final VariantLog log = VariantLog.builder().add("a", "b").build();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        first = mock(Cut.class);
        second = mock(Cut.class);
        third = mock(Cut.class);
    }

    @Test
    void testFirstSuccessWins() {
        CutResult<VariantLog> result = new CutResult<>(Operator.SEQUENCE,
                List.of(VariantLog.builder().add("a").build(), VariantLog.builder().add("b").build()),
                MiningStep.SEQUENCE_CUT);
        when(first.apply(log)).thenReturn(Optional.empty());
        when(second.apply(log)).thenReturn(Optional.of(result));

        Optional<CutResult<VariantLog>> found = new CutFinder<>(List.of(first, second, third)).find(log);

        assertEquals(Optional.of(result), found);
        InOrder order = inOrder(first, second);
        order.verify(first).apply(log);
        order.verify(second).apply(log);
        verifyNoInteractions(third);
    }

    @Test
    void testNoCut() {
        when(first.apply(log)).thenReturn(Optional.empty());
        when(second.apply(log)).thenReturn(Optional.empty());

        assertTrue(new CutFinder<>(List.of(first, second)).find(log).isEmpty());
    }

    @Test
    void testPriorityOrder() {
        List<Cut<VariantLog>> cuts = CutFinder.forVariants(true, true).cuts();

        assertEquals(List.of(MiningStep.EXCLUSIVE_CHOICE_CUT, MiningStep.SEQUENCE_CUT,
                        MiningStep.CONCURRENCY_CUT, MiningStep.LOOP_CUT),
                cuts.stream().map(Cut::step).toList());
        assertEquals(4, CutFinder.forGraphs(false).cuts().size());
    }

    @Test
    void testChoiceBeatsLaterCuts() {
        VariantLog choice = VariantLog.builder().add("a").add("b").build();

        CutResult<VariantLog> cut = CutFinder.forVariants(true, true).find(choice).orElseThrow();

        assertEquals(Operator.EXCLUSIVE_CHOICE, cut.operator());
        assertEquals(MiningStep.EXCLUSIVE_CHOICE_CUT, cut.step());
    }
}
