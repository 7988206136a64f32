package com.raditha.inductive.basecase;

import com.raditha.inductive.model.DirectlyFollowsGraph;
import com.raditha.inductive.model.DirectlyFollowsLog;
import com.raditha.inductive.model.MiningStep;
import com.raditha.inductive.model.ProcessTree;
import com.raditha.inductive.model.VariantLog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BaseCaseEvaluatorTest {

    private final BaseCaseEvaluator<VariantLog> variants = BaseCaseEvaluator.forVariants();
    private final BaseCaseEvaluator<DirectlyFollowsLog> graphs = BaseCaseEvaluator.forGraphs();

    @Test
    void testEmptyLog() {
        Optional<BaseCaseEvaluator.Hit> hit = variants.evaluate(VariantLog.empty());

        assertTrue(hit.isPresent());
        assertEquals(MiningStep.EMPTY_LOG, hit.get().step());
        assertTrue(hit.get().leaf().isSilent());
    }

    @Test
    void testSingleActivity() {
        VariantLog log = VariantLog.builder().add(5, "a").build();
        Optional<BaseCaseEvaluator.Hit> hit = variants.evaluate(log);

        assertTrue(hit.isPresent());
        assertEquals(MiningStep.SINGLE_ACTIVITY, hit.get().step());
        assertEquals(ProcessTree.activity("a"), hit.get().leaf());
    }

    @Test
    void testSingleActivityAllowsEmptyTraces() {
        VariantLog log = VariantLog.builder().add("a").add(List.of(), 2).build();
        assertEquals(ProcessTree.activity("a"), variants.evaluate(log).orElseThrow().leaf());
    }

    @Test
    void testRepeatedActivityIsNotABaseCase() {
        VariantLog log = VariantLog.builder().add("a", "a", "a").build();
        assertTrue(variants.evaluate(log).isEmpty());
    }

    @Test
    void testTwoActivitiesIsNotABaseCase() {
        VariantLog log = VariantLog.builder().add("a").add("b").build();
        assertTrue(variants.evaluate(log).isEmpty());
    }

    @Test
    void testGraphBaseCases() {
        DirectlyFollowsLog single = new DirectlyFollowsLog(DirectlyFollowsGraph.builder()
                .addStart("a").addEnd("a").build());
        DirectlyFollowsLog selfLoop = new DirectlyFollowsLog(DirectlyFollowsGraph.builder()
                .addEdge("a", "a").addStart("a").addEnd("a").build());
        DirectlyFollowsLog twoBoundaries = new DirectlyFollowsLog(DirectlyFollowsGraph.builder()
                .addStart("a").addEnd("b").build());

        assertEquals(MiningStep.EMPTY_LOG, graphs.evaluate(DirectlyFollowsLog.empty()).orElseThrow().step());
        assertEquals(ProcessTree.activity("a"), graphs.evaluate(single).orElseThrow().leaf());
        assertTrue(graphs.evaluate(selfLoop).isEmpty());
        assertTrue(graphs.evaluate(twoBoundaries).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStopsAtFirstMatchingRule() {
        BaseCase<VariantLog> first = mock(BaseCase.class);
        BaseCase<VariantLog> second = mock(BaseCase.class);
        when(first.apply(any())).thenReturn(Optional.of(ProcessTree.silent()));
        when(first.step()).thenReturn(MiningStep.EMPTY_LOG);

        BaseCaseEvaluator<VariantLog> evaluator = new BaseCaseEvaluator<>(List.of(first, second));
        BaseCaseEvaluator.Hit hit = evaluator.evaluate(VariantLog.empty()).orElseThrow();

        assertEquals(MiningStep.EMPTY_LOG, hit.step());
        verify(first).apply(VariantLog.empty());
        verifyNoInteractions(second);
    }

    @Test
    void testRuleOrder() {
        List<BaseCase<VariantLog>> rules = variants.baseCases();
        assertEquals(MiningStep.EMPTY_LOG, rules.get(0).step());
        assertEquals(MiningStep.SINGLE_ACTIVITY, rules.get(1).step());
    }
}
