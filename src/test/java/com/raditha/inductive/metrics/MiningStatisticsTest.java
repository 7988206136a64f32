package com.raditha.inductive.metrics;

import com.raditha.inductive.model.MiningStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class MiningStatisticsTest {

    private MiningStatistics statistics;

    @BeforeEach
    void setUp() {
        statistics = new MiningStatistics();
    }

    @Test
    void testCounts() {
        statistics.record(MiningStep.SEQUENCE_CUT, 0);
        statistics.record(MiningStep.SINGLE_ACTIVITY, 1);
        statistics.record(MiningStep.SINGLE_ACTIVITY, 3);
        statistics.record(MiningStep.TAU_LOOP, 2);

        assertEquals(2, statistics.count(MiningStep.SINGLE_ACTIVITY));
        assertEquals(0, statistics.count(MiningStep.LOOP_CUT));
        assertEquals(2, statistics.count(MiningStep.Kind.BASE_CASE));
        assertEquals(1, statistics.count(MiningStep.Kind.FALL_THROUGH));
        assertEquals(4, statistics.total());
        assertEquals(3, statistics.maxDepth());
        assertFalse(statistics.usedFlowerModel());
    }

    @Test
    void testSnapshotListsEveryStep() {
        statistics.record(MiningStep.FLOWER_MODEL, 0);

        Map<MiningStep, Integer> snapshot = statistics.snapshot();

        assertEquals(MiningStep.values().length, snapshot.size());
        assertEquals(1, snapshot.get(MiningStep.FLOWER_MODEL));
        assertEquals(0, snapshot.get(MiningStep.EMPTY_LOG));
        assertTrue(statistics.usedFlowerModel());
    }

    @Test
    void testConcurrentUpdates() {
        IntStream.range(0, 1000).parallel()
                .forEach(i -> statistics.record(MiningStep.CONCURRENCY_CUT, i % 7));

        assertEquals(1000, statistics.count(MiningStep.CONCURRENCY_CUT));
        assertEquals(6, statistics.maxDepth());
    }
}
