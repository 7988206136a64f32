package com.raditha.inductive.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DirectlyFollowsGraphTest {

    private final DirectlyFollowsGraph graph = DirectlyFollowsGraph.builder()
            .addEdge("a", "b", 3)
            .addEdge("b", "c", 2)
            .addEdge("a", "b")
            .addEdge("c", "a")
            .addStart("a", 4)
            .addEnd("c", 4)
            .build();

    @Test
    void testWeightsAccumulate() {
        assertEquals(4, graph.weight("a", "b"));
        assertEquals(0, graph.weight("b", "a"));
        assertTrue(graph.isStart("a"));
        assertTrue(graph.isEnd("c"));
        assertFalse(graph.isStart("c"));
    }

    @Test
    void testNeighbours() {
        assertEquals(Set.of("b"), graph.successors("a"));
        assertEquals(Set.of("c"), graph.predecessors("a"));
        assertEquals(Set.of("a", "b", "c"), graph.alphabet());
        assertEquals(Set.of("b"), graph.successorMap().get("a"));
    }

    @Test
    void testInducedSubgraph() {
        DirectlyFollowsGraph induced = graph.induced(Set.of("a", "b"));

        assertEquals(1, induced.edges().size());
        assertEquals(4, induced.weight("a", "b"));
        assertEquals(Set.of("a"), induced.startActivities().keySet());
        assertTrue(induced.endActivities().isEmpty());
    }

    @Test
    void testProjectedSubgraphKeepsBoundary() {
        DirectlyFollowsGraph projected = graph.projected(Set.of("a", "b"));

        assertEquals(4, projected.weight("a", "b"));
        assertEquals(5, projected.startActivities().get("a"));
        assertEquals(2, projected.endActivities().get("b"));
        assertEquals(Set.of("a", "b"), projected.alphabet());
    }

    @Test
    void testProjectedKeepsActivityWithOnlyOutsideEdges() {
        DirectlyFollowsGraph projected = graph.projected(Set.of("a", "c"));

        assertEquals(Set.of("a", "c"), projected.alphabet());
        assertEquals(1, projected.weight("c", "a"));
        assertTrue(projected.isStart("c"));
        assertTrue(projected.isEnd("a"));
    }

    @Test
    void testTotalWeight() {
        assertEquals(15, graph.totalWeight());
    }

    @Test
    void testWeightOverflowIsRejected() {
        DirectlyFollowsGraph.Builder builder = DirectlyFollowsGraph.builder()
                .addStart("a", Integer.MAX_VALUE);
        assertThrows(MalformedAbstractionException.class, () -> builder.addStart("a", 1));
        assertThrows(MalformedAbstractionException.class,
                () -> DirectlyFollowsGraph.builder().addEdge("a", "b", Integer.MAX_VALUE).addEdge("a", "b"));
    }

    @Test
    void testEdgeOrderAndText() {
        DirectlyFollowsGraph.Edge first = new DirectlyFollowsGraph.Edge("a", "z");
        DirectlyFollowsGraph.Edge second = new DirectlyFollowsGraph.Edge("b", "a");
        assertTrue(first.compareTo(second) < 0);
        assertEquals("a->z", first.toString());
    }

    @Test
    void testRejectsMalformedGraph() {
        DirectlyFollowsGraph.Builder builder = DirectlyFollowsGraph.builder();
        assertThrows(MalformedAbstractionException.class, () -> builder.addEdge("a", ""));
        assertThrows(MalformedAbstractionException.class,
                () -> DirectlyFollowsGraph.builder().addStart("a", -1).build());
    }

    @Test
    void testDirectlyFollowsLogEmptiness() {
        assertTrue(DirectlyFollowsLog.empty().isEmpty());
        DirectlyFollowsLog skipOnly = new DirectlyFollowsLog(DirectlyFollowsGraph.empty(), true);
        assertFalse(skipOnly.isEmpty());
        assertFalse(skipOnly.withoutEmptyTraces().containsEmptyTraces());
    }
}
