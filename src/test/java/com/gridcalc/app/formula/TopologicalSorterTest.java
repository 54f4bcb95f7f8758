package com.gridcalc.app.formula;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TopologicalSorterTest {

    private static void assertBefore(List<String> order, String first, String second) {
        assertTrue(order.indexOf(first) >= 0, first + " missing from " + order);
        assertTrue(order.indexOf(first) < order.indexOf(second), first + " should precede " + second + " in " + order);
    }

    @Test
    void testDependenciesComeFirst() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("B", Set.of("A", "C"));
        graph.put("C", Set.of("D"));

        TopologicalOrder result = TopologicalSorter.sort(graph);

        assertFalse(result.hasCycle());
        List<String> order = result.getOrder();
        assertEquals(4, order.size());
        assertBefore(order, "D", "C");
        assertBefore(order, "A", "B");
        assertBefore(order, "C", "B");
    }

    @Test
    void testTwoNodeCycleFails() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("A1", Set.of("B1"));
        graph.put("B1", Set.of("A1"));

        TopologicalOrder result = TopologicalSorter.sort(graph);

        assertTrue(result.hasCycle());
        assertEquals(Set.of("A1", "B1"), result.getUnresolved());
    }

    @Test
    void testSelfLoopFails() {
        TopologicalOrder result = TopologicalSorter.sort(Map.of("A1", Set.of("A1")));
        assertTrue(result.hasCycle());
    }

    @Test
    void testCycleLeavesIndependentNodesOrdered() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("A1", Set.of("B1"));
        graph.put("B1", Set.of("A1"));
        graph.put("C1", Set.of("D1"));
        graph.put("E1", Set.of("A1"));

        TopologicalOrder result = TopologicalSorter.sort(graph);

        assertTrue(result.hasCycle());
        assertEquals(Set.of("A1", "B1", "E1"), result.getUnresolved());
        assertBefore(result.getOrder(), "D1", "C1");
    }

    @Test
    void testEmptyGraph() {
        TopologicalOrder result = TopologicalSorter.sort(Map.of());
        assertFalse(result.hasCycle());
        assertTrue(result.getOrder().isEmpty());
    }

    @Test
    void testDiamond() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("D", Set.of("B", "C"));
        graph.put("B", Set.of("A"));
        graph.put("C", Set.of("A"));
        graph.put("A", Set.of());

        List<String> order = TopologicalSorter.sort(graph).getOrder();

        assertEquals(4, order.size());
        assertBefore(order, "A", "B");
        assertBefore(order, "A", "C");
        assertBefore(order, "B", "D");
        assertBefore(order, "C", "D");
    }
}
