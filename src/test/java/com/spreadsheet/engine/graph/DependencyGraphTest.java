package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.exceptions.CircularReferenceException;
import com.spreadsheet.engine.models.CellId;
import com.spreadsheet.engine.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for edge bookkeeping, cycle probing and recalculation order.
 */
class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    private static CellId id(String ref) {
        return CellId.parse(ref);
    }

    private static Set<CellId> ids(String... refs) {
        Set<CellId> result = new HashSet<>();
        for (String ref : refs) {
            result.add(id(ref));
        }
        return result;
    }

    /**
     * Replacing a cell's edges fixes up the reverse map of old and new precedents.
     */
    @Test
    void testUpdateKeepsMapsInverse() {
        graph.updateDependencies(id("C1"), ids("A1", "B1"));
        assertEquals(ids("A1", "B1"), graph.getDependencies(id("C1")));
        assertEquals(ids("C1"), graph.getDependents(id("A1")));

        graph.updateDependencies(id("C1"), ids("B1", "D1"));
        assertTrue(graph.getDependents(id("A1")).isEmpty());
        assertEquals(ids("C1"), graph.getDependents(id("D1")));
        assertFalse(graph.getReverseGraph().containsKey(id("A1")));

        graph.clear(id("C1"));
        assertTrue(graph.getForwardGraph().isEmpty());
        assertTrue(graph.getReverseGraph().isEmpty());
    }

    /**
     * Self references and longer loops are detected without touching the graph.
     */
    @Test
    void testCycleProbeLeavesGraphUnchanged() {
        graph.updateDependencies(id("B1"), ids("A1"));
        graph.updateDependencies(id("C1"), ids("B1"));
        Map<CellId, Set<CellId>> forward = graph.getForwardGraph();
        Map<CellId, Set<CellId>> reverse = graph.getReverseGraph();

        assertTrue(graph.checkForCircularReference(id("A1"), ids("C1")));
        assertTrue(graph.checkForCircularReference(id("D1"), ids("D1")));
        assertTrue(graph.checkForCircularReference(id("B1"), ids("C1")));
        assertEquals(forward, graph.getForwardGraph());
        assertEquals(reverse, graph.getReverseGraph());
    }

    /**
     * A cell's current edges do not count against its replacement.
     */
    @Test
    void testReplacingOwnEdgesIsNotACycle() {
        graph.updateDependencies(id("B1"), ids("A1"));
        assertFalse(graph.checkForCircularReference(id("B1"), ids("A1", "C1")));
        assertFalse(graph.checkForCircularReference(id("A1"), ids("C1")));
    }

    /**
     * Committing a cycle directly is a contract violation.
     */
    @Test
    void testUpdateRejectsCycle() {
        graph.updateDependencies(id("B1"), ids("A1"));
        assertThrows(CircularReferenceException.class, () -> graph.updateDependencies(id("A1"), ids("B1")));
        assertTrue(graph.getDependencies(id("A1")).isEmpty());
    }

    /**
     * Chain and diamond: each affected cell once, after everything it reads.
     */
    @Test
    void testRecalculationOrder() {
        // B1 = A1, C1 = B1, D1 = B1 + C1
        graph.updateDependencies(id("B1"), ids("A1"));
        graph.updateDependencies(id("C1"), ids("B1"));
        graph.updateDependencies(id("D1"), ids("B1", "C1"));

        List<CellId> order = graph.getRecalculationOrder(id("A1"));
        assertEquals(3, order.size());
        assertEquals(id("B1"), order.get(0));
        assertTrue(order.indexOf(id("C1")) < order.indexOf(id("D1")));

        assertEquals(Collections.emptyList(), graph.getRecalculationOrder(id("D1")));
    }

    /**
     * Ranges contribute every member cell; repeated references count once.
     */
    @Test
    void testDependencyExtraction() {
        Set<CellId> deps = DependencyExtractor.extract(Parser.parseFormula("SUM(A1:A3) + $B$1 * B1 - IF(C1, 1, 2)"));
        assertEquals(new HashSet<>(Arrays.asList(id("A1"), id("A2"), id("A3"), id("B1"), id("C1"))), deps);
        assertTrue(DependencyExtractor.extract(Parser.parseFormula("1+2")).isEmpty());
    }
}
