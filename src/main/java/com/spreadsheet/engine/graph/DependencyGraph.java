package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.exceptions.CircularReferenceException;
import com.spreadsheet.engine.models.CellId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks which cells read which:
 * - dependencies (precedents): "B1" -> {A1, C1} when B1 = A1 + C1
 * - dependents (followers):    "A1" -> {B1}     B1 reads A1
 *
 * The two maps are kept exact inverses of each other, and the graph is kept acyclic:
 * callers probe with {@link #checkForCircularReference} before committing edges.
 */
public class DependencyGraph {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraph.class);

    // Precedents: "cell" -> setOfCellsItReads
    private final Map<CellId, Set<CellId>> dependencies = new HashMap<>();
    // Followers: "cell" -> setOfCellsThatReadIt
    private final Map<CellId, Set<CellId>> dependents = new HashMap<>();

    /**
     * Replaces all outgoing edges of 'cell' with 'newDependencies',
     * fixing up the reverse adjacency of old and new precedents.
     * Throws CircularReferenceException if the new edges would close a cycle.
     */
    public void updateDependencies(CellId cell, Set<CellId> newDependencies) {
        if (checkForCircularReference(cell, newDependencies)) {
            throw new CircularReferenceException("Cycle detected for " + cell);
        }
        remove(cell);
        if (newDependencies.isEmpty()) {
            return;
        }
        dependencies.put(cell, new LinkedHashSet<>(newDependencies));
        for (CellId dep : newDependencies) {
            dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(cell);
        }
    }

    /**
     * Removes all outgoing edges of 'cell'. Edges from other cells into
     * 'cell' stay: their formulas still read it, it is just empty now.
     */
    public void clear(CellId cell) {
        remove(cell);
    }

    /**
     * Drops every edge.
     */
    public void reset() {
        dependencies.clear();
        dependents.clear();
    }

    /**
     * Reports whether giving 'cell' the edges 'newDependencies' would create a cycle.
     *
     * Walks precedents upstream from each candidate dependency looking for 'cell'.
     * The cell's current edges are ignored for the probe, since they are the ones being
     * replaced, and the graph is left exactly as it was whatever the answer.
     */
    public boolean checkForCircularReference(CellId cell, Set<CellId> newDependencies) {
        Set<CellId> currentEdges = dependencies.remove(cell);
        try {
            Set<CellId> visited = new HashSet<>();
            for (CellId dep : newDependencies) {
                if (dep.equals(cell) || reaches(dep, cell, visited)) {
                    logger.debug("Circular reference: {} -> {} leads back to {}", cell, dep, cell);
                    return true;
                }
            }
            return false;
        } finally {
            if (currentEdges != null) {
                dependencies.put(cell, currentEdges);
            }
        }
    }

    /**
     * DFS over precedents from 'current', looking for 'target'.
     */
    private boolean reaches(CellId current, CellId target, Set<CellId> visited) {
        if (!visited.add(current)) {
            return false;
        }
        Set<CellId> precedents = dependencies.get(current);
        if (precedents == null) {
            return false;
        }
        for (CellId precedent : precedents) {
            if (precedent.equals(target) || reaches(precedent, target, visited)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Every cell transitively downstream of 'changedCell', each once, ordered so that
     * a cell comes after every affected cell it reads. Empty when nothing reads it.
     */
    public List<CellId> getRecalculationOrder(CellId changedCell) {
        Set<CellId> direct = dependents.get(changedCell);
        if (direct == null || direct.isEmpty()) {
            return Collections.emptyList();
        }
        List<CellId> order = new ArrayList<>();
        Set<CellId> visited = new HashSet<>();
        for (CellId dependent : direct) {
            visit(dependent, visited, order);
        }
        // Post-order lists dependents before precedents; reverse for calculation order
        Collections.reverse(order);
        logger.debug("Recalculation order for {}: {}", changedCell, order);
        return order;
    }

    private void visit(CellId cell, Set<CellId> visited, List<CellId> order) {
        if (!visited.add(cell)) {
            return;
        }
        for (CellId dependent : dependents.getOrDefault(cell, Collections.emptySet())) {
            visit(dependent, visited, order);
        }
        order.add(cell);
    }

    /** Cells that 'cell' reads. */
    public Set<CellId> getDependencies(CellId cell) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(cell, Collections.emptySet()));
    }

    /** Cells that read 'cell'. */
    public Set<CellId> getDependents(CellId cell) {
        return Collections.unmodifiableSet(dependents.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Copy of the precedent adjacency, for inspection.
     */
    public Map<CellId, Set<CellId>> getForwardGraph() {
        return copy(dependencies);
    }

    /**
     * Copy of the follower adjacency, for inspection.
     */
    public Map<CellId, Set<CellId>> getReverseGraph() {
        return copy(dependents);
    }

    private void remove(CellId cell) {
        Set<CellId> oldTargets = dependencies.remove(cell);
        if (oldTargets == null) {
            return;
        }
        // Remove 'cell' from the reverse adjacency of every cell it used to read
        for (CellId target : oldTargets) {
            Set<CellId> followers = dependents.get(target);
            if (followers != null) {
                followers.remove(cell);
                if (followers.isEmpty()) {
                    dependents.remove(target);
                }
            }
        }
    }

    private static Map<CellId, Set<CellId>> copy(Map<CellId, Set<CellId>> source) {
        Map<CellId, Set<CellId>> result = new HashMap<>();
        for (Map.Entry<CellId, Set<CellId>> entry : source.entrySet()) {
            result.put(entry.getKey(), Collections.unmodifiableSet(new HashSet<>(entry.getValue())));
        }
        return result;
    }
}
