package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.Grid;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * State for one evaluation pass over a grid:
 * - the grid being read
 * - the formula cells currently being evaluated (re-entering one means a cycle)
 * - the results of formula cells the grid pass has already settled, in order
 * - optionally, a memo of formula results already computed in this pass
 *
 * A context must not outlive the pass it was created for.
 */
public final class EvaluationContext {
    private final Grid grid;
    private final boolean cacheEnabled;
    private final Map<CellCoordinate, Double> cache = new HashMap<>();
    private final Set<CellCoordinate> inProgress = new HashSet<>();
    private final Map<CellCoordinate, EvaluationResult> settled = new HashMap<>();

    public EvaluationContext(Grid grid) {
        this(grid, false);
    }

    public EvaluationContext(Grid grid, boolean cacheEnabled) {
        this.grid = grid;
        this.cacheEnabled = cacheEnabled;
    }

    public Grid getGrid() {
        return grid;
    }

    Double cachedValue(CellCoordinate coordinate) {
        return cacheEnabled ? cache.get(coordinate) : null;
    }

    void remember(CellCoordinate coordinate, double value) {
        if (cacheEnabled) {
            cache.put(coordinate, value);
        }
    }

    /**
     * Records the final result of a formula cell for the rest of the pass.
     * References to it are answered from here instead of re-walking its formula.
     */
    void settle(CellCoordinate coordinate, EvaluationResult result) {
        settled.put(coordinate, result);
    }

    EvaluationResult settledResult(CellCoordinate coordinate) {
        return settled.get(coordinate);
    }

    /**
     * Marks a formula cell as being evaluated. Returns false if it already was.
     */
    boolean enter(CellCoordinate coordinate) {
        return inProgress.add(coordinate);
    }

    void exit(CellCoordinate coordinate) {
        inProgress.remove(coordinate);
    }
}
