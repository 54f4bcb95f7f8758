package com.gridcalc.app.formula;

/**
 * Which formula cells get the cycle error when a grid contains a cycle.
 */
public enum CyclePolicy {
    /**
     * Every formula cell in the grid is marked, whether or not it is on the cycle.
     */
    MARK_ALL_FORMULAS,

    /**
     * Cells that could still be ordered are evaluated normally; only the cells on
     * a cycle or depending on one are marked.
     */
    MARK_UNRESOLVED
}
