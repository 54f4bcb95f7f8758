package com.gridcalc.app.config;

import com.gridcalc.app.formula.CyclePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "gridcalc" prefix, e.g.
 * gridcalc.grid.min-rows=10
 * gridcalc.evaluation.cycle-policy=MARK_ALL_FORMULAS
 */
@ConfigurationProperties(prefix = "gridcalc")
public class GridCalcProperties {

    private final GridSettings grid = new GridSettings();
    private final EvaluationSettings evaluation = new EvaluationSettings();

    public GridSettings getGrid() {
        return grid;
    }

    public EvaluationSettings getEvaluation() {
        return evaluation;
    }

    public static class GridSettings {
        // Grids are never created or trimmed below this size
        private int minRows = 10;
        private int minCols = 10;

        public int getMinRows() {
            return minRows;
        }
        public int getMinCols() {
            return minCols;
        }
        public void setMinRows(int minRows) {
            this.minRows = minRows;
        }
        public void setMinCols(int minCols) {
            this.minCols = minCols;
        }
    }

    public static class EvaluationSettings {
        // Memoize formula results within one pass
        private boolean cacheEnabled = false;
        private CyclePolicy cyclePolicy = CyclePolicy.MARK_ALL_FORMULAS;

        public boolean isCacheEnabled() {
            return cacheEnabled;
        }
        public CyclePolicy getCyclePolicy() {
            return cyclePolicy;
        }
        public void setCacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
        }
        public void setCyclePolicy(CyclePolicy cyclePolicy) {
            this.cyclePolicy = cyclePolicy;
        }
    }
}
