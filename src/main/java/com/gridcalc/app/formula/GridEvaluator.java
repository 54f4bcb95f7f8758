package com.gridcalc.app.formula;

import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.CellKind;
import com.gridcalc.app.models.FormulaCell;
import com.gridcalc.app.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one full evaluation pass over a grid:
 * 1) extract the dependency map of every formula cell
 * 2) sort it topologically
 * 3) on a cycle, mark formula cells with the cycle error (which ones depends on the {@link CyclePolicy})
 * 4) otherwise evaluate formula cells in order and write value/error back in place
 *
 * The caller owns the grid for the duration of the pass.
 */
public class GridEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(GridEvaluator.class);

    private final FormulaEvaluator formulaEvaluator;
    private final CyclePolicy cyclePolicy;
    private final boolean cacheEnabled;

    public GridEvaluator() {
        this(new FormulaEvaluator(), CyclePolicy.MARK_ALL_FORMULAS, false);
    }

    public GridEvaluator(FormulaEvaluator formulaEvaluator, CyclePolicy cyclePolicy, boolean cacheEnabled) {
        this.formulaEvaluator = formulaEvaluator;
        this.cyclePolicy = cyclePolicy;
        this.cacheEnabled = cacheEnabled;
    }

    public void evaluateGrid(Grid grid) {
        Map<String, Set<String>> dependencies = DependencyExtractor.extract(grid);
        TopologicalOrder order = TopologicalSorter.sort(dependencies);
        EvaluationContext context = new EvaluationContext(grid, cacheEnabled);

        if (order.hasCycle()) {
            logger.info("Grid {} has a cyclic dependency among {}", grid.getId(), order.getUnresolved());
            if (cyclePolicy == CyclePolicy.MARK_ALL_FORMULAS) {
                markAllFormulas(grid);
                return;
            }
            evaluateInOrder(grid, order, context);
            for (String id : order.getUnresolved()) {
                formulaCellAt(grid, id).ifPresent(cell ->
                        cell.setResult(0, FormulaEvaluator.CYCLE_MESSAGE));
            }
            return;
        }

        logger.debug("Grid {} evaluation order: {}", grid.getId(), order.getOrder());
        evaluateInOrder(grid, order, context);
    }

    private void evaluateInOrder(Grid grid, TopologicalOrder order, EvaluationContext context) {
        for (String id : order.getOrder()) {
            Optional<CellCoordinate> at = CellReferences.toCoordinate(id);
            if (at.isEmpty() || !grid.contains(at.get())) {
                // referenced but not addressable; the referencing formula reports it
                continue;
            }
            Cell cell = grid.getCell(at.get());
            if (cell.getKind() != CellKind.FORMULA) {
                continue;
            }
            FormulaCell formulaCell = (FormulaCell) cell;
            EvaluationResult result = formulaEvaluator.evaluateCell(at.get(), formulaCell, context);
            // later cells read this result instead of re-walking the chain below it
            context.settle(at.get(), result);
            formulaCell.setResult(result.getValue(), result.getError());
        }
    }

    private static void markAllFormulas(Grid grid) {
        for (int row = 0; row < grid.getRows(); row++) {
            for (int col = 0; col < grid.getCols(); col++) {
                Cell cell = grid.getCell(row, col);
                if (cell.getKind() == CellKind.FORMULA) {
                    ((FormulaCell) cell).setResult(0, FormulaEvaluator.CYCLE_MESSAGE);
                }
            }
        }
    }

    private static Optional<FormulaCell> formulaCellAt(Grid grid, String id) {
        return CellReferences.toCoordinate(id)
                .filter(grid::contains)
                .map(grid::getCell)
                .filter(cell -> cell.getKind() == CellKind.FORMULA)
                .map(FormulaCell.class::cast);
    }
}
