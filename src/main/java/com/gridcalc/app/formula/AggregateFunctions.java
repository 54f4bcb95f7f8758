package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.ast.RangeExpr;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.FormulaCell;
import com.gridcalc.app.models.Grid;
import com.gridcalc.app.models.NumericCell;

import java.util.List;

/**
 * SUM, PRODUCT, COUNTIF and SUMIF over a rectangular range.
 *
 * Empty cells count as 0 (1 for PRODUCT). Text cells are a type mismatch for
 * SUM and PRODUCT and are skipped by the conditional variants.
 */
class AggregateFunctions {

    static final String SUM = "SUM";
    static final String PRODUCT = "PRODUCT";
    static final String COUNTIF = "COUNTIF";
    static final String SUMIF = "SUMIF";

    private final FormulaEvaluator evaluator;

    AggregateFunctions(FormulaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    double sum(RangeExpr range, EvaluationContext context) {
        double total = 0;
        for (CellCoordinate at : resolve(range, context.getGrid())) {
            Double value = numericValue(at, context, 0, false);
            total += value;
        }
        return total;
    }

    double product(RangeExpr range, EvaluationContext context) {
        double total = 1;
        for (CellCoordinate at : resolve(range, context.getGrid())) {
            Double value = numericValue(at, context, 1, false);
            total *= value;
        }
        return total;
    }

    double countIf(RangeExpr range, String criteria, EvaluationContext context) {
        CriteriaEvaluator.Criterion criterion = CriteriaEvaluator.compile(criteria);
        int count = 0;
        for (CellCoordinate at : resolve(range, context.getGrid())) {
            Double value = numericValue(at, context, 0, true);
            if (value != null && criterion.test(value)) {
                count++;
            }
        }
        return count;
    }

    double sumIf(RangeExpr range, String criteria, EvaluationContext context) {
        CriteriaEvaluator.Criterion criterion = CriteriaEvaluator.compile(criteria);
        double total = 0;
        for (CellCoordinate at : resolve(range, context.getGrid())) {
            Double value = numericValue(at, context, 0, true);
            if (value != null && criterion.test(value)) {
                total += value;
            }
        }
        return total;
    }

    private static List<CellCoordinate> resolve(RangeExpr range, Grid grid) {
        List<CellCoordinate> coordinates = RangeResolver.expand(range);
        for (CellCoordinate at : coordinates) {
            if (!grid.contains(at)) {
                throw new FormulaException(FormulaErrorKind.RANGE_OUT_OF_BOUNDS,
                        "Range " + range + " is outside the grid");
            }
        }
        return coordinates;
    }

    /**
     * Numeric value of one cell in a range. Returns null for a text cell when
     * skipText is set, otherwise a text cell is a type mismatch.
     */
    private Double numericValue(CellCoordinate at, EvaluationContext context, double emptyValue, boolean skipText) {
        Cell cell = context.getGrid().getCell(at);
        switch (cell.getKind()) {
            case NUMERIC:
                return ((NumericCell) cell).getValue();
            case FORMULA:
                return evaluator.formulaValue(at, (FormulaCell) cell, context);
            case EMPTY:
                return emptyValue;
            case TEXT:
                if (skipText) {
                    return null;
                }
                throw new FormulaException(FormulaErrorKind.TYPE_MISMATCH, FormulaEvaluator.TEXT_CELL_MESSAGE);
            default:
                throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                        "Unsupported cell kind " + cell.getKind());
        }
    }
}
