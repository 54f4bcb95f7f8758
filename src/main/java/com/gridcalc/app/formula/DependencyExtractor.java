package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.ast.*;
import com.gridcalc.app.formula.parser.FormulaParser;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.CellKind;
import com.gridcalc.app.models.FormulaCell;
import com.gridcalc.app.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the dependency map of a grid: cell id -> ids of the cells it reads.
 *
 * Every formula cell is a key. Every cell referenced by a formula is a key
 * too, with an empty set unless it is itself a formula, so the scheduler
 * sees the leaves as roots.
 */
public final class DependencyExtractor {
    private static final Logger logger = LoggerFactory.getLogger(DependencyExtractor.class);

    private DependencyExtractor() {
    }

    public static Map<String, Set<String>> extract(Grid grid) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (int row = 0; row < grid.getRows(); row++) {
            for (int col = 0; col < grid.getCols(); col++) {
                Cell cell = grid.getCell(row, col);
                if (cell.getKind() != CellKind.FORMULA) {
                    continue;
                }
                String id = CellReferences.toIdentifier(row, col);
                Set<String> reads = dependenciesOf(((FormulaCell) cell).getFormula(), grid);
                dependencies.put(id, reads);
                for (String dependency : reads) {
                    dependencies.putIfAbsent(dependency, new LinkedHashSet<>());
                }
            }
        }
        return dependencies;
    }

    /**
     * Ids read by one formula, ranges expanded. A formula that does not parse
     * reads nothing; its parse error surfaces when it is evaluated.
     */
    public static Set<String> dependenciesOf(String formula) {
        return dependenciesOf(formula, null);
    }

    /**
     * Ids read by one formula in the given grid. A range with a corner outside
     * the grid reads nothing; evaluating it fails with an out-of-bounds error.
     */
    public static Set<String> dependenciesOf(String formula, Grid grid) {
        Expr expr;
        try {
            expr = FormulaParser.parse(formula);
        } catch (FormulaException e) {
            logger.debug("Skipping dependencies of unparsable formula {}: {}", formula, e.getMessage());
            return new LinkedHashSet<>();
        }
        Set<String> reads = new LinkedHashSet<>();
        expr.accept(new Collector(reads, grid));
        return reads;
    }

    /**
     * Collects references; ranges are expanded into their member cells.
     */
    private static final class Collector implements ExprVisitor<Void> {
        private final Set<String> reads;
        private final Grid grid;

        Collector(Set<String> reads, Grid grid) {
            this.reads = reads;
            this.grid = grid;
        }

        @Override
        public Void visitReference(ReferenceExpr expr) {
            reads.add(expr.getIdentifier());
            return null;
        }

        @Override
        public Void visitRange(RangeExpr expr) {
            if (grid != null && !(insideGrid(expr.getStart()) && insideGrid(expr.getEnd()))) {
                logger.debug("Range {} leaves the grid, contributes no dependencies", expr);
                return null;
            }
            try {
                for (CellCoordinate at : RangeResolver.expand(expr)) {
                    reads.add(CellReferences.toIdentifier(at));
                }
            } catch (FormulaException e) {
                // the evaluator reports the bad range for this cell
                logger.debug("Range {} contributes no dependencies: {}", expr, e.getMessage());
            }
            return null;
        }

        private boolean insideGrid(String identifier) {
            return CellReferences.toCoordinate(identifier).map(grid::contains).orElse(false);
        }

        @Override
        public Void visitNumber(NumberLiteral expr) {
            return null;
        }

        @Override
        public Void visitString(StringLiteral expr) {
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpr expr) {
            expr.getLeft().accept(this);
            expr.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr expr) {
            return expr.getOperand().accept(this);
        }

        @Override
        public Void visitGrouping(GroupingExpr expr) {
            return expr.getInner().accept(this);
        }

        @Override
        public Void visitCall(CallExpr expr) {
            for (Expr argument : expr.getArguments()) {
                argument.accept(this);
            }
            return null;
        }
    }
}
