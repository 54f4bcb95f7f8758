package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.ast.*;
import com.gridcalc.app.formula.parser.FormulaParser;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.FormulaCell;
import com.gridcalc.app.models.Grid;
import com.gridcalc.app.models.NumericCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tree-walking interpreter for cell formulas.
 *
 * Errors are raised as {@link FormulaException} while walking and turned into
 * an {@link EvaluationResult} at the public entry points, so a failing formula
 * only affects its own cell. A child error is propagated as-is; values are
 * never combined once an operand has failed.
 *
 * References to formula cells already settled by the grid pass reuse that
 * result. Other formula cells are evaluated again from their formula text,
 * unless the context has its per-pass cache enabled.
 */
public class FormulaEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    static final String TEXT_CELL_MESSAGE = "cannot evaluate a text cell as a number";
    static final String DIVISION_BY_ZERO_MESSAGE = "Division by zero";
    static final String CYCLE_MESSAGE = "Cyclic dependency detected";

    private final AggregateFunctions aggregates = new AggregateFunctions(this);

    /**
     * Parses and evaluates a formula ("=A1+1") against a grid.
     */
    public EvaluationResult evaluate(String formula, Grid grid) {
        return evaluate(formula, new EvaluationContext(grid));
    }

    public EvaluationResult evaluate(String formula, EvaluationContext context) {
        try {
            return EvaluationResult.success(evaluateExpression(FormulaParser.parse(formula), context));
        } catch (FormulaException e) {
            logger.debug("Formula {} failed: {}", formula, e.getMessage());
            return EvaluationResult.failure(e);
        }
    }

    /**
     * Evaluates an already parsed expression against a grid.
     */
    public EvaluationResult evaluate(Expr expr, Grid grid) {
        try {
            return EvaluationResult.success(evaluateExpression(expr, new EvaluationContext(grid)));
        } catch (FormulaException e) {
            return EvaluationResult.failure(e);
        }
    }

    /**
     * Evaluates the formula cell at the given position, guarding against the
     * cell reaching itself through its references.
     */
    public EvaluationResult evaluateCell(CellCoordinate at, FormulaCell cell, EvaluationContext context) {
        try {
            return EvaluationResult.success(formulaValue(at, cell, context));
        } catch (FormulaException e) {
            logger.debug("Cell {} failed: {}", CellReferences.toIdentifier(at), e.getMessage());
            return EvaluationResult.failure(e);
        }
    }

    double evaluateExpression(Expr expr, EvaluationContext context) {
        return expr.accept(new Interpreter(context));
    }

    /**
     * Value of a formula cell reached through a reference or a range.
     */
    double formulaValue(CellCoordinate at, FormulaCell cell, EvaluationContext context) {
        EvaluationResult settled = context.settledResult(at);
        if (settled != null) {
            if (!settled.isSuccess()) {
                throw new FormulaException(settled.getErrorKind(), settled.getError());
            }
            return settled.getValue();
        }
        Double cached = context.cachedValue(at);
        if (cached != null) {
            return cached;
        }
        if (!context.enter(at)) {
            throw new FormulaException(FormulaErrorKind.CYCLIC_DEPENDENCY, CYCLE_MESSAGE);
        }
        try {
            double value = evaluateExpression(FormulaParser.parse(cell.getFormula()), context);
            context.remember(at, value);
            return value;
        } finally {
            context.exit(at);
        }
    }

    /**
     * Visits one formula tree. One instance per tree walk.
     */
    private final class Interpreter implements ExprVisitor<Double> {
        private final EvaluationContext context;

        Interpreter(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public Double visitReference(ReferenceExpr expr) {
            String identifier = expr.getIdentifier();
            CellCoordinate at = CellReferences.toCoordinate(identifier)
                    .orElseThrow(() -> new FormulaException(FormulaErrorKind.UNKNOWN_REFERENCE,
                            "Unknown reference: " + identifier));
            Grid grid = context.getGrid();
            if (!grid.contains(at)) {
                throw new FormulaException(FormulaErrorKind.OUT_OF_BOUNDS,
                        "Reference " + identifier + " is outside the grid");
            }
            Cell cell = grid.getCell(at);
            switch (cell.getKind()) {
                case NUMERIC:
                    return ((NumericCell) cell).getValue();
                case FORMULA:
                    return formulaValue(at, (FormulaCell) cell, context);
                case TEXT:
                    throw new FormulaException(FormulaErrorKind.TYPE_MISMATCH, TEXT_CELL_MESSAGE);
                case EMPTY:
                    return 0.0;
                default:
                    throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                            "Unsupported cell kind " + cell.getKind());
            }
        }

        @Override
        public Double visitRange(RangeExpr expr) {
            throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                    "Range " + expr + " can only be used as a function argument");
        }

        @Override
        public Double visitNumber(NumberLiteral expr) {
            try {
                return Double.parseDouble(expr.getText());
            } catch (NumberFormatException e) {
                throw new FormulaException(FormulaErrorKind.UNKNOWN_TOKEN,
                        "Unknown token: " + expr.getText(), e);
            }
        }

        @Override
        public Double visitString(StringLiteral expr) {
            throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                    "String " + expr + " can only be used as a criteria argument");
        }

        @Override
        public Double visitBinary(BinaryExpr expr) {
            double left = expr.getLeft().accept(this);
            double right = expr.getRight().accept(this);
            switch (expr.getOperator()) {
                case ADD:
                    return left + right;
                case SUBTRACT:
                    return left - right;
                case MULTIPLY:
                    return left * right;
                case DIVIDE:
                    if (right == 0) {
                        throw new FormulaException(FormulaErrorKind.DIVISION_BY_ZERO, DIVISION_BY_ZERO_MESSAGE);
                    }
                    return left / right;
                case EQUAL:
                    return left == right ? 1.0 : 0.0;
                default:
                    throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                            "Operator " + expr.getOperator().getSymbol() + " is not supported in cell formulas");
            }
        }

        @Override
        public Double visitUnary(UnaryExpr expr) {
            double operand = expr.getOperand().accept(this);
            switch (expr.getOperator()) {
                case ADD:
                    return operand;
                case SUBTRACT:
                    return -operand;
                default:
                    throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                            "Unary operator " + expr.getOperator().getSymbol() + " is not supported");
            }
        }

        @Override
        public Double visitGrouping(GroupingExpr expr) {
            return expr.getInner().accept(this);
        }

        @Override
        public Double visitCall(CallExpr expr) {
            String name = expr.getName();
            List<Expr> arguments = expr.getArguments();

            if (arguments.size() == 1 && arguments.get(0) instanceof RangeExpr) {
                RangeExpr range = (RangeExpr) arguments.get(0);
                if (AggregateFunctions.SUM.equals(name)) {
                    return aggregates.sum(range, context);
                }
                if (AggregateFunctions.PRODUCT.equals(name)) {
                    return aggregates.product(range, context);
                }
            } else if (arguments.size() == 2
                    && arguments.get(0) instanceof RangeExpr
                    && arguments.get(1) instanceof StringLiteral) {
                RangeExpr range = (RangeExpr) arguments.get(0);
                String criteria = ((StringLiteral) arguments.get(1)).getValue();
                if (AggregateFunctions.COUNTIF.equals(name)) {
                    return aggregates.countIf(range, criteria, context);
                }
                if (AggregateFunctions.SUMIF.equals(name)) {
                    return aggregates.sumIf(range, criteria, context);
                }
            }
            throw new FormulaException(FormulaErrorKind.UNSUPPORTED_OPERATION,
                    "Unsupported argument type for function " + name);
        }
    }
}
