package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.ast.*;
import com.gridcalc.app.formula.parser.FormulaParser;

/**
 * Evaluates COUNTIF/SUMIF criteria such as ">10", "<=5", "==3" or "<>7".
 *
 * The criteria text is appended to a placeholder identifier ("_value >10"),
 * parsed with the formula grammar in criteria mode, and evaluated with the
 * placeholder bound to the cell value under test. The only operands allowed
 * are numeric literals (optionally signed or parenthesized) and the placeholder.
 */
public final class CriteriaEvaluator {

    static final String PLACEHOLDER = "_value";

    private CriteriaEvaluator() {
    }

    /**
     * Parses and validates a criteria string once, so it can be tested against many values.
     *
     * @throws FormulaException INVALID_CRITERIA if the text is not a single comparison
     */
    public static Criterion compile(String criteria) {
        if (criteria == null || criteria.isBlank()) {
            throw invalid(criteria, "empty criteria");
        }
        Expr expr;
        try {
            expr = FormulaParser.parseCriteria(PLACEHOLDER + " " + criteria);
        } catch (FormulaException e) {
            throw new FormulaException(FormulaErrorKind.INVALID_CRITERIA,
                    "Invalid criteria \"" + criteria + "\": " + e.getMessage(), e);
        }
        if (!(expr instanceof BinaryExpr) || !((BinaryExpr) expr).getOperator().isComparison()) {
            throw invalid(criteria, "expected a single comparison");
        }
        BinaryExpr comparison = (BinaryExpr) expr;
        OperandValidator validator = new OperandValidator(criteria);
        comparison.getLeft().accept(validator);
        comparison.getRight().accept(validator);
        return new Criterion(criteria, comparison);
    }

    /**
     * Convenience for a single test; use {@link #compile(String)} when testing a whole range.
     */
    public static boolean matches(double value, String criteria) {
        return compile(criteria).test(value);
    }

    private static FormulaException invalid(String criteria, String reason) {
        return new FormulaException(FormulaErrorKind.INVALID_CRITERIA,
                "Invalid criteria \"" + criteria + "\": " + reason);
    }

    /**
     * A compiled criteria predicate.
     */
    public static final class Criterion {
        private final String text;
        private final BinaryExpr comparison;

        private Criterion(String text, BinaryExpr comparison) {
            this.text = text;
            this.comparison = comparison;
        }

        public String getText() {
            return text;
        }

        public boolean test(double value) {
            OperandEvaluator evaluator = new OperandEvaluator(value);
            double left = comparison.getLeft().accept(evaluator);
            double right = comparison.getRight().accept(evaluator);
            switch (comparison.getOperator()) {
                case EQUAL:
                    return left == right;
                case NOT_EQUAL:
                    return left != right;
                case LESS:
                    return left < right;
                case LESS_EQUAL:
                    return left <= right;
                case GREATER:
                    return left > right;
                case GREATER_EQUAL:
                    return left >= right;
                default:
                    throw new IllegalStateException("Not a comparison: " + comparison.getOperator());
            }
        }
    }

    /**
     * Rejects everything except numbers, sign, parentheses and the placeholder.
     */
    private static final class OperandValidator implements ExprVisitor<Void> {
        private final String criteria;

        OperandValidator(String criteria) {
            this.criteria = criteria;
        }

        @Override
        public Void visitReference(ReferenceExpr expr) {
            if (!PLACEHOLDER.equals(expr.getIdentifier())) {
                throw invalid(criteria, "unexpected identifier " + expr.getIdentifier());
            }
            return null;
        }

        @Override
        public Void visitRange(RangeExpr expr) {
            throw invalid(criteria, "ranges are not allowed");
        }

        @Override
        public Void visitNumber(NumberLiteral expr) {
            try {
                Double.parseDouble(expr.getText());
            } catch (NumberFormatException e) {
                throw invalid(criteria, "bad number " + expr.getText());
            }
            return null;
        }

        @Override
        public Void visitString(StringLiteral expr) {
            throw invalid(criteria, "strings are not allowed");
        }

        @Override
        public Void visitBinary(BinaryExpr expr) {
            throw invalid(criteria, "only one comparison is allowed");
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
            throw invalid(criteria, "function calls are not allowed");
        }
    }

    /**
     * Evaluates an operand already accepted by {@link OperandValidator}.
     */
    private static final class OperandEvaluator implements ExprVisitor<Double> {
        private final double boundValue;

        OperandEvaluator(double boundValue) {
            this.boundValue = boundValue;
        }

        @Override
        public Double visitReference(ReferenceExpr expr) {
            return boundValue;
        }

        @Override
        public Double visitNumber(NumberLiteral expr) {
            return Double.parseDouble(expr.getText());
        }

        @Override
        public Double visitUnary(UnaryExpr expr) {
            double operand = expr.getOperand().accept(this);
            return expr.getOperator() == Operator.SUBTRACT ? -operand : operand;
        }

        @Override
        public Double visitGrouping(GroupingExpr expr) {
            return expr.getInner().accept(this);
        }

        @Override
        public Double visitRange(RangeExpr expr) {
            throw new IllegalStateException("validated criteria contains a range");
        }

        @Override
        public Double visitString(StringLiteral expr) {
            throw new IllegalStateException("validated criteria contains a string");
        }

        @Override
        public Double visitBinary(BinaryExpr expr) {
            throw new IllegalStateException("validated criteria contains a nested operator");
        }

        @Override
        public Double visitCall(CallExpr expr) {
            throw new IllegalStateException("validated criteria contains a call");
        }
    }
}
