package com.gridcalc.app.formula.parser;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.ast.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    @Test
    void testPrecedence() {
        assertEquals("(1 + (2 * 3))", FormulaParser.parse("=1+2*3").toString());
        assertEquals("((1 - 2) - 3)", FormulaParser.parse("=1-2-3").toString());
        assertEquals("((1 + 2) * 3)", FormulaParser.parse("=(1+2)*3").toString());
    }

    @Test
    void testLeadingEqualsIsOptional() {
        assertEquals(FormulaParser.parse("=A1+1").toString(), FormulaParser.parse("A1+1").toString());
    }

    @Test
    void testUnary() {
        Expr expr = FormulaParser.parse("=-A1");
        assertTrue(expr instanceof UnaryExpr);
        assertEquals(Operator.SUBTRACT, ((UnaryExpr) expr).getOperator());
        assertEquals("--2", FormulaParser.parse("=--2").toString());
    }

    @Test
    void testReference() {
        Expr expr = FormulaParser.parse("=B5");
        assertTrue(expr instanceof ReferenceExpr);
        assertEquals("B5", ((ReferenceExpr) expr).getIdentifier());
    }

    @Test
    void testColonRangeIsFirstClass() {
        CallExpr call = (CallExpr) FormulaParser.parse("=SUM(A1:B3)");
        assertEquals("SUM", call.getName());
        RangeExpr range = (RangeExpr) call.getArguments().get(0);
        assertEquals("A1", range.getStart());
        assertEquals("B3", range.getEnd());
    }

    @Test
    void testCompactRangeToken() {
        CallExpr call = (CallExpr) FormulaParser.parse("=SUM(A1B3)");
        RangeExpr range = (RangeExpr) call.getArguments().get(0);
        assertEquals("A1", range.getStart());
        assertEquals("B3", range.getEnd());
    }

    @Test
    void testCallWithCriteria() {
        CallExpr call = (CallExpr) FormulaParser.parse("=COUNTIF(A1:B2, \">10\")");
        assertEquals(2, call.getArguments().size());
        assertEquals(">10", ((StringLiteral) call.getArguments().get(1)).getValue());
    }

    @Test
    void testEqualityAllowedInFormulas() {
        BinaryExpr expr = (BinaryExpr) FormulaParser.parse("=A1==2");
        assertEquals(Operator.EQUAL, expr.getOperator());
    }

    @Test
    void testOtherComparisonsOnlyInCriteria() {
        FormulaException ex = assertThrows(FormulaException.class, () -> FormulaParser.parse("=A1>2"));
        assertEquals(FormulaErrorKind.PARSE_FAILURE, ex.getKind());
        assertThrows(FormulaException.class, () -> FormulaParser.parse("=A1=2"));

        BinaryExpr criteria = (BinaryExpr) FormulaParser.parseCriteria("x >= -3");
        assertEquals(Operator.GREATER_EQUAL, criteria.getOperator());
        assertEquals(Operator.NOT_EQUAL, ((BinaryExpr) FormulaParser.parseCriteria("x <> 7")).getOperator());
        assertEquals(Operator.EQUAL, ((BinaryExpr) FormulaParser.parseCriteria("x = 7")).getOperator());
    }

    @Test
    void testMalformedFormulas() {
        for (String formula : new String[]{"=", "=1+", "=(1+2", "=SUM(A1:B2", "=1 2", "=A1:", "=*3", "=SUM(A1,)"}) {
            FormulaException ex = assertThrows(FormulaException.class, () -> FormulaParser.parse(formula), formula);
            assertEquals(FormulaErrorKind.PARSE_FAILURE, ex.getKind(), formula);
        }
    }
}
