package com.gridcalc.app.formula;

import com.gridcalc.app.exceptions.FormulaErrorKind;
import com.gridcalc.app.exceptions.FormulaException;
import com.gridcalc.app.formula.ast.RangeExpr;
import com.gridcalc.app.models.CellCoordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes and expands rectangular ranges.
 * A range is written "A1:B3"; the compact form "A1B3" (no colon) is
 * recognized too.
 */
public final class RangeResolver {

    private RangeResolver() {
    }

    static final int MAX_RANGE_CELLS = 1_000_000;

    // States of the letters+ digits+ letters+ digits+ scan
    private static final int START = 0;
    private static final int START_LETTERS = 1;
    private static final int START_DIGITS = 2;
    private static final int END_LETTERS = 3;
    private static final int END_DIGITS = 4;

    /**
     * True only for the exact shape letters+ digits+ letters+ digits+, e.g. "A1B1".
     */
    public static boolean isRange(String token) {
        if (token == null || token.length() < 4) {
            return false;
        }
        int state = START;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            boolean letter = CellReferences.isAsciiLetter(c);
            boolean digit = CellReferences.isAsciiDigit(c);
            if (!letter && !digit) {
                return false;
            }
            switch (state) {
                case START:
                    if (!letter) {
                        return false;
                    }
                    state = START_LETTERS;
                    break;
                case START_LETTERS:
                    state = letter ? START_LETTERS : START_DIGITS;
                    break;
                case START_DIGITS:
                    state = digit ? START_DIGITS : END_LETTERS;
                    break;
                case END_LETTERS:
                    state = letter ? END_LETTERS : END_DIGITS;
                    break;
                case END_DIGITS:
                    if (!digit) {
                        return false;
                    }
                    break;
                default:
                    return false;
            }
        }
        return state == END_DIGITS;
    }

    /**
     * Splits a compact range token at the first digit-to-letter boundary:
     * "A1B3" -> A1:B3.
     */
    public static RangeExpr parseRange(String token) {
        if (!isRange(token)) {
            throw new IllegalArgumentException("Not a range: " + token);
        }
        for (int i = 1; i < token.length(); i++) {
            if (CellReferences.isAsciiDigit(token.charAt(i - 1)) && CellReferences.isAsciiLetter(token.charAt(i))) {
                return new RangeExpr(token.substring(0, i), token.substring(i));
            }
        }
        // isRange guarantees a boundary
        throw new IllegalStateException("No boundary in range token " + token);
    }

    public static List<CellCoordinate> expand(RangeExpr range) {
        return expand(range.getStart(), range.getEnd());
    }

    /**
     * Every coordinate in the rectangle spanned by the two corners, row-major.
     * Corners may be given in any order.
     *
     * @throws FormulaException UNKNOWN_REFERENCE if either corner does not decode,
     *                          RANGE_OUT_OF_BOUNDS if the rectangle is unreasonably large
     */
    public static List<CellCoordinate> expand(String start, String end) {
        CellCoordinate from = decode(start);
        CellCoordinate to = decode(end);

        int minRow = Math.min(from.getRow(), to.getRow());
        int maxRow = Math.max(from.getRow(), to.getRow());
        int minCol = Math.min(from.getColumn(), to.getColumn());
        int maxCol = Math.max(from.getColumn(), to.getColumn());

        long area = (long) (maxRow - minRow + 1) * (maxCol - minCol + 1);
        if (area > MAX_RANGE_CELLS) {
            throw new FormulaException(FormulaErrorKind.RANGE_OUT_OF_BOUNDS,
                    "Range " + start + ":" + end + " covers more than " + MAX_RANGE_CELLS + " cells");
        }
        List<CellCoordinate> coordinates = new ArrayList<>((int) area);
        for (int row = minRow; row <= maxRow; row++) {
            for (int col = minCol; col <= maxCol; col++) {
                coordinates.add(new CellCoordinate(row, col));
            }
        }
        return coordinates;
    }

    private static CellCoordinate decode(String identifier) {
        return CellReferences.toCoordinate(identifier)
                .orElseThrow(() -> new FormulaException(FormulaErrorKind.UNKNOWN_REFERENCE,
                        "Unknown reference in range: " + identifier));
    }
}
