package com.gridcalc.app.formula;

import com.gridcalc.app.models.CellCoordinate;

import java.util.Optional;

/**
 * Conversions between zero-based coordinates and cell identifiers such as "B5".
 *
 * Column labels are bijective base-26: 0=A, 25=Z, 26=AA, 701=ZZ, 702=AAA.
 * Identifier decoding reads a single leading column letter, so columns past Z
 * can be labelled but not referenced.
 */
public final class CellReferences {

    private CellReferences() {
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA", ...
     */
    public static String columnLabel(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must be non-negative: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            sb.append((char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Inverse of {@link #columnLabel(int)}; returns -1 for anything that is
     * not a non-empty run of uppercase letters.
     */
    public static int columnIndex(String label) {
        if (label == null || label.isEmpty()) {
            return -1;
        }
        long index = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            index = index * 26 + (c - 'A' + 1);
            if (index > Integer.MAX_VALUE) {
                return -1;
            }
        }
        return (int) index - 1;
    }

    /**
     * Decodes "B5" into (4, 1). Empty if the first character is not a column
     * letter A-Z or the rest is not a row number of at least 1.
     */
    public static Optional<CellCoordinate> toCoordinate(String identifier) {
        if (identifier == null || identifier.length() < 2) {
            return Optional.empty();
        }
        int column = identifier.charAt(0) - 'A';
        if (column < 0 || column > 25) {
            return Optional.empty();
        }
        String digits = identifier.substring(1);
        for (int i = 0; i < digits.length(); i++) {
            if (!isAsciiDigit(digits.charAt(i))) {
                return Optional.empty();
            }
        }
        int rowNumber;
        try {
            rowNumber = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // too many digits for an int
            return Optional.empty();
        }
        if (rowNumber < 1) {
            return Optional.empty();
        }
        return Optional.of(new CellCoordinate(rowNumber - 1, column));
    }

    public static String toIdentifier(int row, int column) {
        if (row < 0) {
            throw new IllegalArgumentException("Row index must be non-negative: " + row);
        }
        return columnLabel(column) + (row + 1);
    }

    public static String toIdentifier(CellCoordinate coordinate) {
        return toIdentifier(coordinate.getRow(), coordinate.getColumn());
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
