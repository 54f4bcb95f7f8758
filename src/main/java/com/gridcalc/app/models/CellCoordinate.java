package com.gridcalc.app.models;

import java.util.Objects;

/**
 * A zero-based (row, column) position in a grid.
 */
public final class CellCoordinate {
    private final int row;
    private final int column;

    public CellCoordinate(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellCoordinate)) {
            return false;
        }
        CellCoordinate other = (CellCoordinate) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
