package com.gridcalc.app.models;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire grid of cells:
 * - Has a unique ID
 * - A dense row-major array of cells, always rows * cols long
 * - A read/write lock used by the service layer around edits and evaluation passes
 *
 * The formula engine only reads and writes existing cells; resizing
 * (insertRow, insertColumn, trim) belongs to the editing side.
 */
public class Grid {

    // Generates unique IDs for newly created grids
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private int rows;
    private int cols;
    private Cell[] cells;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Grid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid must have at least one row and one column, got "
                    + rows + "x" + cols);
        }
        this.id = ID_GENERATOR.getAndIncrement();
        this.rows = rows;
        this.cols = cols;
        this.cells = new Cell[rows * cols];
        Arrays.fill(cells, Cell.empty());
    }

    public long getId() {
        return id;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public boolean contains(CellCoordinate coordinate) {
        return contains(coordinate.getRow(), coordinate.getColumn());
    }

    public Cell getCell(int row, int col) {
        checkBounds(row, col);
        return cells[row * cols + col];
    }

    public Cell getCell(CellCoordinate coordinate) {
        return getCell(coordinate.getRow(), coordinate.getColumn());
    }

    public void setCell(int row, int col, Cell cell) {
        checkBounds(row, col);
        cells[row * cols + col] = cell == null ? Cell.empty() : cell;
    }

    private void checkBounds(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + col + ") is outside a "
                    + rows + "x" + cols + " grid");
        }
    }

    // ------------------------
    // Resizing (editor side)
    // ------------------------

    /**
     * Inserts an empty row before index 'at' (at == rows appends).
     */
    public void insertRow(int at) {
        if (at < 0 || at > rows) {
            throw new IndexOutOfBoundsException("Row insertion index " + at + " outside 0.." + rows);
        }
        Cell[] resized = new Cell[(rows + 1) * cols];
        Arrays.fill(resized, Cell.empty());
        for (int r = 0; r < rows; r++) {
            int target = r < at ? r : r + 1;
            System.arraycopy(cells, r * cols, resized, target * cols, cols);
        }
        cells = resized;
        rows++;
    }

    /**
     * Inserts an empty column before index 'at' (at == cols appends).
     */
    public void insertColumn(int at) {
        if (at < 0 || at > cols) {
            throw new IndexOutOfBoundsException("Column insertion index " + at + " outside 0.." + cols);
        }
        int newCols = cols + 1;
        Cell[] resized = new Cell[rows * newCols];
        Arrays.fill(resized, Cell.empty());
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int target = c < at ? c : c + 1;
                resized[r * newCols + target] = cells[r * cols + c];
            }
        }
        cells = resized;
        cols = newCols;
    }

    /**
     * Shrinks the grid to the smallest size that still holds every non-empty
     * cell, never going below minRows x minCols and never growing.
     */
    public void trim(int minRows, int minCols) {
        int newRows = Math.min(rows, Math.max(minRows, lastNonEmptyRow() + 1));
        int newCols = Math.min(cols, Math.max(minCols, lastNonEmptyColumn() + 1));
        if (newRows == rows && newCols == cols) {
            return;
        }
        Cell[] resized = new Cell[newRows * newCols];
        for (int r = 0; r < newRows; r++) {
            System.arraycopy(cells, r * cols, resized, r * newCols, newCols);
        }
        cells = resized;
        rows = newRows;
        cols = newCols;
    }

    /**
     * Index of the last row holding a non-empty cell, or -1 if the grid is empty.
     */
    public int lastNonEmptyRow() {
        for (int r = rows - 1; r >= 0; r--) {
            for (int c = 0; c < cols; c++) {
                if (!cells[r * cols + c].isEmpty()) {
                    return r;
                }
            }
        }
        return -1;
    }

    /**
     * Index of the last column holding a non-empty cell, or -1 if the grid is empty.
     */
    public int lastNonEmptyColumn() {
        for (int c = cols - 1; c >= 0; c--) {
            for (int r = 0; r < rows; r++) {
                if (!cells[r * cols + c].isEmpty()) {
                    return c;
                }
            }
        }
        return -1;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
