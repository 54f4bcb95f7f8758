package com.gridcalc.app.services;

import com.gridcalc.app.config.GridCalcProperties;
import com.gridcalc.app.exceptions.GridNotFoundException;
import com.gridcalc.app.exceptions.InvalidCellReferenceException;
import com.gridcalc.app.formula.CellReferences;
import com.gridcalc.app.formula.DependencyExtractor;
import com.gridcalc.app.formula.GridEvaluator;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.CellView;
import com.gridcalc.app.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Editing side of the calculator: creates grids, applies cell edits and
 * resizes, and runs a full evaluation pass after every change.
 */
@Service
public class GridService {
    private static final Logger logger = LoggerFactory.getLogger(GridService.class);

    // All grids live here in memory; there is no persistent store
    private final Map<Long, Grid> grids = new ConcurrentHashMap<>();

    private final GridEvaluator gridEvaluator;
    private final GridCalcProperties properties;

    public GridService(GridEvaluator gridEvaluator, GridCalcProperties properties) {
        this.gridEvaluator = gridEvaluator;
        this.properties = properties;
    }

    /**
     * Creates a new empty grid and returns its ID.
     * Sizes below the configured minimum (or missing) are raised to it.
     */
    public long createGrid(Integer rows, Integer cols) {
        GridCalcProperties.GridSettings settings = properties.getGrid();
        int actualRows = Math.max(settings.getMinRows(), rows == null ? 0 : rows);
        int actualCols = Math.max(settings.getMinCols(), cols == null ? 0 : cols);
        Grid grid = new Grid(actualRows, actualCols);
        grids.put(grid.getId(), grid);
        logger.info("Created grid {} ({}x{})", grid.getId(), actualRows, actualCols);
        return grid.getId();
    }

    /**
     * Retrieves a Grid by ID. Throws if not found.
     */
    public Grid getGrid(long gridId) {
        Grid grid = grids.get(gridId);
        if (grid == null) {
            throw new GridNotFoundException("Grid not found: " + gridId);
        }
        return grid;
    }

    /**
     * Replaces a cell with the parsed input and re-evaluates the whole grid.
     * Formula errors do not fail the call; they are stored in the cells.
     */
    public void setCellValue(long gridId, String cellId, String rawValue) {
        mutate(gridId, grid -> {
            CellCoordinate at = resolveCell(grid, cellId);
            grid.setCell(at.getRow(), at.getColumn(), Cell.fromInput(rawValue));
            logger.debug("Grid {}: {} <- {}", gridId, cellId, rawValue);
        });
    }

    public CellView getCell(long gridId, String cellId) {
        Grid grid = getGrid(gridId);
        grid.getLock().readLock().lock();
        try {
            CellCoordinate at = resolveCell(grid, cellId);
            return CellView.of(cellId, grid.getCell(at));
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * Returns cellId -> display value for every non-empty cell, row by row.
     * Formula cells show their error instead of the value when they have one.
     */
    public Map<String, Object> getGridData(long gridId) {
        Grid grid = getGrid(gridId);
        grid.getLock().readLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (int row = 0; row < grid.getRows(); row++) {
                for (int col = 0; col < grid.getCols(); col++) {
                    Cell cell = grid.getCell(row, col);
                    if (cell.isEmpty()) {
                        continue;
                    }
                    String id = CellReferences.toIdentifier(row, col);
                    data.put(id, CellView.of(id, cell).displayValue());
                }
            }
            return data;
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    /**
     * The dependency map the last evaluation pass was (or the next one will be) built from.
     */
    public Map<String, Set<String>> getDependencies(long gridId) {
        Grid grid = getGrid(gridId);
        grid.getLock().readLock().lock();
        try {
            return DependencyExtractor.extract(grid);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    public void insertRow(long gridId, int at) {
        mutate(gridId, grid -> grid.insertRow(at));
    }

    public void insertColumn(long gridId, int at) {
        mutate(gridId, grid -> grid.insertColumn(at));
    }

    public void trim(long gridId) {
        GridCalcProperties.GridSettings settings = properties.getGrid();
        mutate(gridId, grid -> grid.trim(settings.getMinRows(), settings.getMinCols()));
    }

    /**
     * Re-runs the evaluation pass without changing any cell.
     */
    public void evaluate(long gridId) {
        mutate(gridId, grid -> { });
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private void mutate(long gridId, Consumer<Grid> change) {
        Grid grid = getGrid(gridId);

        // One writer at a time; the evaluation pass must not see concurrent edits
        grid.getLock().writeLock().lock();
        try {
            change.accept(grid);
            gridEvaluator.evaluateGrid(grid);
        } finally {
            grid.getLock().writeLock().unlock();
        }
    }

    private static CellCoordinate resolveCell(Grid grid, String cellId) {
        CellCoordinate at = CellReferences.toCoordinate(cellId)
                .orElseThrow(() -> new InvalidCellReferenceException(
                        "Cell " + cellId + " is not a valid reference"));
        if (!grid.contains(at)) {
            throw new InvalidCellReferenceException("Cell " + cellId + " is outside the "
                    + grid.getRows() + "x" + grid.getCols() + " grid");
        }
        return at;
    }
}
