package com.gridcalc.app.controllers;

import com.gridcalc.app.models.CellView;
import com.gridcalc.app.services.GridService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for editing and reading grids.
 * "/grid" is the base path.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private GridService gridService;

    /**
     * POST /grid
     * Body: { "rows": 20, "cols": 8 } (both optional).
     * Creates an empty grid, returns its ID.
     */
    @PostMapping
    public ResponseEntity<Long> createGrid(@RequestBody(required = false) Map<String, Integer> request) {
        Integer rows = request == null ? null : request.get("rows");
        Integer cols = request == null ? null : request.get("cols");
        long gridId = gridService.createGrid(rows, cols);
        return ResponseEntity.ok(gridId);
    }

    /**
     * PUT /grid/{gridId}/cell/{cellId}
     * Body: raw input ("42", "hello", "=SUM(A1:B2)"; empty clears the cell).
     * The grid is re-evaluated; formula errors are reported in the cells, not as HTTP errors.
     */
    @PutMapping("/{gridId}/cell/{cellId}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long gridId,
            @PathVariable String cellId,
            @RequestBody(required = false) String rawValue
    ) {
        gridService.setCellValue(gridId, cellId, rawValue);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /grid/{gridId}
     * Returns display values of all non-empty cells: { "A1": 1.0, "B1": "Division by zero", ... }.
     */
    @GetMapping("/{gridId}")
    public ResponseEntity<Map<String, Object>> getGrid(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getGridData(gridId));
    }

    @GetMapping("/{gridId}/cell/{cellId}")
    public ResponseEntity<CellView> getCell(@PathVariable long gridId, @PathVariable String cellId) {
        return ResponseEntity.ok(gridService.getCell(gridId, cellId));
    }

    /**
     * GET /grid/{gridId}/dependencies
     * For each formula cell (and each cell it reads) => the set of cells it reads.
     */
    @GetMapping("/{gridId}/dependencies")
    public ResponseEntity<Map<String, Set<String>>> getDependencies(@PathVariable long gridId) {
        return ResponseEntity.ok(gridService.getDependencies(gridId));
    }

    @PostMapping("/{gridId}/rows")
    public ResponseEntity<Void> insertRow(@PathVariable long gridId, @RequestParam int at) {
        gridService.insertRow(gridId, at);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{gridId}/columns")
    public ResponseEntity<Void> insertColumn(@PathVariable long gridId, @RequestParam int at) {
        gridService.insertColumn(gridId, at);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{gridId}/trim")
    public ResponseEntity<Void> trim(@PathVariable long gridId) {
        gridService.trim(gridId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{gridId}/evaluate")
    public ResponseEntity<Void> evaluate(@PathVariable long gridId) {
        gridService.evaluate(gridId);
        return ResponseEntity.ok().build();
    }
}
