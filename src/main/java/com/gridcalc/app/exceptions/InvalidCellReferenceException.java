package com.gridcalc.app.exceptions;

/**
 * Thrown when a request names a cell that is not a valid identifier
 * or lies outside the grid, e.g. "Cell AA1 is not a valid reference".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
