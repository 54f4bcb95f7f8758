package com.gridcalc.app.models;

public final class EmptyCell extends Cell {
    static final EmptyCell INSTANCE = new EmptyCell();

    private EmptyCell() {
    }

    @Override
    public CellKind getKind() {
        return CellKind.EMPTY;
    }

    @Override
    public String getRawValue() {
        return "";
    }
}
