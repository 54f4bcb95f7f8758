package com.gridcalc.app.models;

import java.util.Objects;

public final class TextCell extends Cell {
    private final String value;

    TextCell(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public CellKind getKind() {
        return CellKind.TEXT;
    }

    @Override
    public String getRawValue() {
        return value;
    }
}
