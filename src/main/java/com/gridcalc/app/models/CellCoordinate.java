package com.gridcalc.app.models;

import com.gridcalc.app.util.ColumnLabels;

import java.util.Objects;

/**
 * Zero-based (row, column) position of a cell in a grid.
 * The label form is one-based: (0, 0) -> "A1", (1, 27) -> "AB2".
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

    /**
     * Column label followed by the one-based row number, e.g. "B2".
     */
    public String toLabel() {
        return ColumnLabels.indexToLabel(column + 1) + (row + 1);
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

    /**
     * The label, or "(row, column)" for a coordinate that has no label (negative indices).
     */
    @Override
    public String toString() {
        if (row < 0 || column < 0) {
            return "(" + row + ", " + column + ")";
        }
        return toLabel();
    }
}
