package com.gridcalc.app.models;

/**
 * Resolved values of an evaluated grid, same shape as the input.
 */
public class EvaluationResult {
    private int rows;
    private int columns;
    private long[][] values;

    public EvaluationResult() {
    }

    public EvaluationResult(int rows, int columns, long[][] values) {
        this.rows = rows;
        this.columns = columns;
        this.values = values;
    }

    public int getRows() {
        return rows;
    }
    public int getColumns() {
        return columns;
    }
    public long[][] getValues() {
        return values;
    }

    public void setRows(int rows) {
        this.rows = rows;
    }
    public void setColumns(int columns) {
        this.columns = columns;
    }
    public void setValues(long[][] values) {
        this.values = values;
    }
}
