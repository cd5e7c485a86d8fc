package com.gridcalc.app.models;

import java.util.List;

/**
 * Request body for grid evaluation: the raw cell texts, row by row.
 * For example: { "cells": [["1", "=A1+1"], ["", "=B1-A1"]] }
 */
public class EvaluationRequest {
    private List<List<String>> cells;

    // Default constructor needed for JSON (de)serialization
    public EvaluationRequest() {
    }

    public EvaluationRequest(List<List<String>> cells) {
        this.cells = cells;
    }

    public List<List<String>> getCells() {
        return cells;
    }

    public void setCells(List<List<String>> cells) {
        this.cells = cells;
    }
}
