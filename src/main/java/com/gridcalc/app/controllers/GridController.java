package com.gridcalc.app.controllers;

import com.gridcalc.app.models.EvaluationRequest;
import com.gridcalc.app.models.EvaluationResult;
import com.gridcalc.app.services.GridService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST endpoints for evaluating grids and converting column labels.
 * "/grid" is the base path.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    private final GridService gridService;

    public GridController(GridService gridService) {
        this.gridService = gridService;
    }

    /**
     * POST /grid/evaluate
     * Body: { "cells": [["10", "=A1+5"], ...] }.
     * Returns { "rows": r, "columns": c, "values": [[10, 15], ...] }.
     * Any evaluation error is turned into a 4xx by the GlobalExceptionHandler.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResult> evaluate(@RequestBody EvaluationRequest request) {
        return ResponseEntity.ok(gridService.evaluate(request.getCells()));
    }

    /**
     * GET /grid/labels/{label}
     * Returns { "label": "AA", "index": 27 }.
     */
    @GetMapping("/labels/{label}")
    public ResponseEntity<Map<String, Object>> labelToIndex(@PathVariable String label) {
        int index = gridService.labelToIndex(label);
        return ResponseEntity.ok(Map.of("label", label, "index", index));
    }

    /**
     * GET /grid/labels/index/{index}
     * Returns { "index": 27, "label": "AA" }.
     */
    @GetMapping("/labels/index/{index}")
    public ResponseEntity<Map<String, Object>> indexToLabel(@PathVariable int index) {
        String label = gridService.indexToLabel(index);
        return ResponseEntity.ok(Map.of("index", index, "label", label));
    }
}
