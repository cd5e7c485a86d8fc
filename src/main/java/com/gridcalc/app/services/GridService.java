package com.gridcalc.app.services;

import com.gridcalc.app.evaluation.GridEvaluator;
import com.gridcalc.app.exceptions.GridTooLargeException;
import com.gridcalc.app.exceptions.RaggedGridException;
import com.gridcalc.app.models.EvaluationResult;
import com.gridcalc.app.util.ColumnLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates grids on behalf of the controller and exposes the column label codec.
 * Holds no grid state: every call gets its own {@link GridEvaluator}.
 */
@Service
public class GridService {

    private static final Logger logger = LoggerFactory.getLogger(GridService.class);

    // Caps the work and memory of a single request
    private final long maxCells;

    public GridService(@Value("${gridcalc.evaluation.max-cells:10000}") long maxCells) {
        this.maxCells = maxCells;
    }

    /**
     * Evaluates every cell of {@code cells} and returns the resolved values.
     *
     * @throws GridTooLargeException if the grid has more cells than allowed
     */
    public EvaluationResult evaluate(List<List<String>> cells) {
        if (cells == null) {
            throw new RaggedGridException("Request must contain a 'cells' array");
        }
        long cellCount = countCells(cells);
        if (cellCount > maxCells) {
            logger.warn("Rejecting grid with {} cells (limit {})", cellCount, maxCells);
            throw new GridTooLargeException("Grid has " + cellCount + " cells, the limit is " + maxCells);
        }

        GridEvaluator evaluator = new GridEvaluator(cells);
        logger.info("Evaluating grid of {} rows x {} columns", evaluator.getRows(), evaluator.getColumns());
        long[][] values = evaluator.evaluateAll();
        logger.debug("Evaluated {} cells", cellCount);
        return new EvaluationResult(evaluator.getRows(), evaluator.getColumns(), values);
    }

    public int labelToIndex(String label) {
        return ColumnLabels.labelToIndex(label);
    }

    public String indexToLabel(int index) {
        return ColumnLabels.indexToLabel(index);
    }

    private long countCells(List<List<String>> cells) {
        long count = 0;
        for (List<String> row : cells) {
            if (row != null) {
                count += row.size();
            }
        }
        return count;
    }
}
