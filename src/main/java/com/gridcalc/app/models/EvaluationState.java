package com.gridcalc.app.models;

/**
 * Per-cell evaluation progress: NOT_STARTED -> IN_PROGRESS -> DONE.
 * Meeting a cell that is still IN_PROGRESS means the references loop back
 * on themselves. A cell whose evaluation fails goes back to NOT_STARTED.
 */
public enum EvaluationState {
    NOT_STARTED,
    IN_PROGRESS,
    DONE
}
