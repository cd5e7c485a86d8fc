package com.gridcalc.app.evaluation;

import com.gridcalc.app.exceptions.CircularReferenceException;
import com.gridcalc.app.exceptions.InvalidCellValueException;
import com.gridcalc.app.exceptions.InvalidFormulaException;
import com.gridcalc.app.exceptions.InvalidLabelException;
import com.gridcalc.app.exceptions.InvalidTokenException;
import com.gridcalc.app.exceptions.RaggedGridException;
import com.gridcalc.app.exceptions.ReferenceOutOfRangeException;
import com.gridcalc.app.models.CellCoordinate;
import com.gridcalc.app.models.EvaluationState;
import com.gridcalc.app.util.ColumnLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates a rectangular grid of raw cell texts into integers.
 * <p>
 * Supported cell contents:
 * <ul>
 *   <li>blank (after trimming) -> 0</li>
 *   <li>an integer literal such as "5" or " -12 "</li>
 *   <li>a formula starting with "=": a single operand ({@code =A1}, {@code =7}) or
 *       two operands joined by {@code +} or {@code -} ({@code =A1+5}, {@code =10-B2})</li>
 * </ul>
 * Operands are integers or references like {@code AA12} (column label, one-based row).
 * <p>
 * Each cell is computed at most once and memoized. Cycles are detected by the
 * per-cell {@link EvaluationState}: re-entering a cell that is IN_PROGRESS throws
 * {@link CircularReferenceException}.
 * <p>
 * References are followed depth-first on an explicit stack of {@link PendingCell}s rather
 * than the call stack, so the length of a reference chain is bounded only by the grid.
 * <p>
 * An instance owns all of its tables and is not thread-safe; evaluate independent
 * grids with independent instances.
 */
public class GridEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(GridEvaluator.class);

    // Operators are kept as tokens when splitting a formula
    private static final Pattern OPERATOR_PATTERN = Pattern.compile("[+-]");

    // A cell reference: letters for the column, digits for the one-based row, e.g. "AA12"
    private static final Pattern REFERENCE_PATTERN = Pattern.compile("([A-Za-z]+)([0-9]+)");

    private final String[][] cells;
    private final long[][] values;
    private final EvaluationState[][] states;
    private final int rows;
    private final int columns;

    /**
     * Copies the grid; later changes to {@code grid} are not seen by this evaluator.
     * A null cell is treated as blank.
     *
     * @throws RaggedGridException if the grid or one of its rows is null,
     *                             or the rows differ in length
     */
    public GridEvaluator(List<List<String>> grid) {
        if (grid == null) {
            throw new RaggedGridException("Grid must not be null");
        }
        this.rows = grid.size();
        this.columns = rows > 0 && grid.get(0) != null ? grid.get(0).size() : 0;

        this.cells = new String[rows][];
        for (int r = 0; r < rows; r++) {
            List<String> row = grid.get(r);
            if (row == null) {
                throw new RaggedGridException("Row " + (r + 1) + " is null");
            }
            if (row.size() != columns) {
                throw new RaggedGridException("All rows must have the same number of columns: row "
                        + (r + 1) + " has " + row.size() + ", expected " + columns);
            }
            cells[r] = row.toArray(new String[0]);
        }

        this.values = new long[rows][columns];
        this.states = new EvaluationState[rows][columns];
        for (EvaluationState[] stateRow : states) {
            Arrays.fill(stateRow, EvaluationState.NOT_STARTED);
        }
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * Evaluates every cell in row-major order and returns a copy of the resolved values.
     * Cells already resolved by an earlier call are not recomputed.
     */
    public long[][] evaluateAll() {
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                if (states[r][c] != EvaluationState.DONE) {
                    evaluateCell(r, c);
                }
            }
        }
        long[][] result = new long[rows][];
        for (int r = 0; r < rows; r++) {
            result[r] = values[r].clone();
        }
        return result;
    }

    /**
     * Evaluates a single cell by zero-based coordinates.
     *
     * @throws ReferenceOutOfRangeException if the coordinates lie outside the grid
     */
    public long evaluateCell(int row, int column) {
        return evaluateCell(new CellCoordinate(row, column));
    }

    public long evaluateCell(CellCoordinate coordinate) {
        if (!contains(coordinate.getRow(), coordinate.getColumn())) {
            throw new ReferenceOutOfRangeException("Cell " + coordinate + " is outside the grid "
                    + describeBounds());
        }
        if (stateOf(coordinate) == EvaluationState.DONE) {
            return valueOf(coordinate);
        }
        if (stateOf(coordinate) == EvaluationState.IN_PROGRESS) {
            throw circularReference(coordinate);
        }

        Deque<PendingCell> pending = new ArrayDeque<>();
        try {
            pending.push(start(coordinate));
            while (!pending.isEmpty()) {
                PendingCell current = pending.peek();
                if (current.isResolved()) {
                    finish(current);
                    pending.pop();
                    continue;
                }
                String token = current.nextOperand();
                if (!REFERENCE_PATTERN.matcher(token).matches()) {
                    current.accept(parseLiteral(token));
                    continue;
                }
                CellCoordinate target = parseReference(token);
                switch (stateOf(target)) {
                    case DONE:
                        current.accept(valueOf(target));
                        break;
                    case IN_PROGRESS:
                        throw circularReference(target);
                    default:
                        pending.push(start(target));
                        break;
                }
            }
        } catch (RuntimeException ex) {
            // Leave no stale IN_PROGRESS marker behind, so a retry reports the same error
            for (PendingCell cell : pending) {
                states[cell.coordinate.getRow()][cell.coordinate.getColumn()] = EvaluationState.NOT_STARTED;
            }
            throw ex;
        }
        return valueOf(coordinate);
    }

    /**
     * Evaluates the cell named by a reference such as "B2" or "aa10".
     *
     * @throws InvalidTokenException        if {@code reference} is not of the form letters+digits
     * @throws ReferenceOutOfRangeException if it names a cell outside the grid
     */
    public long evaluateReference(String reference) {
        String ref = reference == null ? "" : stripSpaces(reference);
        if (!REFERENCE_PATTERN.matcher(ref).matches()) {
            throw new InvalidTokenException("Invalid reference: '" + reference + "'");
        }
        return evaluateCell(parseReference(ref));
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    /**
     * Reads the cell's text and marks it IN_PROGRESS. Blank cells and literals come back
     * already resolved; formulas come back with their operands still to be evaluated.
     */
    private PendingCell start(CellCoordinate coordinate) {
        String raw = cells[coordinate.getRow()][coordinate.getColumn()];
        String content = raw == null ? "" : stripSpaces(raw);

        PendingCell cell;
        if (content.isEmpty()) {
            cell = PendingCell.resolved(coordinate, 0);
        } else if (content.startsWith("=")) {
            cell = PendingCell.formula(coordinate, stripSpaces(content.substring(1)));
        } else {
            try {
                cell = PendingCell.resolved(coordinate, Long.parseLong(content));
            } catch (NumberFormatException e) {
                throw new InvalidCellValueException("Invalid cell value at row " + (coordinate.getRow() + 1)
                        + ", column " + (coordinate.getColumn() + 1) + " (" + coordinate.toLabel() + "): '"
                        + raw + "'");
            }
        }
        states[coordinate.getRow()][coordinate.getColumn()] = EvaluationState.IN_PROGRESS;
        return cell;
    }

    private void finish(PendingCell cell) {
        long value = cell.result();
        CellCoordinate coordinate = cell.coordinate;
        values[coordinate.getRow()][coordinate.getColumn()] = value;
        states[coordinate.getRow()][coordinate.getColumn()] = EvaluationState.DONE;
        logger.trace("{} = {}", coordinate.toLabel(), value);
    }

    /**
     * Splits on '+' and '-', keeping the operators as tokens, then drops blank fragments.
     * "A1 + 5" -> [A1, +, 5]; "-5" -> [-, 5].
     */
    static List<String> tokenize(String formula) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = OPERATOR_PATTERN.matcher(formula);
        int start = 0;
        while (matcher.find()) {
            addIfNotBlank(tokens, formula.substring(start, matcher.start()));
            tokens.add(matcher.group());
            start = matcher.end();
        }
        addIfNotBlank(tokens, formula.substring(start));
        return tokens;
    }

    private static void addIfNotBlank(List<String> tokens, String fragment) {
        String stripped = stripSpaces(fragment);
        if (!stripped.isEmpty()) {
            tokens.add(stripped);
        }
    }

    /**
     * Strips leading and trailing whitespace, including no-break and other Unicode spaces
     * that {@link String#strip()} keeps.
     */
    static String stripSpaces(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static long parseLiteral(String token) {
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new InvalidTokenException("Invalid token: '" + token + "'");
        }
    }

    /**
     * Parses a reference already known to match REFERENCE_PATTERN into a zero-based coordinate.
     */
    private CellCoordinate parseReference(String reference) {
        Matcher matcher = REFERENCE_PATTERN.matcher(reference);
        if (!matcher.matches()) {
            throw new InvalidTokenException("Invalid reference: '" + reference + "'");
        }
        int column;
        int row;
        try {
            column = ColumnLabels.labelToIndex(matcher.group(1)) - 1;
            row = Integer.parseInt(matcher.group(2)) - 1;
        } catch (InvalidLabelException | NumberFormatException e) {
            throw outOfRange(reference);
        }
        if (!contains(row, column)) {
            throw outOfRange(reference);
        }
        return new CellCoordinate(row, column);
    }

    private EvaluationState stateOf(CellCoordinate coordinate) {
        return states[coordinate.getRow()][coordinate.getColumn()];
    }

    private long valueOf(CellCoordinate coordinate) {
        return values[coordinate.getRow()][coordinate.getColumn()];
    }

    private boolean contains(int row, int column) {
        return row >= 0 && row < rows && column >= 0 && column < columns;
    }

    private CircularReferenceException circularReference(CellCoordinate coordinate) {
        // We came back to a cell still being computed
        logger.debug("Cycle closed at {}", coordinate.toLabel());
        return new CircularReferenceException("Circular reference detected at " + coordinate.toLabel());
    }

    private ReferenceOutOfRangeException outOfRange(String reference) {
        return new ReferenceOutOfRangeException("Reference out of range: " + reference
                + " is outside the grid " + describeBounds());
    }

    private String describeBounds() {
        if (rows == 0 || columns == 0) {
            return "(" + rows + " rows x " + columns + " columns, empty)";
        }
        return "(" + rows + " rows x " + columns + " columns, A1:"
                + new CellCoordinate(rows - 1, columns - 1).toLabel() + ")";
    }

    /**
     * A cell on the evaluation stack: its operands are evaluated left to right,
     * and the operator is applied once both are known.
     */
    private static final class PendingCell {
        private final CellCoordinate coordinate;
        private final String formula;
        private final String[] operands;
        private final String operator;
        private final long[] operandValues;
        private int next;
        private final long literal;

        private PendingCell(CellCoordinate coordinate, String formula, String[] operands,
                            String operator, long literal) {
            this.coordinate = coordinate;
            this.formula = formula;
            this.operands = operands;
            this.operator = operator;
            this.operandValues = new long[operands.length];
            this.literal = literal;
        }

        static PendingCell resolved(CellCoordinate coordinate, long value) {
            return new PendingCell(coordinate, null, new String[0], null, value);
        }

        /**
         * Only "operand" and "operand op operand" are accepted.
         */
        static PendingCell formula(CellCoordinate coordinate, String formula) {
            List<String> tokens = tokenize(formula);
            if (tokens.size() == 1) {
                return new PendingCell(coordinate, formula, new String[]{tokens.get(0)}, null, 0);
            }
            if (tokens.size() != 3) {
                throw new InvalidFormulaException("Invalid formula: '" + formula + "'");
            }
            return new PendingCell(coordinate, formula,
                    new String[]{tokens.get(0), tokens.get(2)}, tokens.get(1), 0);
        }

        boolean isResolved() {
            return next == operands.length;
        }

        String nextOperand() {
            return operands[next];
        }

        void accept(long value) {
            operandValues[next++] = value;
        }

        long result() {
            if (operands.length == 0) {
                return literal;
            }
            if (operator == null) {
                return operandValues[0];
            }
            long left = operandValues[0];
            long right = operandValues[1];
            try {
                switch (operator) {
                    case "+":
                        return Math.addExact(left, right);
                    case "-":
                        return Math.subtractExact(left, right);
                    default:
                        throw new InvalidFormulaException("Invalid operator '" + operator + "' in formula '"
                                + formula + "'. Only '+' and '-' are supported");
                }
            } catch (ArithmeticException e) {
                throw new InvalidFormulaException("Integer overflow in formula: '" + formula + "'");
            }
        }
    }
}
