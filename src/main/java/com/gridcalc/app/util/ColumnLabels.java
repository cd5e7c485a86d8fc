package com.gridcalc.app.util;

import com.gridcalc.app.exceptions.InvalidIndexException;
import com.gridcalc.app.exceptions.InvalidLabelException;

/**
 * Converts between spreadsheet column labels and one-based column numbers.
 * Labels are bijective base-26 numerals: A=1, Z=26, AA=27, ZZ=702, AAA=703.
 * There is no zero digit, which is why both directions shift by one per digit.
 */
public final class ColumnLabels {

    private static final int RADIX = 26;

    private ColumnLabels() {
    }

    /**
     * Decodes a column label (case-insensitive) into its one-based number.
     * An empty label decodes to 0.
     *
     * @throws InvalidLabelException if the label is null, contains a character that is
     *                               not an ASCII letter, or is too long to fit in an int
     */
    public static int labelToIndex(String label) {
        if (label == null) {
            throw new InvalidLabelException("Column label must not be null");
        }
        int result = 0;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            int digit;
            if (c >= 'A' && c <= 'Z') {
                digit = c - 'A' + 1;
            } else if (c >= 'a' && c <= 'z') {
                digit = c - 'a' + 1;
            } else {
                throw new InvalidLabelException("Invalid character '" + c + "' in column label '"
                        + label + "'. Only letters A-Z are allowed");
            }
            try {
                result = Math.addExact(Math.multiplyExact(result, RADIX), digit);
            } catch (ArithmeticException e) {
                throw new InvalidLabelException("Column label is too long: " + label);
            }
        }
        return result;
    }

    /**
     * Encodes a one-based column number as an uppercase label. 0 encodes to "".
     *
     * @throws InvalidIndexException if {@code index} is negative
     */
    public static String indexToLabel(int index) {
        if (index < 0) {
            throw new InvalidIndexException("Column index must be non-negative: " + index);
        }
        StringBuilder sb = new StringBuilder();
        int n = index;
        while (n > 0) {
            int remainder = (n - 1) % RADIX;
            sb.append((char) ('A' + remainder));
            n = (n - 1) / RADIX;
        }
        return sb.reverse().toString();
    }
}
