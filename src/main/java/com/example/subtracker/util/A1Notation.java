package com.example.subtracker.util;

/**
 * Converts 0-based column indices and 1-based row numbers into spreadsheet A1 ranges.
 */
public final class A1Notation {

    private static final int ALPHABET_SIZE = 26;

    private A1Notation() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Returns the column letter for a 0-based index: 0 is "A", 25 is "Z", 26 is "AA".
     */
    public static String columnLetter(int columnIndex) {
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column index cannot be negative: " + columnIndex);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = columnIndex + 1;
        while (remaining > 0) {
            int offset = (remaining - 1) % ALPHABET_SIZE;
            letters.insert(0, (char) ('A' + offset));
            remaining = (remaining - 1) / ALPHABET_SIZE;
        }
        return letters.toString();
    }

    public static String rowRange(int rowNumber, int columnCount) {
        if (rowNumber < 1) {
            throw new IllegalArgumentException("Row numbers start at 1: " + rowNumber);
        }
        if (columnCount < 1) {
            throw new IllegalArgumentException("Column count must be positive: " + columnCount);
        }
        return "A" + rowNumber + ":" + columnLetter(columnCount - 1) + rowNumber;
    }

    public static String columnsRange(int columnCount) {
        String last = columnLetter(columnCount - 1);
        return "A:" + last;
    }
}
