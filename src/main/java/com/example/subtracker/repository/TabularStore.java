package com.example.subtracker.repository;

import java.util.List;

/**
 * Native addressing of one spreadsheet: a grid of strings read whole, written one row at a time.
 */
public interface TabularStore {

    String id();

    /**
     * Reads every populated row, header included. Rows may be shorter than the schema when
     * trailing cells are empty. An unprovisioned sheet returns an empty list.
     */
    List<List<String>> readAll();

    /**
     * Overwrites the cells of a 1-based row, starting at the first column.
     */
    void writeRow(int rowNumber, List<String> values);
}
