package com.rtops.ingestion.source;

import java.util.Collections;
import java.util.List;

/**
 * Cell text of one worksheet, detached from the workbook it was read from.
 * 
 * Row 0 is the header row. Cells are kept as display strings; a missing cell
 * is an empty string. Rows may have different lengths.
 */
public class SheetData {
    private final String name;
    private final List<List<String>> rows;

    public SheetData(String name, List<List<String>> rows) {
        this.name = name;
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    }

    public String getName() {
        return name;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    /**
     * @return the header row, or an empty list for an empty sheet
     */
    public List<String> getHeader() {
        return rows.isEmpty() ? Collections.emptyList() : rows.get(0);
    }

    /**
     * Get a cell value, tolerating short rows
     *
     * @param row zero-based row index
     * @param column zero-based column index
     * @return the cell text, or "" if the row or cell is absent
     */
    public String cell(int row, int column) {
        if (row < 0 || row >= rows.size() || column < 0) {
            return "";
        }
        List<String> cells = rows.get(row);
        if (column >= cells.size() || cells.get(column) == null) {
            return "";
        }
        return cells.get(column);
    }

    public int getRowCount() {
        return rows.size();
    }
}
