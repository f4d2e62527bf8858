package com.bmsedge.cbcr.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One worksheet as read from the uploaded workbook.
 * Column names come from the first row; every later row is a data row.
 * The typed values of the first row are kept next to the names, since some
 * sheets put data there as well. A {@code null} cell value means the cell
 * is missing (NA).
 */
@Getter
public class SheetData {

    /** Name given to a column whose header cell is blank. */
    public static final String UNNAMED_COLUMN_PREFIX = "Unnamed: ";

    private final String name;
    private final List<String> columns;
    private final List<Object> headerValues;
    private final List<List<Object>> rows;

    public SheetData(String name, List<String> columns, List<List<Object>> rows) {
        this(name, columns, new ArrayList<>(columns), rows);
    }

    public SheetData(String name, List<String> columns, List<Object> headerValues, List<List<Object>> rows) {
        this.name = name;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.headerValues = Collections.unmodifiableList(new ArrayList<>(headerValues));
        List<List<Object>> copy = new ArrayList<>();
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    public static boolean isUnnamedColumn(String column) {
        return column == null || column.startsWith(UNNAMED_COLUMN_PREFIX);
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Cell value at the given position, or {@code null} when the cell is
     * missing, blank or outside the row.
     */
    public Object getCell(int rowIndex, int columnIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) return null;
        List<Object> row = rows.get(rowIndex);
        if (columnIndex < 0 || columnIndex >= row.size()) return null;
        Object value = row.get(columnIndex);
        if (value instanceof String && ((String) value).trim().isEmpty()) {
            return null;
        }
        if (value instanceof Double && ((Double) value).isNaN()) {
            return null;
        }
        return value;
    }

    /**
     * Typed value of a first-row cell, or {@code null} when that cell was blank.
     */
    public Object getHeaderValue(int columnIndex) {
        if (columnIndex < 0 || columnIndex >= columns.size()
                || isUnnamedColumn(columns.get(columnIndex)) || columnIndex >= headerValues.size()) {
            return null;
        }
        return headerValues.get(columnIndex);
    }

    public List<Object> getFirstColumnValues() {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Object value = getCell(i, 0);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
