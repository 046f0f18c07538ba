package com.example.regreport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named rectangular table with a fixed column order; unit of both the gap and the report artifact.
 * Cells may be null (rendered blank).
 */
public final class ReportTable {

    private final String name;
    private final List<ReportColumn> columns;
    private final List<List<Object>> rows;

    public ReportTable(String name, List<ReportColumn> columns, List<List<Object>> rows) {
        this.name = Objects.requireNonNull(name, "name");
        this.columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("Row width " + row.size() + " does not match "
                        + this.columns.size() + " columns of table " + name);
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getName() {
        return name;
    }

    public List<ReportColumn> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public List<String> columnNames() {
        return columns.stream().map(ReportColumn::name).toList();
    }

    public boolean hasNumericColumns() {
        return columns.stream().anyMatch(ReportColumn::isNumeric);
    }

    public int columnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Table " + name + " has no column " + columnName);
    }

    public Object value(int rowIndex, String columnName) {
        return rows.get(rowIndex).get(columnIndex(columnName));
    }

    public List<Object> column(String columnName) {
        int index = columnIndex(columnName);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportTable that)) {
            return false;
        }
        return name.equals(that.name) && columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows);
    }

    @Override
    public String toString() {
        return "ReportTable{name='" + name + "', columns=" + columns.size() + ", rows=" + rows.size() + "}";
    }
}
