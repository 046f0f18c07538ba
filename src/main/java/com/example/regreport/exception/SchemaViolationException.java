package com.example.regreport.exception;

/**
 * A source table lacks an expected column or breaks a table-level constraint.
 */
public class SchemaViolationException extends ReportPipelineException {

    private final String table;
    private final String column;

    public SchemaViolationException(String table, String column) {
        this(table, column, "Table " + table + " is missing required column " + column);
    }

    public SchemaViolationException(String table, String column, String message) {
        super(message);
        this.table = table;
        this.column = column;
    }

    public static SchemaViolationException duplicateKey(String table, String key) {
        return new SchemaViolationException(table, "KEY", "Table " + table + " contains duplicate key '" + key + "'");
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }
}
