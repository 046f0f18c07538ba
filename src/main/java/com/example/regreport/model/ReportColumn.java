package com.example.regreport.model;

/**
 * Named, typed column of a {@link ReportTable}.
 */
public record ReportColumn(String name, Type type) {

    public enum Type {
        TEXT,
        NUMBER,
        DATE
    }

    public static ReportColumn text(String name) {
        return new ReportColumn(name, Type.TEXT);
    }

    public static ReportColumn number(String name) {
        return new ReportColumn(name, Type.NUMBER);
    }

    public static ReportColumn date(String name) {
        return new ReportColumn(name, Type.DATE);
    }

    public boolean isNumeric() {
        return type == Type.NUMBER;
    }
}
