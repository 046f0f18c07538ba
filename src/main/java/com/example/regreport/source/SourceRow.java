package com.example.regreport.source;

import com.example.regreport.exception.ReportPipelineException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * One row of a source table addressed by column name, with typed accessors.
 * Blank cells read as null.
 */
public record SourceRow(String table, long line, Map<String, String> values) {

    public String text(String column) {
        String value = values.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public BigDecimal decimal(String column) {
        String value = text(column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ReportPipelineException(String.format(
                    "Invalid number '%s' in column %s of table %s, line %d", value, column, table, line), e);
        }
    }

    public LocalDate date(String column) {
        String value = text(column);
        if (value == null) {
            return null;
        }
        try {
            // tolerate timestamps exported with a time part
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new ReportPipelineException(String.format(
                    "Invalid date '%s' in column %s of table %s, line %d", value, column, table, line), e);
        }
    }
}
