package com.example.regreport.exception;

import java.time.YearMonth;

/**
 * A source returned no rows for the report month; the upstream extract is stale.
 */
public class DataAbsenceException extends ReportPipelineException {

    private final String table;
    private final String column;
    private final YearMonth period;

    public DataAbsenceException(String table, String column, YearMonth period) {
        super(String.format("No data found in table %s for year %d and month %d in column '%s'",
                table, period.getYear(), period.getMonthValue(), column));
        this.table = table;
        this.column = column;
        this.period = period;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    public YearMonth getPeriod() {
        return period;
    }
}
