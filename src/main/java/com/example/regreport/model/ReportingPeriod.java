package com.example.regreport.model;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Report date and the window boundaries derived from it.
 * Built once per run; every temporal filter of the run reads these four values.
 */
public record ReportingPeriod(
        LocalDate reportDate,
        LocalDate yearStart,
        LocalDate previousQuarterEnd,
        LocalDate quarterStart
) {

    public static ReportingPeriod of(LocalDate reportDate) {
        if (reportDate == null) {
            throw new IllegalArgumentException("Report date is required");
        }
        if (!isQuarterEnd(reportDate)) {
            throw new IllegalArgumentException("Report date must be a quarter end: " + reportDate);
        }

        LocalDate previousQuarterEnd = YearMonth.from(reportDate).minusMonths(3).atEndOfMonth();
        return new ReportingPeriod(
                reportDate,
                reportDate.withDayOfYear(1),
                previousQuarterEnd,
                previousQuarterEnd.plusDays(1)
        );
    }

    public static boolean isQuarterEnd(LocalDate date) {
        return date.getMonthValue() % 3 == 0 && date.equals(YearMonth.from(date).atEndOfMonth());
    }

    /**
     * Balance window: everything booked on or before the previous quarter end.
     */
    public boolean inStatusWindow(LocalDate date) {
        return date != null && !date.isAfter(previousQuarterEnd);
    }

    /**
     * Change window: quarter start to report date, both inclusive.
     */
    public boolean inChangeWindow(LocalDate date) {
        return date != null && !date.isBefore(quarterStart) && !date.isAfter(reportDate);
    }

    public boolean inYearToDate(LocalDate date) {
        return date != null && !date.isBefore(yearStart) && !date.isAfter(reportDate);
    }

    public boolean inReportMonth(LocalDate date) {
        return date != null && YearMonth.from(date).equals(YearMonth.from(reportDate));
    }
}
