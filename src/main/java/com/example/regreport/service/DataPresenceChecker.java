package com.example.regreport.service;

import com.example.regreport.exception.DataAbsenceException;
import com.example.regreport.model.ReportingPeriod;
import com.example.regreport.model.SourceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

import static com.example.regreport.source.ReportDataSource.*;

/**
 * Staleness check run before any key is derived: every source must have rows in the report month.
 */
@Slf4j
@Component
public class DataPresenceChecker {

    public void check(SourceSnapshot snapshot, List<LocalDate> accountPostingDates) {
        ReportingPeriod period = snapshot.period();

        require(period, LEDGER_TABLE, BOOKING_DATE, snapshot.ledgerEntries(), entry -> entry.bookingDate());
        require(period, HOLDINGS_TABLE, REPORT_DATE, snapshot.holdings(), holding -> holding.reportDate());
        require(period, POSITIONS_TABLE, REPORT_DATE, snapshot.positions(), position -> position.reportDate());
        require(period, POSTINGS_TABLE, POSTING_DATE, accountPostingDates, Function.identity());

        log.debug("All sources have data for {}", YearMonth.from(period.reportDate()));
    }

    private <T> void require(ReportingPeriod period, String table, String column,
                             Collection<T> rows, Function<T, LocalDate> dateOf) {
        boolean present = rows.stream().map(dateOf).anyMatch(period::inReportMonth);
        if (!present) {
            DataAbsenceException exception =
                    new DataAbsenceException(table, column, YearMonth.from(period.reportDate()));
            log.error(exception.getMessage());
            throw exception;
        }
    }
}
