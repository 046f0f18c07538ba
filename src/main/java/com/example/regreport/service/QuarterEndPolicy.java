package com.example.regreport.service;

import com.example.regreport.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Default report date: the quarter end {@code report.quarter-offset} quarters before the current one.
 */
@Component
@RequiredArgsConstructor
public class QuarterEndPolicy {

    private final Clock clock;
    private final ReportProperties properties;

    public LocalDate defaultReportDate() {
        LocalDate today = LocalDate.now(clock);
        int lastMonthOfQuarter = ((today.getMonthValue() - 1) / 3 + 1) * 3;
        YearMonth currentQuarterEnd = YearMonth.of(today.getYear(), lastMonthOfQuarter);
        return currentQuarterEnd.minusMonths(3L * properties.getQuarterOffset()).atEndOfMonth();
    }
}
