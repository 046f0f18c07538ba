package com.example.regreport.source;

import com.example.regreport.model.AccountBalance;
import com.example.regreport.model.Holding;
import com.example.regreport.model.InvestmentPosition;
import com.example.regreport.model.LedgerEntry;
import com.example.regreport.model.ReportingPeriod;

import java.time.LocalDate;
import java.util.List;

/**
 * Fact side of a run. Implementations apply the period filters themselves.
 */
public interface ReportDataSource {

    String LEDGER_TABLE = "ledger_entries";
    String HOLDINGS_TABLE = "holdings";
    String POSITIONS_TABLE = "investment_positions";
    String POSTINGS_TABLE = "account_postings";

    String BOOKING_DATE = "BOOKING_DATE";
    String REPORT_DATE = "REPORT_DATE";
    String POSTING_DATE = "POSTING_DATE";

    /**
     * Ledger entries booked on or before the report date.
     */
    List<LedgerEntry> loadLedgerEntries(ReportingPeriod period);

    /**
     * Holdings snapshot dated at the report date.
     */
    List<Holding> loadHoldings(ReportingPeriod period);

    /**
     * Investment positions dated at the report date.
     */
    List<InvestmentPosition> loadPositions(ReportingPeriod period);

    /**
     * Account balances summed over postings up to the report date.
     */
    List<AccountBalance> loadAccountBalances(ReportingPeriod period);

    /**
     * Distinct posting dates behind {@link #loadAccountBalances}, used for the staleness check.
     */
    List<LocalDate> loadAccountPostingDates(ReportingPeriod period);
}
