package com.example.regreport.service;

import com.example.regreport.model.*;
import com.example.regreport.util.KeyBuilder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small in-memory data sets for the service tests, classified with the real key builder.
 */
final class TestSnapshots {

    static final LocalDate REPORT_DATE = LocalDate.of(2025, 9, 30);
    static final ReportingPeriod PERIOD = ReportingPeriod.of(REPORT_DATE);

    static final LocalDate IN_STATUS = LocalDate.of(2025, 5, 15);
    static final LocalDate IN_CHANGE = LocalDate.of(2025, 8, 15);

    static final String ACQUISITION = TransactionKind.ACCOUNTING_VALUE.getLabel();
    static final String RESERVE = TransactionKind.REVALUATION_RESERVE.getLabel();

    private final List<LedgerEntry> entries = new ArrayList<>();
    private final List<Holding> holdings = new ArrayList<>();
    private final List<InvestmentPosition> positions = new ArrayList<>();
    private final List<AccountBalance> accounts = new ArrayList<>();
    private final Map<String, TransactionTypeMapping> transactionTypes = new LinkedHashMap<>();
    private final Map<String, InvestmentTypeMapping> investmentTypes = new LinkedHashMap<>();
    private final Map<String, InvestmentMapping> investments = new LinkedHashMap<>();
    private final Map<String, AccountMapping> accountMappings = new LinkedHashMap<>();
    private final Map<String, PositionMapping> positionMappings = new LinkedHashMap<>();
    private final Map<String, String> codes = new LinkedHashMap<>();

    static TestSnapshots create() {
        return new TestSnapshots();
    }

    /**
     * Ledger entry of group account GA, security type BOND, investments INV.
     * The balance of the entry is the given amount.
     */
    TestSnapshots entry(LocalDate date, String groupAccount, String securityId, String ltSt, String amount) {
        BigDecimal value = new BigDecimal(amount);
        entries.add(LedgerEntry.builder()
                .bookingDate(date)
                .groupAccount(groupAccount)
                .securityType("BOND")
                .investments("INV")
                .securityId(securityId)
                .ltSt(ltSt)
                .purpose("P")
                .debitAmountForeign(value.signum() >= 0 ? value : BigDecimal.ZERO)
                .creditAmountForeign(value.signum() < 0 ? value.negate() : BigDecimal.ZERO)
                .build());
        return this;
    }

    TestSnapshots transactionType(String groupAccount, String status, String change, String kind, String realized) {
        String key = groupAccount + "BONDINV";
        transactionTypes.put(key, new TransactionTypeMapping(key, status, change, kind, realized));
        return this;
    }

    TestSnapshots investmentType(String ltSt, InvestmentCategory category) {
        String key = "BOND" + ltSt;
        investmentTypes.put(key, new InvestmentTypeMapping(key, category.getLabel()));
        return this;
    }

    TestSnapshots investment(String securityId, String tag, String ifrs, String fundingSource) {
        String key = securityId + "BOND";
        investments.put(key, InvestmentMapping.builder()
                .key(key).tags(tag).ifrsClassification(ifrs).valuationMethod("Market").fundingSource(fundingSource)
                .build());
        return this;
    }

    TestSnapshots holding(String securityId, String ltSt, String nominal) {
        holdings.add(Holding.builder()
                .reportDate(REPORT_DATE).securityId(securityId).securityType("BOND").ltSt(ltSt)
                .nominal(new BigDecimal(nominal))
                .build());
        return this;
    }

    TestSnapshots position(InvestmentPosition position) {
        positions.add(position);
        return this;
    }

    TestSnapshots positionMapping(String key, RegulatoryAttributes attributes) {
        positionMappings.put(key, new PositionMapping(key, attributes));
        return this;
    }

    TestSnapshots account(String accountNo, String accountNo2, String name, String balance) {
        accounts.add(AccountBalance.builder()
                .accountNo(accountNo).accountNo2(accountNo2).accountName(name).balance(new BigDecimal(balance))
                .build());
        return this;
    }

    TestSnapshots accountMapping(String key, RegulatoryAttributes attributes, InstrumentDetails details) {
        accountMappings.put(key, new AccountMapping(key, attributes, details));
        return this;
    }

    TestSnapshots code(String code, String value) {
        codes.put(code, value);
        return this;
    }

    SourceSnapshot source() {
        return SourceSnapshot.builder()
                .period(PERIOD)
                .ledgerEntries(entries)
                .holdings(holdings)
                .positions(positions)
                .accountBalances(accounts)
                .mappings(MappingTables.builder()
                        .transactionTypes(transactionTypes)
                        .investmentTypes(investmentTypes)
                        .investments(investments)
                        .accounts(accountMappings)
                        .positions(positionMappings)
                        .codes(codes)
                        .build())
                .build();
    }

    ClassifiedSnapshot classified() {
        return new EntryClassifier(new KeyBuilder()).classify(source());
    }
}
