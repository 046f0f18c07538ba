package com.example.regreport.service;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.example.regreport.model.ReportColumn.date;
import static com.example.regreport.model.ReportColumn.number;
import static com.example.regreport.model.ReportColumn.text;

/**
 * Turns aggregated figures into the named report tables.
 * Aggregated tables end with a totals row; lookup extracts are passed through as they are.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportAssembler {

    public static final String REALIZED_PROFIT_ALL = "REALIZED_PROFIT_ALL";
    public static final String REALIZED_PROFIT_FUNDS = "REALIZED_PROFIT_FUNDS";
    public static final String UNREALIZED_PROFIT_ALL = "UNREALIZED_PROFIT_ALL";
    public static final String UNREALIZED_PROFIT_FUNDS = "UNREALIZED_PROFIT_FUNDS";
    public static final String UNREALIZED_PROFIT_BONDS_UNDER_1Y = "UNREALIZED_PROFIT_BONDS_UNDER_1Y";
    public static final String UNREALIZED_PROFIT_BONDS_OVER_1Y = "UNREALIZED_PROFIT_BONDS_OVER_1Y";
    public static final String ACCOUNT_LOOKUP = "ACCOUNT_LOOKUP";
    public static final String POSITION_LOOKUP = "POSITION_LOOKUP";
    public static final String COMBINED_LOOKUP = "COMBINED_LOOKUP";

    public static final String CATEGORY = "Category";
    public static final String TAG = "Tag";
    public static final String SHARES = "Number of securities";
    public static final String ACCOUNTING_VALUE = "Accounting value";
    public static final String SELL_VALUE = "Sell value";
    public static final String REALIZED_PROFIT_LOSS = "Realized profit (loss)";
    public static final String IFRS_CLASSIFICATION = "IFRS classification";
    public static final String VALUATION_METHOD = "Valuation method";
    public static final String VALUATION_METHOD_ALT = "Valuation method (if other)";
    public static final String LAST_VALUATION_DATE = "Date of last valuation";
    public static final String ACQUISITION_COST = "Total acquisition cost/accounting value";
    public static final String OBJECTIVE_VALUE = "Objective value at date of last valuation";
    public static final String REVALUATION_EFFECT = "Revaluation effect";
    public static final String REVALUATION_RESERVE = "Revaluation reserve (status)";
    public static final String VALUE_ADJUSTMENT_PL = "Value adjustment recognised directly in P&L";
    public static final String FX_DIFFERENCE = "Net exchange rate difference";
    public static final String AMORTIZATION = "Amortization of discount/premium";
    public static final String FUNDING_SOURCE = "Funding source";

    static final List<ReportColumn> LOOKUP_COLUMNS = List.of(
            text(MappingColumns.FUNDING_SOURCE),
            text(MappingColumns.EMPLOYEES_IN_BS),
            text(MappingColumns.COMPANY_TYPE),
            text(MappingColumns.COMPANY_SUBTYPE),
            text(MappingColumns.GUARANTEE),
            text(MappingColumns.ISSUER_NAME),
            text(MappingColumns.ISSUER_NAME_IF_DIFFERENT),
            text(MappingColumns.SECTOR),
            text(MappingColumns.ISIN),
            text(MappingColumns.OWNERSHIP),
            number(MappingColumns.QUANTITY),
            text(MappingColumns.IFRS_CLASSIFICATION),
            text(MappingColumns.VALUATION_METHOD),
            text(MappingColumns.ISSUER_COUNTRY),
            text(MappingColumns.TRADING_COUNTRY),
            text(MappingColumns.REGULATED_MARKET),
            text(MappingColumns.VALUATION_SOURCE),
            number("ACQUISITION_VALUE"),
            number(MappingColumns.ACCRUED_INTEREST),
            number(MappingColumns.AMORTIZED_EXPENSES),
            number("OBJECTIVE_VALUE"),
            number("ACCOUNTING_VALUE"),
            number("ACCOUNTING_VALUE_ORIGINAL_CURRENCY"),
            text(MappingColumns.CURRENCY),
            text(MappingColumns.COUPON_TYPE),
            number(MappingColumns.COUPON_FREQUENCY),
            number(MappingColumns.INTEREST_RATE),
            number(MappingColumns.EFFECTIVE_INTEREST_RATE),
            date(MappingColumns.INVESTMENT_DATE),
            date(MappingColumns.MATURITY_DATE),
            text(MappingColumns.RATING),
            text(MappingColumns.RATING_AGENCY)
    );

    private final CategoryAggregator aggregator;
    private final ReportProperties properties;

    /**
     * Build every report table of a run, in output order.
     */
    public List<ReportTable> assemble(ClassifiedSnapshot snapshot) {
        List<ReportTable> tables = new ArrayList<>();
        LocalDate reportDate = snapshot.period().reportDate();

        tables.add(realizedByCategory(aggregator.realizedByCategory(snapshot)));
        tables.add(realizedByTag(REALIZED_PROFIT_FUNDS,
                aggregator.realizedByTag(snapshot, InvestmentCategory.INVESTMENT_FUND_SHARES)));

        tables.add(unrealizedByCategory(aggregator.unrealizedByCategory(snapshot)));
        tables.add(unrealizedByTag(UNREALIZED_PROFIT_FUNDS, reportDate,
                aggregator.unrealizedByTag(snapshot, InvestmentCategory.INVESTMENT_FUND_SHARES)));
        tables.add(unrealizedByTag(UNREALIZED_PROFIT_BONDS_UNDER_1Y, reportDate,
                aggregator.unrealizedByTag(snapshot, InvestmentCategory.DEBT_SECURITIES_UNDER_ONE_YEAR)));
        tables.add(unrealizedByTag(UNREALIZED_PROFIT_BONDS_OVER_1Y, reportDate,
                aggregator.unrealizedByTag(snapshot, InvestmentCategory.DEBT_SECURITIES_OVER_ONE_YEAR)));

        ReportTable accounts = accountLookup(snapshot);
        ReportTable positions = positionLookup(snapshot);
        tables.add(accounts);
        tables.add(positions);
        tables.add(combine(COMBINED_LOOKUP, accounts, positions));

        log.info("Assembled {} report tables for {}", tables.size(), reportDate);
        return tables;
    }

    public ReportTable realizedByCategory(List<CategoryRealized> figures) {
        List<ReportColumn> columns = List.of(
                text(CATEGORY), number(SHARES), number(ACCOUNTING_VALUE), number(SELL_VALUE),
                number(REALIZED_PROFIT_LOSS));

        List<List<Object>> rows = new ArrayList<>();
        for (CategoryRealized figure : figures) {
            RealizedSums sums = figure.sums();
            rows.add(row(figure.category().getLabel(), sums.shares(), sums.accountingValue(),
                    sums.sellValue(), sums.realizedProfitLoss()));
        }
        return withTotals(new ReportTable(REALIZED_PROFIT_ALL, columns, rows));
    }

    public ReportTable realizedByTag(String name, List<TagRealized> figures) {
        List<ReportColumn> columns = List.of(
                text(TAG), text(IFRS_CLASSIFICATION), number(SHARES), number(ACCOUNTING_VALUE),
                number(SELL_VALUE), number(REALIZED_PROFIT_LOSS), text(FUNDING_SOURCE));

        List<List<Object>> rows = new ArrayList<>();
        for (TagRealized figure : figures) {
            RealizedSums sums = figure.sums();
            rows.add(row(figure.tag(), figure.attributes().ifrsClassification(), sums.shares(),
                    sums.accountingValue(), sums.sellValue(), sums.realizedProfitLoss(),
                    figure.attributes().fundingSource()));
        }
        return withTotals(new ReportTable(name, columns, rows));
    }

    public ReportTable unrealizedByCategory(List<CategoryLineItems> figures) {
        List<ReportColumn> columns = List.of(
                text(CATEGORY), number(ACQUISITION_COST), number(OBJECTIVE_VALUE), number(REVALUATION_EFFECT),
                number(REVALUATION_RESERVE), number(VALUE_ADJUSTMENT_PL), number(FX_DIFFERENCE),
                number(AMORTIZATION));

        List<List<Object>> rows = new ArrayList<>();
        for (CategoryLineItems figure : figures) {
            LineItems items = figure.items();
            rows.add(row(figure.category().getLabel(), items.accountingValue(), items.objectiveValue(),
                    items.revaluationEffect(), items.revaluationReserve(), null, items.fxDifference(),
                    items.amortization()));
        }
        return withTotals(new ReportTable(UNREALIZED_PROFIT_ALL, columns, rows));
    }

    public ReportTable unrealizedByTag(String name, LocalDate reportDate, List<TagLineItems> figures) {
        List<ReportColumn> columns = List.of(
                text(TAG), text(IFRS_CLASSIFICATION), text(VALUATION_METHOD), text(VALUATION_METHOD_ALT),
                date(LAST_VALUATION_DATE), number(ACQUISITION_COST), number(OBJECTIVE_VALUE),
                number(REVALUATION_EFFECT), number(REVALUATION_RESERVE), number(VALUE_ADJUSTMENT_PL),
                number(FX_DIFFERENCE), number(AMORTIZATION), text(FUNDING_SOURCE));

        List<List<Object>> rows = new ArrayList<>();
        for (TagLineItems figure : figures) {
            LineItems items = figure.items();
            TagAttributes attributes = figure.attributes();
            rows.add(row(figure.tag(), attributes.ifrsClassification(), attributes.valuationMethod(),
                    attributes.valuationMethodAlt(), reportDate, items.accountingValue(), items.objectiveValue(),
                    items.revaluationEffect(), items.revaluationReserve(), null, items.fxDifference(),
                    items.amortization(), attributes.fundingSource()));
        }
        return withTotals(new ReportTable(name, columns, rows));
    }

    /**
     * Ledger accounts as lookup rows; the account balance stands in for every value column.
     */
    public ReportTable accountLookup(ClassifiedSnapshot snapshot) {
        ReportProperties.Lookup lookup = properties.getLookup();
        List<List<Object>> rows = new ArrayList<>();

        for (ClassifiedAccount account : snapshot.accounts()) {
            if (!account.attributes().hasFundingSource()) {
                continue;
            }
            BigDecimal balance = account.account().balance();
            BigDecimal acquisitionValue = lookup.getZeroAcquisitionAccounts().contains(account.account().accountNo())
                    ? BigDecimal.ZERO
                    : balance;
            rows.add(lookupRow(account.attributes(), account.details(),
                    acquisitionValue, balance, balance, balance));
        }
        return new ReportTable(ACCOUNT_LOOKUP, LOOKUP_COLUMNS, rows);
    }

    /**
     * Investment positions as lookup rows, with codes translated and lot counts normalized.
     */
    public ReportTable positionLookup(ClassifiedSnapshot snapshot) {
        MappingTables mappings = snapshot.mappings();
        List<List<Object>> rows = new ArrayList<>();

        for (ClassifiedPosition classified : snapshot.positions()) {
            if (!classified.attributes().hasFundingSource()) {
                continue;
            }
            InvestmentPosition position = classified.position();
            InstrumentDetails details = InstrumentDetails.builder()
                    .isin(position.isin())
                    .quantity(quantityOf(position))
                    .accruedInterest(position.accruedInterestPc())
                    .currency(mappings.translateCode(position.quotationCurrency()).orElse(null))
                    .couponFrequency(position.couponFrequency())
                    .interestRate(position.couponRate())
                    .effectiveInterestRate(position.effectiveInterestRate())
                    .investmentDate(position.purchaseDate())
                    .maturityDate(position.maturityDate())
                    .rating(position.issuerRating())
                    .ratingAgency(mappings.translateCode(position.issuerRatingAgency()).orElse(null))
                    .build();

            rows.add(lookupRow(classified.attributes(), details, position.acquisitionValuePc(),
                    position.accountingValue(), position.accountingValue(),
                    position.accountingValueInQuotationCurrency()));
        }
        return new ReportTable(POSITION_LOOKUP, LOOKUP_COLUMNS, rows);
    }

    /**
     * Append the totals row: column sums for numeric columns, the total label elsewhere.
     * Tables without numeric columns are returned unchanged.
     */
    public ReportTable withTotals(ReportTable table) {
        if (!table.hasNumericColumns()) {
            return table;
        }

        List<ReportColumn> columns = table.getColumns();
        List<Object> totals = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).isNumeric()) {
                BigDecimal sum = BigDecimal.ZERO;
                for (List<Object> row : table.getRows()) {
                    Object value = row.get(i);
                    if (value instanceof BigDecimal decimal) {
                        sum = sum.add(decimal);
                    }
                }
                totals.add(sum);
            } else {
                totals.add(properties.getTotalLabel());
            }
        }

        List<List<Object>> rows = new ArrayList<>(table.getRows());
        rows.add(totals);
        return new ReportTable(table.getName(), columns, rows);
    }

    private ReportTable combine(String name, ReportTable first, ReportTable second) {
        List<List<Object>> rows = new ArrayList<>(first.getRows());
        rows.addAll(second.getRows());
        return new ReportTable(name, LOOKUP_COLUMNS, rows);
    }

    private BigDecimal quantityOf(InvestmentPosition position) {
        ReportProperties.Lookup lookup = properties.getLookup();
        String name = position.investmentName() == null ? "" : position.investmentName();

        if (lookup.getZeroQuantityNameFragments().stream().anyMatch(name::contains)) {
            return BigDecimal.ZERO;
        }
        BigDecimal lots = position.numberOfLots();
        if (lots != null && position.nominalValueOfLot() != null
                && position.nominalValueOfLot().compareTo(lookup.getPercentLotNominal()) == 0) {
            return lots.divide(lookup.getPercentLotNominal(), MathContext.DECIMAL128);
        }
        return lots;
    }

    private static List<Object> lookupRow(RegulatoryAttributes attributes, InstrumentDetails details,
                                          BigDecimal acquisitionValue, BigDecimal objectiveValue,
                                          BigDecimal accountingValue, BigDecimal accountingValueOriginal) {
        return row(
                attributes.fundingSource(),
                attributes.employeesInBs(),
                attributes.companyType(),
                attributes.companySubtype(),
                attributes.guarantee(),
                attributes.issuerName(),
                attributes.issuerNameIfDifferent(),
                attributes.sector(),
                details.isin(),
                attributes.ownership(),
                details.quantity(),
                attributes.ifrsClassification(),
                attributes.valuationMethod(),
                attributes.issuerCountry(),
                attributes.tradingCountry(),
                attributes.regulatedMarket(),
                attributes.valuationSource(),
                acquisitionValue,
                details.accruedInterest(),
                details.amortizedExpenses(),
                objectiveValue,
                accountingValue,
                accountingValueOriginal,
                details.currency(),
                attributes.couponType(),
                details.couponFrequency(),
                details.interestRate(),
                details.effectiveInterestRate(),
                details.investmentDate(),
                details.maturityDate(),
                details.rating(),
                details.ratingAgency()
        );
    }

    private static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }
}
