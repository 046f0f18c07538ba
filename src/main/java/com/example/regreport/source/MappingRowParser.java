package com.example.regreport.source;

import com.example.regreport.exception.SchemaViolationException;
import com.example.regreport.model.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.example.regreport.model.MappingColumns.*;

/**
 * Converts mapping-table rows into mapping records, whatever file format they came from.
 */
public final class MappingRowParser {

    private MappingRowParser() {
    }

    public static TransactionTypeMapping transactionType(SourceRow row) {
        return TransactionTypeMapping.builder()
                .key(row.text(KEY))
                .statusMapping(row.text(STATUS_MAPPING))
                .changeMapping(row.text(CHANGE_MAPPING))
                .unrealizedKind(row.text(UNREALIZED_KIND))
                .realizedKind(row.text(REALIZED_KIND))
                .build();
    }

    public static InvestmentTypeMapping investmentType(SourceRow row) {
        return new InvestmentTypeMapping(row.text(KEY), row.text(CATEGORY));
    }

    public static InvestmentMapping investment(SourceRow row) {
        return InvestmentMapping.builder()
                .key(row.text(KEY))
                .tags(row.text(TAGS))
                .ifrsClassification(row.text(IFRS_CLASSIFICATION))
                .valuationMethod(row.text(VALUATION_METHOD))
                .valuationMethodAlt(row.text(VALUATION_METHOD_ALT))
                .fundingSource(row.text(FUNDING_SOURCE))
                .build();
    }

    public static AccountMapping account(SourceRow row) {
        InstrumentDetails details = InstrumentDetails.builder()
                .isin(row.text(ISIN))
                .quantity(row.decimal(QUANTITY))
                .accruedInterest(row.decimal(ACCRUED_INTEREST))
                .amortizedExpenses(row.decimal(AMORTIZED_EXPENSES))
                .currency(row.text(CURRENCY))
                .couponFrequency(row.decimal(COUPON_FREQUENCY))
                .interestRate(row.decimal(INTEREST_RATE))
                .effectiveInterestRate(row.decimal(EFFECTIVE_INTEREST_RATE))
                .investmentDate(row.date(INVESTMENT_DATE))
                .maturityDate(row.date(MATURITY_DATE))
                .rating(row.text(RATING))
                .ratingAgency(row.text(RATING_AGENCY))
                .build();
        return new AccountMapping(row.text(KEY), attributes(row), details);
    }

    public static PositionMapping position(SourceRow row) {
        return new PositionMapping(row.text(KEY), attributes(row));
    }

    public static RegulatoryAttributes attributes(SourceRow row) {
        return RegulatoryAttributes.builder()
                .fundingSource(row.text(FUNDING_SOURCE))
                .employeesInBs(row.text(EMPLOYEES_IN_BS))
                .companyType(row.text(COMPANY_TYPE))
                .companySubtype(row.text(COMPANY_SUBTYPE))
                .guarantee(row.text(GUARANTEE))
                .issuerName(row.text(ISSUER_NAME))
                .issuerNameIfDifferent(row.text(ISSUER_NAME_IF_DIFFERENT))
                .sector(row.text(SECTOR))
                .ownership(row.text(OWNERSHIP))
                .ifrsClassification(row.text(IFRS_CLASSIFICATION))
                .valuationMethod(row.text(VALUATION_METHOD))
                .issuerCountry(row.text(ISSUER_COUNTRY))
                .tradingCountry(row.text(TRADING_COUNTRY))
                .regulatedMarket(row.text(REGULATED_MARKET))
                .valuationSource(row.text(VALUATION_SOURCE))
                .couponType(row.text(COUPON_TYPE))
                .build();
    }

    /**
     * Index rows by key, rejecting blank and duplicate keys.
     */
    public static <T> Map<String, T> indexByKey(String table, List<SourceRow> rows, Function<SourceRow, T> parser) {
        Map<String, T> index = new LinkedHashMap<>();
        for (SourceRow row : rows) {
            String key = row.text(KEY);
            if (key == null) {
                throw new SchemaViolationException(table, KEY,
                        "Table " + table + " has a blank key on line " + row.line());
            }
            if (index.putIfAbsent(key, parser.apply(row)) != null) {
                throw SchemaViolationException.duplicateKey(table, key);
            }
        }
        return index;
    }
}
