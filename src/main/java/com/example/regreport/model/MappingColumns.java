package com.example.regreport.model;

import java.util.List;

/**
 * Column names shared by the mapping files, the gap workbook and the mapping import.
 */
public final class MappingColumns {

    public static final String KEY = "KEY";

    public static final String GROUP_ACCOUNT = "GROUP_ACCOUNT";
    public static final String SECURITY_TYPE = "SECURITY_TYPE";
    public static final String INVESTMENTS = "INVESTMENTS";
    public static final String SECURITY_ID = "SECURITY_ID";
    public static final String LT_ST = "LT_ST";
    public static final String PURPOSE = "PURPOSE";
    public static final String INVESTMENT_TYPE = "INVESTMENT_TYPE";
    public static final String ACCOUNT_NO = "ACCOUNT_NO";
    public static final String ACCOUNT_NO2 = "ACCOUNT_NO2";
    public static final String ACCOUNT_NAME = "ACCOUNT_NAME";

    public static final String STATUS_MAPPING = "STATUS_MAPPING";
    public static final String CHANGE_MAPPING = "CHANGE_MAPPING";
    public static final String UNREALIZED_KIND = "UNREALIZED_KIND";
    public static final String REALIZED_KIND = "REALIZED_KIND";

    public static final String CATEGORY = "CATEGORY";

    public static final String TAGS = "TAGS";
    public static final String IFRS_CLASSIFICATION = "IFRS_CLASSIFICATION";
    public static final String VALUATION_METHOD = "VALUATION_METHOD";
    public static final String VALUATION_METHOD_ALT = "VALUATION_METHOD_ALT";
    public static final String FUNDING_SOURCE = "FUNDING_SOURCE";

    public static final String EMPLOYEES_IN_BS = "EMPLOYEES_IN_BS";
    public static final String COMPANY_TYPE = "COMPANY_TYPE";
    public static final String COMPANY_SUBTYPE = "COMPANY_SUBTYPE";
    public static final String GUARANTEE = "GUARANTEE";
    public static final String ISSUER_NAME = "ISSUER_NAME";
    public static final String ISSUER_NAME_IF_DIFFERENT = "ISSUER_NAME_IF_DIFFERENT";
    public static final String SECTOR = "SECTOR";
    public static final String OWNERSHIP = "OWNERSHIP";
    public static final String ISSUER_COUNTRY = "ISSUER_COUNTRY";
    public static final String TRADING_COUNTRY = "TRADING_COUNTRY";
    public static final String REGULATED_MARKET = "REGULATED_MARKET";
    public static final String VALUATION_SOURCE = "VALUATION_SOURCE";
    public static final String COUPON_TYPE = "COUPON_TYPE";

    public static final String ISIN = "ISIN";
    public static final String QUANTITY = "QUANTITY";
    public static final String ACCRUED_INTEREST = "ACCRUED_INTEREST";
    public static final String AMORTIZED_EXPENSES = "AMORTIZED_EXPENSES";
    public static final String CURRENCY = "CURRENCY";
    public static final String COUPON_FREQUENCY = "COUPON_FREQUENCY";
    public static final String INTEREST_RATE = "INTEREST_RATE";
    public static final String EFFECTIVE_INTEREST_RATE = "EFFECTIVE_INTEREST_RATE";
    public static final String INVESTMENT_DATE = "INVESTMENT_DATE";
    public static final String MATURITY_DATE = "MATURITY_DATE";
    public static final String RATING = "RATING";
    public static final String RATING_AGENCY = "RATING_AGENCY";

    public static final String CODE_VALUE = "VALUE";

    public static final List<String> TRANSACTION_TYPE_ATTRIBUTES =
            List.of(STATUS_MAPPING, CHANGE_MAPPING, UNREALIZED_KIND, REALIZED_KIND);

    public static final List<String> INVESTMENT_TYPE_ATTRIBUTES = List.of(CATEGORY);

    public static final List<String> INVESTMENT_ATTRIBUTES =
            List.of(TAGS, IFRS_CLASSIFICATION, VALUATION_METHOD, VALUATION_METHOD_ALT, FUNDING_SOURCE);

    public static final List<String> REGULATORY_ATTRIBUTES = List.of(
            FUNDING_SOURCE, EMPLOYEES_IN_BS, COMPANY_TYPE, COMPANY_SUBTYPE, GUARANTEE,
            ISSUER_NAME, ISSUER_NAME_IF_DIFFERENT, SECTOR, OWNERSHIP, IFRS_CLASSIFICATION,
            VALUATION_METHOD, ISSUER_COUNTRY, TRADING_COUNTRY, REGULATED_MARKET,
            VALUATION_SOURCE, COUPON_TYPE);

    public static final List<String> INSTRUMENT_DETAILS = List.of(
            ISIN, QUANTITY, ACCRUED_INTEREST, AMORTIZED_EXPENSES, CURRENCY, COUPON_FREQUENCY,
            INTEREST_RATE, EFFECTIVE_INTEREST_RATE, INVESTMENT_DATE, MATURITY_DATE, RATING, RATING_AGENCY);

    private MappingColumns() {
    }
}
