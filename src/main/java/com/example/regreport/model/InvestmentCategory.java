package com.example.regreport.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Investment categories of the quarterly regulatory report.
 * Declaration order is the row order of every per-category report table.
 */
public enum InvestmentCategory {

    LAND_BUILDINGS_FOR_OPERATIONS("I. Land and buildings used for operations"),
    LAND_BUILDINGS_NOT_FOR_OPERATIONS("II. Land and buildings not used for operations"),
    GROUP_EQUITY_INSTRUMENTS("III. Shares, interests and other equity instruments in group companies"),
    GROUP_DEBT_SECURITIES("IV. Debt securities issued by group companies"),
    DEBT_SECURITIES_UNDER_ONE_YEAR("V. Debt securities maturing within one year"),
    DEBT_SECURITIES_OVER_ONE_YEAR("VI. Debt securities maturing after more than one year"),
    OTHER_EQUITY_INSTRUMENTS("VII. Shares and other equity instruments"),
    INVESTMENT_FUND_SHARES("VIII. Shares and units in investment funds"),
    DERIVATIVES("IX. Derivatives");

    private final String label;

    InvestmentCategory(String label) {
        this.label = label;
    }

    /**
     * Label as it appears in the investment-type mapping table and in the report.
     */
    public String getLabel() {
        return label;
    }

    public static List<InvestmentCategory> ordered() {
        return List.of(values());
    }

    public static Optional<InvestmentCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(category -> category.label.equals(trimmed))
                .findFirst();
    }
}
