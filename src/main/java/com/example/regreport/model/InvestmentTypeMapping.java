package com.example.regreport.model;

import lombok.Builder;

import java.util.Optional;

/**
 * Investment-type mapping row, keyed on security type + LT/ST flag, assigning the report category.
 */
@Builder
public record InvestmentTypeMapping(
        String key,
        String categoryLabel
) {

    public Optional<InvestmentCategory> category() {
        return InvestmentCategory.fromLabel(categoryLabel);
    }
}
