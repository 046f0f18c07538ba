package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record ClassifiedHolding(
        Holding holding,
        String investmentKey,
        String investmentTypeKey,
        InvestmentCategory category,
        String tag
) {

    public BigDecimal nominal() {
        return holding.nominal() == null ? BigDecimal.ZERO : holding.nominal();
    }
}
