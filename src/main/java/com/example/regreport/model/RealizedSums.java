package com.example.regreport.model;

import java.math.BigDecimal;

/**
 * Year-to-date realized figures. The profit (loss) is already sign-corrected.
 */
public record RealizedSums(BigDecimal shares, BigDecimal accountingValue, BigDecimal realizedProfitLoss) {

    public BigDecimal sellValue() {
        return accountingValue.add(realizedProfitLoss);
    }
}
