package com.example.regreport.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Securities holding snapshot row; the nominal feeds the share counts of the realized-profit tables.
 */
@Builder
public record Holding(
        LocalDate reportDate,
        String securityId,
        String securityType,
        String ltSt,
        BigDecimal nominal
) {
}
