package com.example.regreport.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The five mapping tables plus the code translation table, each indexed by key.
 */
@Builder
public record MappingTables(
        Map<String, TransactionTypeMapping> transactionTypes,
        Map<String, InvestmentTypeMapping> investmentTypes,
        Map<String, InvestmentMapping> investments,
        Map<String, AccountMapping> accounts,
        Map<String, PositionMapping> positions,
        Map<String, String> codes
) {

    public MappingTables {
        transactionTypes = freeze(transactionTypes);
        investmentTypes = freeze(investmentTypes);
        investments = freeze(investments);
        accounts = freeze(accounts);
        positions = freeze(positions);
        codes = freeze(codes);
    }

    public Set<String> keys(KeySpace keySpace) {
        return switch (keySpace) {
            case TRANSACTION_TYPE -> transactionTypes.keySet();
            case INVESTMENT_TYPE -> investmentTypes.keySet();
            case INVESTMENT -> investments.keySet();
            case ACCOUNT -> accounts.keySet();
            case POSITION -> positions.keySet();
        };
    }

    public Optional<String> translateCode(String code) {
        return Optional.ofNullable(code == null ? null : codes.get(code.trim()));
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
