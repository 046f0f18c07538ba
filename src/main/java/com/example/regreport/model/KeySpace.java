package com.example.regreport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.example.regreport.model.MappingColumns.*;

/**
 * The five independent key spaces checked for mapping coverage.
 * Each names the fact fields its key is built from, the extra context columns
 * shown to the maintainer, and the attribute columns of its mapping table.
 */
public enum KeySpace {

    TRANSACTION_TYPE("Missing Transaction Types", "mapping_transaction_types.csv",
            List.of(GROUP_ACCOUNT, SECURITY_TYPE, INVESTMENTS), List.of(), TRANSACTION_TYPE_ATTRIBUTES),
    INVESTMENT_TYPE("Missing Investment Types", "mapping_investment_types.csv",
            List.of(SECURITY_TYPE, LT_ST), List.of(), INVESTMENT_TYPE_ATTRIBUTES),
    INVESTMENT("Missing Investment Mappings", "mapping_investments.csv",
            List.of(SECURITY_ID, SECURITY_TYPE), List.of(PURPOSE), INVESTMENT_ATTRIBUTES),
    ACCOUNT("Missing Account Mapping", "mapping_accounts.csv",
            List.of(ACCOUNT_NO, ACCOUNT_NO2, ACCOUNT_NAME), List.of(), concat(REGULATORY_ATTRIBUTES, INSTRUMENT_DETAILS)),
    POSITION("Missing Position Mapping", "mapping_positions.csv",
            List.of(SECURITY_ID, MappingColumns.INVESTMENT_TYPE, LT_ST), List.of(ISIN), REGULATORY_ATTRIBUTES);

    private final String sheetName;
    private final String fileName;
    private final List<String> keyFields;
    private final List<String> contextColumns;
    private final List<String> attributeColumns;

    KeySpace(String sheetName, String fileName, List<String> keyFields,
             List<String> contextColumns, List<String> attributeColumns) {
        this.sheetName = sheetName;
        this.fileName = fileName;
        this.keyFields = keyFields;
        this.contextColumns = contextColumns;
        this.attributeColumns = attributeColumns;
    }

    public String getSheetName() {
        return sheetName;
    }

    public String getFileName() {
        return fileName;
    }

    public List<String> getKeyFields() {
        return keyFields;
    }

    public List<String> getContextColumns() {
        return contextColumns;
    }

    public List<String> getAttributeColumns() {
        return attributeColumns;
    }

    /**
     * Column layout of this key space's gap table: key, key fields, context, blank attributes.
     */
    public List<String> gapColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(KEY);
        columns.addAll(keyFields);
        columns.addAll(contextColumns);
        columns.addAll(attributeColumns);
        return Collections.unmodifiableList(columns);
    }

    /**
     * Header of this key space's mapping file.
     */
    public List<String> mappingColumns() {
        List<String> columns = new ArrayList<>();
        columns.add(KEY);
        columns.addAll(attributeColumns);
        return Collections.unmodifiableList(columns);
    }

    public static Optional<KeySpace> fromSheetName(String sheetName) {
        for (KeySpace keySpace : values()) {
            if (keySpace.sheetName.equalsIgnoreCase(sheetName == null ? "" : sheetName.trim())) {
                return Optional.of(keySpace);
            }
        }
        return Optional.empty();
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return List.copyOf(all);
    }
}
