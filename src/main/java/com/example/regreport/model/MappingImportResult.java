package com.example.regreport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Rows appended and rows skipped per key space, keyed by gap sheet name.
 */
public record MappingImportResult(

        @JsonProperty("appended")
        Map<String, Integer> appended,

        @JsonProperty("skipped")
        Map<String, Integer> skipped
) {

    public MappingImportResult {
        appended = Map.copyOf(appended);
        skipped = Map.copyOf(skipped);
    }

    public int totalAppended() {
        return appended.values().stream().mapToInt(Integer::intValue).sum();
    }
}
