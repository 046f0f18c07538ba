package com.example.regreport.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keys of one key space found among the facts but not in its mapping table,
 * with the de-duplicated fact rows carrying them.
 */
public record MappingGap(KeySpace keySpace, Set<String> missingKeys, ReportTable rows) {

    public MappingGap {
        missingKeys = Collections.unmodifiableSet(new TreeSet<>(missingKeys));
    }
}
