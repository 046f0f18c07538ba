package com.example.regreport.source;

import com.example.regreport.model.KeySpace;

import java.util.List;
import java.util.Map;

/**
 * Write side of the mapping tables, used when completed gap rows are imported.
 */
public interface MappingStore {

    /**
     * Append rows (column name to value) to the mapping table of the key space.
     *
     * @return number of rows written
     */
    int append(KeySpace keySpace, List<Map<String, String>> rows);
}
