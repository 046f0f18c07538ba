package com.example.regreport.service;

import com.example.regreport.exception.ReportPipelineException;
import com.example.regreport.model.KeySpace;
import com.example.regreport.model.MappingImportResult;
import com.example.regreport.model.MappingTables;
import com.example.regreport.source.MappingSource;
import com.example.regreport.source.MappingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

import static com.example.regreport.model.MappingColumns.KEY;

/**
 * Feeds a maintainer-completed gap workbook back into the mapping tables.
 * Sheets are matched to key spaces by name; rows whose key is already mapped are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MappingImportService {

    private final MappingSource mappingSource;
    private final MappingStore mappingStore;

    private final DataFormatter formatter = new DataFormatter();

    public MappingImportResult importWorkbook(InputStream input) {
        MappingTables existing = mappingSource.loadMappings();
        Map<String, Integer> appended = new LinkedHashMap<>();
        Map<String, Integer> skipped = new LinkedHashMap<>();

        try (Workbook workbook = WorkbookFactory.create(input)) {
            for (Sheet sheet : workbook) {
                Optional<KeySpace> keySpace = KeySpace.fromSheetName(sheet.getSheetName());
                if (keySpace.isEmpty()) {
                    log.warn("Ignoring sheet '{}': not a mapping gap sheet", sheet.getSheetName());
                    continue;
                }

                Set<String> knownKeys = new HashSet<>(existing.keys(keySpace.get()));
                List<Map<String, String>> rows = new ArrayList<>();
                int duplicates = 0;

                for (Map<String, String> row : readRows(sheet)) {
                    String key = row.get(KEY);
                    if (key == null || key.isBlank()) {
                        throw new IllegalArgumentException("Sheet '" + sheet.getSheetName()
                                + "' contains a row with a blank " + KEY);
                    }
                    if (!knownKeys.add(key)) {
                        duplicates++;
                        continue;
                    }
                    rows.add(project(row, keySpace.get()));
                }

                int written = mappingStore.append(keySpace.get(), rows);
                appended.put(sheet.getSheetName(), written);
                skipped.put(sheet.getSheetName(), duplicates);
                log.info("Imported sheet '{}': {} appended, {} already mapped", sheet.getSheetName(), written, duplicates);
            }
        } catch (IOException e) {
            throw new ReportPipelineException("Failed to read mapping workbook", e);
        }

        return new MappingImportResult(appended, skipped);
    }

    private List<Map<String, String>> readRows(Sheet sheet) {
        Row header = sheet.getRow(sheet.getFirstRowNum());
        if (header == null) {
            return List.of();
        }

        List<String> columns = new ArrayList<>();
        for (Cell cell : header) {
            columns.add(formatter.formatCellValue(cell).trim());
        }

        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = header.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (row == null) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            boolean blank = true;
            for (int j = 0; j < columns.size(); j++) {
                String value = formatter.formatCellValue(row.getCell(j)).trim();
                values.put(columns.get(j), value);
                blank &= value.isEmpty();
            }
            if (!blank) {
                rows.add(values);
            }
        }
        return rows;
    }

    /**
     * Keep the key and the attribute columns; key fields and context columns are not stored.
     */
    private static Map<String, String> project(Map<String, String> row, KeySpace keySpace) {
        Map<String, String> projected = new LinkedHashMap<>();
        for (String column : keySpace.mappingColumns()) {
            projected.put(column, row.getOrDefault(column, ""));
        }
        return projected;
    }
}
