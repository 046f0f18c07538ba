package com.example.regreport.source;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.exception.ReportPipelineException;
import com.example.regreport.model.KeySpace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends mapping rows to the mapping CSV files read by {@link CsvReportDataSource}.
 * A missing file is created with the full header of its key space.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvMappingStore implements MappingStore {

    private final ReportProperties properties;

    @Override
    public synchronized int append(KeySpace keySpace, List<Map<String, String>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }

        Path file = Path.of(properties.getSource().getDirectory()).resolve(keySpace.getFileName());
        List<String> columns = keySpace.mappingColumns();

        try {
            boolean exists = Files.isRegularFile(file) && Files.size(file) > 0;
            if (!exists && file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            if (exists && !endsWithNewline(file)) {
                Files.writeString(file, System.lineSeparator(), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            }

            CSVFormat format = exists
                    ? CSVFormat.DEFAULT
                    : CSVFormat.DEFAULT.builder().setHeader(columns.toArray(String[]::new)).build();

            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (Map<String, String> row : rows) {
                    List<String> values = new ArrayList<>(columns.size());
                    for (String column : columns) {
                        values.add(row.getOrDefault(column, ""));
                    }
                    printer.printRecord(values);
                }
            }
        } catch (IOException e) {
            throw new ReportPipelineException("Failed to append to mapping file " + file, e);
        }

        log.info("Appended {} row(s) to {}", rows.size(), file);
        return rows.size();
    }

    private static boolean endsWithNewline(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return bytes.length == 0 || bytes[bytes.length - 1] == '\n';
    }
}
