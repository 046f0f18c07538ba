package com.example.regreport.artifact;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.exception.ArtifactWriteException;
import com.example.regreport.model.ReportColumn;
import com.example.regreport.model.ReportTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Apache POI writer for xlsx artifacts.
 * Output directories are tried in configured order; the first one that accepts the file wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExcelWorkbookWriter implements WorkbookWriter {

    static final String DATE_FORMAT = "yyyy-mm-dd";

    private final ReportProperties properties;

    @Override
    public Path write(String fileName, List<ReportTable> tables, LocalDate asOf) {
        List<String> candidates = properties.getOutput().getDirectories();
        List<String> failures = new ArrayList<>();

        byte[] content;
        try {
            content = toBytes(tables, asOf);
        } catch (IOException e) {
            throw new ArtifactWriteException("Failed to build workbook " + fileName, e);
        }

        for (String candidate : candidates) {
            Path directory = Path.of(candidate);
            Path target = directory.resolve(fileName);
            try {
                Files.createDirectories(directory);
                Files.write(target, content);
                log.info("Wrote {} sheet(s) to {}", tables.size(), target);
                return target;
            } catch (IOException | SecurityException e) {
                log.warn("Cannot write {} to {}: {}", fileName, directory, e.getMessage());
                failures.add(directory + " (" + e.getMessage() + ")");
            }
        }

        throw new ArtifactWriteException("No writable output directory for " + fileName
                + ", tried: " + (failures.isEmpty() ? candidates : failures));
    }

    /**
     * Serialized workbook whose zip entries all carry the report date, so equal tables give equal bytes.
     */
    byte[] toBytes(List<ReportTable> tables, LocalDate asOf) throws IOException {
        ByteArrayOutputStream serialized = new ByteArrayOutputStream();
        try (XSSFWorkbook workbook = toWorkbook(tables, asOf)) {
            workbook.write(serialized);
        }
        return pinEntryTimes(serialized.toByteArray(), startOfDay(asOf).getTime());
    }

    static byte[] pinEntryTimes(byte[] zip, long time) throws IOException {
        ByteArrayOutputStream repacked = new ByteArrayOutputStream(zip.length);
        try (ZipArchiveInputStream in = new ZipArchiveInputStream(new ByteArrayInputStream(zip));
             ZipArchiveOutputStream out = new ZipArchiveOutputStream(repacked)) {
            ZipArchiveEntry source;
            while ((source = in.getNextEntry()) != null) {
                ZipArchiveEntry entry = new ZipArchiveEntry(source.getName());
                entry.setTime(time);
                out.putArchiveEntry(entry);
                in.transferTo(out);
                out.closeArchiveEntry();
            }
        }
        return repacked.toByteArray();
    }

    private static Date startOfDay(LocalDate date) {
        return Date.from(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    XSSFWorkbook toWorkbook(List<ReportTable> tables, LocalDate asOf) {
        XSSFWorkbook workbook = new XSSFWorkbook();

        Date created = startOfDay(asOf);
        workbook.getProperties().getCoreProperties().setCreated(Optional.of(created));
        workbook.getProperties().getCoreProperties().setModified(Optional.of(created));

        CellStyle headerStyle = workbook.createCellStyle();
        Font bold = workbook.createFont();
        bold.setBold(true);
        headerStyle.setFont(bold);

        CellStyle dateStyle = workbook.createCellStyle();
        dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat(DATE_FORMAT));

        for (ReportTable table : tables) {
            Sheet sheet = workbook.createSheet(WorkbookUtil.createSafeSheetName(table.getName()));
            List<ReportColumn> columns = table.getColumns();

            Row header = sheet.createRow(0);
            for (int i = 0; i < columns.size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(columns.get(i).name());
                cell.setCellStyle(headerStyle);
            }

            int rowIndex = 1;
            for (List<Object> values : table.getRows()) {
                Row row = sheet.createRow(rowIndex++);
                for (int i = 0; i < values.size(); i++) {
                    Object value = values.get(i);
                    if (value != null) {
                        writeCell(row.createCell(i), value, dateStyle);
                    }
                }
            }
        }
        return workbook;
    }

    private static void writeCell(Cell cell, Object value, CellStyle dateStyle) {
        if (value instanceof BigDecimal decimal) {
            cell.setCellValue(decimal.doubleValue());
        } else if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else if (value instanceof LocalDate date) {
            cell.setCellValue(date);
            cell.setCellStyle(dateStyle);
        } else {
            cell.setCellValue(value.toString());
        }
    }
}
