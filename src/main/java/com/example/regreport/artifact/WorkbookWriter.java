package com.example.regreport.artifact;

import com.example.regreport.model.ReportTable;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Persists named tables as one workbook, one sheet per table, in table order.
 */
public interface WorkbookWriter {

    /**
     * @param fileName file name inside the first usable output directory
     * @param tables   tables to write, one sheet each
     * @param asOf     date recorded as the workbook creation date
     * @return path of the written file
     */
    Path write(String fileName, List<ReportTable> tables, LocalDate asOf);
}
