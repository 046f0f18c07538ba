package com.example.regreport.source;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.model.KeySpace;
import com.example.regreport.model.MappingColumns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvMappingStoreTest {

    @TempDir
    Path sourceDir;

    private ReportProperties properties;
    private CsvMappingStore store;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        properties.getSource().setDirectory(sourceDir.toString());
        store = new CsvMappingStore(properties);
    }

    @Test
    void shouldCreateFileWithHeader() throws IOException {
        int appended = store.append(KeySpace.INVESTMENT_TYPE, List.of(
                Map.of(MappingColumns.KEY, "BONDLT",
                        MappingColumns.CATEGORY, "VI. Debt securities maturing after more than one year")));

        assertThat(appended).isEqualTo(1);
        List<String> lines = Files.readAllLines(sourceDir.resolve(KeySpace.INVESTMENT_TYPE.getFileName()));
        assertThat(lines).containsExactly("KEY,CATEGORY", "BONDLT,VI. Debt securities maturing after more than one year");
    }

    @Test
    void shouldAppendToExistingFileWithoutTrailingNewline() throws IOException {
        Path file = sourceDir.resolve(KeySpace.INVESTMENT.getFileName());
        Files.writeString(file, "KEY,TAGS,IFRS_CLASSIFICATION,VALUATION_METHOD,VALUATION_METHOD_ALT,FUNDING_SOURCE\n"
                + "B1BOND,Bond A,AC,Amortized cost,,Own funds");

        store.append(KeySpace.INVESTMENT, List.of(
                Map.of(MappingColumns.KEY, "B2BOND", MappingColumns.TAGS, "Bond B, senior")));

        CsvReportDataSource reader = new CsvReportDataSource(properties);
        assertThat(reader.loadMappings().investments()).containsOnlyKeys("B1BOND", "B2BOND");
        assertThat(reader.loadMappings().investments().get("B2BOND").tags()).isEqualTo("Bond B, senior");
        assertThat(reader.loadMappings().investments().get("B2BOND").fundingSource()).isNull();
    }

    @Test
    void shouldIgnoreEmptyBatch() {
        assertThat(store.append(KeySpace.ACCOUNT, List.of())).isZero();
        assertThat(sourceDir.resolve(KeySpace.ACCOUNT.getFileName())).doesNotExist();
    }
}
