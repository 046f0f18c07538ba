package com.example.regreport.service;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.exception.DataAbsenceException;
import com.example.regreport.model.*;
import com.example.regreport.source.CsvReportDataSource;
import com.example.regreport.support.Fixtures;
import com.example.regreport.util.KeyBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static com.example.regreport.service.ReportAssembler.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportPipelineTest {

    private static final ReportingPeriod Q3 = ReportingPeriod.of(LocalDate.of(2025, 9, 30));

    @TempDir
    Path sourceDir;

    private ReportPipeline pipeline;

    @BeforeEach
    void setUp() {
        Fixtures.copyTo(sourceDir);

        ReportProperties properties = new ReportProperties();
        properties.getSource().setDirectory(sourceDir.toString());

        CsvReportDataSource dataSource = new CsvReportDataSource(properties);
        pipeline = new ReportPipeline(dataSource, dataSource, new DataPresenceChecker(),
                new EntryClassifier(new KeyBuilder()), new MappingReconciler(),
                new ReportAssembler(new CategoryAggregator(properties), properties));
    }

    private static BigDecimal number(ReportTable table, int row, String column) {
        return (BigDecimal) table.value(row, column);
    }

    private static int rowOf(ReportTable table, String firstColumn, String label) {
        int index = table.column(firstColumn).indexOf(label);
        assertThat(index).as("row %s in %s", label, table.getName()).isNotNegative();
        return index;
    }

    @Test
    void shouldProduceReportTables() {
        PipelineResult result = pipeline.run(Q3);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.tableNames()).containsExactly(
                REALIZED_PROFIT_ALL, REALIZED_PROFIT_FUNDS, UNREALIZED_PROFIT_ALL, UNREALIZED_PROFIT_FUNDS,
                UNREALIZED_PROFIT_BONDS_UNDER_1Y, UNREALIZED_PROFIT_BONDS_OVER_1Y,
                ACCOUNT_LOOKUP, POSITION_LOOKUP, COMBINED_LOOKUP);
    }

    @Test
    void shouldComputeUnrealizedFigures() {
        ReportTable table = pipeline.run(Q3).table(UNREALIZED_PROFIT_ALL).orElseThrow();

        int overOneYear = rowOf(table, CATEGORY, InvestmentCategory.DEBT_SECURITIES_OVER_ONE_YEAR.getLabel());
        assertThat(number(table, overOneYear, ACQUISITION_COST)).isEqualByComparingTo("1600");
        assertThat(number(table, overOneYear, OBJECTIVE_VALUE)).isEqualByComparingTo("1570");
        assertThat(number(table, overOneYear, REVALUATION_EFFECT)).isEqualByComparingTo("-30");
        assertThat(number(table, overOneYear, REVALUATION_RESERVE)).isEqualByComparingTo("50");

        int underOneYear = rowOf(table, CATEGORY, InvestmentCategory.DEBT_SECURITIES_UNDER_ONE_YEAR.getLabel());
        assertThat(number(table, underOneYear, ACQUISITION_COST)).isEqualByComparingTo("500");

        int funds = rowOf(table, CATEGORY, InvestmentCategory.INVESTMENT_FUND_SHARES.getLabel());
        assertThat(number(table, funds, ACQUISITION_COST)).isEqualByComparingTo("1200");
        assertThat(number(table, funds, OBJECTIVE_VALUE)).isEqualByComparingTo("1200");

        int derivatives = rowOf(table, CATEGORY, InvestmentCategory.DERIVATIVES.getLabel());
        assertThat(number(table, derivatives, ACQUISITION_COST)).isEqualByComparingTo("0");

        int total = rowOf(table, CATEGORY, "Total");
        assertThat(total).isEqualTo(table.size() - 1);
        assertThat(number(table, total, ACQUISITION_COST)).isEqualByComparingTo("3300");
        assertThat(number(table, total, OBJECTIVE_VALUE)).isEqualByComparingTo("3270");
        assertThat(number(table, total, FX_DIFFERENCE)).isEqualByComparingTo("0");
    }

    @Test
    void shouldComputeRealizedFigures() {
        PipelineResult result = pipeline.run(Q3);
        ReportTable all = result.table(REALIZED_PROFIT_ALL).orElseThrow();

        int funds = rowOf(all, CATEGORY, InvestmentCategory.INVESTMENT_FUND_SHARES.getLabel());
        assertThat(number(all, funds, SHARES)).isEqualByComparingTo("300");
        assertThat(number(all, funds, ACCOUNTING_VALUE)).isEqualByComparingTo("2800");
        assertThat(number(all, funds, REALIZED_PROFIT_LOSS)).isEqualByComparingTo("120");
        assertThat(number(all, funds, SELL_VALUE)).isEqualByComparingTo("2920");

        int bonds = rowOf(all, CATEGORY, InvestmentCategory.DEBT_SECURITIES_OVER_ONE_YEAR.getLabel());
        assertThat(number(all, bonds, SHARES)).isEqualByComparingTo("10");
        assertThat(number(all, bonds, ACCOUNTING_VALUE)).isEqualByComparingTo("800");

        ReportTable fundDetail = result.table(REALIZED_PROFIT_FUNDS).orElseThrow();
        assertThat(fundDetail.value(0, TAG)).isEqualTo("Fund X");
        assertThat(fundDetail.value(0, IFRS_CLASSIFICATION)).isEqualTo("FVTPL");
        assertThat(fundDetail.value(0, FUNDING_SOURCE)).isEqualTo("Technical reserves");
    }

    @Test
    void shouldBuildLookups() {
        PipelineResult result = pipeline.run(Q3);

        ReportTable positions = result.table(POSITION_LOOKUP).orElseThrow();
        assertThat(positions.size()).isEqualTo(1);
        assertThat(number(positions, 0, MappingColumns.QUANTITY)).isEqualByComparingTo("15");
        assertThat(positions.value(0, MappingColumns.CURRENCY)).isEqualTo("EUR");
        assertThat(positions.value(0, MappingColumns.RATING_AGENCY)).isEqualTo("S&P");

        ReportTable accounts = result.table(ACCOUNT_LOOKUP).orElseThrow();
        assertThat(accounts.size()).isEqualTo(2);
        assertThat(number(accounts, 0, "ACCOUNTING_VALUE")).isEqualByComparingTo("4000");

        assertThat(result.table(COMBINED_LOOKUP).orElseThrow().size()).isEqualTo(3);
    }

    @Test
    void shouldBeIdempotent() {
        PipelineResult first = pipeline.run(Q3);
        PipelineResult second = pipeline.run(Q3);

        assertThat(second.tables()).isEqualTo(first.tables());
    }

    @Test
    void shouldAbortWithGapTablesWhenMappingIsMissing() {
        Fixtures.removeLines(sourceDir.resolve(KeySpace.TRANSACTION_TYPE.getFileName()), "1260BONDRVE");

        PipelineResult result = pipeline.run(Q3);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.outcome()).isEqualTo(PipelineResult.Outcome.MAPPING_GAP);
        assertThat(result.tableNames()).containsExactly("Missing Transaction Types");
        ReportTable gap = result.tables().get(0);
        assertThat(gap.column(MappingColumns.KEY)).containsExactly("1260BONDRVE");
    }

    @Test
    void shouldTreatMissingMappingFileAsEmpty() throws IOException {
        Files.delete(sourceDir.resolve(KeySpace.ACCOUNT.getFileName()));

        PipelineResult result = pipeline.run(Q3);

        assertThat(result.tableNames()).containsExactly("Missing Account Mapping");
        assertThat(result.tables().get(0).column(MappingColumns.KEY))
                .containsExactly("100001Cash at bank", "101002Deposits");
    }

    @Test
    void shouldRejectStaleSources() {
        Fixtures.removeLines(sourceDir.resolve("holdings.csv"), "2025-09-30");

        assertThatThrownBy(() -> pipeline.run(Q3))
                .isInstanceOf(DataAbsenceException.class)
                .hasMessageContaining("holdings")
                .hasMessageContaining("month 9");
    }
}
