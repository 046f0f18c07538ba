package com.example.regreport.service;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static com.example.regreport.model.InvestmentCategory.DEBT_SECURITIES_OVER_ONE_YEAR;
import static com.example.regreport.service.ReportAssembler.*;
import static com.example.regreport.service.TestSnapshots.ACQUISITION;
import static com.example.regreport.service.TestSnapshots.IN_STATUS;
import static com.example.regreport.service.TestSnapshots.REPORT_DATE;
import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    private ReportProperties properties;
    private ReportAssembler assembler;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        assembler = new ReportAssembler(new CategoryAggregator(properties), properties);
    }

    private static RegulatoryAttributes fundedBy(String fundingSource) {
        return RegulatoryAttributes.builder().fundingSource(fundingSource).sector("S.12").build();
    }

    @Test
    void shouldAppendTotalsRowWithColumnSums() {
        ReportTable table = new ReportTable("T",
                List.of(ReportColumn.text("Name"), ReportColumn.number("A"), ReportColumn.number("B")),
                List.of(
                        Arrays.asList("x", new BigDecimal("1.5"), new BigDecimal("-2")),
                        Arrays.asList("y", new BigDecimal("3"), null)));

        ReportTable withTotals = assembler.withTotals(table);

        assertThat(withTotals.size()).isEqualTo(3);
        int last = withTotals.size() - 1;
        assertThat(withTotals.value(last, "Name")).isEqualTo("Total");
        assertThat((BigDecimal) withTotals.value(last, "A")).isEqualByComparingTo("4.5");
        assertThat((BigDecimal) withTotals.value(last, "B")).isEqualByComparingTo("-2");
        assertThat(withTotals.getRows().subList(0, 2)).isEqualTo(table.getRows());
    }

    @Test
    void shouldUseConfiguredTotalLabel() {
        properties.setTotalLabel("Skupaj");
        ReportTable table = new ReportTable("T", List.of(ReportColumn.text("Name"), ReportColumn.number("A")),
                List.of());

        ReportTable withTotals = assembler.withTotals(table);

        assertThat(withTotals.getRows()).hasSize(1);
        assertThat(withTotals.value(0, "Name")).isEqualTo("Skupaj");
        assertThat((BigDecimal) withTotals.value(0, "A")).isEqualByComparingTo("0");
    }

    @Test
    void shouldLeaveTableWithoutNumericColumnsUnchanged() {
        ReportTable table = new ReportTable("T", List.of(ReportColumn.text("Name")),
                List.of(Arrays.<Object>asList("x")));

        assertThat(assembler.withTotals(table)).isSameAs(table);
    }

    @Test
    void shouldAssembleTablesInOutputOrder() {
        ClassifiedSnapshot snapshot = TestSnapshots.create()
                .transactionType("1200", "Status", "Change", ACQUISITION, null)
                .investmentType("LT", DEBT_SECURITIES_OVER_ONE_YEAR)
                .investment("B1", "Bond A", "AC", "Own funds")
                .entry(IN_STATUS, "1200", "B1", "LT", "100")
                .classified();

        List<ReportTable> tables = assembler.assemble(snapshot);

        assertThat(tables).extracting(ReportTable::getName).containsExactly(
                REALIZED_PROFIT_ALL, REALIZED_PROFIT_FUNDS, UNREALIZED_PROFIT_ALL, UNREALIZED_PROFIT_FUNDS,
                UNREALIZED_PROFIT_BONDS_UNDER_1Y, UNREALIZED_PROFIT_BONDS_OVER_1Y,
                ACCOUNT_LOOKUP, POSITION_LOOKUP, COMBINED_LOOKUP);

        ReportTable unrealized = tables.get(2);
        assertThat(unrealized.size()).isEqualTo(InvestmentCategory.values().length + 1);
        assertThat(unrealized.column(VALUE_ADJUSTMENT_PL).subList(0, unrealized.size() - 1)).containsOnlyNulls();

        ReportTable overOneYear = tables.get(5);
        assertThat(overOneYear.value(0, TAG)).isEqualTo("Bond A");
        assertThat(overOneYear.value(0, LAST_VALUATION_DATE)).isEqualTo(REPORT_DATE);
        assertThat((BigDecimal) overOneYear.value(0, ACQUISITION_COST)).isEqualByComparingTo("100");
        assertThat(overOneYear.value(1, TAG)).isEqualTo("Total");

        // tag tables of empty categories hold only the totals row
        assertThat(tables.get(3).size()).isEqualTo(1);
    }

    @Test
    void shouldKeepTotalsConsistentWithBodyRows() {
        ClassifiedSnapshot snapshot = TestSnapshots.create()
                .transactionType("1200", "Status", "Change", ACQUISITION, null)
                .investmentType("LT", DEBT_SECURITIES_OVER_ONE_YEAR)
                .investmentType("ST", InvestmentCategory.DEBT_SECURITIES_UNDER_ONE_YEAR)
                .investment("B1", "Bond A", "AC", "Own funds")
                .investment("B2", "Bond B", "AC", "Own funds")
                .entry(IN_STATUS, "1200", "B1", "LT", "100.25")
                .entry(IN_STATUS, "1200", "B2", "ST", "-40")
                .classified();

        for (ReportTable table : assembler.assemble(snapshot)) {
            if (table.getName().endsWith("LOOKUP")) {
                continue;
            }
            int last = table.size() - 1;
            for (ReportColumn column : table.getColumns()) {
                if (!column.isNumeric()) {
                    continue;
                }
                BigDecimal body = table.column(column.name()).subList(0, last).stream()
                        .filter(BigDecimal.class::isInstance)
                        .map(BigDecimal.class::cast)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                assertThat((BigDecimal) table.value(last, column.name()))
                        .as("%s / %s", table.getName(), column.name())
                        .isEqualByComparingTo(body);
            }
        }
    }

    @Test
    void shouldBuildAccountLookupFromFundedAccounts() {
        properties.getLookup().getZeroAcquisitionAccounts().add("1010");
        ClassifiedSnapshot snapshot = TestSnapshots.create()
                .account("1000", "01", "Cash at bank", "4000")
                .account("1010", "02", "Deposits", "2500")
                .account("1020", "03", "Suspense", "10")
                .accountMapping("100001Cash at bank", fundedBy("Own funds"),
                        InstrumentDetails.builder().currency("EUR").build())
                .accountMapping("101002Deposits", fundedBy("Technical reserves"), null)
                .accountMapping("102003Suspense", fundedBy(" "), null)
                .classified();

        ReportTable lookup = assembler.accountLookup(snapshot);

        assertThat(lookup.columnNames()).hasSize(32);
        assertThat(lookup.size()).isEqualTo(2);
        assertThat(lookup.column(MappingColumns.FUNDING_SOURCE)).containsExactly("Own funds", "Technical reserves");
        assertThat(lookup.value(0, MappingColumns.CURRENCY)).isEqualTo("EUR");
        assertThat((BigDecimal) lookup.value(0, "ACQUISITION_VALUE")).isEqualByComparingTo("4000");
        assertThat((BigDecimal) lookup.value(0, "OBJECTIVE_VALUE")).isEqualByComparingTo("4000");
        assertThat((BigDecimal) lookup.value(1, "ACQUISITION_VALUE")).isEqualByComparingTo("0");
        assertThat((BigDecimal) lookup.value(1, "ACCOUNTING_VALUE")).isEqualByComparingTo("2500");
    }

    @Test
    void shouldNormalizePositionQuantitiesAndTranslateCodes() {
        properties.getLookup().getZeroQuantityNameFragments().add("Accumulating");
        InvestmentPosition bond = InvestmentPosition.builder()
                .reportDate(REPORT_DATE).securityId("B1").investmentType("DEBT").ltSt("LT")
                .investmentName("Bond A 2030").isin("SI0000000001")
                .nominalValueOfLot(new BigDecimal("100")).numberOfLots(new BigDecimal("1500"))
                .quotationCurrency("978").issuerRatingAgency("1")
                .acquisitionValuePc(new BigDecimal("1500"))
                .bookValuePc(new BigDecimal("1570")).accruedInterestPc(new BigDecimal("12"))
                .bookValueQc(new BigDecimal("1570")).accruedInterestQc(new BigDecimal("12"))
                .build();
        InvestmentPosition fund = InvestmentPosition.builder()
                .reportDate(REPORT_DATE).securityId("F1").investmentType("FUND").ltSt("LT")
                .investmentName("Fund X Accumulating")
                .nominalValueOfLot(BigDecimal.ONE).numberOfLots(new BigDecimal("300"))
                .build();
        InvestmentPosition share = InvestmentPosition.builder()
                .reportDate(REPORT_DATE).securityId("S1").investmentType("EQ").ltSt("LT")
                .investmentName("Share").nominalValueOfLot(BigDecimal.ONE).numberOfLots(new BigDecimal("42"))
                .quotationCurrency("999")
                .build();

        ClassifiedSnapshot snapshot = TestSnapshots.create()
                .position(bond).position(fund).position(share)
                .positionMapping("B1DEBTLT", fundedBy("Own funds"))
                .positionMapping("F1FUNDLT", fundedBy("Own funds"))
                .positionMapping("S1EQLT", fundedBy("Own funds"))
                .code("978", "EUR")
                .code("1", "S&P")
                .classified();

        ReportTable lookup = assembler.positionLookup(snapshot);

        assertThat(lookup.size()).isEqualTo(3);
        assertThat((BigDecimal) lookup.value(0, MappingColumns.QUANTITY)).isEqualByComparingTo("15");
        assertThat(lookup.value(0, MappingColumns.CURRENCY)).isEqualTo("EUR");
        assertThat(lookup.value(0, MappingColumns.RATING_AGENCY)).isEqualTo("S&P");
        assertThat((BigDecimal) lookup.value(0, "ACCOUNTING_VALUE")).isEqualByComparingTo("1582");
        assertThat((BigDecimal) lookup.value(0, "ACQUISITION_VALUE")).isEqualByComparingTo("1500");
        assertThat((BigDecimal) lookup.value(1, MappingColumns.QUANTITY)).isEqualByComparingTo("0");
        assertThat((BigDecimal) lookup.value(2, MappingColumns.QUANTITY)).isEqualByComparingTo("42");
        // untranslatable codes are left blank
        assertThat(lookup.value(2, MappingColumns.CURRENCY)).isNull();
    }

    @Test
    void shouldCombineAccountAndPositionLookups() {
        ClassifiedSnapshot snapshot = TestSnapshots.create()
                .account("1000", "01", "Cash", "1")
                .accountMapping("100001Cash", fundedBy("Own funds"), null)
                .position(InvestmentPosition.builder().securityId("B1").investmentType("DEBT").ltSt("LT").build())
                .positionMapping("B1DEBTLT", fundedBy("Own funds"))
                .classified();

        ReportTable combined = assembler.assemble(snapshot).get(8);

        assertThat(combined.getName()).isEqualTo(COMBINED_LOOKUP);
        assertThat(combined.size()).isEqualTo(2);
        assertThat(combined.getColumns()).isEqualTo(LOOKUP_COLUMNS);
    }
}
