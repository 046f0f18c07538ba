package com.example.regreport.source;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.exception.ReportPipelineException;
import com.example.regreport.exception.SchemaViolationException;
import com.example.regreport.model.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

import static com.example.regreport.model.MappingColumns.*;

/**
 * Reads facts and mappings from a directory of CSV exports (header row, comma separated, UTF-8).
 * Files are read afresh on every call.
 */
@Slf4j
@Component
public class CsvReportDataSource implements ReportDataSource, MappingSource {

    static final String LEDGER_FILE = "ledger_entries.csv";
    static final String HOLDINGS_FILE = "holdings.csv";
    static final String POSITIONS_FILE = "investment_positions.csv";
    static final String POSTINGS_FILE = "account_postings.csv";
    static final String CODE_MAP_FILE = "code_map.csv";

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private static final List<String> LEDGER_COLUMNS = List.of(
            BOOKING_DATE, GROUP_ACCOUNT, SECURITY_TYPE, INVESTMENTS, SECURITY_ID, LT_ST, PURPOSE,
            "DEBIT_AMOUNT_FOREIGN_CUR", "CREDIT_AMOUNT_FOREIGN_CUR",
            "DEBIT_AMOUNT_BASE_CUR", "CREDIT_AMOUNT_BASE_CUR");

    private static final List<String> HOLDINGS_COLUMNS = List.of(
            REPORT_DATE, SECURITY_ID, "SECTYPE", LT_ST, "NOMINAL");

    // the remaining position columns are optional and read as blank when absent
    private static final List<String> POSITIONS_COLUMNS = List.of(
            REPORT_DATE, SECURITY_ID, INVESTMENT_TYPE, LT_ST, ISIN, "INVESTMENT_NAME");

    private static final List<String> POSTINGS_COLUMNS = List.of(
            POSTING_DATE, ACCOUNT_NO, ACCOUNT_NO2, ACCOUNT_NAME, "AMOUNT");

    private final ReportProperties properties;

    public CsvReportDataSource(ReportProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<LedgerEntry> loadLedgerEntries(ReportingPeriod period) {
        List<LedgerEntry> entries = new ArrayList<>();
        for (SourceRow row : read(LEDGER_TABLE, LEDGER_FILE, LEDGER_COLUMNS, true)) {
            LocalDate bookingDate = row.date(BOOKING_DATE);
            if (bookingDate == null || bookingDate.isAfter(period.reportDate())) {
                continue;
            }
            entries.add(LedgerEntry.builder()
                    .bookingDate(bookingDate)
                    .groupAccount(row.text(GROUP_ACCOUNT))
                    .securityType(row.text(SECURITY_TYPE))
                    .investments(row.text(INVESTMENTS))
                    .securityId(row.text(SECURITY_ID))
                    .ltSt(row.text(LT_ST))
                    .purpose(row.text(PURPOSE))
                    .debitAmountForeign(row.decimal("DEBIT_AMOUNT_FOREIGN_CUR"))
                    .creditAmountForeign(row.decimal("CREDIT_AMOUNT_FOREIGN_CUR"))
                    .debitAmountBase(row.decimal("DEBIT_AMOUNT_BASE_CUR"))
                    .creditAmountBase(row.decimal("CREDIT_AMOUNT_BASE_CUR"))
                    .build());
        }
        log.info("Loaded {} ledger entries up to {}", entries.size(), period.reportDate());
        return entries;
    }

    @Override
    public List<Holding> loadHoldings(ReportingPeriod period) {
        List<Holding> holdings = new ArrayList<>();
        for (SourceRow row : read(HOLDINGS_TABLE, HOLDINGS_FILE, HOLDINGS_COLUMNS, true)) {
            if (!period.reportDate().equals(row.date(REPORT_DATE))) {
                continue;
            }
            holdings.add(Holding.builder()
                    .reportDate(row.date(REPORT_DATE))
                    .securityId(row.text(SECURITY_ID))
                    .securityType(row.text("SECTYPE"))
                    .ltSt(row.text(LT_ST))
                    .nominal(row.decimal("NOMINAL"))
                    .build());
        }
        log.info("Loaded {} holdings at {}", holdings.size(), period.reportDate());
        return holdings;
    }

    @Override
    public List<InvestmentPosition> loadPositions(ReportingPeriod period) {
        List<InvestmentPosition> positions = new ArrayList<>();
        for (SourceRow row : read(POSITIONS_TABLE, POSITIONS_FILE, POSITIONS_COLUMNS, true)) {
            if (!period.reportDate().equals(row.date(REPORT_DATE))) {
                continue;
            }
            positions.add(InvestmentPosition.builder()
                    .reportDate(row.date(REPORT_DATE))
                    .securityId(row.text(SECURITY_ID))
                    .investmentType(row.text(INVESTMENT_TYPE))
                    .ltSt(row.text(LT_ST))
                    .ifrsGroup(row.text("IFRS_GROUP"))
                    .investmentName(row.text("INVESTMENT_NAME"))
                    .isin(row.text(ISIN))
                    .nominalValueOfLot(row.decimal("NOMINAL_VALUE_OF_LOT_QC"))
                    .numberOfLots(row.decimal("NUMBER_OF_LOTS"))
                    .quotationCurrency(row.text("QUOTATION_CURRENCY"))
                    .acquisitionValueQc(row.decimal("ACQUISITION_VALUE_QC"))
                    .acquisitionValuePc(row.decimal("ACQUISITION_VALUE_PC"))
                    .bookValueQc(row.decimal("BALANCE_BOOK_VALUE_IN_QC"))
                    .bookValuePc(row.decimal("BALANCE_BOOK_VALUE_IN_PC"))
                    .accruedInterestQc(row.decimal("ACCRUED_INTEREST_IN_QC"))
                    .accruedInterestPc(row.decimal("ACCRUED_INTEREST_IN_PC"))
                    .couponRate(row.decimal("COUPON_RATE"))
                    .effectiveInterestRate(row.decimal(EFFECTIVE_INTEREST_RATE))
                    .couponFrequency(row.decimal(COUPON_FREQUENCY))
                    .purchaseDate(row.date("PURCHASE_DATE"))
                    .maturityDate(row.date(MATURITY_DATE))
                    .issuerRating(row.text("ISSUER_RATING_SECOND_BEST"))
                    .issuerRatingAgency(row.text("ISSUER_RATING_AGENCY"))
                    .dirtyMarketValueQc(row.decimal("DIRTY_MARKET_VALUE_IN_QC"))
                    .dirtyMarketValuePc(row.decimal("DIRTY_MARKET_VALUE_IN_PC"))
                    .build());
        }
        log.info("Loaded {} investment positions at {}", positions.size(), period.reportDate());
        return positions;
    }

    @Override
    public List<AccountBalance> loadAccountBalances(ReportingPeriod period) {
        Map<List<String>, BigDecimal> balances = new LinkedHashMap<>();
        for (SourceRow row : postings(period)) {
            List<String> account = Arrays.asList(row.text(ACCOUNT_NO), row.text(ACCOUNT_NO2), row.text(ACCOUNT_NAME));
            BigDecimal amount = row.decimal("AMOUNT");
            balances.merge(account, amount == null ? BigDecimal.ZERO : amount, BigDecimal::add);
        }

        List<AccountBalance> result = new ArrayList<>(balances.size());
        balances.forEach((account, balance) -> result.add(AccountBalance.builder()
                .accountNo(account.get(0))
                .accountNo2(account.get(1))
                .accountName(account.get(2))
                .balance(balance)
                .build()));

        log.info("Loaded {} account balances up to {}", result.size(), period.reportDate());
        return result;
    }

    @Override
    public List<LocalDate> loadAccountPostingDates(ReportingPeriod period) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        for (SourceRow row : postings(period)) {
            dates.add(row.date(POSTING_DATE));
        }
        return new ArrayList<>(dates);
    }

    @Override
    public MappingTables loadMappings() {
        MappingTables tables = MappingTables.builder()
                .transactionTypes(mapping(KeySpace.TRANSACTION_TYPE, MappingRowParser::transactionType))
                .investmentTypes(mapping(KeySpace.INVESTMENT_TYPE, MappingRowParser::investmentType))
                .investments(mapping(KeySpace.INVESTMENT, MappingRowParser::investment))
                .accounts(mapping(KeySpace.ACCOUNT, MappingRowParser::account))
                .positions(mapping(KeySpace.POSITION, MappingRowParser::position))
                .codes(MappingRowParser.indexByKey("code_map",
                        read("code_map", CODE_MAP_FILE, List.of(KEY, CODE_VALUE), false),
                        row -> row.text(CODE_VALUE)))
                .build();

        log.info("Loaded mappings: {} transaction types, {} investment types, {} investments, {} accounts, {} positions",
                tables.transactionTypes().size(), tables.investmentTypes().size(), tables.investments().size(),
                tables.accounts().size(), tables.positions().size());
        return tables;
    }

    private <T> Map<String, T> mapping(KeySpace keySpace, Function<SourceRow, T> parser) {
        String table = tableName(keySpace.getFileName());
        return MappingRowParser.indexByKey(table,
                read(table, keySpace.getFileName(), keySpace.mappingColumns(), false), parser);
    }

    private List<SourceRow> postings(ReportingPeriod period) {
        Predicate<LocalDate> upToReportDate = date -> date != null && !date.isAfter(period.reportDate());
        return read(POSTINGS_TABLE, POSTINGS_FILE, POSTINGS_COLUMNS, true).stream()
                .filter(row -> upToReportDate.test(row.date(POSTING_DATE)))
                .toList();
    }

    /**
     * Read every record of a file, checking the required header columns first.
     * A missing optional file reads as empty; a missing required file is fatal.
     */
    List<SourceRow> read(String table, String fileName, List<String> requiredColumns, boolean requiredFile) {
        Path file = directory().resolve(fileName);
        if (!Files.isRegularFile(file)) {
            if (requiredFile) {
                throw new ReportPipelineException("Source file not found for table " + table + ": " + file);
            }
            log.debug("No file for table {} at {}, reading as empty", table, file);
            return List.of();
        }

        try (CSVParser parser = CSVParser.parse(new StringReader(content(file)), FORMAT)) {
            Map<String, Integer> headerMap = parser.getHeaderMap();
            Set<String> header = headerMap == null ? Set.of() : headerMap.keySet();
            for (String column : requiredColumns) {
                if (!header.contains(column)) {
                    throw new SchemaViolationException(table, column);
                }
            }

            List<SourceRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                // header is line 1
                rows.add(new SourceRow(table, record.getRecordNumber() + 1, record.toMap()));
            }
            log.debug("Read {} row(s) from {}", rows.size(), file);
            return rows;
        } catch (IOException e) {
            throw new ReportPipelineException("Failed to read table " + table + " from " + file, e);
        }
    }

    Path directory() {
        return Path.of(properties.getSource().getDirectory());
    }

    private static String content(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
            return content.substring(1);
        }
        return content;
    }

    private static String tableName(String fileName) {
        return fileName.endsWith(".csv") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }
}
