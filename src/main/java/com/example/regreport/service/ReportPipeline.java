package com.example.regreport.service;

import com.example.regreport.model.*;
import com.example.regreport.source.MappingSource;
import com.example.regreport.source.ReportDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * One report run: load, staleness check, classify, reconciliation gate, assemble.
 * Holds no state between runs; the same sources and period always give the same tables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportPipeline {

    private final ReportDataSource dataSource;
    private final MappingSource mappingSource;
    private final DataPresenceChecker presenceChecker;
    private final EntryClassifier classifier;
    private final MappingReconciler reconciler;
    private final ReportAssembler assembler;

    public PipelineResult run(ReportingPeriod period) {
        log.info("Starting report run for {} (year start {}, previous quarter end {}, quarter start {})",
                period.reportDate(), period.yearStart(), period.previousQuarterEnd(), period.quarterStart());

        SourceSnapshot snapshot = SourceSnapshot.builder()
                .period(period)
                .ledgerEntries(dataSource.loadLedgerEntries(period))
                .holdings(dataSource.loadHoldings(period))
                .positions(dataSource.loadPositions(period))
                .accountBalances(dataSource.loadAccountBalances(period))
                .mappings(mappingSource.loadMappings())
                .build();

        List<LocalDate> postingDates = dataSource.loadAccountPostingDates(period);
        presenceChecker.check(snapshot, postingDates);

        ClassifiedSnapshot classified = classifier.classify(snapshot);

        ReconciliationResult reconciliation = reconciler.reconcile(classified);
        if (!reconciliation.passed()) {
            log.warn("Mapping incomplete for {}: {} key space(s) with gaps, no report produced",
                    period.reportDate(), reconciliation.gaps().size());
            return PipelineResult.mappingGap(period, reconciliation.gapTables());
        }

        return PipelineResult.success(period, assembler.assemble(classified));
    }
}
