package com.example.regreport.service;

import com.example.regreport.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;

/**
 * Coverage gate between the facts and the hand-maintained mapping tables.
 * For every key space the gap is the set of fact keys absent from the mapping keys;
 * any non-empty gap fails the whole run.
 */
@Slf4j
@Service
public class MappingReconciler {

    public ReconciliationResult reconcile(ClassifiedSnapshot snapshot) {
        MappingTables mappings = snapshot.mappings();
        List<MappingGap> gaps = new ArrayList<>();

        check(KeySpace.TRANSACTION_TYPE, snapshot.entries(), ClassifiedEntry::transactionTypeKey,
                entry -> Arrays.asList(entry.entry().groupAccount(), entry.entry().securityType(), entry.entry().investments()),
                mappings).ifPresent(gaps::add);

        check(KeySpace.INVESTMENT_TYPE, snapshot.entries(), ClassifiedEntry::investmentTypeKey,
                entry -> Arrays.asList(entry.entry().securityType(), entry.entry().ltSt()),
                mappings).ifPresent(gaps::add);

        check(KeySpace.INVESTMENT, snapshot.entries(), ClassifiedEntry::investmentKey,
                entry -> Arrays.asList(entry.entry().securityId(), entry.entry().securityType(), entry.entry().purpose()),
                mappings).ifPresent(gaps::add);

        check(KeySpace.ACCOUNT, snapshot.accounts(), ClassifiedAccount::accountKey,
                account -> Arrays.asList(account.account().accountNo(), account.account().accountNo2(),
                        account.account().accountName()),
                mappings).ifPresent(gaps::add);

        check(KeySpace.POSITION, snapshot.positions(), ClassifiedPosition::positionKey,
                position -> Arrays.asList(position.position().securityId(), position.position().investmentType(),
                        position.position().ltSt(), position.position().isin()),
                mappings).ifPresent(gaps::add);

        if (gaps.isEmpty()) {
            log.info("All mapping up to date");
        } else {
            gaps.forEach(gap -> log.warn("{}: {} unmapped key(s) in {} row(s)",
                    gap.keySpace().getSheetName(), gap.missingKeys().size(), gap.rows().size()));
        }

        return new ReconciliationResult(gaps);
    }

    /**
     * Keys present among the facts but missing from the mapping table of the given key space.
     */
    public <T> Set<String> missingKeys(Collection<T> facts, Function<T, String> keyOf, Set<String> mappingKeys) {
        Set<String> missing = new TreeSet<>();
        for (T fact : facts) {
            String key = keyOf.apply(fact);
            if (!mappingKeys.contains(key)) {
                missing.add(key);
            }
        }
        return missing;
    }

    private <T> Optional<MappingGap> check(KeySpace keySpace,
                                           List<T> facts,
                                           Function<T, String> keyOf,
                                           Function<T, List<Object>> identifyingValues,
                                           MappingTables mappings) {
        Set<String> missing = missingKeys(facts, keyOf, mappings.keys(keySpace));
        if (missing.isEmpty()) {
            log.debug("{}: {} fact row(s) fully covered", keySpace, facts.size());
            return Optional.empty();
        }

        List<String> columnNames = keySpace.gapColumns();
        int blankAttributes = keySpace.getAttributeColumns().size();

        // distinct on the projected columns, first occurrence order
        Set<List<Object>> rows = new LinkedHashSet<>();
        for (T fact : facts) {
            String key = keyOf.apply(fact);
            if (!missing.contains(key)) {
                continue;
            }
            List<Object> row = new ArrayList<>(columnNames.size());
            row.add(key);
            row.addAll(identifyingValues.apply(fact));
            row.addAll(Collections.nCopies(blankAttributes, null));
            rows.add(row);
        }

        List<ReportColumn> columns = columnNames.stream().map(ReportColumn::text).toList();
        ReportTable table = new ReportTable(keySpace.getSheetName(), columns, new ArrayList<>(rows));

        return Optional.of(new MappingGap(keySpace, missing, table));
    }
}
