package com.example.regreport.service;

import com.example.regreport.model.*;
import com.example.regreport.util.KeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives the key columns of every fact row and joins each key to its mapping row.
 * Unmatched keys leave the joined side null; the reconciler reports them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryClassifier {

    private final KeyBuilder keyBuilder;

    public ClassifiedSnapshot classify(SourceSnapshot snapshot) {
        MappingTables mappings = snapshot.mappings();

        List<ClassifiedEntry> entries = snapshot.ledgerEntries().stream()
                .map(entry -> classify(entry, mappings))
                .toList();

        List<ClassifiedHolding> holdings = snapshot.holdings().stream()
                .map(holding -> classify(holding, mappings))
                .toList();

        List<ClassifiedPosition> positions = snapshot.positions().stream()
                .map(position -> {
                    String key = keyBuilder.positionKey(position);
                    return new ClassifiedPosition(position, key, mappings.positions().get(key));
                })
                .toList();

        List<ClassifiedAccount> accounts = snapshot.accountBalances().stream()
                .map(account -> {
                    String key = keyBuilder.accountKey(account);
                    return new ClassifiedAccount(account, key, mappings.accounts().get(key));
                })
                .toList();

        log.debug("Classified {} ledger entries, {} holdings, {} positions, {} accounts",
                entries.size(), holdings.size(), positions.size(), accounts.size());

        return ClassifiedSnapshot.builder()
                .period(snapshot.period())
                .entries(entries)
                .holdings(holdings)
                .positions(positions)
                .accounts(accounts)
                .mappings(mappings)
                .build();
    }

    private ClassifiedEntry classify(LedgerEntry entry, MappingTables mappings) {
        String transactionTypeKey = keyBuilder.transactionTypeKey(entry);
        String investmentTypeKey = keyBuilder.investmentTypeKey(entry);
        String investmentKey = keyBuilder.investmentKey(entry);

        return ClassifiedEntry.builder()
                .entry(entry)
                .transactionTypeKey(transactionTypeKey)
                .investmentTypeKey(investmentTypeKey)
                .investmentKey(investmentKey)
                .transactionType(mappings.transactionTypes().get(transactionTypeKey))
                .category(categoryOf(mappings.investmentTypes().get(investmentTypeKey)))
                .investment(mappings.investments().get(investmentKey))
                .build();
    }

    private ClassifiedHolding classify(Holding holding, MappingTables mappings) {
        String investmentKey = keyBuilder.investmentKey(holding);
        String investmentTypeKey = keyBuilder.investmentTypeKey(holding);
        InvestmentMapping investment = mappings.investments().get(investmentKey);

        return ClassifiedHolding.builder()
                .holding(holding)
                .investmentKey(investmentKey)
                .investmentTypeKey(investmentTypeKey)
                .category(categoryOf(mappings.investmentTypes().get(investmentTypeKey)))
                .tag(investment == null ? null : investment.tags())
                .build();
    }

    private InvestmentCategory categoryOf(InvestmentTypeMapping mapping) {
        return mapping == null ? null : mapping.category().orElse(null);
    }
}
