package com.example.regreport.service;

import com.example.regreport.config.ReportProperties;
import com.example.regreport.exception.AggregationAmbiguityException;
import com.example.regreport.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Windowed summation of classified ledger entries per category and per tag.
 *
 * <p>Status sums take the balance measure of status rows booked on or before the previous
 * quarter end; change sums take the delta measure of change rows booked inside the current
 * quarter. The revaluation-reserve status sum is negated. An empty selection sums to zero.
 *
 * <p>Realized figures use the year-to-date window over all rows instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryAggregator {

    private final ReportProperties properties;

    public List<CategoryLineItems> unrealizedByCategory(ClassifiedSnapshot snapshot) {
        List<ClassifiedEntry> statusRows = statusRows(snapshot);
        List<ClassifiedEntry> changeRows = changeRows(snapshot);

        List<CategoryLineItems> result = new ArrayList<>();
        for (InvestmentCategory category : InvestmentCategory.ordered()) {
            WindowedSums sums = windowedSums(
                    filter(statusRows, entry -> entry.matches(category)),
                    filter(changeRows, entry -> entry.matches(category)));
            result.add(new CategoryLineItems(category, sums, LineItems.from(sums)));
        }
        return result;
    }

    /**
     * Same computation repeated for every tag found in the category, tags in natural order.
     */
    public List<TagLineItems> unrealizedByTag(ClassifiedSnapshot snapshot, InvestmentCategory category) {
        List<ClassifiedEntry> statusRows = filter(statusRows(snapshot), entry -> entry.matches(category));
        List<ClassifiedEntry> changeRows = filter(changeRows(snapshot), entry -> entry.matches(category));

        ReportingPeriod period = snapshot.period();
        List<ClassifiedEntry> combined = filter(snapshot.entries(), entry -> entry.matches(category)
                && ((period.inStatusWindow(entry.bookingDate()) && entry.isStatusRow())
                || (period.inChangeWindow(entry.bookingDate()) && entry.isChangeRow())));

        List<TagLineItems> result = new ArrayList<>();
        for (String tag : tagsOf(combined)) {
            WindowedSums sums = windowedSums(
                    filter(statusRows, entry -> tag.equals(entry.tag())),
                    filter(changeRows, entry -> tag.equals(entry.tag())));
            TagAttributes attributes = resolveAttributes(tag, filter(combined, entry -> tag.equals(entry.tag())));
            result.add(new TagLineItems(tag, attributes, sums, LineItems.from(sums)));
        }

        log.debug("Aggregated {} tag(s) for category {}", result.size(), category);
        return result;
    }

    public List<CategoryRealized> realizedByCategory(ClassifiedSnapshot snapshot) {
        List<ClassifiedEntry> realizedRows = realizedRows(snapshot);

        List<CategoryRealized> result = new ArrayList<>();
        for (InvestmentCategory category : InvestmentCategory.ordered()) {
            BigDecimal shares = sum(snapshot.holdings().stream()
                    .filter(holding -> holding.category() == category)
                    .map(ClassifiedHolding::nominal));
            result.add(new CategoryRealized(category,
                    realizedSums(shares, filter(realizedRows, entry -> entry.matches(category)))));
        }
        return result;
    }

    public List<TagRealized> realizedByTag(ClassifiedSnapshot snapshot, InvestmentCategory category) {
        List<ClassifiedEntry> categoryRows = filter(realizedRows(snapshot), entry -> entry.matches(category));

        List<TagRealized> result = new ArrayList<>();
        for (String tag : tagsOf(categoryRows)) {
            List<ClassifiedEntry> tagRows = filter(categoryRows, entry -> tag.equals(entry.tag()));
            BigDecimal shares = sum(snapshot.holdings().stream()
                    .filter(holding -> holding.category() == category && tag.equals(holding.tag()))
                    .map(ClassifiedHolding::nominal));
            result.add(new TagRealized(tag, resolveAttributes(tag, tagRows), realizedSums(shares, tagRows)));
        }
        return result;
    }

    /**
     * Five kinds times two windows over pre-filtered status and change rows.
     */
    WindowedSums windowedSums(List<ClassifiedEntry> statusRows, List<ClassifiedEntry> changeRows) {
        Map<TransactionKind, BigDecimal> status = new EnumMap<>(TransactionKind.class);
        Map<TransactionKind, BigDecimal> change = new EnumMap<>(TransactionKind.class);

        for (TransactionKind kind : TransactionKind.ordered()) {
            BigDecimal statusSum = sumOfKind(statusRows, kind, ClassifiedEntry::balance);
            // reserve balances carry the opposite sign to the report
            if (kind == TransactionKind.REVALUATION_RESERVE) {
                statusSum = statusSum.negate();
            }
            status.put(kind, statusSum);
            change.put(kind, sumOfKind(changeRows, kind, ClassifiedEntry::delta));
        }
        return new WindowedSums(status, change);
    }

    private RealizedSums realizedSums(BigDecimal shares, List<ClassifiedEntry> rows) {
        BigDecimal accountingValue = sum(rows.stream()
                .filter(entry -> entry.realizedKind().filter(RealizedKind.ACCOUNTING_VALUE::equals).isPresent())
                .map(ClassifiedEntry::balance));
        BigDecimal profitLoss = sum(rows.stream()
                .filter(entry -> entry.realizedKind().filter(RealizedKind.REALIZED_PROFIT_LOSS::equals).isPresent())
                .map(ClassifiedEntry::balance)).negate();
        return new RealizedSums(shares, accountingValue, profitLoss);
    }

    private TagAttributes resolveAttributes(String tag, List<ClassifiedEntry> rows) {
        if (rows.isEmpty()) {
            return TagAttributes.EMPTY;
        }
        TagAttributes first = TagAttributes.of(rows.get(0).investment());

        checkAgreement(tag, "IFRS classification", rows, TagAttributes::ifrsClassification);
        checkAgreement(tag, "valuation method", rows, TagAttributes::valuationMethod);
        checkAgreement(tag, "alternate valuation method", rows, TagAttributes::valuationMethodAlt);
        checkAgreement(tag, "funding source", rows, TagAttributes::fundingSource);

        return first;
    }

    private void checkAgreement(String tag, String attribute, List<ClassifiedEntry> rows,
                                Function<TagAttributes, String> accessor) {
        Set<String> values = new LinkedHashSet<>();
        for (ClassifiedEntry row : rows) {
            values.add(accessor.apply(TagAttributes.of(row.investment())));
        }
        if (values.size() <= 1) {
            return;
        }
        if (properties.getAttributePolicy() == AttributePolicy.REQUIRE_AGREEMENT) {
            throw new AggregationAmbiguityException(tag, attribute, new ArrayList<>(values));
        }
        log.warn("Tag '{}' has {} different values for {}, using the first: {}",
                tag, values.size(), attribute, values.iterator().next());
    }

    private List<ClassifiedEntry> statusRows(ClassifiedSnapshot snapshot) {
        ReportingPeriod period = snapshot.period();
        return filter(snapshot.entries(),
                entry -> period.inStatusWindow(entry.bookingDate()) && entry.isStatusRow());
    }

    private List<ClassifiedEntry> changeRows(ClassifiedSnapshot snapshot) {
        ReportingPeriod period = snapshot.period();
        return filter(snapshot.entries(),
                entry -> period.inChangeWindow(entry.bookingDate()) && entry.isChangeRow());
    }

    private List<ClassifiedEntry> realizedRows(ClassifiedSnapshot snapshot) {
        ReportingPeriod period = snapshot.period();
        return filter(snapshot.entries(), entry -> period.inYearToDate(entry.bookingDate()));
    }

    private static SortedSet<String> tagsOf(List<ClassifiedEntry> rows) {
        SortedSet<String> tags = new TreeSet<>();
        for (ClassifiedEntry row : rows) {
            if (row.tag() != null && !row.tag().isBlank()) {
                tags.add(row.tag());
            }
        }
        return tags;
    }

    private static BigDecimal sumOfKind(List<ClassifiedEntry> rows, TransactionKind kind,
                                        Function<ClassifiedEntry, BigDecimal> measure) {
        return sum(rows.stream()
                .filter(entry -> entry.transactionKind().filter(kind::equals).isPresent())
                .map(measure));
    }

    private static BigDecimal sum(Stream<BigDecimal> values) {
        return values.filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static <T> List<T> filter(List<T> rows, Predicate<T> predicate) {
        return rows.stream().filter(predicate).toList();
    }
}
