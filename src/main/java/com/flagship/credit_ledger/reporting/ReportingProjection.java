package com.flagship.credit_ledger.reporting;

import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.credit.CreditTransaction;
import com.flagship.credit_ledger.credit.CurrencyCode;
import com.flagship.credit_ledger.credit.TransactionType;
import com.flagship.credit_ledger.credit.exception.CreditNotFoundException;
import com.flagship.credit_ledger.ledger.DateRange;
import com.flagship.credit_ledger.ledger.LedgerStore;
import com.flagship.credit_ledger.ledger.TransactionFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Read-only views computed from the transaction history on demand.
 *
 * Sums are over signed entry amounts, so redemptions count negative. Nothing here writes
 * or caches.
 */
@Service
@RequiredArgsConstructor
public class ReportingProjection {

    static final String NO_VALUE = "(none)";

    private final LedgerStore ledgerStore;

    @Transactional(readOnly = true)
    public AggregateResult aggregate(TransactionFilter filter, GroupBy groupBy, DateRange range) {
        List<CreditTransaction> transactions = ledgerStore.findTransactions(filter, range);

        if (groupBy.isTimeBucketed()) {
            Map<Instant, long[]> counts = new TreeMap<>();
            Map<Instant, BigDecimal> sums = new TreeMap<>();
            for (CreditTransaction tx : transactions) {
                Instant bucket = bucketStart(tx.getTimestamp(), groupBy);
                counts.computeIfAbsent(bucket, k -> new long[1])[0]++;
                sums.merge(bucket, tx.getAmount(), BigDecimal::add);
            }
            List<TimeBucket> buckets = new ArrayList<>();
            counts.forEach((start, count) -> buckets.add(new TimeBucket(start, count[0], sums.get(start))));
            return new TimeSeries(groupBy, List.copyOf(buckets));
        }

        BigDecimal total = transactions.stream().map(CreditTransaction::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (groupBy == GroupBy.NONE) {
            return new Totals(groupBy, transactions.size(), total, List.of());
        }

        Function<CreditTransaction, String> keyOf = groupKey(groupBy);
        Map<String, long[]> counts = new TreeMap<>();
        Map<String, BigDecimal> sums = new TreeMap<>();
        for (CreditTransaction tx : transactions) {
            String key = keyOf.apply(tx);
            counts.computeIfAbsent(key, k -> new long[1])[0]++;
            sums.merge(key, tx.getAmount(), BigDecimal::add);
        }
        List<GroupTotal> groups = new ArrayList<>();
        counts.forEach((key, count) -> groups.add(new GroupTotal(key, count[0], sums.get(key))));
        return new Totals(groupBy, transactions.size(), total, List.copyOf(groups));
    }

    @Transactional(readOnly = true)
    public CreditStats creditStats() {
        Map<CurrencyCode, BigDecimal[]> perCurrency = new EnumMap<>(CurrencyCode.class);
        for (CreditTransaction tx : ledgerStore.findTransactions(TransactionFilter.all(), DateRange.unbounded())) {
            // issued, redeemed, outstanding
            BigDecimal[] figures = perCurrency.computeIfAbsent(tx.getCurrency(),
                c -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO});
            if (tx.getType() == TransactionType.ISSUE) {
                figures[0] = figures[0].add(tx.getAmount());
            } else if (tx.getType() == TransactionType.REDEEM) {
                figures[1] = figures[1].subtract(tx.getAmount());
            }
            figures[2] = figures[2].add(tx.getAmount());
        }

        List<CreditStats.CurrencyTotals> currencies = new ArrayList<>();
        perCurrency.forEach((currency, f) -> currencies.add(new CreditStats.CurrencyTotals(currency, f[0], f[1], f[2])));
        return new CreditStats(ledgerStore.countByStatus(), List.copyOf(currencies));
    }

    /**
     * Balance right after the last entry at or before the instant; zero before issuance.
     */
    @Transactional(readOnly = true)
    public BigDecimal balanceAsOf(UUID creditId, Instant asOf) {
        requireCredit(creditId);
        BigDecimal balance = BigDecimal.ZERO;
        for (CreditTransaction tx : ledgerStore.findTransactions(creditId)) {
            if (tx.getTimestamp().isAfter(asOf)) {
                break;
            }
            balance = tx.getBalanceAfter();
        }
        return balance;
    }

    @Transactional(readOnly = true)
    public LedgerVerification verify(UUID creditId) {
        Credit credit = requireCredit(creditId);
        List<CreditTransaction> history = ledgerStore.findTransactions(creditId);
        List<String> problems = new ArrayList<>();

        BigDecimal running = BigDecimal.ZERO;
        for (CreditTransaction tx : history) {
            running = running.add(tx.getAmount());
            if (running.compareTo(tx.getBalanceAfter()) != 0) {
                problems.add(String.format("Entry %s (seq %d) has balanceAfter %s but entries sum to %s",
                    tx.getId(), tx.getSequenceNumber(), tx.getBalanceAfter(), running));
            }
        }

        if (history.isEmpty() || history.get(0).getType() != TransactionType.ISSUE) {
            problems.add("History does not start with an ISSUE entry");
        }
        BigDecimal latest = history.isEmpty() ? null : history.get(history.size() - 1).getBalanceAfter();
        if (running.compareTo(credit.getBalance()) != 0) {
            problems.add(String.format("Stored balance %s differs from summed amounts %s", credit.getBalance(), running));
        }
        if (latest != null && latest.compareTo(credit.getBalance()) != 0) {
            problems.add(String.format("Stored balance %s differs from latest balanceAfter %s", credit.getBalance(), latest));
        }

        return new LedgerVerification(creditId, credit.getBalance(), running, latest, List.copyOf(problems));
    }

    private Credit requireCredit(UUID creditId) {
        return ledgerStore.findById(creditId)
            .orElseThrow(() -> new CreditNotFoundException("Credit not found: " + creditId));
    }

    private static Function<CreditTransaction, String> groupKey(GroupBy groupBy) {
        return switch (groupBy) {
            case TYPE -> tx -> tx.getType().name();
            case STAFF -> tx -> orNone(tx.getStaffId());
            case LOCATION -> tx -> orNone(tx.getLocationId());
            case CURRENCY -> tx -> tx.getCurrency().name();
            default -> throw new IllegalArgumentException("Not a totals grouping: " + groupBy);
        };
    }

    private static String orNone(String value) {
        return value == null ? NO_VALUE : value;
    }

    static Instant bucketStart(Instant timestamp, GroupBy groupBy) {
        LocalDate day = timestamp.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate start = switch (groupBy) {
            case DAY -> day;
            case WEEK -> day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> day.withDayOfMonth(1);
            default -> throw new IllegalArgumentException("Not a time grouping: " + groupBy);
        };
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
