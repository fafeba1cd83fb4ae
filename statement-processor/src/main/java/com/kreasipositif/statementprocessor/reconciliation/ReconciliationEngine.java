package com.kreasipositif.statementprocessor.reconciliation;

import com.kreasipositif.statementprocessor.config.ReconciliationProperties;
import com.kreasipositif.statementprocessor.domain.ExistingTransaction;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.domain.Reconciliation;
import com.kreasipositif.statementprocessor.matching.ClientDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairs matched bank rows with unconfirmed ledger entries of the same client.
 *
 * <p>A candidate has the same client and direction, is still MANUAL or DISCREPANCY, lies
 * within the date window and differs in amount by less than the configured percentage of the
 * larger amount. An entry already settled by the same bank amount and date is skipped. The closest amount wins, then the closest date, then the lowest id. An entry
 * claimed by one row is not offered to later rows of the same import.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationEngine {

    static final BigDecimal EXACT = new BigDecimal("0.01");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ReconciliationProperties properties;

    public List<ParsedTransaction> reconcile(List<ParsedTransaction> transactions,
                                             List<ExistingTransaction> existing) {
        Set<String> claimed = new HashSet<>();
        List<ParsedTransaction> result = new ArrayList<>(transactions.size());
        for (ParsedTransaction tx : transactions) {
            if (!tx.isMatched()) {
                result.add(tx.getReconciliation() == null ? tx : tx.toBuilder().reconciliation(null).build());
                continue;
            }
            Reconciliation reconciliation = reconcileOne(tx, existing, claimed);
            result.add(tx.toBuilder().reconciliation(reconciliation).build());
        }
        return result;
    }

    private Reconciliation reconcileOne(ParsedTransaction tx, List<ExistingTransaction> existing, Set<String> claimed) {
        ExistingTransaction best = null;
        Comparator<ExistingTransaction> ranking = Comparator
                .comparing((ExistingTransaction e) -> e.amount().subtract(tx.getAmount()).abs())
                .thenComparingLong(e -> Math.abs(ChronoUnit.DAYS.between(e.date(), tx.getDate())))
                .thenComparing(ExistingTransaction::id, ClientDirectory.ID_ORDER);

        for (ExistingTransaction entry : existing) {
            if (isCandidate(tx, entry, claimed) && (best == null || ranking.compare(entry, best) < 0)) {
                best = entry;
            }
        }

        if (best == null) {
            log.debug("Line {}: no ledger entry for client {}, new", tx.getSourceLine(), tx.getMatchedClientId());
            return Reconciliation.newEntry();
        }
        claimed.add(best.id());
        BigDecimal difference = best.amount().subtract(tx.getAmount()).abs();
        if (difference.compareTo(EXACT) < 0) {
            log.debug("Line {}: verified against ledger entry {}", tx.getSourceLine(), best.id());
            return Reconciliation.verified(best);
        }
        log.debug("Line {}: ledger entry {} differs by {}", tx.getSourceLine(), best.id(), difference.toPlainString());
        return Reconciliation.discrepancy(best);
    }

    private boolean isCandidate(ParsedTransaction tx, ExistingTransaction entry, Set<String> claimed) {
        if (claimed.contains(entry.id())
                || !entry.reconciliationStatus().isUnconfirmed()
                || !tx.getMatchedClientId().equals(entry.clientId())
                || entry.direction() != tx.getDirection()
                || entry.date() == null
                || entry.settledBy(tx)) {
            return false;
        }
        return withinDateWindow(tx.getDate(), entry.date()) && withinAmountTolerance(tx.getAmount(), entry.amount());
    }

    private boolean withinDateWindow(LocalDate bankDate, LocalDate ledgerDate) {
        if (properties.isSameMonth() && YearMonth.from(bankDate).equals(YearMonth.from(ledgerDate))) {
            return true;
        }
        return Math.abs(ChronoUnit.DAYS.between(ledgerDate, bankDate)) <= properties.getDateToleranceDays();
    }

    /** {@code |a - b| * 100 < pct * max(a, b)}, computed exactly. */
    private boolean withinAmountTolerance(BigDecimal bank, BigDecimal ledger) {
        BigDecimal difference = bank.subtract(ledger).abs();
        BigDecimal larger = bank.max(ledger);
        return difference.multiply(HUNDRED).compareTo(properties.getAmountTolerancePercent().multiply(larger)) < 0;
    }
}
