package com.kreasipositif.statementprocessor.reconciliation;

import com.kreasipositif.statementprocessor.domain.ExistingTransaction;
import com.kreasipositif.statementprocessor.domain.MatchSource;
import com.kreasipositif.statementprocessor.domain.MatchStatus;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.domain.ReconciliationStatus;
import com.kreasipositif.statementprocessor.normalize.CounterpartyNameCleaner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags bank rows that an earlier import already committed.
 *
 * <p>Only ledger entries that came from a bank import are compared: those with a bank document
 * number, a {@code [DOC:]}/{@code [BANK:]} tag or status {@code BANK_IMPORT}. Manually entered
 * entries are the reconciliation engine's business, never duplicates. Rows without a document
 * number are compared with the amount and date the bank reported for the entry, not the booked
 * ones.
 */
@Slf4j
@Component
public class DuplicateDetector {

    public List<ParsedTransaction> flagDuplicates(List<ParsedTransaction> transactions,
                                                  List<ExistingTransaction> existing) {
        List<ExistingTransaction> imported = new ArrayList<>();
        Set<String> documentNumbers = new HashSet<>();
        for (ExistingTransaction entry : existing) {
            if (!isBankImported(entry)) {
                continue;
            }
            imported.add(entry);
            if (!entry.bankDocumentNumber().isEmpty()) {
                documentNumbers.add(entry.bankDocumentNumber());
            }
            String tagged = DescriptionTags.documentNumber(entry.description());
            if (!tagged.isEmpty()) {
                documentNumbers.add(tagged);
            }
        }

        List<ParsedTransaction> result = new ArrayList<>(transactions.size());
        for (ParsedTransaction tx : transactions) {
            if (isDuplicate(tx, imported, documentNumbers)) {
                log.debug("Line {}: already imported (doc='{}', {} {})",
                        tx.getSourceLine(), tx.getDocumentNumber(), tx.getDate(), tx.getAmount());
                result.add(tx.toBuilder()
                        .matchStatus(MatchStatus.DUPLICATE)
                        .matchSource(MatchSource.NONE)
                        .matchedClientId(null)
                        .ambiguousMatch(false)
                        .reconciliation(null)
                        .build());
            } else {
                result.add(tx);
            }
        }
        return result;
    }

    private static boolean isBankImported(ExistingTransaction entry) {
        return entry.reconciliationStatus() == ReconciliationStatus.BANK_IMPORT
                || !entry.bankDocumentNumber().isEmpty()
                || DescriptionTags.isBankTagged(entry.description());
    }

    private static boolean isDuplicate(ParsedTransaction tx,
                                       List<ExistingTransaction> imported,
                                       Set<String> documentNumbers) {
        String doc = tx.getDocumentNumber() == null ? "" : tx.getDocumentNumber().trim();
        if (!doc.isEmpty()) {
            return documentNumbers.contains(doc);
        }
        for (ExistingTransaction entry : imported) {
            LocalDate date = entry.statementDate();
            if (date == null || !date.equals(tx.getDate())) {
                continue;
            }
            if (entry.statementAmount().compareTo(tx.getAmount()) != 0 || entry.direction() != tx.getDirection()) {
                continue;
            }
            if (sameCounterparty(tx, entry)) {
                return true;
            }
        }
        return false;
    }

    private static boolean sameCounterparty(ParsedTransaction tx, ExistingTransaction entry) {
        String key = tx.getClientNameKey();
        if (key != null && !key.isEmpty()
                && key.equals(CounterpartyNameCleaner.matchingKey(entry.bankClientName()))) {
            return true;
        }
        return tx.getMatchedClientId() != null && tx.getMatchedClientId().equals(entry.clientId());
    }
}
