package com.kreasipositif.statementprocessor.service;

import com.kreasipositif.statementprocessor.client.LedgerServiceClient;
import com.kreasipositif.statementprocessor.client.LedgerServiceClient.WriteResult;
import com.kreasipositif.statementprocessor.domain.ImportResult;
import com.kreasipositif.statementprocessor.domain.LedgerEntryDraft;
import com.kreasipositif.statementprocessor.domain.MatchSource;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.domain.Reconciliation;
import com.kreasipositif.statementprocessor.domain.ReconciliationType;
import com.kreasipositif.statementprocessor.matching.CounterpartyAliasStore;
import com.kreasipositif.statementprocessor.normalize.CounterpartyNameCleaner;
import com.kreasipositif.statementprocessor.reconciliation.DescriptionTags;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Writes a reviewed import to the ledger.
 *
 * <p>For every selected row with a client (matched or overridden) a ledger entry draft is
 * built; rows reconciled with an existing entry link to it. Alongside, the commit learns an
 * alias when the reviewer overrode the client or the match came from the name tier, and fills
 * in the client's BIN when the ledger has none.
 *
 * <p>Alias and BIN writes are dispatched through the {@code ledgerWriteThreadPoolBulkhead}
 * and are idempotent. A write that fails is logged and listed in
 * {@link CommitReport#failedWrites()}; it never aborts the rest of the commit.
 */
@Slf4j
@Service
public class ImportCommitService {

    private final LedgerServiceClient ledgerServiceClient;
    private final CounterpartyAliasStore aliasStore;
    private final ThreadPoolBulkhead ledgerWriteThreadPoolBulkhead;

    public ImportCommitService(LedgerServiceClient ledgerServiceClient,
                               CounterpartyAliasStore aliasStore,
                               @Qualifier("ledgerWriteThreadPoolBulkhead") ThreadPoolBulkhead ledgerWriteThreadPoolBulkhead) {
        this.ledgerServiceClient = ledgerServiceClient;
        this.aliasStore = aliasStore;
        this.ledgerWriteThreadPoolBulkhead = ledgerWriteThreadPoolBulkhead;
    }

    public CommitReport commit(ImportResult result, CommitRequest request) {
        List<ParsedTransaction> transactions = result.getTransactions();
        List<Integer> selection = request.selectedRows() != null ? request.selectedRows() : result.defaultSelection();

        List<LedgerEntryDraft> drafts = new ArrayList<>();
        Map<String, AliasWrite> aliases = new LinkedHashMap<>();
        Map<String, String> bins = new LinkedHashMap<>();
        int skipped = 0;
        int linked = 0;

        for (Integer row : new LinkedHashSet<>(selection)) {
            if (row == null || row < 0 || row >= transactions.size()) {
                skipped++;
                continue;
            }
            ParsedTransaction tx = transactions.get(row);
            String override = blankToNull(request.clientOverrides().get(row));
            boolean overridden = override != null && !override.equals(tx.getMatchedClientId());
            String clientId = override != null ? override : tx.getMatchedClientId();
            if (clientId == null) {
                skipped++;
                log.debug("Row {} skipped: no client", row);
                continue;
            }

            String linkedId = overridden ? null : linkedTransactionId(tx.getReconciliation());
            if (linkedId != null) {
                linked++;
            }
            drafts.add(new LedgerEntryDraft(
                    clientId,
                    tx.getAmount(),
                    tx.getDate(),
                    tx.getDirection(),
                    tx.getPaymentType(),
                    describe(tx),
                    tx.getDocumentNumber(),
                    CounterpartyNameCleaner.sanitize(tx.getClientNameRaw()),
                    linkedId));

            boolean hasBankIdentity = !tx.getClientBin().isEmpty() || !tx.getClientNameKey().isEmpty();
            if (hasBankIdentity && (overridden || tx.getMatchSource() == MatchSource.NAME)) {
                AliasWrite alias = new AliasWrite(tx.getClientNameRaw(), tx.getClientBin(), clientId);
                aliases.put(alias.key(), alias);
            }
            if (!tx.getClientBin().isEmpty() && (overridden || tx.getMatchSource() != MatchSource.BIN)) {
                bins.putIfAbsent(clientId, tx.getClientBin());
            }
        }

        List<String> failedWrites = Collections.synchronizedList(new ArrayList<>());
        int committed = appendDrafts(drafts, failedWrites);
        if (committed == 0) {
            linked = 0;
        }

        List<CompletableFuture<Boolean>> aliasFutures = new ArrayList<>();
        for (AliasWrite alias : aliases.values()) {
            aliasFutures.add(submit(() -> aliasStore.save(alias.bankName(), alias.bankBin(), alias.clientId()),
                    "alias '" + alias.bankName() + "' -> " + alias.clientId(), failedWrites));
        }
        List<CompletableFuture<Boolean>> binFutures = new ArrayList<>();
        for (Map.Entry<String, String> bin : bins.entrySet()) {
            binFutures.add(submit(() -> backfill(bin.getKey(), bin.getValue()),
                    "BIN " + bin.getValue() + " for client " + bin.getKey(), failedWrites));
        }

        int aliasesLearned = countApplied(aliasFutures);
        int binsBackfilled = countApplied(binFutures);

        CommitReport report = new CommitReport(committed, linked, skipped, aliasesLearned, binsBackfilled,
                List.copyOf(failedWrites));
        log.info("Committed '{}' — {} entries ({} linked), {} skipped, {} aliases learned, {} BINs backfilled, "
                        + "{} failed writes",
                result.getFileName(), committed, linked, skipped, aliasesLearned, binsBackfilled,
                report.failedWrites().size());
        return report;
    }

    /** Purpose text followed by the bank-import tags. */
    static String describe(ParsedTransaction tx) {
        List<String> parts = new ArrayList<>();
        if (tx.getDescription() != null && !tx.getDescription().isBlank()) {
            parts.add(tx.getDescription().trim());
        }
        if (tx.getAmountOriginal() != null && tx.getExchangeRate() != null) {
            parts.add(DescriptionTags.conversion(tx.getAmountOriginal(), tx.getCurrency(), tx.getExchangeRate()));
        }
        if (tx.getKnpCode() != null && !tx.getKnpCode().isBlank()) {
            parts.add(DescriptionTags.knp(tx.getKnpCode().trim()));
        }
        parts.add(DescriptionTags.bank(tx.getDirection()));
        if (tx.getDocumentNumber() != null && !tx.getDocumentNumber().isBlank()) {
            parts.add(DescriptionTags.document(tx.getDocumentNumber().trim()));
        }
        return String.join(" ", parts);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private int appendDrafts(List<LedgerEntryDraft> drafts, List<String> failedWrites) {
        if (drafts.isEmpty()) {
            return 0;
        }
        List<String> created = ledgerServiceClient.appendTransactions(drafts);
        if (created.isEmpty()) {
            failedWrites.add("ledger append of " + drafts.size() + " entries");
        }
        return created.size();
    }

    private boolean backfill(String clientId, String bin) {
        WriteResult result = ledgerServiceClient.backfillBin(clientId, bin);
        if (result == WriteResult.FAILED) {
            throw new IllegalStateException("ledger-service rejected or did not answer");
        }
        return result == WriteResult.APPLIED;
    }

    private CompletableFuture<Boolean> submit(Supplier<Boolean> write,
                                              String description,
                                              List<String> failedWrites) {
        try {
            return ledgerWriteThreadPoolBulkhead.executeSupplier(write)
                    .toCompletableFuture()
                    .exceptionally(e -> {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.warn("Write failed: {}: {}", description, cause.getMessage());
                        failedWrites.add(description);
                        return false;
                    });
        } catch (BulkheadFullException e) {
            log.warn("Bulkhead full, write dropped: {}: {}", description, e.getMessage());
            failedWrites.add(description);
            return CompletableFuture.completedFuture(false);
        }
    }

    private static int countApplied(List<CompletableFuture<Boolean>> futures) {
        int applied = 0;
        for (CompletableFuture<Boolean> future : futures) {
            try {
                if (Boolean.TRUE.equals(future.get())) {
                    applied++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return applied;
            } catch (ExecutionException e) {
                log.warn("Write future failed: {}", e.getCause().getMessage());
            }
        }
        return applied;
    }

    private static String linkedTransactionId(Reconciliation reconciliation) {
        if (reconciliation == null || reconciliation.type() == ReconciliationType.NEW) {
            return null;
        }
        return reconciliation.existingTransaction().id();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record AliasWrite(String bankName, String bankBin, String clientId) {

        String key() {
            return bankBin.isEmpty()
                    ? "name:" + CounterpartyNameCleaner.sanitize(bankName).toLowerCase(Locale.ROOT)
                    : "bin:" + bankBin;
        }
    }
}
