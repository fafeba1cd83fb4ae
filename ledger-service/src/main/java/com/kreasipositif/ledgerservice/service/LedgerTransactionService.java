package com.kreasipositif.ledgerservice.service;

import com.kreasipositif.ledgerservice.config.LedgerSeedProperties;
import com.kreasipositif.ledgerservice.config.LedgerSeedProperties.TransactionEntry;
import com.kreasipositif.ledgerservice.dto.BulkAppendRequest;
import com.kreasipositif.ledgerservice.dto.BulkAppendResponse;
import com.kreasipositif.ledgerservice.dto.LedgerEntryDraftDto;
import com.kreasipositif.ledgerservice.dto.LedgerTransactionDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The ledger itself: manually entered entries plus everything committed from statements.
 *
 * <p>A committed row either creates a {@code BANK_IMPORT} entry or, when it carries a
 * {@code linkedTransactionId}, settles that entry: the status becomes {@code VERIFIED} or
 * {@code DISCREPANCY}, the bank amount and document number are recorded and the booked amount
 * is left alone until {@link #applyBankAmount} is called.
 */
@Slf4j
@Service
public class LedgerTransactionService {

    /** Amounts closer than this are the same amount. */
    private static final BigDecimal AMOUNT_EPSILON = new BigDecimal("0.01");

    private final ClientDirectoryService clientDirectoryService;
    private final Map<String, LedgerEntry> entries = new LinkedHashMap<>();

    public LedgerTransactionService(LedgerSeedProperties properties,
                                    ClientDirectoryService clientDirectoryService) {
        this.clientDirectoryService = clientDirectoryService;
        for (TransactionEntry seed : properties.getTransactions()) {
            String id = seed.getId() != null ? seed.getId() : UUID.randomUUID().toString();
            entries.put(id, LedgerEntry.builder()
                    .id(id)
                    .clientId(seed.getClientId())
                    .amount(seed.getAmount())
                    .date(seed.getDate())
                    .direction(seed.getDirection())
                    .paymentType(seed.getPaymentType())
                    .description(nullToEmpty(seed.getDescription()))
                    .bankDocumentNumber("")
                    .bankClientName("")
                    .reconciliationStatus(seed.getReconciliationStatus())
                    .build());
        }
        log.info("Ledger seeded with {} transactions", entries.size());
    }

    public synchronized List<LedgerTransactionDto> findAll() {
        return entries.values().stream().map(LedgerEntry::toDto).toList();
    }

    public synchronized Optional<LedgerTransactionDto> findById(String id) {
        return Optional.ofNullable(entries.get(id)).map(LedgerEntry::toDto);
    }

    /**
     * Writes every draft. A draft whose linked entry does not exist creates a new entry instead.
     *
     * @throws IllegalArgumentException when a draft names an unknown client; nothing is written
     */
    public synchronized BulkAppendResponse append(BulkAppendRequest request) {
        for (LedgerEntryDraftDto draft : request.getEntries()) {
            if (!clientDirectoryService.exists(draft.getClientId())) {
                throw new IllegalArgumentException("unknown client: " + draft.getClientId());
            }
        }

        List<String> entryIds = new ArrayList<>(request.getEntries().size());
        int created = 0;
        int linked = 0;
        for (LedgerEntryDraftDto draft : request.getEntries()) {
            LedgerEntry target = draft.getLinkedTransactionId() != null
                    ? entries.get(draft.getLinkedTransactionId())
                    : null;
            if (target != null) {
                settle(target, draft);
                linked++;
            } else {
                if (draft.getLinkedTransactionId() != null) {
                    log.warn("Linked entry {} not found — creating a new entry", draft.getLinkedTransactionId());
                }
                target = create(draft);
                created++;
            }
            entryIds.add(target.getId());
        }

        log.info("Bulk append — {} created, {} linked", created, linked);
        return BulkAppendResponse.builder()
                .totalCreated(created)
                .totalLinked(linked)
                .entryIds(entryIds)
                .build();
    }

    /**
     * Replaces the booked amount of a settled entry with the amount the bank reported and marks
     * it {@code VERIFIED}. Empty when the entry is unknown.
     *
     * @throws IllegalStateException when the entry has no bank amount yet
     */
    public synchronized Optional<LedgerTransactionDto> applyBankAmount(String id) {
        LedgerEntry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.getBankAmount() == null) {
            throw new IllegalStateException("entry " + id + " has not been settled by a bank row");
        }
        entry.setAmount(entry.getBankAmount());
        entry.setReconciliationStatus(LedgerEntry.VERIFIED);
        log.info("Entry {} amount set to bank amount {}", id, entry.getBankAmount());
        return Optional.of(entry.toDto());
    }

    // ─── Internal helpers ────────────────────────────────────────────────────────

    private LedgerEntry create(LedgerEntryDraftDto draft) {
        LedgerEntry entry = LedgerEntry.builder()
                .id(UUID.randomUUID().toString())
                .clientId(draft.getClientId())
                .amount(draft.getAmount())
                .date(draft.getDate())
                .direction(draft.getDirection())
                .paymentType(draft.getPaymentType())
                .description(nullToEmpty(draft.getDescription()))
                .bankDocumentNumber(nullToEmpty(draft.getBankDocumentNumber()))
                .bankClientName(nullToEmpty(draft.getBankClientName()))
                .bankAmount(draft.getAmount())
                .bankDate(draft.getDate())
                .reconciliationStatus(LedgerEntry.BANK_IMPORT)
                .build();
        entries.put(entry.getId(), entry);
        return entry;
    }

    private void settle(LedgerEntry entry, LedgerEntryDraftDto draft) {
        boolean amountDiffers = entry.getAmount().subtract(draft.getAmount()).abs().compareTo(AMOUNT_EPSILON) >= 0;
        entry.setReconciliationStatus(amountDiffers ? LedgerEntry.DISCREPANCY : LedgerEntry.VERIFIED);
        entry.setBankAmount(draft.getAmount());
        entry.setBankDate(draft.getDate());
        entry.setBankDocumentNumber(nullToEmpty(draft.getBankDocumentNumber()));
        entry.setBankClientName(nullToEmpty(draft.getBankClientName()));
        String tags = nullToEmpty(draft.getDescription());
        if (!tags.isEmpty() && !entry.getDescription().contains(tags)) {
            entry.setDescription((entry.getDescription() + " " + tags).trim());
        }
        log.debug("Entry {} settled — {} (bank {} vs booked {})",
                entry.getId(), entry.getReconciliationStatus(), draft.getAmount(), entry.getAmount());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
