package com.kreasipositif.statementprocessor.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A ledger entry to be written by a commit.
 *
 * @param linkedTransactionId existing entry the bank row was reconciled with; {@code null} for
 *                            new entries
 */
public record LedgerEntryDraft(String clientId,
                               BigDecimal amount,
                               LocalDate date,
                               Direction direction,
                               PaymentType paymentType,
                               String description,
                               String bankDocumentNumber,
                               String bankClientName,
                               String linkedTransactionId) {
}
