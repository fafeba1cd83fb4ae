package com.kreasipositif.statementprocessor.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A ledger entry recorded before this import, manually or by an earlier commit.
 *
 * @param bankAmount amount of the bank row that created or settled the entry; {@code null} for
 *                   entries no statement has touched
 * @param bankDate   date of that bank row; {@code null} alongside {@code bankAmount}
 */
public record ExistingTransaction(String id,
                                  String clientId,
                                  BigDecimal amount,
                                  LocalDate date,
                                  Direction direction,
                                  String description,
                                  String bankDocumentNumber,
                                  String bankClientName,
                                  ReconciliationStatus reconciliationStatus,
                                  BigDecimal bankAmount,
                                  LocalDate bankDate) {

    public ExistingTransaction {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("transaction id is required");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative: " + amount);
        }
        clientId = Identifiers.trimToEmpty(clientId);
        direction = direction == null ? Direction.INCOME : direction;
        description = Identifiers.trimToEmpty(description);
        bankDocumentNumber = Identifiers.trimToEmpty(bankDocumentNumber);
        bankClientName = Identifiers.trimToEmpty(bankClientName);
        reconciliationStatus = reconciliationStatus == null ? ReconciliationStatus.MANUAL : reconciliationStatus;
    }

    public ExistingTransaction(String id, String clientId, BigDecimal amount, LocalDate date, Direction direction,
                               String description, String bankDocumentNumber, String bankClientName,
                               ReconciliationStatus reconciliationStatus) {
        this(id, clientId, amount, date, direction, description, bankDocumentNumber, bankClientName,
                reconciliationStatus, null, null);
    }

    /** Amount as the bank reported it, falling back to the booked amount. */
    public BigDecimal statementAmount() {
        return bankAmount != null ? bankAmount : amount;
    }

    /** Date as the bank reported it, falling back to the booked date. */
    public LocalDate statementDate() {
        return bankDate != null ? bankDate : date;
    }

    public boolean settledBy(ParsedTransaction tx) {
        return bankAmount != null && bankDate != null
                && bankAmount.compareTo(tx.getAmount()) == 0
                && bankDate.equals(tx.getDate());
    }
}
