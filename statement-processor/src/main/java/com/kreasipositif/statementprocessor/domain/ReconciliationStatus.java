package com.kreasipositif.statementprocessor.domain;

/**
 * Status of a ledger entry as stored by the ledger service.
 *
 * <p>Only {@link #MANUAL} and {@link #DISCREPANCY} entries are unconfirmed and may be
 * paired with a bank row during reconciliation.
 */
public enum ReconciliationStatus {
    MANUAL,
    VERIFIED,
    DISCREPANCY,
    BANK_IMPORT;

    public boolean isUnconfirmed() {
        return this == MANUAL || this == DISCREPANCY;
    }
}
