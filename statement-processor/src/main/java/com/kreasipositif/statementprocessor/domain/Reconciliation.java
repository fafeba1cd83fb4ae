package com.kreasipositif.statementprocessor.domain;

/**
 * Outcome of pairing a matched bank row with the ledger.
 *
 * @param existingTransaction present exactly when {@code type} is VERIFIED or DISCREPANCY
 */
public record Reconciliation(ReconciliationType type,
                             boolean amountDiffers,
                             ExistingTransaction existingTransaction) {

    public Reconciliation {
        if (type == null) {
            throw new IllegalArgumentException("reconciliation type is required");
        }
        if ((type == ReconciliationType.NEW) != (existingTransaction == null)) {
            throw new IllegalArgumentException(
                    "existing transaction must be set for VERIFIED/DISCREPANCY and only then");
        }
    }

    public static Reconciliation verified(ExistingTransaction existing) {
        return new Reconciliation(ReconciliationType.VERIFIED, false, existing);
    }

    public static Reconciliation discrepancy(ExistingTransaction existing) {
        return new Reconciliation(ReconciliationType.DISCREPANCY, true, existing);
    }

    public static Reconciliation newEntry() {
        return new Reconciliation(ReconciliationType.NEW, false, null);
    }
}
