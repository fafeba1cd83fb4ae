package com.kreasipositif.statementprocessor.domain;

public enum ReconciliationType {
    /** A ledger entry with the same amount already exists. */
    VERIFIED,
    /** A ledger entry exists but the recorded amount differs from the bank amount. */
    DISCREPANCY,
    /** No prior ledger entry; committing creates one. */
    NEW
}
