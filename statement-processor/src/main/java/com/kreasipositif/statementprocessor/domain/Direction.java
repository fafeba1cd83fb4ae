package com.kreasipositif.statementprocessor.domain;

/**
 * Money flow relative to the organization that owns the statement.
 */
public enum Direction {

    INCOME("IN"),
    EXPENSE("OUT");

    private final String marker;

    Direction(String marker) {
        this.marker = marker;
    }

    /** Short marker written into committed ledger descriptions, e.g. {@code [BANK:IN]}. */
    public String marker() {
        return marker;
    }

    public boolean isIncome() {
        return this == INCOME;
    }

    public static Direction of(boolean income) {
        return income ? INCOME : EXPENSE;
    }
}
