package com.kreasipositif.statementprocessor.domain;

/**
 * A known counterparty of the organization.
 */
public record ClientRecord(String id, String name, String company, String bin) {

    public ClientRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("client id is required");
        }
        name = Identifiers.trimToEmpty(name);
        company = Identifiers.trimToEmpty(company);
        bin = Identifiers.digitsOnly(bin);
    }

    public boolean hasBin() {
        return !bin.isEmpty();
    }
}
