package com.kreasipositif.statementprocessor.domain;

/**
 * Learned mapping from a bank-side counterparty name/BIN to a client.
 */
public record CounterpartyAlias(String bankName, String bankBin, String clientId) {

    public CounterpartyAlias {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("alias client id is required");
        }
        bankName = Identifiers.trimToEmpty(bankName);
        bankBin = Identifiers.digitsOnly(bankBin);
    }
}
