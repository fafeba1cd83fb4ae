package com.kreasipositif.statementprocessor.domain;

/**
 * Identity of the organization that owns the statements.
 */
public record CompanyInfo(String bin, String iban) {

    public CompanyInfo {
        bin = Identifiers.digitsOnly(bin);
        iban = Identifiers.account(iban);
    }
}
