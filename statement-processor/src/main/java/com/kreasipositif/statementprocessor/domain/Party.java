package com.kreasipositif.statementprocessor.domain;

/**
 * One side of a bank transfer as printed in the statement.
 */
public record Party(String name, String bin, String account) {

    public static final Party EMPTY = new Party("", "", "");

    public Party {
        name = Identifiers.trimToEmpty(name);
        bin = Identifiers.digitsOnly(bin);
        account = Identifiers.account(account);
    }

    public boolean isEmpty() {
        return name.isEmpty() && bin.isEmpty() && account.isEmpty();
    }
}
