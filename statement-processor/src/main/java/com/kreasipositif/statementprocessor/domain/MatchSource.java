package com.kreasipositif.statementprocessor.domain;

/**
 * Which tier of the counterparty matcher produced the client id.
 */
public enum MatchSource {
    BIN,
    ALIAS,
    NAME,
    NONE
}
