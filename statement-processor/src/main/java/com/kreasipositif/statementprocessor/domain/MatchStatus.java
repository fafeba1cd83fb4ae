package com.kreasipositif.statementprocessor.domain;

public enum MatchStatus {
    MATCHED,
    UNMATCHED,
    DUPLICATE
}
