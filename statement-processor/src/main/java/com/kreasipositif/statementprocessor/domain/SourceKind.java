package com.kreasipositif.statementprocessor.domain;

public enum SourceKind {
    TEXT,
    SPREADSHEET
}
