package com.kreasipositif.statementprocessor.domain;

public enum StatementFormat {
    /** 1C "ClientBankExchange" text export with {@code СекцияДокумент} blocks. */
    NATIONAL_TXT,
    /** Header-driven tabular export: CSV/TSV text or an XLS/XLSX sheet. */
    DELIMITED
}
