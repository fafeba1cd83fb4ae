package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.StatementLine;

import java.util.List;

/**
 * Records recovered from a file, plus how many were dropped as malformed.
 *
 * @param statementAccount the account the statement was issued for, when the format states it
 */
public record ParseOutcome(List<StatementLine> lines, int warnings, String statementAccount) {

    public ParseOutcome {
        lines = List.copyOf(lines);
        statementAccount = statementAccount == null ? "" : statementAccount;
    }
}
