package com.kreasipositif.statementprocessor.parser;

/**
 * One statement grammar.
 *
 * <p>Implementations never fail on an individual record: malformed records are skipped and
 * counted in {@link ParseOutcome#warnings()}. They throw
 * {@link UnsupportedStatementFormatException} only when the file as a whole cannot be read.
 */
public interface StatementParser {

    boolean supports(DetectedStatement statement);

    ParseOutcome parse(DetectedStatement statement);
}
