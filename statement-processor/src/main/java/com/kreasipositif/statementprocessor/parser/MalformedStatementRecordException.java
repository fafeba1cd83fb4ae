package com.kreasipositif.statementprocessor.parser;

/**
 * A single record could not be turned into a statement line. Never leaves the parser package.
 */
class MalformedStatementRecordException extends RuntimeException {

    MalformedStatementRecordException(String message) {
        super(message);
    }
}
