package com.kreasipositif.statementprocessor.parser;

/**
 * Raised when no statement grammar applies to a file, or when a grammar applied but not a
 * single record could be recovered from it.
 */
public class UnsupportedStatementFormatException extends RuntimeException {

    public static final String FORMAT_NOT_RECOGNIZED = "format not recognized";

    private final String fileName;

    public UnsupportedStatementFormatException(String fileName, String detail) {
        super(FORMAT_NOT_RECOGNIZED + ": " + fileName + " (" + detail + ")");
        this.fileName = fileName;
    }

    public UnsupportedStatementFormatException(String fileName, String detail, Throwable cause) {
        super(FORMAT_NOT_RECOGNIZED + ": " + fileName + " (" + detail + ")", cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
