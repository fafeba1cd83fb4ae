package com.kreasipositif.statementprocessor.parser;

import com.kreasipositif.statementprocessor.domain.SourceKind;
import com.kreasipositif.statementprocessor.domain.StatementFormat;

/**
 * A statement file whose grammar has been identified.
 *
 * @param text    decoded text for {@link SourceKind#TEXT} sources, {@code null} for spreadsheets
 * @param content the original bytes
 */
public record DetectedStatement(String fileName,
                                StatementFormat format,
                                SourceKind sourceKind,
                                String text,
                                byte[] content) {
}
