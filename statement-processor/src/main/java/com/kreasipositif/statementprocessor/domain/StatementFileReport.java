package com.kreasipositif.statementprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of the screening report: what an import of a single statement file would produce.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementFileReport {

    public static final String IMPORTED = "IMPORTED";
    public static final String UNRECOGNIZED = "UNRECOGNIZED";
    public static final String UNREADABLE = "UNREADABLE";

    private String fileName;

    /** {@link #IMPORTED}, {@link #UNRECOGNIZED} or {@link #UNREADABLE}. */
    private String status;

    private StatementFormat format;

    private SourceKind sourceKind;

    private int total;
    private int matched;
    private int unmatched;
    private int duplicates;
    private int verified;
    private int discrepancies;
    private int newEntries;
    private int parseWarnings;

    private BigDecimal incomeTotal;
    private BigDecimal expenseTotal;

    /** Why the file was not imported; empty for imported files. */
    private String message;

    public boolean isImported() {
        return IMPORTED.equals(status);
    }

    public static StatementFileReport of(ImportResult result) {
        ImportSummary s = result.getSummary();
        return StatementFileReport.builder()
                .fileName(result.getFileName())
                .status(IMPORTED)
                .format(result.getFormat())
                .sourceKind(result.getSourceKind())
                .total(s.getTotal())
                .matched(s.getMatched())
                .unmatched(s.getUnmatched())
                .duplicates(s.getDuplicates())
                .verified(s.getVerified())
                .discrepancies(s.getDiscrepancies())
                .newEntries(s.getNewEntries())
                .parseWarnings(s.getParseWarnings())
                .incomeTotal(s.getIncomeTotal())
                .expenseTotal(s.getExpenseTotal())
                .message("")
                .build();
    }

    public static StatementFileReport rejected(String fileName, String status, String message) {
        return StatementFileReport.builder()
                .fileName(fileName)
                .status(status)
                .incomeTotal(BigDecimal.ZERO)
                .expenseTotal(BigDecimal.ZERO)
                .message(message)
                .build();
    }
}
