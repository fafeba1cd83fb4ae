package com.kreasipositif.statementprocessor.batch;

import com.kreasipositif.statementprocessor.domain.StatementFileReport;
import org.springframework.batch.item.ExecutionContext;

/**
 * Screening counts of one partition, or of a whole job once partitions are summed.
 *
 * <p>Kept in the worker step's execution context under {@code screening.*} keys, so the job
 * status endpoint can read them while partitions are still running.
 *
 * @param rows          statement rows read from imported files
 * @param matched       rows resolved to a client
 * @param discrepancies rows whose ledger entry has a different amount
 * @param parseWarnings records dropped as malformed
 */
public record ScreeningTally(long imported,
                             long unrecognized,
                             long unreadable,
                             long rows,
                             long matched,
                             long discrepancies,
                             long parseWarnings) {

    public static final ScreeningTally EMPTY = new ScreeningTally(0, 0, 0, 0, 0, 0, 0);

    private static final String IMPORTED = "screening.imported";
    private static final String UNRECOGNIZED = "screening.unrecognized";
    private static final String UNREADABLE = "screening.unreadable";
    private static final String ROWS = "screening.rows";
    private static final String MATCHED = "screening.matched";
    private static final String DISCREPANCIES = "screening.discrepancies";
    private static final String PARSE_WARNINGS = "screening.parseWarnings";

    public ScreeningTally add(StatementFileReport report) {
        if (report.isImported()) {
            return new ScreeningTally(imported + 1, unrecognized, unreadable,
                    rows + report.getTotal(), matched + report.getMatched(),
                    discrepancies + report.getDiscrepancies(), parseWarnings + report.getParseWarnings());
        }
        if (StatementFileReport.UNRECOGNIZED.equals(report.getStatus())) {
            return new ScreeningTally(imported, unrecognized + 1, unreadable, rows, matched, discrepancies, parseWarnings);
        }
        return new ScreeningTally(imported, unrecognized, unreadable + 1, rows, matched, discrepancies, parseWarnings);
    }

    public ScreeningTally plus(ScreeningTally other) {
        return new ScreeningTally(imported + other.imported, unrecognized + other.unrecognized,
                unreadable + other.unreadable, rows + other.rows, matched + other.matched,
                discrepancies + other.discrepancies, parseWarnings + other.parseWarnings);
    }

    public long rejected() {
        return unrecognized + unreadable;
    }

    public void writeTo(ExecutionContext context) {
        context.putLong(IMPORTED, imported);
        context.putLong(UNRECOGNIZED, unrecognized);
        context.putLong(UNREADABLE, unreadable);
        context.putLong(ROWS, rows);
        context.putLong(MATCHED, matched);
        context.putLong(DISCREPANCIES, discrepancies);
        context.putLong(PARSE_WARNINGS, parseWarnings);
    }

    public static ScreeningTally readFrom(ExecutionContext context) {
        return new ScreeningTally(
                context.getLong(IMPORTED, 0L),
                context.getLong(UNRECOGNIZED, 0L),
                context.getLong(UNREADABLE, 0L),
                context.getLong(ROWS, 0L),
                context.getLong(MATCHED, 0L),
                context.getLong(DISCREPANCIES, 0L),
                context.getLong(PARSE_WARNINGS, 0L));
    }
}
