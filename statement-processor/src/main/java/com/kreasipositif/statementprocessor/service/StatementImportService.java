package com.kreasipositif.statementprocessor.service;

import com.kreasipositif.statementprocessor.domain.ImportResult;
import com.kreasipositif.statementprocessor.domain.ImportSummary;
import com.kreasipositif.statementprocessor.domain.ParsedTransaction;
import com.kreasipositif.statementprocessor.matching.ClientDirectory;
import com.kreasipositif.statementprocessor.matching.CounterpartyMatcher;
import com.kreasipositif.statementprocessor.normalize.TransactionNormalizer;
import com.kreasipositif.statementprocessor.parser.DetectedStatement;
import com.kreasipositif.statementprocessor.parser.ParseOutcome;
import com.kreasipositif.statementprocessor.parser.StatementFormatDetector;
import com.kreasipositif.statementprocessor.parser.StatementParser;
import com.kreasipositif.statementprocessor.parser.UnsupportedStatementFormatException;
import com.kreasipositif.statementprocessor.reconciliation.DuplicateDetector;
import com.kreasipositif.statementprocessor.reconciliation.ReconciliationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one statement file through the engine:
 * detect → parse → normalize → match → flag duplicates → reconcile.
 *
 * <p>The pipeline has no side effects. Nothing is written anywhere until the reviewed result
 * is passed to {@link ImportCommitService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatementImportService {

    private final StatementFormatDetector formatDetector;
    private final List<StatementParser> parsers;
    private final TransactionNormalizer normalizer;
    private final CounterpartyMatcher matcher;
    private final DuplicateDetector duplicateDetector;
    private final ReconciliationEngine reconciliationEngine;
    private final ReferenceDataService referenceDataService;

    /**
     * Imports against the current ledger-service state.
     */
    public ImportResult importStatement(String fileName, byte[] content) {
        return importStatement(fileName, content, referenceDataService.loadContext());
    }

    /**
     * @throws UnsupportedStatementFormatException when no grammar applies or no record could
     *                                             be read
     */
    public ImportResult importStatement(String fileName, byte[] content, ImportContext context) {
        DetectedStatement detected = formatDetector.detect(fileName, content);
        StatementParser parser = parsers.stream()
                .filter(p -> p.supports(detected))
                .findFirst()
                .orElseThrow(() -> new UnsupportedStatementFormatException(fileName, "no parser for " + detected.format()));

        ParseOutcome outcome = parser.parse(detected);
        if (outcome.lines().isEmpty()) {
            throw new UnsupportedStatementFormatException(fileName,
                    "no records recognized, " + outcome.warnings() + " malformed");
        }

        List<ParsedTransaction> transactions = outcome.lines().stream()
                .map(line -> normalizer.normalize(line, outcome.statementAccount(), context.getCompany()))
                .toList();
        transactions = matcher.matchAll(transactions, new ClientDirectory(context.getClients()), context.getAliases());
        transactions = duplicateDetector.flagDuplicates(transactions, context.getExistingTransactions());
        transactions = reconciliationEngine.reconcile(transactions, context.getExistingTransactions());

        ImportSummary summary = ImportSummary.of(transactions, outcome.warnings());
        log.info("Imported '{}' as {}/{} — {} rows: {} matched, {} unmatched, {} duplicates, "
                        + "{} verified, {} discrepancies, {} new, {} warnings",
                fileName, detected.format(), detected.sourceKind(), summary.getTotal(), summary.getMatched(),
                summary.getUnmatched(), summary.getDuplicates(), summary.getVerified(),
                summary.getDiscrepancies(), summary.getNewEntries(), summary.getParseWarnings());
        if (summary.getParseWarnings() > 0) {
            log.warn("'{}': {} malformed records dropped", fileName, summary.getParseWarnings());
        }

        return ImportResult.builder()
                .fileName(fileName)
                .format(detected.format())
                .sourceKind(detected.sourceKind())
                .transactions(transactions)
                .summary(summary)
                .build();
    }
}
