package com.kreasipositif.statementprocessor.batch;

import com.kreasipositif.statementprocessor.domain.StatementFileReport;
import com.kreasipositif.statementprocessor.parser.UnsupportedStatementFormatException;
import com.kreasipositif.statementprocessor.service.ImportContext;
import com.kreasipositif.statementprocessor.service.ReferenceDataService;
import com.kreasipositif.statementprocessor.service.StatementImportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Dry-runs the import of one statement file and reports the outcome.
 *
 * <p>Created as a {@code @StepScope} bean in
 * {@link com.kreasipositif.statementprocessor.config.BatchConfig}: each partition worker loads
 * one reference snapshot from the ledger-service on its first file and screens all of its files
 * against it. Nothing is committed.
 *
 * <p>Files that no grammar can read become {@code UNRECOGNIZED} rows, unreadable files
 * {@code UNREADABLE} rows; neither fails the step.
 */
@Slf4j
public class StatementFileItemProcessor implements ItemProcessor<Resource, StatementFileReport> {

    private final StatementImportService importService;
    private final ReferenceDataService referenceDataService;

    private ImportContext context;

    public StatementFileItemProcessor(StatementImportService importService,
                                      ReferenceDataService referenceDataService) {
        this.importService = importService;
        this.referenceDataService = referenceDataService;
    }

    @Override
    public StatementFileReport process(Resource file) {
        String fileName = file.getFilename() != null ? file.getFilename() : file.getDescription();
        byte[] content;
        try (InputStream in = file.getInputStream()) {
            content = in.readAllBytes();
        } catch (IOException e) {
            log.warn("Cannot read statement file '{}': {}", fileName, e.getMessage());
            return StatementFileReport.rejected(fileName, StatementFileReport.UNREADABLE, e.getMessage());
        }

        try {
            StatementFileReport report = StatementFileReport.of(
                    importService.importStatement(fileName, content, context()));
            log.debug("File '{}' screened — {} rows, {} matched", fileName, report.getTotal(), report.getMatched());
            return report;
        } catch (UnsupportedStatementFormatException e) {
            log.warn("File '{}' not recognized: {}", fileName, e.getMessage());
            return StatementFileReport.rejected(fileName, StatementFileReport.UNRECOGNIZED, e.getMessage());
        }
    }

    private ImportContext context() {
        if (context == null) {
            context = referenceDataService.loadContext();
        }
        return context;
    }
}
