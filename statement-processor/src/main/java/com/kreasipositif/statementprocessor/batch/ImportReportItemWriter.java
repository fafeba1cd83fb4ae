package com.kreasipositif.statementprocessor.batch;

import com.kreasipositif.statementprocessor.domain.StatementFileReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamWriter;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.item.file.transform.BeanWrapperFieldExtractor;
import org.springframework.batch.item.file.transform.DelimitedLineAggregator;
import org.springframework.core.io.FileSystemResource;

import java.io.File;
import java.util.List;

/**
 * Writes {@link StatementFileReport} rows to two CSV files per partition:
 * <ul>
 *   <li><b>imported-{partition}-{timestamp}.csv</b>: files the engine could read, with their counts</li>
 *   <li><b>rejected-{partition}-{timestamp}.csv</b>: unrecognized or unreadable files, with the reason</li>
 * </ul>
 *
 * <p>Running counts go to the step execution context as a {@link ScreeningTally}.
 *
 * <p>Not a {@code @Component}; created as a {@code @StepScope} bean in
 * {@link com.kreasipositif.statementprocessor.config.BatchConfig} so that each partition
 * worker writes its own files.
 */
@Slf4j
public class ImportReportItemWriter implements ItemStreamWriter<StatementFileReport> {

    static final String[] IMPORTED_FIELDS = {
            "fileName", "format", "sourceKind", "total", "matched", "unmatched", "duplicates",
            "verified", "discrepancies", "newEntries", "parseWarnings", "incomeTotal", "expenseTotal"
    };

    static final String[] REJECTED_FIELDS = {
            "fileName", "status", "message"
    };

    private final String reportFilePath;
    private final int partitionIndex;

    private FlatFileItemWriter<StatementFileReport> importedWriter;
    private FlatFileItemWriter<StatementFileReport> rejectedWriter;

    private ScreeningTally tally = ScreeningTally.EMPTY;

    public ImportReportItemWriter(String reportFilePath, int partitionIndex) {
        this.reportFilePath = reportFilePath;
        this.partitionIndex = partitionIndex;
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        File outputDir = new File(reportFilePath).getParentFile();
        if (outputDir != null && !outputDir.exists() && !outputDir.mkdirs()) {
            throw new ItemStreamException("Cannot create report directory " + outputDir);
        }

        long ts = System.currentTimeMillis();
        String base = outputDir != null ? outputDir.getAbsolutePath() : System.getProperty("java.io.tmpdir");
        String suffix = "p" + partitionIndex + "-" + ts;

        importedWriter = buildWriter(base + "/imported-" + suffix + ".csv", IMPORTED_FIELDS, "importedWriter-" + suffix);
        rejectedWriter = buildWriter(base + "/rejected-" + suffix + ".csv", REJECTED_FIELDS, "rejectedWriter-" + suffix);

        importedWriter.open(executionContext);
        rejectedWriter.open(executionContext);
        tally = ScreeningTally.readFrom(executionContext);

        log.info("Partition {} report — imported-{}.csv | rejected-{}.csv", partitionIndex, suffix, suffix);
    }

    @Override
    public void write(Chunk<? extends StatementFileReport> chunk) throws Exception {
        List<StatementFileReport> imported = chunk.getItems().stream()
                .filter(StatementFileReport::isImported)
                .map(r -> (StatementFileReport) r).toList();
        List<StatementFileReport> rejected = chunk.getItems().stream()
                .filter(r -> !r.isImported())
                .map(r -> (StatementFileReport) r).toList();

        if (!imported.isEmpty()) {
            importedWriter.write(new Chunk<>(imported));
        }
        if (!rejected.isEmpty()) {
            rejectedWriter.write(new Chunk<>(rejected));
        }
        for (StatementFileReport report : chunk.getItems()) {
            tally = tally.add(report);
        }
    }

    @Override
    public void close() throws ItemStreamException {
        if (importedWriter != null) importedWriter.close();
        if (rejectedWriter != null) rejectedWriter.close();
        log.info("Partition {} done — {} files imported, {} rejected",
                partitionIndex, tally.imported(), tally.rejected());
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        if (importedWriter != null) importedWriter.update(executionContext);
        if (rejectedWriter != null) rejectedWriter.update(executionContext);
        tally.writeTo(executionContext);
    }

    private FlatFileItemWriter<StatementFileReport> buildWriter(String path, String[] fields, String name) {
        BeanWrapperFieldExtractor<StatementFileReport> extractor = new BeanWrapperFieldExtractor<>();
        extractor.setNames(fields);

        DelimitedLineAggregator<StatementFileReport> aggregator = new DelimitedLineAggregator<>();
        aggregator.setDelimiter(";");
        aggregator.setFieldExtractor(extractor);

        return new FlatFileItemWriterBuilder<StatementFileReport>()
                .name(name)
                .resource(new FileSystemResource(path))
                .encoding("UTF-8")
                .lineAggregator(aggregator)
                .headerCallback(writer -> writer.write(String.join(";", fields)))
                .append(false)
                .build();
    }
}
