package com.kreasipositif.statementprocessor.config;

import com.kreasipositif.statementprocessor.batch.FileRangePartitioner;
import com.kreasipositif.statementprocessor.batch.ImportReportItemWriter;
import com.kreasipositif.statementprocessor.batch.StatementFileItemProcessor;
import com.kreasipositif.statementprocessor.domain.StatementFileReport;
import com.kreasipositif.statementprocessor.service.ReferenceDataService;
import com.kreasipositif.statementprocessor.service.StatementImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.partition.PartitionHandler;
import org.springframework.batch.core.partition.support.TaskExecutorPartitionHandler;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.support.ListItemReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Spring Batch configuration for the statement screening job.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  Job ─► managerStep (partitioned)
 *              │
 *              ├── FileRangePartitioner  (splits matched statement files → N execution contexts)
 *              │
 *              └── PartitionHandler  (TaskExecutorPartitionHandler)
 *                      │
 *                      └── workerStep (chunk-oriented, one file per item)
 *                               │
 *                               ├── ListItemReader             (assigned file range)
 *                               ├── StatementFileItemProcessor (dry-run import per file)
 *                               └── ImportReportItemWriter     (imported / rejected CSV output)
 * </pre>
 *
 * <p>The job never writes to the ledger; it reports what an import of each file would produce.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final ResourcePatternResolver resourcePatternResolver;
    private final StatementImportService statementImportService;
    private final ReferenceDataService referenceDataService;

    @Value("${batch.chunk-size:10}")
    private int chunkSize;

    @Value("${batch.grid-size:4}")
    private int gridSize;

    @Value("${batch.output-file:${java.io.tmpdir}/statement-screening/report.csv}")
    private String outputFilePath;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job statementScreeningJob() {
        return new JobBuilder("statementScreeningJob", jobRepository)
                .start(managerStep())
                .build();
    }

    // ─── Async JobLauncher ────────────────────────────────────────────────────

    /**
     * An async {@link JobLauncher}: {@code jobLauncher.run(...)} returns immediately with
     * {@code BatchStatus.STARTING}. Callers poll {@code GET /api/v1/batch/status/{id}}.
     */
    @Bean("asyncJobLauncher")
    @Primary
    public JobLauncher asyncJobLauncher() throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(new SimpleAsyncTaskExecutor("job-launcher-"));
        launcher.afterPropertiesSet();
        return launcher;
    }

    // ─── Manager Step (partitioned) ──────────────────────────────────────────

    @Bean
    public Step managerStep() {
        return new StepBuilder("managerStep", jobRepository)
                .partitioner("workerStep", partitioner(null))   // resolved at runtime
                .partitionHandler(partitionHandler())
                .build();
    }

    /**
     * Creates a {@link FileRangePartitioner} sized to the number of files the
     * {@code inputPattern} job parameter matches.
     */
    @Bean
    @StepScope
    public FileRangePartitioner partitioner(
            @Value("#{jobParameters['inputPattern'] ?: '${batch.input-pattern}'}") String inputPattern) {
        List<Resource> files = resolveStatementFiles(inputPattern);
        log.info("Input pattern '{}' matched {} statement files — using gridSize={}",
                inputPattern, files.size(), gridSize);
        return new FileRangePartitioner(files.size());
    }

    // ─── Partition Handler ───────────────────────────────────────────────────

    @Bean
    public PartitionHandler partitionHandler() {
        TaskExecutorPartitionHandler handler = new TaskExecutorPartitionHandler();
        handler.setTaskExecutor(batchWorkerTaskExecutor());
        handler.setStep(workerStep());
        handler.setGridSize(gridSize);
        return handler;
    }

    /**
     * Bounded pool: each partition worker runs on its own platform thread.
     */
    @Bean
    public TaskExecutor batchWorkerTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("batch-worker-");
        executor.setCorePoolSize(gridSize);
        executor.setMaxPoolSize(gridSize);
        executor.initialize();
        return executor;
    }

    // ─── Worker Step (chunk-oriented) ────────────────────────────────────────

    @Bean
    public Step workerStep() {
        return new StepBuilder("workerStep", jobRepository)
                .<Resource, StatementFileReport>chunk(chunkSize, transactionManager)
                .reader(workerItemReader(null, 0, 0))   // placeholders, overridden by @StepScope
                .processor(workerItemProcessor())
                .writer(workerItemWriter(0))
                .build();
    }

    @Bean
    @StepScope
    public ListItemReader<Resource> workerItemReader(
            @Value("#{jobParameters['inputPattern'] ?: '${batch.input-pattern}'}") String inputPattern,
            @Value("#{stepExecutionContext['startIndex'] ?: 0}") int startIndex,
            @Value("#{stepExecutionContext['endIndex'] ?: -1}") int endIndex) {
        List<Resource> files = resolveStatementFiles(inputPattern);
        int from = Math.min(startIndex, files.size());
        int to = Math.min(endIndex + 1, files.size());
        log.debug("workerItemReader — pattern={}, files {}-{}", inputPattern, from, to - 1);
        return new ListItemReader<>(from < to ? files.subList(from, to) : List.of());
    }

    /**
     * Step-scoped so that each partition loads its own reference snapshot.
     */
    @Bean
    @StepScope
    public StatementFileItemProcessor workerItemProcessor() {
        return new StatementFileItemProcessor(statementImportService, referenceDataService);
    }

    /**
     * Step-scoped writer: each partition worker gets its own pair of report files.
     */
    @Bean
    @StepScope
    public ImportReportItemWriter workerItemWriter(
            @Value("#{stepExecutionContext['partition'] ?: 0}") int partition) {
        return new ImportReportItemWriter(outputFilePath, partition);
    }

    /**
     * Readable files matching the pattern, sorted by name so that every partition sees the same order.
     */
    List<Resource> resolveStatementFiles(String inputPattern) {
        if (inputPattern == null || inputPattern.isBlank()) {
            return List.of();
        }
        try {
            return Arrays.stream(resourcePatternResolver.getResources(inputPattern))
                    .filter(Resource::isReadable)
                    .sorted(Comparator.comparing(r -> String.valueOf(r.getFilename())))
                    .toList();
        } catch (IOException e) {
            log.error("Cannot resolve input pattern '{}': {}", inputPattern, e.getMessage());
            return List.of();
        }
    }
}
