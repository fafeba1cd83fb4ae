package com.kreasipositif.statementprocessor.controller;

import com.kreasipositif.statementprocessor.batch.ScreeningTally;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.explore.JobExplorer;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Starts the statement screening job and reports, per partition and in total, how many files
 * were imported, unrecognized or unreadable. Screening never commits to the ledger.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/batch")
@Tag(name = "Statement screening", description = "Dry-run a folder of statement files and report the outcome per file")
public class JobController {

    private static final String WORKER_STEP_PREFIX = "workerStep:";

    private final JobLauncher asyncJobLauncher;
    private final Job statementScreeningJob;
    private final JobExplorer jobExplorer;

    @Value("${batch.input-pattern}")
    private String defaultInputPattern;

    public JobController(@Qualifier("asyncJobLauncher") JobLauncher asyncJobLauncher,
                         Job statementScreeningJob,
                         JobExplorer jobExplorer) {
        this.asyncJobLauncher = asyncJobLauncher;
        this.statementScreeningJob = statementScreeningJob;
        this.jobExplorer = jobExplorer;
    }

    @PostMapping("/start")
    @Operation(
            summary = "Screen the statement files matching a pattern",
            description = "Runs in the background. Poll `GET /api/v1/batch/status/{jobExecutionId}` for the outcome.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Screening started",
                            content = @Content(schema = @Schema(implementation = ScreeningStarted.class))),
                    @ApiResponse(responseCode = "500", description = "The job could not be launched")
            })
    public ResponseEntity<?> startJob(
            @Parameter(description = "Spring resource pattern; blank uses `batch.input-pattern`",
                    example = "file:/data/statements/*")
            @RequestParam(value = "inputPattern", required = false) String inputPattern) {

        String pattern = inputPattern == null || inputPattern.isBlank() ? defaultInputPattern : inputPattern;
        JobParameters params = new JobParametersBuilder()
                .addString("inputPattern", pattern)
                .addLong("startedAt", Instant.now().toEpochMilli())
                .toJobParameters();
        try {
            JobExecution execution = asyncJobLauncher.run(statementScreeningJob, params);
            log.info("Screening {} started for '{}'", execution.getId(), pattern);
            return ResponseEntity.accepted()
                    .body(new ScreeningStarted(execution.getId(), execution.getStatus().name(), pattern));
        } catch (Exception e) {
            log.error("Screening of '{}' could not start: {}", pattern, e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to start job: " + e.getMessage()));
        }
    }

    @GetMapping("/status/{jobExecutionId}")
    @Operation(
            summary = "Screening progress and file outcomes",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Execution found",
                            content = @Content(schema = @Schema(implementation = ScreeningStatus.class))),
                    @ApiResponse(responseCode = "404", description = "Unknown execution id")
            })
    public ResponseEntity<ScreeningStatus> getStatus(@PathVariable("jobExecutionId") Long jobExecutionId) {
        JobExecution execution = jobExplorer.getJobExecution(jobExecutionId);
        if (execution == null) {
            return ResponseEntity.notFound().build();
        }

        List<PartitionStatus> partitions = execution.getStepExecutions().stream()
                .filter(step -> step.getStepName().startsWith(WORKER_STEP_PREFIX))
                .sorted(Comparator.comparing(StepExecution::getStepName))
                .map(JobController::partitionStatus)
                .toList();
        ScreeningTally total = partitions.stream()
                .map(PartitionStatus::files)
                .reduce(ScreeningTally.EMPTY, ScreeningTally::plus);

        return ResponseEntity.ok(new ScreeningStatus(
                jobExecutionId,
                execution.getStatus().name(),
                execution.getExitStatus().getExitCode(),
                text(execution.getStartTime()),
                text(execution.getEndTime()),
                total,
                partitions));
    }

    private static PartitionStatus partitionStatus(StepExecution step) {
        return new PartitionStatus(
                step.getStepName().substring(WORKER_STEP_PREFIX.length()),
                step.getStatus().name(),
                step.getReadCount(),
                ScreeningTally.readFrom(step.getExecutionContext()));
    }

    private static String text(LocalDateTime time) {
        return time != null ? time.toString() : null;
    }

    public record ScreeningStarted(Long jobExecutionId, String status, String inputPattern) {}

    /**
     * @param files      file outcomes and row counts summed over all partitions
     * @param partitions one entry per worker partition, sorted by name
     */
    public record ScreeningStatus(Long jobExecutionId,
                                  String status,
                                  String exitCode,
                                  String startTime,
                                  String endTime,
                                  ScreeningTally files,
                                  List<PartitionStatus> partitions) {}

    /**
     * @param filesRead files the partition has picked up so far
     */
    public record PartitionStatus(String partition, String status, long filesRead, ScreeningTally files) {}
}
