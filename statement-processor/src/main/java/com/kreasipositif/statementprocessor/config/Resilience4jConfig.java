package com.kreasipositif.statementprocessor.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j bulkheads around the ledger-service.
 *
 * <ul>
 *   <li><b>ledgerReadBulkhead</b> (semaphore): caps concurrent reference-data reads. Batch
 *       partitions each load a snapshot, and the cap keeps them from stampeding the ledger.</li>
 *   <li><b>ledgerWriteThreadPoolBulkhead</b> (fixed thread pool): runs the alias upserts and
 *       BIN backfills of a commit in parallel on a bounded pool, queueing the excess.</li>
 * </ul>
 *
 * <p>Values come from {@code application.yml} under {@code resilience4j.*}.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    // ── SemaphoreBulkhead: ledger reads ─────────────────────────────────────

    @Value("${resilience4j.bulkhead.instances.ledgerReadBulkhead.max-concurrent-calls:10}")
    private int readMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.ledgerReadBulkhead.max-wait-duration:2s}")
    private Duration readMaxWait;

    // ── FixedThreadPoolBulkhead: ledger writes ──────────────────────────────

    @Value("${resilience4j.thread-pool-bulkhead.instances.ledgerWriteThreadPoolBulkhead.max-thread-pool-size:8}")
    private int writeMaxPoolSize;

    @Value("${resilience4j.thread-pool-bulkhead.instances.ledgerWriteThreadPoolBulkhead.core-thread-pool-size:4}")
    private int writeCorePoolSize;

    @Value("${resilience4j.thread-pool-bulkhead.instances.ledgerWriteThreadPoolBulkhead.queue-capacity:200}")
    private int writeQueueCapacity;

    @Value("${resilience4j.thread-pool-bulkhead.instances.ledgerWriteThreadPoolBulkhead.keep-alive-duration:20ms}")
    private Duration writeKeepAlive;

    // ─── Beans ───────────────────────────────────────────────────────────────

    @Bean("ledgerReadBulkhead")
    public Bulkhead ledgerReadBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(readMaxConcurrent)
                .maxWaitDuration(readMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("ledgerReadBulkhead", cfg);
        log.info("SemaphoreBulkhead 'ledgerReadBulkhead' created — maxConcurrent={}, maxWait={}",
                readMaxConcurrent, readMaxWait);
        return bh;
    }

    @Bean("ledgerWriteThreadPoolBulkhead")
    public ThreadPoolBulkhead ledgerWriteThreadPoolBulkhead(ThreadPoolBulkheadRegistry registry) {
        ThreadPoolBulkheadConfig cfg = ThreadPoolBulkheadConfig.custom()
                .maxThreadPoolSize(writeMaxPoolSize)
                .coreThreadPoolSize(writeCorePoolSize)
                .queueCapacity(writeQueueCapacity)
                .keepAliveDuration(writeKeepAlive)
                .build();
        ThreadPoolBulkhead bh = registry.bulkhead("ledgerWriteThreadPoolBulkhead", cfg);
        log.info("ThreadPoolBulkhead 'ledgerWriteThreadPoolBulkhead' created — corePool={}, maxPool={}, queue={}",
                writeCorePoolSize, writeMaxPoolSize, writeQueueCapacity);
        return bh;
    }

    // ─── Registries ──────────────────────────────────────────────────────────

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }

    @Bean
    public ThreadPoolBulkheadRegistry threadPoolBulkheadRegistry() {
        return ThreadPoolBulkheadRegistry.ofDefaults();
    }
}
