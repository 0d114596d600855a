package com.companya.ledgersync.config;

import com.companya.ledgersync.dedup.DeduplicationWindow;
import com.companya.ledgersync.dispatch.BatchingDispatcher;
import com.companya.ledgersync.dispatch.ConcurrencyLimiter;
import com.companya.ledgersync.dispatch.LedgerForwarder;
import com.companya.ledgersync.kafka.ProcessTerminator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeduplicationWindow deduplicationWindow(LedgerSyncProperties properties, Clock clock) {
        LedgerSyncProperties.Pipeline pipeline = properties.getPipeline();
        return new DeduplicationWindow(clock,
                Duration.ofMillis(pipeline.getDedupWindowMs()),
                Duration.ofMillis(pipeline.getDedupToleranceMs()));
    }

    @Bean
    public ConcurrencyLimiter concurrencyLimiter(LedgerSyncProperties properties) {
        return new ConcurrencyLimiter(properties.getPipeline().getMaxConcurrent());
    }

    /**
     * Runs the ledger calls. Slots of timed-out calls are released before their HTTP request ends,
     * so the pool allows more threads than concurrent slots; beyond that, calls are rejected.
     */
    @Bean
    @Qualifier("ledgerExecutor")
    public ThreadPoolTaskExecutor ledgerExecutor(LedgerSyncProperties properties) {
        int maxConcurrent = properties.getPipeline().getMaxConcurrent();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrent);
        executor.setMaxPoolSize(maxConcurrent * 4);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("ledger-call-");
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("ledger-sync-sched-");
        return scheduler;
    }

    @Bean
    public BatchingDispatcher batchingDispatcher(LedgerSyncProperties properties,
                                                 ThreadPoolTaskScheduler taskScheduler,
                                                 LedgerForwarder forwarder,
                                                 Clock clock) {
        LedgerSyncProperties.Pipeline pipeline = properties.getPipeline();
        logger.info("Batching {} event(s) or {} ms idle, at most {} concurrent ledger call(s)",
                pipeline.getBatchSize(), pipeline.getBatchIdleTimeoutMs(), pipeline.getMaxConcurrent());
        return new BatchingDispatcher(pipeline.getBatchSize(),
                Duration.ofMillis(pipeline.getBatchIdleTimeoutMs()),
                taskScheduler, forwarder, clock);
    }

    @Bean
    public ProcessTerminator processTerminator(ConfigurableApplicationContext context) {
        return exitCode -> new Thread(
                () -> System.exit(SpringApplication.exit(context, () -> exitCode)),
                "ledger-sync-exit").start();
    }
}
