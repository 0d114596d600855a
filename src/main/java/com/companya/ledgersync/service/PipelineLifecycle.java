package com.companya.ledgersync.service;

import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.dispatch.BatchingDispatcher;
import com.companya.ledgersync.dispatch.ConcurrencyLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Graceful drain on shutdown. Stops before the listener containers: flushes the queue, stops the
 * listener, flushes what arrived meanwhile, then waits a bounded time for in-flight ledger calls.
 */
@Slf4j
@Component
public class PipelineLifecycle implements SmartLifecycle {

    private final BatchingDispatcher dispatcher;
    private final ConcurrencyLimiter limiter;
    private final KafkaListenerEndpointRegistry listenerRegistry;
    private final PipelineStatsReporter statsReporter;
    private final LedgerSyncProperties properties;
    private volatile boolean running;

    public PipelineLifecycle(BatchingDispatcher dispatcher,
                             ConcurrencyLimiter limiter,
                             KafkaListenerEndpointRegistry listenerRegistry,
                             PipelineStatsReporter statsReporter,
                             LedgerSyncProperties properties) {
        this.dispatcher = dispatcher;
        this.limiter = limiter;
        this.listenerRegistry = listenerRegistry;
        this.statsReporter = statsReporter;
        this.properties = properties;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        log.info("Shutting down pipeline, {} event(s) queued, {} call(s) in flight",
                dispatcher.getPendingCount(), limiter.getRunning());
        dispatcher.flush();

        MessageListenerContainer container =
                listenerRegistry.getListenerContainer(properties.getKafka().getListenerId());
        if (container != null && container.isRunning()) {
            container.stop();
            log.info("Change-stream listener stopped");
        }
        dispatcher.flush();

        Duration grace = Duration.ofMillis(properties.getPipeline().getShutdownGraceMs());
        try {
            if (!limiter.awaitIdle(grace)) {
                log.warn("{} ledger call(s) still in flight after {} ms, abandoning them",
                        limiter.getRunning() + limiter.getQueued(), grace.toMillis());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight ledger calls");
        }
        statsReporter.logFinalReport();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // highest phase stops first
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
