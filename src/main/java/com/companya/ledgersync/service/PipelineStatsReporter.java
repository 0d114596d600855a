package com.companya.ledgersync.service;

import com.companya.ledgersync.dedup.DeduplicationWindow;
import com.companya.ledgersync.dispatch.BatchingDispatcher;
import com.companya.ledgersync.dispatch.ConcurrencyLimiter;
import com.companya.ledgersync.metrics.LatencyMonitor;
import com.companya.ledgersync.metrics.LatencyMonitor.StageSummary;
import com.companya.ledgersync.metrics.LatencyStage;
import com.companya.ledgersync.metrics.PipelineCounters;
import com.companya.ledgersync.model.PipelineOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Periodic operator summary of counters and latencies.
 */
@Service
public class PipelineStatsReporter {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStatsReporter.class);

    private final PipelineCounters counters;
    private final LatencyMonitor latencyMonitor;
    private final ConcurrencyLimiter limiter;
    private final BatchingDispatcher dispatcher;
    private final DeduplicationWindow deduplicationWindow;

    public PipelineStatsReporter(PipelineCounters counters,
                                 LatencyMonitor latencyMonitor,
                                 ConcurrencyLimiter limiter,
                                 BatchingDispatcher dispatcher,
                                 DeduplicationWindow deduplicationWindow) {
        this.counters = counters;
        this.latencyMonitor = latencyMonitor;
        this.limiter = limiter;
        this.dispatcher = dispatcher;
        this.deduplicationWindow = deduplicationWindow;
    }

    @Scheduled(fixedRateString = "${ledgersync.pipeline.stats-interval-ms:60000}",
            initialDelayString = "${ledgersync.pipeline.stats-interval-ms:60000}")
    public void logStatistics() {
        if (counters.getReceived() == 0) {
            logger.debug("No change events received yet");
            return;
        }
        report("PIPELINE STATISTICS");
    }

    public void logFinalReport() {
        report("FINAL PIPELINE REPORT");
    }

    private void report(String title) {
        logger.info("=== {} (uptime {}s) ===", title, counters.getUptime().toSeconds());
        logger.info("Events - Received: {}, Enqueued: {}, Skipped: {}, Errors: {}, Rate: {}/s",
                counters.getReceived(),
                counters.getOutcomeCount(PipelineOutcome.ENQUEUED),
                counters.getSkipped(),
                counters.getErrors(),
                String.format(Locale.ROOT, "%.2f", counters.getReceiveRate()));
        logger.info("Skips - Duplicates: {}, Deletes: {}, Unknown stream: {}, Malformed: {}, Missing identity: {}, Tombstones: {}",
                counters.getOutcomeCount(PipelineOutcome.DUPLICATE),
                counters.getOutcomeCount(PipelineOutcome.DELETE_SKIPPED),
                counters.getOutcomeCount(PipelineOutcome.UNKNOWN_STREAM),
                counters.getOutcomeCount(PipelineOutcome.MALFORMED),
                counters.getOutcomeCount(PipelineOutcome.MISSING_IDENTITY),
                counters.getOutcomeCount(PipelineOutcome.TOMBSTONE));
        logger.info("Ledger - Forwarded: {}, Failed: {} (timeouts {}), Success rate: {}%",
                counters.getForwarded(),
                counters.getForwardFailures(),
                counters.getForwardTimeouts(),
                String.format(Locale.ROOT, "%.1f", counters.getSuccessRate()));
        logger.info("Dispatch - Queued: {}, Batches: {}, Running: {}/{}, Waiting: {}, Peak: {}, Dedup entries: {}",
                dispatcher.getPendingCount(),
                dispatcher.getBatchCount(),
                limiter.getRunning(),
                limiter.getMaxConcurrent(),
                limiter.getQueued(),
                limiter.getPeakRunning(),
                deduplicationWindow.size());
        for (LatencyStage stage : LatencyStage.values()) {
            StageSummary summary = latencyMonitor.summary(stage);
            if (summary.count() > 0) {
                logger.info("Latency {} - avg {} ms, min {} ms, max {} ms ({} samples)",
                        stage.tag(),
                        String.format(Locale.ROOT, "%.1f", summary.averageMs()),
                        summary.minMs(), summary.maxMs(), summary.count());
            }
        }
        logger.info("==============================");

        if (counters.getSuccessRate() < 90.0) {
            logger.warn("HIGH ALERT: ledger success rate {}% - check the ledger API",
                    String.format(Locale.ROOT, "%.1f", counters.getSuccessRate()));
        }
    }
}
