package com.companya.ledgersync.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running latency aggregates per pipeline stage. Observability only; nothing in the pipeline reads
 * these values to make decisions.
 */
@Component
public class LatencyMonitor {

    private final Map<LatencyStage, StageStats> stats = new EnumMap<>(LatencyStage.class);
    private final Map<LatencyStage, Timer> timers = new EnumMap<>(LatencyStage.class);

    public LatencyMonitor(MeterRegistry meterRegistry) {
        for (LatencyStage stage : LatencyStage.values()) {
            stats.put(stage, new StageStats());
            timers.put(stage, Timer.builder("ledgersync.latency")
                    .description("Latency of one pipeline stage")
                    .tag("stage", stage.tag())
                    .register(meterRegistry));
        }
    }

    public void record(StageLatencies latencies) {
        record(LatencyStage.SOURCE_TO_BUS, latencies.sourceToBusMs());
        record(LatencyStage.BUS_TO_CONSUMER, latencies.busToConsumerMs());
        record(LatencyStage.CONSUMER_PROCESSING, latencies.processingMs());
        record(LatencyStage.CONSUMER_TO_LEDGER, latencies.ledgerMs());
        record(LatencyStage.PIPELINE_TOTAL, latencies.pipelineTotalMs());
        record(LatencyStage.END_TO_END, latencies.endToEndMs());
    }

    private void record(LatencyStage stage, long millis) {
        stats.get(stage).add(millis);
        // negative samples come from clock skew between hosts
        timers.get(stage).record(Duration.ofMillis(Math.max(0, millis)));
    }

    public StageSummary summary(LatencyStage stage) {
        return stats.get(stage).summary();
    }

    public Map<LatencyStage, StageSummary> summaries() {
        Map<LatencyStage, StageSummary> result = new EnumMap<>(LatencyStage.class);
        stats.forEach((stage, stageStats) -> result.put(stage, stageStats.summary()));
        return result;
    }

    public void reset() {
        stats.values().forEach(StageStats::reset);
    }

    /**
     * @param count   number of samples
     * @param averageMs mean, 0 without samples
     * @param minMs   smallest sample, 0 without samples
     * @param maxMs   largest sample, 0 without samples
     */
    public record StageSummary(long count, double averageMs, long minMs, long maxMs) {
    }

    private static final class StageStats {
        private long sum;
        private long count;
        private long min = Long.MAX_VALUE;
        private long max = Long.MIN_VALUE;

        synchronized void add(long value) {
            sum += value;
            count++;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        synchronized StageSummary summary() {
            if (count == 0) {
                return new StageSummary(0, 0, 0, 0);
            }
            return new StageSummary(count, (double) sum / count, min, max);
        }

        synchronized void reset() {
            sum = 0;
            count = 0;
            min = Long.MAX_VALUE;
            max = Long.MIN_VALUE;
        }
    }
}
