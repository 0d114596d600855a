package com.companya.ledgersync.dispatch;

import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.integration.LedgerClient;
import com.companya.ledgersync.integration.LedgerResponse;
import com.companya.ledgersync.metrics.LatencyMonitor;
import com.companya.ledgersync.metrics.PipelineCounters;
import com.companya.ledgersync.metrics.StageLatencies;
import com.companya.ledgersync.model.ReductionStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one ledger write per request under the {@link ConcurrencyLimiter}, with a per-operation
 * deadline. A timed-out call frees its slot at the deadline. Failures are counted, never retried here.
 */
@Slf4j
@Component
public class LedgerForwarder {

    private final LedgerClient ledgerClient;
    private final ConcurrencyLimiter limiter;
    private final Executor ledgerExecutor;
    private final LedgerSyncProperties properties;
    private final PipelineCounters counters;
    private final LatencyMonitor latencyMonitor;
    private final Clock clock;

    public LedgerForwarder(LedgerClient ledgerClient,
                           ConcurrencyLimiter limiter,
                           @Qualifier("ledgerExecutor") Executor ledgerExecutor,
                           LedgerSyncProperties properties,
                           PipelineCounters counters,
                           LatencyMonitor latencyMonitor,
                           Clock clock) {
        this.ledgerClient = ledgerClient;
        this.limiter = limiter;
        this.ledgerExecutor = ledgerExecutor;
        this.properties = properties;
        this.counters = counters;
        this.latencyMonitor = latencyMonitor;
        this.clock = clock;
    }

    /**
     * @return a future that always completes normally with the outcome of the call
     */
    public CompletableFuture<ForwardingResult> forward(ForwardingRequest request) {
        long timeoutMs = properties.getLedger().timeoutFor(request.operation());
        AtomicLong startedAt = new AtomicLong(-1);
        return limiter.<LedgerResponse>execute(() -> {
                    startedAt.set(clock.millis());
                    return CompletableFuture
                            .supplyAsync(() -> ledgerClient.submit(request.url(), request.payload().body()), ledgerExecutor)
                            .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
                })
                .handle((response, error) -> complete(request, startedAt.get(), timeoutMs, response, error));
    }

    private ForwardingResult complete(ForwardingRequest request, long startedAt, long timeoutMs,
                                      LedgerResponse response, Throwable error) {
        long now = clock.millis();
        long start = startedAt >= 0 ? startedAt : now;
        Throwable cause = error != null ? unwrap(error) : null;
        boolean timedOut = cause instanceof TimeoutException;
        // the deadline timer and the millisecond clock can disagree by a tick
        long elapsed = timedOut ? Math.max(now - start, timeoutMs) : now - start;
        latencyMonitor.record(StageLatencies.of(
                request.eventTimestampMs(),
                request.busTimestampMs(),
                request.receivedAt().toEpochMilli(),
                start,
                elapsed));

        if (error == null) {
            counters.recordForwardSuccess();
            ReductionStats stats = request.payload().stats();
            log.info("Forwarded {} {} recordId={} to {} in {} ms (block={}, tx={}, size {} -> {}, -{}%)",
                    request.operation(), request.tableName(), request.record().recordId(), request.url(), elapsed,
                    response.blockNumber(), response.transactionHash(),
                    stats.originalSize(), stats.filteredSize(), stats.reductionPercent());
            return new ForwardingResult(request, true, elapsed, false, response, null);
        }

        counters.recordForwardFailure(timedOut);
        if (timedOut) {
            log.error("Ledger call for {} recordId={} timed out after {} ms (limit {} ms)",
                    request.tableName(), request.record().recordId(), elapsed, timeoutMs);
        } else {
            log.error("Failed to forward {} recordId={} to {}: {}",
                    request.tableName(), request.record().recordId(), request.url(), cause.getMessage());
        }
        return new ForwardingResult(request, false, elapsed, timedOut, null, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
