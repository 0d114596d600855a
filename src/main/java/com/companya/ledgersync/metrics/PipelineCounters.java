package com.companya.ledgersync.metrics;

import com.companya.ledgersync.model.PipelineOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide event counters, mirrored to Micrometer as {@code ledgersync.events{outcome}} and
 * {@code ledgersync.forward{result}}.
 */
@Component
public class PipelineCounters {

    private static final Logger logger = LoggerFactory.getLogger(PipelineCounters.class);

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong received = new AtomicLong();
    private final Map<PipelineOutcome, AtomicLong> outcomes = new EnumMap<>(PipelineOutcome.class);
    private final Map<PipelineOutcome, Counter> outcomeCounters = new EnumMap<>(PipelineOutcome.class);
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong forwardFailures = new AtomicLong();
    private final AtomicLong forwardTimeouts = new AtomicLong();
    private final Counter receivedCounter;
    private final Counter forwardedCounter;
    private final Counter failedCounter;
    private final Counter timeoutCounter;

    public PipelineCounters(MeterRegistry meterRegistry, Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        for (PipelineOutcome outcome : PipelineOutcome.values()) {
            outcomes.put(outcome, new AtomicLong());
            outcomeCounters.put(outcome, Counter.builder("ledgersync.events")
                    .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        this.receivedCounter = meterRegistry.counter("ledgersync.events.received");
        this.forwardedCounter = meterRegistry.counter("ledgersync.forward", "result", "success");
        this.failedCounter = meterRegistry.counter("ledgersync.forward", "result", "failure");
        this.timeoutCounter = meterRegistry.counter("ledgersync.forward", "result", "timeout");
    }

    public void recordReceived() {
        received.incrementAndGet();
        receivedCounter.increment();
    }

    public void recordOutcome(PipelineOutcome outcome) {
        outcomes.get(outcome).incrementAndGet();
        outcomeCounters.get(outcome).increment();
    }

    public void recordForwardSuccess() {
        forwarded.incrementAndGet();
        forwardedCounter.increment();
    }

    public void recordForwardFailure(boolean timedOut) {
        forwardFailures.incrementAndGet();
        if (timedOut) {
            forwardTimeouts.incrementAndGet();
            timeoutCounter.increment();
        } else {
            failedCounter.increment();
        }
        logger.debug("Recorded forwarding failure - Total: {}", forwardFailures.get());
    }

    public long getReceived() {
        return received.get();
    }

    public long getOutcomeCount(PipelineOutcome outcome) {
        return outcomes.get(outcome).get();
    }

    public long getSkipped() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getKey().isSkip())
                .mapToLong(e -> e.getValue().get())
                .sum();
    }

    public long getForwarded() {
        return forwarded.get();
    }

    public long getForwardFailures() {
        return forwardFailures.get();
    }

    public long getForwardTimeouts() {
        return forwardTimeouts.get();
    }

    /** Pipeline failures plus forwarding failures. */
    public long getErrors() {
        return outcomes.get(PipelineOutcome.FAILED).get() + forwardFailures.get();
    }

    /**
     * Share of forwarding attempts that succeeded, in percent. 100 before the first attempt.
     */
    public double getSuccessRate() {
        long attempts = forwarded.get() + forwardFailures.get();
        return attempts == 0 ? 100.0 : forwarded.get() * 100.0 / attempts;
    }

    /** Received messages per second since startup. */
    public double getReceiveRate() {
        long seconds = Math.max(1, Duration.between(startedAt, clock.instant()).toSeconds());
        return (double) received.get() / seconds;
    }

    public Duration getUptime() {
        return Duration.between(startedAt, clock.instant());
    }
}
