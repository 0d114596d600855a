package com.companya.ledgersync.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects accepted events into micro-batches. A batch is flushed when the queue reaches the batch
 * size, or when the idle timer, restarted on every enqueue, fires first. Flushing never waits for
 * earlier batches; in-flight work is bounded only by the limiter behind the forwarder.
 */
@Slf4j
public class BatchingDispatcher {

    private final int batchSize;
    private final Duration idleTimeout;
    private final TaskScheduler scheduler;
    private final LedgerForwarder forwarder;
    private final Clock clock;

    private final List<ForwardingRequest> queue = new ArrayList<>();
    private ScheduledFuture<?> idleTimer;
    private long timerGeneration;

    private final AtomicLong batchSequence = new AtomicLong();
    private final Map<FlushTrigger, AtomicLong> flushes = new EnumMap<>(FlushTrigger.class);

    public BatchingDispatcher(int batchSize, Duration idleTimeout, TaskScheduler scheduler,
                              LedgerForwarder forwarder, Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        this.batchSize = batchSize;
        this.idleTimeout = idleTimeout;
        this.scheduler = scheduler;
        this.forwarder = forwarder;
        this.clock = clock;
        for (FlushTrigger trigger : FlushTrigger.values()) {
            flushes.put(trigger, new AtomicLong());
        }
    }

    public void enqueue(ForwardingRequest request) {
        List<ForwardingRequest> ready = null;
        synchronized (this) {
            queue.add(request);
            cancelIdleTimer();
            if (queue.size() >= batchSize) {
                ready = drainQueue();
            } else {
                long generation = timerGeneration;
                idleTimer = scheduler.schedule(() -> onIdle(generation), clock.instant().plus(idleTimeout));
            }
        }
        if (ready != null) {
            dispatch(ready, FlushTrigger.SIZE);
        }
    }

    private void onIdle(long generation) {
        List<ForwardingRequest> ready;
        synchronized (this) {
            // a later enqueue or flush already replaced this timer
            if (generation != timerGeneration || queue.isEmpty()) {
                return;
            }
            idleTimer = null;
            ready = drainQueue();
        }
        dispatch(ready, FlushTrigger.IDLE);
    }

    /**
     * Dispatches whatever is queued.
     *
     * @return completes when every request of the flushed batch has a result
     */
    public CompletableFuture<Void> flush() {
        List<ForwardingRequest> ready;
        synchronized (this) {
            cancelIdleTimer();
            if (queue.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            ready = drainQueue();
        }
        return dispatch(ready, FlushTrigger.SHUTDOWN).thenApply(batch -> null);
    }

    private void cancelIdleTimer() {
        timerGeneration++;
        if (idleTimer != null) {
            idleTimer.cancel(false);
            idleTimer = null;
        }
    }

    private List<ForwardingRequest> drainQueue() {
        List<ForwardingRequest> drained = new ArrayList<>(queue);
        queue.clear();
        return drained;
    }

    private CompletableFuture<Batch> dispatch(List<ForwardingRequest> requests, FlushTrigger trigger) {
        Batch batch = new Batch(batchSequence.incrementAndGet(), requests, trigger, clock.instant());
        flushes.get(trigger).incrementAndGet();
        log.debug("Dispatching batch #{} with {} event(s) ({})", batch.sequence(), batch.size(), trigger);

        List<CompletableFuture<ForwardingResult>> results = new ArrayList<>(batch.size());
        for (ForwardingRequest request : batch.requests()) {
            results.add(forwarder.forward(request));
        }
        return CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    long ok = results.stream().filter(f -> f.join().success()).count();
                    long failed = batch.size() - ok;
                    if (failed > 0) {
                        log.warn("Batch #{} completed: {} ok, {} failed", batch.sequence(), ok, failed);
                    } else {
                        log.info("Batch #{} completed: {} ok", batch.sequence(), ok);
                    }
                    return batch;
                });
    }

    public synchronized int getPendingCount() {
        return queue.size();
    }

    public long getBatchCount() {
        return batchSequence.get();
    }

    public long getFlushCount(FlushTrigger trigger) {
        return flushes.get(trigger).get();
    }
}
