package com.companya.ledgersync.dispatch;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Bounds the number of asynchronous tasks in flight. Tasks beyond the limit wait in a FIFO queue and
 * start strictly in submission order; they may complete in any order.
 * <p>
 * A task's slot is released before its returned future completes, so callbacks on that future
 * already observe the freed slot.
 */
public class ConcurrencyLimiter {

    private final int maxConcurrent;
    private final Deque<PendingTask<?>> queue = new ArrayDeque<>();
    private int running;
    private int peakRunning;
    private boolean draining;

    public ConcurrencyLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Starts the task now if a slot is free, otherwise queues it. A supplier that throws, errors
     * included, counts as a failed task.
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> task) {
        PendingTask<T> pending = new PendingTask<>(task, new CompletableFuture<>());
        synchronized (this) {
            queue.addLast(pending);
        }
        drain();
        return pending.result();
    }

    private void drain() {
        while (true) {
            PendingTask<?> next;
            synchronized (this) {
                if (draining || running >= maxConcurrent || queue.isEmpty()) {
                    return;
                }
                draining = true;
                next = queue.pollFirst();
                running++;
                peakRunning = Math.max(peakRunning, running);
            }
            try {
                start(next);
            } finally {
                synchronized (this) {
                    draining = false;
                }
            }
        }
    }

    private <T> void start(PendingTask<T> pending) {
        CompletionStage<T> stage;
        try {
            stage = pending.task().get();
        } catch (Throwable ex) {
            stage = CompletableFuture.failedFuture(ex);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(new IllegalStateException("task returned no completion stage"));
        }
        stage.whenComplete((value, error) -> {
            release();
            if (error != null) {
                pending.result().completeExceptionally(error);
            } else {
                pending.result().complete(value);
            }
        });
    }

    private void release() {
        synchronized (this) {
            running--;
            notifyAll();
        }
        drain();
    }

    public synchronized int getRunning() {
        return running;
    }

    public synchronized int getQueued() {
        return queue.size();
    }

    public synchronized int getPeakRunning() {
        return peakRunning;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Waits until nothing is running or queued.
     *
     * @return {@code true} if idle, {@code false} if the timeout elapsed first
     */
    public synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (running > 0 || !queue.isEmpty()) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    private record PendingTask<T>(Supplier<? extends CompletionStage<T>> task, CompletableFuture<T> result) {
    }
}
