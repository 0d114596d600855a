package com.companya.ledgersync.dispatch;

public enum FlushTrigger {
    /** The queue reached the batch size. */
    SIZE,
    /** No enqueue happened for the idle timeout. */
    IDLE,
    /** Final flush while stopping. */
    SHUTDOWN
}
