package com.companya.ledgersync.model;

/**
 * What the pipeline did with one inbound message.
 */
public enum PipelineOutcome {
    ENQUEUED,
    /** Null-valued message, emitted by the connector after a delete. */
    TOMBSTONE,
    MALFORMED,
    UNKNOWN_STREAM,
    MISSING_IDENTITY,
    DELETE_SKIPPED,
    DUPLICATE,
    FAILED;

    public boolean isSkip() {
        return this != ENQUEUED && this != FAILED;
    }
}
