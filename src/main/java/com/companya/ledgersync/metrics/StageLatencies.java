package com.companya.ledgersync.metrics;

/**
 * Per-stage latencies of one forwarded event, in milliseconds.
 */
public record StageLatencies(long sourceToBusMs, long busToConsumerMs, long processingMs, long ledgerMs) {

    /**
     * @param eventTimestampMs  when the change happened at the source
     * @param busTimestampMs    when the broker stored the message
     * @param receivedAtMs      when the consumer accepted the message
     * @param forwardStartMs    when the ledger call started
     * @param ledgerElapsedMs   duration of the ledger call
     */
    public static StageLatencies of(long eventTimestampMs, long busTimestampMs, long receivedAtMs,
                                    long forwardStartMs, long ledgerElapsedMs) {
        return new StageLatencies(
                Math.max(0, busTimestampMs - eventTimestampMs),
                receivedAtMs - busTimestampMs,
                forwardStartMs - receivedAtMs,
                ledgerElapsedMs);
    }

    public long pipelineTotalMs() {
        return sourceToBusMs + busToConsumerMs + processingMs;
    }

    public long endToEndMs() {
        return pipelineTotalMs() + ledgerMs;
    }
}
