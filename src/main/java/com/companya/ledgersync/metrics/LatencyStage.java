package com.companya.ledgersync.metrics;

public enum LatencyStage {
    SOURCE_TO_BUS("source-to-bus"),
    BUS_TO_CONSUMER("bus-to-consumer"),
    CONSUMER_PROCESSING("consumer-processing"),
    CONSUMER_TO_LEDGER("consumer-to-ledger"),
    /** Everything except the ledger call. */
    PIPELINE_TOTAL("pipeline-total"),
    END_TO_END("end-to-end");

    private final String tag;

    LatencyStage(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
