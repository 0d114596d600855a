package com.companya.ledgersync.kafka;

/**
 * Ends the process so that a supervisor can restart it.
 */
@FunctionalInterface
public interface ProcessTerminator {

    void terminate(int exitCode);
}
