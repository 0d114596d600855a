package com.companya.ledgersync.kafka;

import org.springframework.boot.ExitCodeGenerator;

/**
 * The change-stream broker cannot be reached. Failing startup with it exits the process with code 1.
 */
public class UpstreamUnavailableException extends RuntimeException implements ExitCodeGenerator {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return UpstreamConnectionSupervisor.EXIT_CODE;
    }
}
