package com.companya.ledgersync.kafka;

import java.time.Duration;
import java.util.Set;

/**
 * Checks that the change-stream broker is reachable.
 */
public interface UpstreamProbe {

    /**
     * @return names of the topics visible to this service
     * @throws UpstreamUnavailableException when the broker does not answer within the timeout
     */
    Set<String> listTopics(Duration timeout);
}
