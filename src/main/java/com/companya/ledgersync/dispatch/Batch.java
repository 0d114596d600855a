package com.companya.ledgersync.dispatch;

import java.time.Instant;
import java.util.List;

/**
 * Requests sliced out of the queue by one flush. Every request is submitted, each independently.
 */
public record Batch(long sequence, List<ForwardingRequest> requests, FlushTrigger trigger, Instant createdAt) {

    public Batch {
        requests = List.copyOf(requests);
    }

    public int size() {
        return requests.size();
    }
}
