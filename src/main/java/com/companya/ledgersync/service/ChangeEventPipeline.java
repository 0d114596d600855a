package com.companya.ledgersync.service;

import com.companya.ledgersync.adapter.SourceAdapter;
import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.config.LedgerSyncProperties.Table;
import com.companya.ledgersync.dedup.DeduplicationWindow;
import com.companya.ledgersync.dispatch.BatchingDispatcher;
import com.companya.ledgersync.dispatch.ForwardingRequest;
import com.companya.ledgersync.kafka.ChangeEnvelopeReader;
import com.companya.ledgersync.kafka.MalformedEnvelopeException;
import com.companya.ledgersync.metrics.PipelineCounters;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.ForwardingPayload;
import com.companya.ledgersync.model.NormalizedRecord;
import com.companya.ledgersync.model.Operation;
import com.companya.ledgersync.model.PipelineOutcome;
import com.companya.ledgersync.registry.AppRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Takes one message from the change stream to the dispatcher queue: resolve, normalize, filter
 * deletes and duplicates, build the ledger payload, enqueue. Runs synchronously on the consumer
 * thread and never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeEventPipeline {

    private final ChangeEnvelopeReader reader;
    private final AppRegistry appRegistry;
    private final DeduplicationWindow deduplicationWindow;
    private final BatchingDispatcher dispatcher;
    private final PipelineCounters counters;
    private final LedgerSyncProperties properties;
    private final Clock clock;

    public PipelineOutcome process(String topic, String value, long busTimestampMs) {
        counters.recordReceived();
        PipelineOutcome outcome;
        try {
            outcome = handle(topic, value, busTimestampMs);
        } catch (RuntimeException ex) {
            log.error("Failed to process message from {}: {}", topic, ex.getMessage(), ex);
            outcome = PipelineOutcome.FAILED;
        }
        counters.recordOutcome(outcome);
        return outcome;
    }

    private PipelineOutcome handle(String topic, String value, long busTimestampMs) {
        Instant receivedAt = clock.instant();
        if (value == null) {
            log.debug("Tombstone on {}, skipping", topic);
            return PipelineOutcome.TOMBSTONE;
        }

        ChangeEnvelope envelope;
        try {
            envelope = reader.read(topic, value, busTimestampMs, receivedAt);
        } catch (MalformedEnvelopeException ex) {
            log.warn("Skipping malformed message on {}: {}", topic, ex.getMessage());
            return PipelineOutcome.MALFORMED;
        }

        Optional<AppRegistry.Resolution> resolved = appRegistry.resolve(topic);
        if (resolved.isEmpty()) {
            log.warn("No configuration for topic {}, skipping", topic);
            return PipelineOutcome.UNKNOWN_STREAM;
        }
        App app = resolved.get().app();
        Table table = resolved.get().table();
        SourceAdapter adapter = resolved.get().adapter();

        JsonNode data = adapter.rowImage(envelope);
        if (data == null || !data.isObject()) {
            log.warn("Message on {} carries no row image, skipping", topic);
            return PipelineOutcome.MISSING_IDENTITY;
        }
        if (table.isRequireNaturalId() && !adapter.hasNaturalId(data)) {
            log.warn("Row on {} has no identity value, skipping", topic);
            return PipelineOutcome.MISSING_IDENTITY;
        }

        NormalizedRecord record = adapter.normalize(envelope, table, data);
        if (record.operation() == Operation.DELETE && !properties.getPipeline().isForwardDeletes()) {
            log.info("Skipping DELETE of {} recordId={}", table.getName(), record.recordId());
            return PipelineOutcome.DELETE_SKIPPED;
        }
        if (deduplicationWindow.shouldSkip(table.getName() + "/" + record.recordId(), record.modifiedAt())) {
            log.debug("Duplicate {} recordId={} within dedup window, skipping", table.getName(), record.recordId());
            return PipelineOutcome.DUPLICATE;
        }

        ForwardingPayload payload = adapter.transformForLedger(table, record, data);
        dispatcher.enqueue(new ForwardingRequest(
                table.getName(),
                record,
                payload,
                ledgerUrl(app, payload.endpoint()),
                adapter.eventTimestampMs(envelope, data),
                busTimestampMs,
                receivedAt));
        log.info("Accepted {} {} recordId={} (fields {}, -{}%)", record.operation(), table.getName(),
                record.recordId(), record.fields().size(), payload.stats().reductionPercent());
        return PipelineOutcome.ENQUEUED;
    }

    String ledgerUrl(App app, String endpoint) {
        String base = app.getLedgerEndpoint() != null && !app.getLedgerEndpoint().isBlank()
                ? app.getLedgerEndpoint()
                : properties.getLedger().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return endpoint.startsWith("/") ? base + endpoint : base + "/" + endpoint;
    }
}
