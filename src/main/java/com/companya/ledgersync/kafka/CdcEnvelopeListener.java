package com.companya.ledgersync.kafka;

import com.companya.ledgersync.model.PipelineOutcome;
import com.companya.ledgersync.service.ChangeEventPipeline;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes change envelopes from every topic matching the registry's subscription pattern.
 */
@Component
public class CdcEnvelopeListener {

    private static final Logger log = LoggerFactory.getLogger(CdcEnvelopeListener.class);

    private final ChangeEventPipeline pipeline;
    private final UpstreamConnectionSupervisor supervisor;

    public CdcEnvelopeListener(ChangeEventPipeline pipeline, UpstreamConnectionSupervisor supervisor) {
        this.pipeline = pipeline;
        this.supervisor = supervisor;
    }

    // The offset is committed whatever the outcome: failures are counted and logged by the pipeline,
    // redelivery would only replay them.
    @KafkaListener(id = "${ledgersync.kafka.listener-id:cdcEnvelopeListener}",
            idIsGroup = false,
            topicPattern = "#{@appRegistry.subscriptionPattern()}",
            containerFactory = "cdcListenerContainerFactory",
            autoStartup = "${ledgersync.kafka.auto-startup:true}")
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        supervisor.markResponsive();
        try {
            PipelineOutcome outcome = pipeline.process(record.topic(), record.value(), record.timestamp());
            log.debug("{}-{}@{} -> {}", record.topic(), record.partition(), record.offset(), outcome);
        } finally {
            ack.acknowledge();
        }
    }
}
