package com.companya.ledgersync.kafka;

import org.apache.kafka.clients.admin.AdminClient;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class KafkaAdminProbe implements UpstreamProbe {

    private final KafkaAdmin kafkaAdmin;

    public KafkaAdminProbe(KafkaAdmin kafkaAdmin) {
        this.kafkaAdmin = kafkaAdmin;
    }

    @Override
    public Set<String> listTopics(Duration timeout) {
        try (AdminClient admin = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            return admin.listTopics().names().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while listing topics", ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new UpstreamUnavailableException("Broker did not answer: " + ex.getMessage(), ex);
        }
    }
}
