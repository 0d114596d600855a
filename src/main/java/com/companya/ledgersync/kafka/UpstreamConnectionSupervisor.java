package com.companya.ledgersync.kafka;

import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.config.LedgerSyncProperties.Table;
import com.companya.ledgersync.registry.AppRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.event.ListenerContainerIdleEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Guards the connection to the change-stream broker.
 * <p>
 * Before the listener container starts, the broker is probed with exponential backoff; if it never
 * answers, startup fails. While running, consecutive non-responsive consumer events beyond the retry
 * limit terminate the process with exit code 1.
 */
@Slf4j
@Component
public class UpstreamConnectionSupervisor implements SmartLifecycle {

    /** Starts before the listener containers. */
    static final int PHASE = Integer.MAX_VALUE - 200;

    public static final int EXIT_CODE = 1;

    private final UpstreamProbe probe;
    private final AppRegistry appRegistry;
    private final LedgerSyncProperties.Upstream settings;
    private final ProcessTerminator terminator;
    private final Retry retry;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile boolean running;

    public UpstreamConnectionSupervisor(UpstreamProbe probe,
                                        AppRegistry appRegistry,
                                        LedgerSyncProperties properties,
                                        RetryRegistry retryRegistry,
                                        ProcessTerminator terminator) {
        this.probe = probe;
        this.appRegistry = appRegistry;
        this.settings = properties.getUpstream();
        this.terminator = terminator;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxRetries())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoffMs(), settings.getBackoffMultiplier(), settings.getMaxBackoffMs()))
                .retryExceptions(UpstreamUnavailableException.class)
                .build();
        this.retry = retryRegistry.retry("upstreamConnection", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Upstream broker not reachable (attempt {}/{}), retrying in {} ms: {}",
                        event.getNumberOfRetryAttempts(), settings.getMaxRetries(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    @Override
    public void start() {
        if (settings.isVerifyOnStartup()) {
            verifyConnection();
        }
        running = true;
    }

    /**
     * Probes the broker until it answers or the retries are exhausted.
     *
     * @throws UpstreamUnavailableException when every attempt failed
     */
    public Set<String> verifyConnection() {
        Duration timeout = Duration.ofMillis(settings.getProbeTimeoutMs());
        Set<String> topics;
        try {
            topics = retry.executeSupplier(() -> probe.listTopics(timeout));
        } catch (UpstreamUnavailableException ex) {
            log.error("Upstream broker unreachable after {} attempts, giving up", settings.getMaxRetries());
            throw ex;
        }
        reportTopics(topics);
        return topics;
    }

    private void reportTopics(Set<String> topics) {
        Pattern subscription = Pattern.compile(appRegistry.subscriptionPattern());
        Set<String> matching = topics.stream()
                .filter(topic -> subscription.matcher(topic).matches())
                .collect(Collectors.toCollection(TreeSet::new));
        log.info("Upstream broker reachable: {} topic(s), {} matching the subscription {}",
                topics.size(), matching.size(), matching);
        for (App app : appRegistry.apps()) {
            String prefix = app.effectiveTopicPrefix() + ".";
            for (Table table : app.getTables()) {
                String suffix = "." + table.getName();
                boolean present = topics.stream().anyMatch(t -> t.startsWith(prefix) && t.endsWith(suffix));
                if (!present) {
                    log.warn("No topic yet for {}{}, events will be picked up once the connector creates it",
                            prefix, table.getName());
                }
            }
        }
    }

    @EventListener
    public void onNonResponsiveConsumer(NonResponsiveConsumerEvent event) {
        int failures = consecutiveFailures.incrementAndGet();
        log.warn("Consumer not responsive for {} ms ({} consecutive)", event.getTimeSinceLastPoll(), failures);
        if (failures > settings.getMaxRetries()) {
            log.error("Upstream connection lost for {} consecutive checks, exiting with code {}",
                    failures, EXIT_CODE);
            terminator.terminate(EXIT_CODE);
        }
    }

    @EventListener
    public void onContainerIdle(ListenerContainerIdleEvent event) {
        markResponsive();
    }

    public void markResponsive() {
        int previous = consecutiveFailures.getAndSet(0);
        if (previous > 0) {
            log.info("Upstream consumer responsive again after {} failed check(s)", previous);
        }
    }

    int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
