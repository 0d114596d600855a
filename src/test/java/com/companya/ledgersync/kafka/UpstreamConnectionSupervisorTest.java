package com.companya.ledgersync.kafka;

import com.companya.ledgersync.adapter.AdapterFactory;
import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.registry.AppRegistry;
import com.companya.ledgersync.support.TestApps;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UpstreamConnectionSupervisor")
class UpstreamConnectionSupervisorTest {

    @Mock
    private UpstreamProbe probe;

    @Mock
    private ProcessTerminator terminator;

    private LedgerSyncProperties properties;
    private UpstreamConnectionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        properties = new LedgerSyncProperties();
        properties.setApps(List.of(TestApps.app("erpnext", "mysql", TestApps.table("tabEmployee"))));
        LedgerSyncProperties.Upstream upstream = properties.getUpstream();
        upstream.setMaxRetries(3);
        upstream.setInitialBackoffMs(10);
        upstream.setMaxBackoffMs(40);

        AppRegistry registry = new AppRegistry(properties, new AdapterFactory(Clock.systemUTC()));
        supervisor = new UpstreamConnectionSupervisor(probe, registry, properties, RetryRegistry.ofDefaults(), terminator);
    }

    private static UpstreamUnavailableException unreachable() {
        return new UpstreamUnavailableException("Broker did not answer", new RuntimeException("connection refused"));
    }

    @Test
    @DisplayName("Retries with backoff until the broker answers")
    void retriesUntilReachable() {
        when(probe.listTopics(any(Duration.class)))
                .thenThrow(unreachable())
                .thenThrow(unreachable())
                .thenReturn(Set.of("erpnext.erpdb.tabEmployee", "other.db.table"));

        supervisor.start();

        verify(probe, times(3)).listTopics(Duration.ofMillis(5_000));
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Gives up after the retry budget and fails startup with exit code 1")
    void failsStartupWhenUnreachable() {
        when(probe.listTopics(any(Duration.class))).thenThrow(unreachable());

        assertThatThrownBy(supervisor::start)
                .isInstanceOfSatisfying(UpstreamUnavailableException.class,
                        ex -> assertThat(ex.getExitCode()).isEqualTo(1));
        verify(probe, times(3)).listTopics(any(Duration.class));
        assertThat(supervisor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Skips the probe when startup verification is disabled")
    void verificationDisabled() {
        properties.getUpstream().setVerifyOnStartup(false);

        supervisor.start();

        verify(probe, never()).listTopics(any());
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Terminates once non-responsive checks exceed the retry limit")
    void terminatesAfterRepeatedNonResponsiveEvents() {
        NonResponsiveConsumerEvent event = mock(NonResponsiveConsumerEvent.class);

        for (int i = 0; i < 3; i++) {
            supervisor.onNonResponsiveConsumer(event);
        }
        verify(terminator, never()).terminate(anyInt());

        supervisor.onNonResponsiveConsumer(event);

        verify(terminator).terminate(UpstreamConnectionSupervisor.EXIT_CODE);
    }

    @Test
    @DisplayName("A delivered record resets the failure count")
    void recoveryResetsCount() {
        NonResponsiveConsumerEvent event = mock(NonResponsiveConsumerEvent.class);
        supervisor.onNonResponsiveConsumer(event);
        supervisor.onNonResponsiveConsumer(event);

        supervisor.markResponsive();

        assertThat(supervisor.getConsecutiveFailures()).isZero();
        for (int i = 0; i < 3; i++) {
            supervisor.onNonResponsiveConsumer(event);
        }
        verify(terminator, never()).terminate(anyInt());
    }
}
