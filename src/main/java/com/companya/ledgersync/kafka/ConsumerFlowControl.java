package com.companya.ledgersync.kafka;

import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.integration.LedgerClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pauses the change-stream listener while the ledger circuit breaker refuses calls and resumes it
 * as soon as the breaker admits trial calls again. The breaker moves from open to half-open on its
 * own timer, so a paused consumer never has to produce traffic to recover.
 */
@Component
public class ConsumerFlowControl {

    private static final Logger log = LoggerFactory.getLogger(ConsumerFlowControl.class);

    private final KafkaListenerEndpointRegistry registry;
    private final String listenerId;
    private final CircuitBreaker circuitBreaker;
    private final AtomicBoolean consumerPaused = new AtomicBoolean(false);

    public ConsumerFlowControl(LedgerClient ledgerClient,
                               KafkaListenerEndpointRegistry registry,
                               LedgerSyncProperties properties) {
        this.registry = registry;
        this.listenerId = properties.getKafka().getListenerId();
        this.circuitBreaker = ledgerClient.getCircuitBreaker();
        circuitBreaker.getEventPublisher().onStateTransition(this::onBreakerTransition);
    }

    void onBreakerTransition(CircuitBreakerOnStateTransitionEvent event) {
        CircuitBreaker.StateTransition transition = event.getStateTransition();
        if (refusesCalls(transition.getToState())) {
            updatePaused(true, transition);
        } else if (refusesCalls(transition.getFromState())) {
            updatePaused(false, transition);
        } else {
            log.debug("Breaker {} moved {}, consumer unaffected", event.getCircuitBreakerName(), transition);
        }
    }

    private static boolean refusesCalls(CircuitBreaker.State state) {
        return state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
    }

    private void updatePaused(boolean pause, CircuitBreaker.StateTransition transition) {
        if (consumerPaused.get() == pause) {
            return;
        }
        MessageListenerContainer container = registry.getListenerContainer(listenerId);
        if (container == null) {
            log.warn("No listener container '{}' to {} on breaker transition {}",
                    listenerId, pause ? "pause" : "resume", transition);
            return;
        }
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
        if (pause) {
            container.pause();
            log.warn("Ledger breaker {} (failure rate {}%, {} failed calls), change-stream consumer paused",
                    transition, metrics.getFailureRate(), metrics.getNumberOfFailedCalls());
        } else {
            container.resume();
            log.info("Ledger breaker {}, change-stream consumer resumed", transition);
        }
        consumerPaused.set(pause);
    }

    public boolean isConsumerPaused() {
        return consumerPaused.get();
    }
}
