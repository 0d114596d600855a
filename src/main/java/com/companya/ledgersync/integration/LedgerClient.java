package com.companya.ledgersync.integration;

import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.integration.exception.LedgerRejectedException;
import com.companya.ledgersync.integration.exception.LedgerUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

/**
 * Posts change records to the ledger write API. Calls run through a circuit breaker; rejected writes
 * do not count against it, unavailability does.
 */
@Component
public class LedgerClient {

    public static final String CIRCUIT_BREAKER_NAME = "ledgerCircuitBreaker";

    private static final Logger log = LoggerFactory.getLogger(LedgerClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String privateKey;

    public LedgerClient(@Qualifier("ledgerRestTemplate") RestTemplate restTemplate,
                        ObjectMapper objectMapper,
                        CircuitBreakerRegistry cbRegistry,
                        LedgerSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.privateKey = properties.getLedger().getPrivateKey();

        LedgerSyncProperties.CircuitBreaker settings = properties.getLedger().getCircuitBreaker();
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofMillis(settings.getWaitInOpenStateMs()))
                // the consumer is paused while open, so no call would ever move it to half-open
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .slidingWindowSize(settings.getSlidingWindowSize())
                .ignoreExceptions(LedgerRejectedException.class)
                .build();
        this.circuitBreaker = cbRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME, cbConfig);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Posts the body to {@code url}.
     *
     * @throws LedgerRejectedException    on 4xx, a status other than 200, or {@code success:false}
     * @throws LedgerUnavailableException on 5xx, I/O failures or an unreadable reply
     * @throws io.github.resilience4j.circuitbreaker.CallNotPermittedException while the breaker is open
     */
    public LedgerResponse submit(String url, ObjectNode body) {
        return circuitBreaker.executeSupplier(() -> post(url, body));
    }

    private LedgerResponse post(String url, ObjectNode body) {
        ObjectNode payload = body;
        if (privateKey != null && !privateKey.isBlank()) {
            payload = body.deepCopy();
            payload.put("privateKey", privateKey);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(payload.toString(), headers), String.class);
        } catch (HttpStatusCodeException ex) {
            if (ex.getStatusCode().is4xxClientError()) {
                log.error("Ledger rejected write to {}: {} {}", url, ex.getStatusCode(), ex.getResponseBodyAsString());
                throw new LedgerRejectedException("Ledger returned " + ex.getStatusCode(), ex);
            }
            log.error("Ledger error from {}: {}", url, ex.getStatusCode());
            throw new LedgerUnavailableException("Ledger returned " + ex.getStatusCode(), ex);
        } catch (RestClientException ex) {
            log.error("Ledger call to {} failed: {}", url, ex.getMessage());
            throw new LedgerUnavailableException("Ledger call failed", ex);
        }

        if (response.getStatusCode().value() != HttpStatus.OK.value()) {
            throw new LedgerRejectedException("Unexpected ledger status " + response.getStatusCode());
        }
        LedgerResponse parsed = parse(response.getBody());
        if (!parsed.success()) {
            throw new LedgerRejectedException("Ledger reported failure: "
                    + (parsed.message() != null ? parsed.message() : "no reason given"));
        }
        return parsed;
    }

    LedgerResponse parse(String body) {
        if (body == null || body.isBlank()) {
            return new LedgerResponse(false, null, null, "empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new LedgerUnavailableException("Unreadable ledger response", ex);
        }
        JsonNode chain = root.path("blockchain").isObject() ? root.get("blockchain") : root;
        Long blockNumber = chain.path("blockNumber").canConvertToLong() ? chain.get("blockNumber").asLong() : null;
        String txHash = chain.hasNonNull("transactionHash") ? chain.get("transactionHash").asText() : null;
        String message = root.hasNonNull("error") ? root.get("error").asText()
                : root.hasNonNull("message") ? root.get("message").asText() : null;
        return new LedgerResponse(root.path("success").asBoolean(false), blockNumber, txHash, message);
    }
}
