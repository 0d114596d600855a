package com.companya.ledgersync.config;

import com.companya.ledgersync.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Arrays;

@Configuration
public class LedgerClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(LedgerClientConfig.class);

    @Bean
    @Qualifier("ledgerRestTemplate")
    public RestTemplate ledgerRestTemplate(RestTemplateBuilder builder, LedgerSyncProperties properties) {
        LedgerSyncProperties.Ledger ledger = properties.getLedger();
        // the per-operation deadline is enforced by the forwarder, the socket only needs the longest one
        long readTimeoutMs = Arrays.stream(Operation.values())
                .mapToLong(ledger::timeoutFor)
                .max()
                .orElse(30_000L);
        logger.info("Initializing ledgerRestTemplate for {} (read timeout {} ms)", ledger.getBaseUrl(), readTimeoutMs);
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
