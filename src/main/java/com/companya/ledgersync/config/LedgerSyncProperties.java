package com.companya.ledgersync.config;

import com.companya.ledgersync.model.Operation;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Binds everything under {@code ledgersync.*}.
 *
 * <pre>
 * ledgersync:
 *   pipeline:
 *     dedup-window-ms: 10000
 *     batch-size: 10
 *     max-concurrent: 5
 *   ledger:
 *     base-url: http://127.0.0.1:4001
 *   apps:
 *     - name: erpnext
 *       database:
 *         type: mysql
 *       tables:
 *         - name: tabEmployee
 *           endpoint: /employees
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "ledgersync")
public class LedgerSyncProperties {

    private Pipeline pipeline = new Pipeline();
    private Ledger ledger = new Ledger();
    private Upstream upstream = new Upstream();
    private Kafka kafka = new Kafka();
    private List<App> apps = new ArrayList<>();

    @Data
    public static class Pipeline {
        private long dedupWindowMs = 10_000;
        private long dedupToleranceMs = 5_000;
        private int batchSize = 10;
        private long batchIdleTimeoutMs = 100;
        private int maxConcurrent = 5;
        private long statsIntervalMs = 60_000;
        private long shutdownGraceMs = 30_000;
        // the ledger contracts have no delete operation
        private boolean forwardDeletes = false;
    }

    @Data
    public static class Ledger {
        private String baseUrl = "http://127.0.0.1:4001";
        private String privateKey;
        private Map<Operation, Long> timeoutsMs = defaultTimeouts();
        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        public long timeoutFor(Operation operation) {
            Long timeout = timeoutsMs.get(operation);
            return timeout != null ? timeout : 30_000L;
        }

        private static Map<Operation, Long> defaultTimeouts() {
            Map<Operation, Long> timeouts = new EnumMap<>(Operation.class);
            timeouts.put(Operation.CREATE, 30_000L);
            timeouts.put(Operation.READ, 30_000L);
            timeouts.put(Operation.UPDATE, 15_000L);
            timeouts.put(Operation.DELETE, 10_000L);
            return timeouts;
        }
    }

    @Data
    public static class CircuitBreaker {
        private float failureRateThreshold = 50;
        private int slidingWindowSize = 20;
        private long waitInOpenStateMs = 60_000;
    }

    @Data
    public static class Upstream {
        private boolean verifyOnStartup = true;
        private int maxRetries = 15;
        private long initialBackoffMs = 1_000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 30_000;
        private long probeTimeoutMs = 5_000;
    }

    @Data
    public static class Kafka {
        private String listenerId = "cdcEnvelopeListener";
        private boolean autoStartup = true;
        private long idleEventIntervalMs = 30_000;
    }

    @Data
    public static class App {
        private String name;
        private String displayName;
        private String topicPrefix;
        private String ledgerEndpoint;
        private Database database;
        private List<Table> tables = new ArrayList<>();

        public String effectiveTopicPrefix() {
            return topicPrefix != null && !topicPrefix.isBlank() ? topicPrefix : name;
        }
    }

    @Data
    public static class Database {
        private String type;
        private String idField;
        private TimestampFields timestampFields = new TimestampFields();
        private int timezoneOffsetHours;
        private int timezoneOffsetMinutes;
        private long operationThresholdMs = 5_000;
    }

    @Data
    public static class TimestampFields {
        private String created;
        private String modified;
        private String modifiedBy;
    }

    @Data
    public static class Table {
        private String name;
        private String endpoint;
        private String dataKey;
        private List<String> fields = new ArrayList<>();
        private boolean requireNaturalId = false;

        public String effectiveEndpoint() {
            return endpoint != null && !endpoint.isBlank() ? endpoint : "/" + name.toLowerCase(Locale.ROOT);
        }

        /**
         * Payload key, e.g. {@code tabEmployee -> employeeData} when none is configured.
         */
        public String effectiveDataKey() {
            if (dataKey != null && !dataKey.isBlank()) {
                return dataKey;
            }
            String base = name.startsWith("tab") ? name.substring(3) : name;
            return base.toLowerCase(Locale.ROOT) + "Data";
        }
    }
}
