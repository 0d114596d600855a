package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.config.LedgerSyncProperties.Table;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.ForwardingPayload;
import com.companya.ledgersync.model.NormalizedRecord;
import com.companya.ledgersync.model.Operation;
import com.companya.ledgersync.support.Json;
import com.companya.ledgersync.support.MutableClock;
import com.companya.ledgersync.support.TestApps;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MySqlAdapter")
class MySqlAdapterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String TOPIC = "erpnext.erpnext_db.tabEmployee";

    private MutableClock clock;
    private MySqlAdapter adapter;
    private Table employeeTable;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        employeeTable = TestApps.table("tabEmployee", "name", "employee_name", "status", "department");
        App app = TestApps.app("erpnext", "mysql", employeeTable);
        app.getDatabase().setTimezoneOffsetHours(7);
        adapter = new MySqlAdapter(app, clock);
    }

    private ChangeEnvelope envelope(String op, JsonNode after) {
        return new ChangeEnvelope(TOPIC, op, null, after, null, null, NOW.toEpochMilli(), NOW, after);
    }

    @Nested
    @DisplayName("detectOperation")
    class DetectOperation {

        @ParameterizedTest(name = "op {0} -> {1}")
        @CsvSource({"c, CREATE", "u, UPDATE", "d, DELETE", "r, READ"})
        @DisplayName("Explicit marker wins over every heuristic signal")
        void explicitMarkerWins(String op, Operation expected) {
            JsonNode row = Json.node("{'name':'HR-EMP-1','creation':1705314600000000,"
                    + "'modified':1705314600000000,'__deleted':'true'}");

            assertThat(adapter.detectOperation(envelope(op, row), row)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Created and modified within the threshold is a CREATE")
        void closeTimestampsAreCreate() {
            JsonNode row = Json.node("{'creation':1705314600000000,'modified':1705314602000000}");

            assertThat(adapter.detectOperation(envelope(null, row), row)).isEqualTo(Operation.CREATE);
        }

        @Test
        @DisplayName("Created and modified far apart is an UPDATE")
        void distantTimestampsAreUpdate() {
            JsonNode row = Json.node("{'creation':1705314600000000,'modified':1705318200000000}");

            assertThat(adapter.detectOperation(envelope(null, row), row)).isEqualTo(Operation.UPDATE);
        }

        @Test
        @DisplayName("Only a creation time is a snapshot READ")
        void creationOnlyIsRead() {
            JsonNode row = Json.node("{'name':'HR-EMP-1','creation':1705314600000000}");

            assertThat(adapter.detectOperation(envelope(null, row), row)).isEqualTo(Operation.READ);
        }

        @Test
        @DisplayName("Deleted marker is a DELETE")
        void deletedMarker() {
            JsonNode row = Json.node("{'name':'HR-EMP-1','__deleted':'true'}");

            assertThat(adapter.detectOperation(envelope(null, row), row)).isEqualTo(Operation.DELETE);
        }

        @Test
        @DisplayName("No signal defaults to CREATE")
        void noSignal() {
            JsonNode row = Json.node("{'name':'HR-EMP-1'}");

            assertThat(adapter.detectOperation(envelope(null, row), row)).isEqualTo(Operation.CREATE);
        }
    }

    @Nested
    @DisplayName("normalizeTimestamp")
    class NormalizeTimestamp {

        @Test
        @DisplayName("Epoch microseconds are shifted by the server offset")
        void epochMicrosWithOffset() {
            Instant result = adapter.normalizeTimestamp(Json.node("1705314600000000"));

            assertThat(Timestamps.format(result)).isEqualTo("2024-01-15T03:30:00.000Z");
        }

        @Test
        @DisplayName("Epoch milliseconds and seconds are recognised by magnitude")
        void epochMillisAndSeconds() {
            assertThat(adapter.normalizeTimestamp(Json.node("1705314600000")))
                    .isEqualTo(Instant.parse("2024-01-15T03:30:00Z"));
            assertThat(adapter.normalizeTimestamp(Json.node("1705314600")))
                    .isEqualTo(Instant.parse("2024-01-15T03:30:00Z"));
        }

        @Test
        @DisplayName("Zone-less DATETIME text gets the offset, zoned text keeps its zone")
        void textualDatetime() {
            assertThat(adapter.normalizeTimestamp(new TextNode("2024-01-15 10:30:00.123456")))
                    .isEqualTo(Instant.parse("2024-01-15T03:30:00.123456Z"));
            assertThat(adapter.normalizeTimestamp(new TextNode("2024-01-15T10:30:00Z")))
                    .isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
        }

        @Test
        @DisplayName("Absent or unparseable input falls back to now")
        void fallbackToNow() {
            assertThat(adapter.normalizeTimestamp(null)).isEqualTo(NOW);
            assertThat(adapter.normalizeTimestamp(new TextNode(""))).isEqualTo(NOW);
            assertThat(adapter.normalizeTimestamp(new TextNode("not a date"))).isEqualTo(NOW);
            assertThat(adapter.normalizeTimestamp(Json.node("{'nested':true}"))).isEqualTo(NOW);
        }
    }

    @Test
    @DisplayName("Record id comes from the name column")
    void recordIdFromName() {
        JsonNode row = Json.node("{'name':'HR-EMP-00042'}");

        assertThat(adapter.extractRecordId("tabEmployee", row, NOW)).isEqualTo("HR-EMP-00042");
        assertThat(adapter.hasNaturalId(row)).isTrue();
    }

    @Test
    @DisplayName("Missing id yields a synthetic id that is deterministic for table and receipt time")
    void syntheticRecordId() {
        JsonNode row = Json.node("{'employee_name':'Jane'}");

        String first = adapter.extractRecordId("tabEmployee", row, NOW);
        String second = adapter.extractRecordId("tabEmployee", row, NOW);

        assertThat(first).isEqualTo("tabEmployee_" + NOW.toEpochMilli()).isEqualTo(second);
        assertThat(adapter.hasNaturalId(row)).isFalse();
    }

    @Test
    @DisplayName("Allow-list keeps only listed fields with a value")
    void allowListFilter() {
        JsonNode row = Json.node("{'name':'HR-EMP-1','employee_name':'Jane','status':'',"
                + "'department':null,'salary':5000,'_user_tags':'x'}");

        ObjectNode filtered = adapter.filterFields(employeeTable, row);

        assertThat(filtered.toString()).isEqualTo(Json.text("{'name':'HR-EMP-1','employee_name':'Jane'}"));
    }

    @Test
    @DisplayName("Generic filter drops nulls and internal columns")
    void genericFilter() {
        JsonNode row = Json.node("{'name':'X','docstatus':0,'_liked_by':'[]','__deleted':'false','owner':null}");

        ObjectNode filtered = adapter.filterFields(TestApps.table("tabNote"), row);

        assertThat(filtered.fieldNames()).toIterable().containsExactly("name", "docstatus");
    }

    @Test
    @DisplayName("Ledger payload carries the canonical fields under the table's data key")
    void transformForLedger() {
        JsonNode row = Json.node("{'name':'HR-EMP-1','employee_name':'Jane','creation':1705314600000000,"
                + "'modified':1705318200000000,'modified_by':'admin@example.com','lft':12,'rgt':13}");
        ChangeEnvelope envelope = envelope("u", row);

        NormalizedRecord record = adapter.normalize(envelope, employeeTable, row);
        ForwardingPayload payload = adapter.transformForLedger(employeeTable, record, row);

        JsonNode data = payload.body().get("employeeData");
        assertThat(payload.endpoint()).isEqualTo("/tabemployee");
        assertThat(data.get("recordId").asText()).isEqualTo("HR-EMP-1");
        assertThat(data.get("createdTimestamp").asText()).isEqualTo("2024-01-15T03:30:00.000Z");
        assertThat(data.get("modifiedTimestamp").asText()).isEqualTo("2024-01-15T04:30:00.000Z");
        assertThat(data.get("modifiedBy").asText()).isEqualTo("admin@example.com");
        assertThat(data.get("allData").toString()).isEqualTo(Json.text("{'name':'HR-EMP-1','employee_name':'Jane'}"));
        assertThat(payload.stats().originalSize()).isEqualTo(row.toString().length());
        assertThat(payload.stats().reductionPercent()).isPositive();
    }

    @Test
    @DisplayName("Missing actor defaults to system")
    void defaultModifiedBy() {
        assertThat(adapter.modifiedBy(Json.node("{'name':'X'}"))).isEqualTo("system");
    }

    @Nested
    @DisplayName("eventTimestampMs")
    class EventTimestamp {

        @Test
        @DisplayName("Prefers the source commit time")
        void sourceTimestamp() {
            JsonNode row = Json.node("{'modified':1705314600000000}");
            ChangeEnvelope envelope = new ChangeEnvelope(TOPIC, "u", null, row, 1_700_000_000_000L,
                    1_700_000_000_500L, 1_700_000_001_000L, NOW, row);

            assertThat(adapter.eventTimestampMs(envelope, row)).isEqualTo(1_700_000_000_000L);
        }

        @Test
        @DisplayName("Falls back to the modified column, then to the broker timestamp")
        void rowFallbacks() {
            JsonNode row = Json.node("{'modified':1705314600000000}");
            assertThat(adapter.eventTimestampMs(envelope(null, row), row))
                    .isEqualTo(Instant.parse("2024-01-15T03:30:00Z").toEpochMilli());

            JsonNode bare = Json.node("{'name':'X'}");
            assertThat(adapter.eventTimestampMs(envelope(null, bare), bare)).isEqualTo(NOW.toEpochMilli());
        }
    }
}
