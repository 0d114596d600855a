package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.ChangeEnvelope;
import com.companya.ledgersync.model.Operation;
import com.companya.ledgersync.support.Json;
import com.companya.ledgersync.support.MutableClock;
import com.companya.ledgersync.support.TestApps;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MongoDbAdapter")
class MongoDbAdapterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String TOPIC = "shop.shopdb.orders";

    private MongoDbAdapter adapter;

    @BeforeEach
    void setUp() {
        App app = TestApps.app("shop", "mongo", TestApps.table("orders"));
        adapter = new MongoDbAdapter(app, new MutableClock(NOW));
    }

    @Test
    @DisplayName("Extended JSON dates are converted")
    void extendedDates() {
        assertThat(adapter.normalizeTimestamp(Json.node("{'$date':'2024-01-15T10:30:00Z'}")))
                .isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
        assertThat(adapter.normalizeTimestamp(Json.node("{'$date':{'$numberLong':'1705314600000'}}")))
                .isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
        assertThat(adapter.normalizeTimestamp(Json.node("{'$date':1705314600000}")))
                .isEqualTo(Instant.parse("2024-01-15T10:30:00Z"));
    }

    @Test
    @DisplayName("ObjectId is unwrapped for the record id")
    void objectIdRecordId() {
        JsonNode doc = Json.node("{'_id':{'$oid':'65a50a8f1c4e2b3d4f5a6b7c'},'total':10}");

        assertThat(adapter.extractRecordId("orders", doc, NOW)).isEqualTo("65a50a8f1c4e2b3d4f5a6b7c");
    }

    @Test
    @DisplayName("Change-stream operationType maps to the canonical operation")
    void changeStreamOperation() {
        JsonNode root = Json.node("{'operationType':'replace','fullDocument':{'_id':'o-1','total':3},"
                + "'clusterTime':{'$timestamp':{'t':1705314600,'i':1}}}");
        ChangeEnvelope envelope = new ChangeEnvelope(TOPIC, null, null, root, null, null,
                NOW.toEpochMilli(), NOW, root);

        JsonNode doc = adapter.rowImage(envelope);

        assertThat(doc.get("_id").asText()).isEqualTo("o-1");
        assertThat(adapter.detectOperation(envelope, doc)).isEqualTo(Operation.UPDATE);
        assertThat(adapter.eventTimestampMs(envelope, doc)).isEqualTo(1_705_314_600_000L);
    }

    @Test
    @DisplayName("Deletes from a change stream use the document key")
    void changeStreamDelete() {
        JsonNode root = Json.node("{'operationType':'delete','documentKey':{'_id':{'$oid':'65a50a8f1c4e2b3d4f5a6b7c'}}}");
        ChangeEnvelope envelope = new ChangeEnvelope(TOPIC, null, null, root, null, null,
                NOW.toEpochMilli(), NOW, root);

        JsonNode doc = adapter.rowImage(envelope);

        assertThat(adapter.detectOperation(envelope, doc)).isEqualTo(Operation.DELETE);
        assertThat(adapter.extractRecordId("orders", doc, NOW)).isEqualTo("65a50a8f1c4e2b3d4f5a6b7c");
    }

    @Test
    @DisplayName("Generic filter keeps a plain _id and unwraps extended types recursively")
    void genericFilter() {
        JsonNode doc = Json.node("{'_id':{'$oid':'abc'},'__v':0,'_class':'Order',"
                + "'total':{'$numberDecimal':'19.99'},'qty':{'$numberLong':'3'},"
                + "'placed':{'$date':'2024-01-15T10:30:00Z'},"
                + "'lines':[{'sku':{'$oid':'def'}}]}");

        ObjectNode filtered = adapter.filterFields(TestApps.table("orders"), doc);

        assertThat(filtered.fieldNames()).toIterable().containsExactly("_id", "total", "qty", "placed", "lines");
        assertThat(filtered.get("_id").asText()).isEqualTo("abc");
        assertThat(filtered.get("total").decimalValue()).isEqualByComparingTo(new BigDecimal("19.99"));
        assertThat(filtered.get("qty").asLong()).isEqualTo(3L);
        assertThat(filtered.get("placed").asText()).isEqualTo("2024-01-15T10:30:00.000Z");
        assertThat(filtered.get("lines").get(0).get("sku").asText()).isEqualTo("def");
    }

    @Test
    @DisplayName("A malformed extended-JSON number drops only that field")
    void malformedNumberDropsField() {
        JsonNode doc = Json.node("{'_id':'o-7','qty':{'$numberLong':'twelve'},'count':{'$numberInt':'1e3'},"
                + "'total':{'$numberDecimal':'19.99'}}");

        ObjectNode filtered = adapter.filterFields(TestApps.table("orders"), doc);

        assertThat(filtered.fieldNames()).toIterable().containsExactly("_id", "total");
        assertThat(filtered.get("total").decimalValue()).isEqualByComparingTo(new BigDecimal("19.99"));
    }
}
