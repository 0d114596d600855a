package com.companya.ledgersync.registry;

import com.companya.ledgersync.adapter.AdapterFactory;
import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.DatabaseFamily;
import com.companya.ledgersync.support.TestApps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AppRegistry")
class AppRegistryTest {

    private final AdapterFactory adapterFactory = new AdapterFactory(Clock.systemUTC());

    private AppRegistry registryOf(App... apps) {
        LedgerSyncProperties properties = new LedgerSyncProperties();
        properties.setApps(List.of(apps));
        return new AppRegistry(properties, adapterFactory);
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Invalid apps are skipped, valid ones still load")
        void invalidAppsSkipped() {
            App noType = TestApps.app("broken", null, TestApps.table("t"));
            App oracle = TestApps.app("legacy", "oracle", TestApps.table("t"));
            App erp = TestApps.app("erpnext", "mysql", TestApps.table("tabEmployee"));

            AppRegistry registry = registryOf(noType, oracle, erp);

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.getApp("erpnext")).isPresent();
            assertThat(registry.getApp("legacy")).isEmpty();
        }

        @Test
        @DisplayName("Validation names the supported types")
        void validationMessage() {
            assertThatThrownBy(() -> AppRegistry.validate(TestApps.app("legacy", "db2")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("legacy")
                    .hasMessageContaining("mysql, postgres, mongodb, sqlserver");
        }

        @Test
        @DisplayName("Re-registering an app replaces its prefix mapping")
        void reRegisterReplacesPrefix() {
            App first = TestApps.app("inventory", "postgres", TestApps.table("products"));
            first.setTopicPrefix("inv");
            AppRegistry registry = registryOf(first);

            App second = TestApps.app("inventory", "postgres", TestApps.table("products"));
            second.setTopicPrefix("stock");
            registry.register(second);

            assertThat(registry.resolve("inv.public.products")).isEmpty();
            assertThat(registry.resolve("stock.public.products")).isPresent();
            assertThat(registry.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        private AppRegistry registry;

        @BeforeEach
        void setUp() {
            App erp = TestApps.app("erpnext", "mysql", TestApps.table("tabEmployee"), TestApps.table("tabAttendance"));
            App inventory = TestApps.app("inventory", "postgresql", TestApps.table("products"));
            inventory.setTopicPrefix("inv");
            registry = registryOf(erp, inventory);
        }

        @Test
        @DisplayName("Prefix selects the app and the last segment the table")
        void resolvesByPrefixAndTable() {
            AppRegistry.Resolution resolution = registry.resolve("erpnext.erpdb.tabEmployee").orElseThrow();

            assertThat(resolution.app().getName()).isEqualTo("erpnext");
            assertThat(resolution.table().getName()).isEqualTo("tabEmployee");
            assertThat(resolution.adapter().family()).isEqualTo(DatabaseFamily.MYSQL);
        }

        @Test
        @DisplayName("A configured topic prefix is used instead of the app name")
        void topicPrefix() {
            assertThat(registry.resolve("inv.public.products"))
                    .hasValueSatisfying(r -> assertThat(r.app().getName()).isEqualTo("inventory"));
            assertThat(registry.resolve("inventory.public.products")).isEmpty();
        }

        @Test
        @DisplayName("Topics with fewer than three segments do not resolve")
        void tooFewSegments() {
            assertThat(registry.resolve("erpnext.tabEmployee")).isEmpty();
            assertThat(registry.resolve("tabEmployee")).isEmpty();
            assertThat(registry.resolve(null)).isEmpty();
        }

        @Test
        @DisplayName("Tables the app does not list do not resolve")
        void unlistedTable() {
            assertThat(registry.resolve("erpnext.erpdb.tabSalarySlip")).isEmpty();
        }

        @Test
        @DisplayName("Unknown prefixes do not resolve without a generic app")
        void unknownPrefix() {
            assertThat(registry.resolve("crm.crmdb.tabEmployee")).isEmpty();
        }

        @Test
        @DisplayName("Unknown prefixes fall back to the generic app")
        void genericFallback() {
            registry.register(TestApps.app(AppRegistry.GENERIC_APP, "mongodb", TestApps.table("orders")));

            assertThat(registry.resolve("shop.shopdb.orders"))
                    .hasValueSatisfying(r -> assertThat(r.adapter().family()).isEqualTo(DatabaseFamily.MONGODB));
        }
    }

    @Nested
    @DisplayName("Subscription pattern")
    class Subscription {

        @Test
        @DisplayName("Matches configured prefix and table combinations only")
        void matchesConfiguredTopics() {
            App erp = TestApps.app("erpnext", "mysql", TestApps.table("tabEmployee"));
            App inventory = TestApps.app("inventory", "postgres", TestApps.table("products"));
            inventory.setTopicPrefix("inv");
            Pattern pattern = Pattern.compile(registryOf(erp, inventory).subscriptionPattern());

            assertThat(pattern.matcher("erpnext.erpdb.tabEmployee").matches()).isTrue();
            assertThat(pattern.matcher("inv.public.products").matches()).isTrue();
            assertThat(pattern.matcher("inv.public.tabEmployee").matches()).isTrue();
            assertThat(pattern.matcher("crm.crmdb.tabEmployee").matches()).isFalse();
            assertThat(pattern.matcher("erpnext.erpdb.tabEmployeeX").matches()).isFalse();
            assertThat(pattern.matcher("erpnextX.erpdb.tabEmployee").matches()).isFalse();
        }

        @Test
        @DisplayName("A generic app opens the subscription to any prefix")
        void genericPrefix() {
            App generic = TestApps.app(AppRegistry.GENERIC_APP, "mysql", TestApps.table("orders"));
            Pattern pattern = Pattern.compile(registryOf(generic).subscriptionPattern());

            assertThat(pattern.matcher("anything.db.orders").matches()).isTrue();
            assertThat(pattern.matcher("anything.db.customers").matches()).isFalse();
        }

        @Test
        @DisplayName("Without apps the pattern matches nothing")
        void noApps() {
            Pattern pattern = Pattern.compile(registryOf().subscriptionPattern());

            assertThat(pattern.matcher("erpnext.erpdb.tabEmployee").find()).isFalse();
        }
    }
}
