package com.companya.ledgersync.registry;

import com.companya.ledgersync.adapter.AdapterFactory;
import com.companya.ledgersync.adapter.SourceAdapter;
import com.companya.ledgersync.config.LedgerSyncProperties;
import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.config.LedgerSyncProperties.Table;
import com.companya.ledgersync.model.DatabaseFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps topic names of the form {@code <prefix>.<database>.<table>} to an app configuration and
 * the adapter built for it. One adapter per app, kept for the life of the process.
 */
@Slf4j
@Component
public class AppRegistry {

    public static final String GENERIC_APP = "generic";

    /** Matches no topic, used while no app is registered. */
    static final String NO_TOPICS = "(?!)";

    private final AdapterFactory adapterFactory;
    private final Map<String, RegisteredApp> appsByName = new ConcurrentHashMap<>();
    private final Map<String, String> appNameByPrefix = new ConcurrentHashMap<>();

    public AppRegistry(LedgerSyncProperties properties, AdapterFactory adapterFactory) {
        this.adapterFactory = adapterFactory;
        for (App app : properties.getApps()) {
            try {
                register(app);
            } catch (IllegalArgumentException ex) {
                log.error("Skipping app configuration: {}", ex.getMessage());
            }
        }
        log.info("Loaded {} app configuration(s)", appsByName.size());
    }

    /**
     * Validates and registers an app, replacing any app of the same name.
     *
     * @throws IllegalArgumentException when the configuration is invalid
     */
    public void register(App app) {
        validate(app);
        Map<String, Table> tables = new LinkedHashMap<>();
        for (Table table : app.getTables()) {
            if (table.getName() == null || table.getName().isBlank()) {
                log.warn("App '{}' has a table without a name, ignoring it", app.getName());
                continue;
            }
            tables.put(table.getName(), table);
        }
        SourceAdapter adapter = adapterFactory.create(app);
        RegisteredApp previous = appsByName.put(app.getName(), new RegisteredApp(app, adapter, tables));
        if (previous != null) {
            appNameByPrefix.remove(previous.app().effectiveTopicPrefix(), app.getName());
        }
        appNameByPrefix.put(app.effectiveTopicPrefix(), app.getName());
        log.info("Registered app {} ({}) with tables {}",
                app.getDisplayName() != null ? app.getDisplayName() : app.getName(),
                adapter.family().primaryName(), tables.keySet());
    }

    static void validate(App app) {
        if (app.getName() == null || app.getName().isBlank()) {
            throw new IllegalArgumentException("app must have a name");
        }
        if (app.getDatabase() == null) {
            throw new IllegalArgumentException("app '" + app.getName() + "' must have a database section");
        }
        String type = app.getDatabase().getType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("app '" + app.getName() + "' must specify database.type");
        }
        if (!DatabaseFamily.isSupported(type)) {
            throw new IllegalArgumentException("app '" + app.getName() + "' has invalid database.type '" + type
                    + "', must be one of: " + AdapterFactory.supportedTypes());
        }
    }

    /**
     * Resolves a topic. Unknown prefixes fall back to the {@code generic} app when one is registered;
     * the table segment must be listed by the app.
     */
    public Optional<Resolution> resolve(String topic) {
        if (topic == null) {
            return Optional.empty();
        }
        String[] parts = topic.split("\\.");
        if (parts.length < 3) {
            return Optional.empty();
        }
        String appName = appNameByPrefix.getOrDefault(parts[0], GENERIC_APP);
        RegisteredApp registered = appsByName.get(appName);
        if (registered == null) {
            return Optional.empty();
        }
        String tableName = parts[parts.length - 1];
        Table table = registered.tables().get(tableName);
        if (table == null) {
            return Optional.empty();
        }
        return Optional.of(new Resolution(registered.app(), table, registered.adapter()));
    }

    /**
     * Regex for the listener subscription, {@code ^(<prefix>|...)\..*\.(<table>|...)$}.
     */
    public String subscriptionPattern() {
        if (appsByName.isEmpty()) {
            return NO_TOPICS;
        }
        String prefixes = appsByName.containsKey(GENERIC_APP)
                ? "[^.]+"
                : joinQuoted(appNameByPrefix.keySet());
        List<String> tables = new ArrayList<>();
        appsByName.values().forEach(registered -> tables.addAll(registered.tables().keySet()));
        if (tables.isEmpty()) {
            return NO_TOPICS;
        }
        return "^(" + prefixes + ")\\..*\\.(" + joinQuoted(tables) + ")$";
    }

    private static String joinQuoted(Collection<String> names) {
        return new TreeSet<>(names).stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
    }

    public Optional<App> getApp(String name) {
        return Optional.ofNullable(appsByName.get(name)).map(RegisteredApp::app);
    }

    public Collection<App> apps() {
        return appsByName.values().stream().map(RegisteredApp::app).toList();
    }

    public int size() {
        return appsByName.size();
    }

    private record RegisteredApp(App app, SourceAdapter adapter, Map<String, Table> tables) {
    }

    /**
     * A resolved topic: the app, the table configuration and the app's adapter.
     */
    public record Resolution(App app, Table table, SourceAdapter adapter) {
    }
}
