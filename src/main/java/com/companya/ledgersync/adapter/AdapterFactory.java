package com.companya.ledgersync.adapter;

import com.companya.ledgersync.config.LedgerSyncProperties.App;
import com.companya.ledgersync.model.DatabaseFamily;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Selects the adapter implementation for an app's database type.
 */
@Component
@RequiredArgsConstructor
public class AdapterFactory {

    private final Clock clock;

    public SourceAdapter create(App app) {
        String type = app.getDatabase() != null ? app.getDatabase().getType() : null;
        DatabaseFamily family = DatabaseFamily.fromName(type);
        if (family == null) {
            throw new IllegalArgumentException("Unsupported database type '" + type + "' for app '"
                    + app.getName() + "'. Supported: " + supportedTypes());
        }
        return switch (family) {
            case MYSQL -> new MySqlAdapter(app, clock);
            case POSTGRES -> new PostgresAdapter(app, clock);
            case MONGODB -> new MongoDbAdapter(app, clock);
            case SQLSERVER -> new SqlServerAdapter(app, clock);
        };
    }

    public static String supportedTypes() {
        return Arrays.stream(DatabaseFamily.values())
                .map(DatabaseFamily::primaryName)
                .collect(Collectors.joining(", "));
    }
}
