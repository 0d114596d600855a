package com.companya.ledgersync.model;

import java.util.Locale;

public enum DatabaseFamily {
    MYSQL("mysql", "mariadb"),
    POSTGRES("postgres", "postgresql"),
    MONGODB("mongodb", "mongo"),
    SQLSERVER("sqlserver", "mssql");

    private final String[] aliases;

    DatabaseFamily(String... aliases) {
        this.aliases = aliases;
    }

    public String primaryName() {
        return aliases[0];
    }

    public static DatabaseFamily fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DatabaseFamily family : values()) {
            for (String alias : family.aliases) {
                if (alias.equals(normalized)) {
                    return family;
                }
            }
        }
        return null;
    }

    public static boolean isSupported(String name) {
        return fromName(name) != null;
    }
}
