package com.companya.ledgersync.model;

import java.util.Locale;

/**
 * Canonical row-level operation carried by a change event.
 */
public enum Operation {
    CREATE,
    UPDATE,
    DELETE,
    READ;

    /**
     * Maps an explicit operation marker to its canonical operation.
     * Accepts Debezium single-letter codes ({@code c u d r}) and the full names.
     *
     * @return the operation, or {@code null} when the marker is absent or not one of the four
     */
    public static Operation fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "c", "create" -> CREATE;
            case "u", "update" -> UPDATE;
            case "d", "delete" -> DELETE;
            case "r", "read" -> READ;
            default -> null;
        };
    }
}
