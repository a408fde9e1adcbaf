package com.tooldeck.config;

/**
 * How the tool list is ordered. Both modes end with the display name so the order is total.
 */
public enum OrderingMode {

    /** Declared priority, then display name. */
    PRIORITY,

    /** Number taken from the JAR file name, then declared priority, then display name. Default. */
    NUMERIC_ID;

    /**
     * Parses a mode name case-insensitively ({@code numeric-id} and {@code numeric_id} both match).
     *
     * @return the mode, or null if value is null/blank or unknown
     */
    public static OrderingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().replace('-', '_');
        for (OrderingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
