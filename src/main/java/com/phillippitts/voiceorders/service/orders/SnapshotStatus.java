package com.phillippitts.voiceorders.service.orders;

/**
 * Outcome of loading the static order snapshot, as reported by health checks.
 */
public enum SnapshotStatus {
    LOADED("static-json", "Static dataset loaded successfully"),
    MISSING("missing", "Static dataset not found"),
    INVALID("invalid", "Static dataset is malformed");

    private final String database;
    private final String message;

    SnapshotStatus(String database, String message) {
        this.database = database;
        this.message = message;
    }

    /** Value reported in the {@code database} field of the health response. */
    public String database() {
        return database;
    }

    public String message() {
        return message;
    }

    public boolean isHealthy() {
        return this == LOADED;
    }
}
