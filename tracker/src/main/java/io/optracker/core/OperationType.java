package io.optracker.core;

/**
 * Kinds of mutating operation a partition can have in flight.
 */
public enum OperationType {
    WRITE("write", "Write"),
    ALTER_SCHEMA("alter_schema", "Alter Schema"),
    UPDATE_TRANSACTION("update_transaction", "Update Transaction"),
    SNAPSHOT("snapshot", "Snapshot"),
    TRUNCATE("truncate", "Truncate");

    private final String metricName;
    private final String displayName;

    OperationType(String metricName, String displayName) {
        this.metricName = metricName;
        this.displayName = displayName;
    }

    public String metricName() { return metricName; }

    public String displayName() { return displayName; }
}
