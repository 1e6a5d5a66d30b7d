package org.airspace.dss.domain.model;

/**
 * The three entity kinds held by the store. Each kind owns one table.
 */
public enum EntityKind {
    ISA("identification_service_areas", "ISA"),
    SUBSCRIPTION("subscriptions", "Subscription"),
    OPERATIONAL_INTENT("operational_intents", "Operational Intent");

    private final String tableName;
    private final String displayName;

    EntityKind(String tableName, String displayName) {
        this.tableName = tableName;
        this.displayName = displayName;
    }

    public String tableName() {
        return tableName;
    }

    public String displayName() {
        return displayName;
    }
}
