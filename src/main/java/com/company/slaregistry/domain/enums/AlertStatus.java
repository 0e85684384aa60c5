package com.company.slaregistry.domain.enums;

public enum AlertStatus {
    OPEN("Alert raised, nobody has picked it up yet"),
    ACKNOWLEDGED("Alert acknowledged by operations"),
    RESOLVED("Alert resolved");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == RESOLVED;
    }

    public boolean canAcknowledge() {
        return this == OPEN;
    }

    public boolean canResolve() {
        return this == OPEN || this == ACKNOWLEDGED;
    }
}
