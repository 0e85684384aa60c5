package com.company.slaregistry.domain.enums;

public enum SlaStatus {
    ACTIVE("SLA is evaluated on every metric report"),
    PAUSED("SLA is temporarily excluded from reporting"),
    ARCHIVED("SLA is retired");

    private final String description;

    SlaStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean acceptsReports() {
        return this == ACTIVE;
    }
}
