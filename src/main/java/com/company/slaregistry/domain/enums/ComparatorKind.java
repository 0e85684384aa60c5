package com.company.slaregistry.domain.enums;

public enum ComparatorKind {
    LT("<", "Observed value must be less than target"),
    LE("<=", "Observed value must be less than or equal to target"),
    EQ("==", "Observed value must equal target"),
    NE("!=", "Observed value must differ from target"),
    GE(">=", "Observed value must be greater than or equal to target"),
    GT(">", "Observed value must be greater than target");

    private final String symbol;
    private final String description;

    ComparatorKind(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }
}
