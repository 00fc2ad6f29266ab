package com.polymarket.edge.domain;

public enum OpportunityStatus {
    PENDING,
    EXECUTING,
    EXECUTED,
    FAILED,
    EXPIRED,
    SKIPPED;

    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == EXPIRED || this == SKIPPED;
    }
}
