package com.polymarket.edge.domain.event;

public enum RiskAlertLevel {
    INFO,
    WARNING,
    CRITICAL
}
