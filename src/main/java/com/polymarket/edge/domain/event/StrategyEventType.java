package com.polymarket.edge.domain.event;

public enum StrategyEventType {
    STARTED,
    STOPPED,
    OPPORTUNITY_FOUND,
    TRADE_EXECUTED,
    TRADE_FAILED,
    ERROR
}
