package com.polymarket.edge.domain;

public enum OpportunityType {
    CROSS_MARKET, // YES + NO < 1 on one binary market
    EVENT_ARBITRAGE, // market price vs. reference bookmaker fair probability
    DEVIATION // price stretched away from its rolling mean
}
