package com.polymarket.edge.strategy;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class StrategyContextStats {
    List<Entry> strategies;
    int strategiesCount;
    int enabledCount;
    int runningCount;
    long totalOpportunitiesFound;
    long totalOpportunitiesExecuted;
    BigDecimal totalPnl;
    double avgWinRate;

    @Value
    public static class Entry {
        String name;
        String type;
        boolean enabled;
        boolean running;
        StrategyStats stats;
    }
}
