package com.polymarket.edge.strategy;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class StrategyStats {
    long opportunitiesFound;
    long opportunitiesExecuted;
    BigDecimal totalPnl;
    double winRate;
    BigDecimal avgProfit;
    Instant lastRunAt;
    long runCount;
}
