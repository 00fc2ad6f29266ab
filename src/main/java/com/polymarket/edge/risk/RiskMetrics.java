package com.polymarket.edge.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class RiskMetrics {
    BigDecimal totalExposure;
    BigDecimal maxPositionSize; // largest single position value
    BigDecimal currentDrawdown;
    BigDecimal maxDrawdown;
    double drawdownPercent;
    int positionCount;
    BigDecimal unrealizedPnl;
    BigDecimal realizedPnl;
    BigDecimal totalPnl;
    int riskScore; // 0-100, higher is riskier
    Instant timestamp;
}
