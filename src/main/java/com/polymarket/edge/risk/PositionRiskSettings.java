package com.polymarket.edge.risk;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Per-position exit rules, created on the first stop-loss or take-profit assignment
 * and updated in place afterwards.
 */
@Data
@AllArgsConstructor
public class PositionRiskSettings {
    private final String positionId;
    private StopLossConfig stopLoss;
    private TakeProfitConfig takeProfit;
    private final Instant createdAt;
    private Instant updatedAt;

    static PositionRiskSettings create(String positionId, Instant now) {
        return new PositionRiskSettings(positionId, null, null, now, now);
    }

    PositionRiskSettings copy() {
        return new PositionRiskSettings(positionId, stopLoss, takeProfit, createdAt, updatedAt);
    }
}
