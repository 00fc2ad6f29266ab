package com.polymarket.edge.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Portfolio limit snapshot. Immutable; {@link RiskManager#setLimits(Patch)} swaps in a merged copy.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    @Builder.Default
    BigDecimal maxPositionSize = new BigDecimal("1000");
    @Builder.Default
    BigDecimal maxTotalExposure = new BigDecimal("10000");
    @Builder.Default
    double maxDrawdownPercent = 10;
    @Builder.Default
    int maxPositions = 10;
    @Builder.Default
    BigDecimal maxPerMarketExposure = new BigDecimal("2000");
    @Builder.Default
    BigDecimal dailyLossLimit = new BigDecimal("500");

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }

    /** Returns a copy with every non-null field of {@code patch} applied. */
    public RiskLimits merge(Patch patch) {
        if (patch == null) {
            return this;
        }
        RiskLimitsBuilder b = toBuilder();
        if (patch.getMaxPositionSize() != null) {
            b.maxPositionSize(patch.getMaxPositionSize());
        }
        if (patch.getMaxTotalExposure() != null) {
            b.maxTotalExposure(patch.getMaxTotalExposure());
        }
        if (patch.getMaxDrawdownPercent() != null) {
            b.maxDrawdownPercent(patch.getMaxDrawdownPercent());
        }
        if (patch.getMaxPositions() != null) {
            b.maxPositions(patch.getMaxPositions());
        }
        if (patch.getMaxPerMarketExposure() != null) {
            b.maxPerMarketExposure(patch.getMaxPerMarketExposure());
        }
        if (patch.getDailyLossLimit() != null) {
            b.dailyLossLimit(patch.getDailyLossLimit());
        }
        return b.build();
    }

    /** Partial update; null fields keep the current value. */
    @Value
    @Builder
    public static class Patch {
        BigDecimal maxPositionSize;
        BigDecimal maxTotalExposure;
        Double maxDrawdownPercent;
        Integer maxPositions;
        BigDecimal maxPerMarketExposure;
        BigDecimal dailyLossLimit;
    }
}
