package com.polymarket.edge.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Snapshot of an open holding, owned and updated by the position tracker. The risk
 * engine only reads it.
 */
@Data
@Builder(toBuilder = true)
public class Position {
    private String id;
    private String marketId;
    private String tokenId; // outcome token held
    private Side side; // BUY = long, SELL = short
    private BigDecimal size;
    private BigDecimal avgEntryPrice;
    private BigDecimal currentPrice;
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public boolean isLong() {
        return side == null || side.isBuy();
    }

    public boolean isOpen() {
        return size != null && size.signum() > 0;
    }

    public BigDecimal getCurrentValue() {
        return size.multiply(currentPrice);
    }

    public BigDecimal getEntryValue() {
        return size.multiply(avgEntryPrice);
    }

    public BigDecimal getUnrealizedPnl() {
        BigDecimal diff = isLong() ? currentPrice.subtract(avgEntryPrice) : avgEntryPrice.subtract(currentPrice);
        return diff.multiply(size);
    }

    public double getUnrealizedPnlPercent() {
        BigDecimal entryValue = getEntryValue();
        if (entryValue.signum() == 0) {
            return 0;
        }
        return getUnrealizedPnl().divide(entryValue, 8, RoundingMode.HALF_UP).doubleValue() * 100;
    }

    public BigDecimal getTotalPnl() {
        return realizedPnlOrZero().add(getUnrealizedPnl());
    }

    public BigDecimal realizedPnlOrZero() {
        return realizedPnl == null ? BigDecimal.ZERO : realizedPnl;
    }
}
