package com.polymarket.edge.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Stop-loss rule for one position. {@code value} is a price for FIXED and a percent
 * for PERCENTAGE / TRAILING. A trailing stop caches its ratcheted trigger in
 * {@code triggerPrice}.
 */
@Value
@Builder(toBuilder = true)
public class StopLossConfig {

    public enum Kind {
        FIXED,
        PERCENTAGE,
        TRAILING
    }

    Kind kind;
    double value;
    boolean activated;
    BigDecimal triggerPrice;
    Double trailingOffset;

    public static StopLossConfig createFixed(BigDecimal triggerPrice) {
        return StopLossConfig.builder().kind(Kind.FIXED).value(triggerPrice.doubleValue()).activated(true)
                .triggerPrice(triggerPrice).build();
    }

    public static StopLossConfig createPercentage(double lossPercent) {
        return StopLossConfig.builder().kind(Kind.PERCENTAGE).value(lossPercent).activated(true).build();
    }

    public static StopLossConfig createTrailing(double trailingPercent) {
        return StopLossConfig.builder().kind(Kind.TRAILING).value(trailingPercent).trailingOffset(trailingPercent)
                .activated(true).build();
    }

    public double effectiveTrailingOffset() {
        return trailingOffset != null ? trailingOffset : value;
    }

    public StopLossConfig withTriggerPrice(BigDecimal price) {
        return toBuilder().triggerPrice(price).build();
    }
}
