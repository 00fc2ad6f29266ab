package com.polymarket.edge.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Take-profit rule for one position. {@code value} is a price for FIXED and a profit
 * percent for PERCENTAGE / PARTIAL; PARTIAL closes {@code partialPercent} of the size.
 */
@Value
@Builder(toBuilder = true)
public class TakeProfitConfig {

    public enum Kind {
        FIXED,
        PERCENTAGE,
        PARTIAL
    }

    Kind kind;
    double value;
    boolean activated;
    BigDecimal triggerPrice;
    Double partialPercent;

    public static TakeProfitConfig createFixed(BigDecimal triggerPrice) {
        return TakeProfitConfig.builder().kind(Kind.FIXED).value(triggerPrice.doubleValue()).activated(true)
                .triggerPrice(triggerPrice).build();
    }

    public static TakeProfitConfig createPercentage(double profitPercent) {
        return TakeProfitConfig.builder().kind(Kind.PERCENTAGE).value(profitPercent).activated(true).build();
    }

    public static TakeProfitConfig createPartial(double profitPercent, double closePercent) {
        return TakeProfitConfig.builder().kind(Kind.PARTIAL).value(profitPercent).partialPercent(closePercent)
                .activated(true).build();
    }
}
