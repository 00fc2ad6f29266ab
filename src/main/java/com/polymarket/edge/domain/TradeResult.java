package com.polymarket.edge.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class TradeResult {
    boolean success;
    @Singular
    List<Fill> fills;
    BigDecimal totalProfit;
    String error;

    public static TradeResult success(List<Fill> fills, BigDecimal totalProfit) {
        return TradeResult.builder().success(true).fills(fills).totalProfit(totalProfit).build();
    }

    public static TradeResult failure(String error) {
        return TradeResult.builder().success(false).error(error).build();
    }

    public BigDecimal profitOrZero() {
        return totalProfit == null ? BigDecimal.ZERO : totalProfit;
    }

    /**
     * An order accepted by the venue for one leg.
     */
    @Value
    @Builder
    public static class Fill {
        String orderId;
        String marketId;
        String tokenId;
        Side side;
        BigDecimal price;
        BigDecimal size;
        String outcome;
    }
}
