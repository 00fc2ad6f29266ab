package com.polymarket.edge.domain;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@ToString
public class Market {
    private String marketId;
    private String conditionId;
    private String question;
    private List<String> outcomeIds; // [YES, NO] token ids for binary markets
    private boolean active;
    private boolean closed;
    private boolean acceptingOrders;
    private BigDecimal liquidity;
    private BigDecimal volume;
    private Instant lastUpdated;

    private OrderBook yesOrderBook;
    private OrderBook noOrderBook;

    public boolean isBinary() {
        return outcomeIds != null && outcomeIds.size() == 2;
    }

    public boolean isTradeable() {
        return active && !closed && acceptingOrders;
    }

    public String getYesTokenId() {
        return isBinary() ? outcomeIds.get(0) : null;
    }

    public String getNoTokenId() {
        return isBinary() ? outcomeIds.get(1) : null;
    }
}
