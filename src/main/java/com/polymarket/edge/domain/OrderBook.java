package com.polymarket.edge.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Data
@Builder
public class OrderBook {
    private String tokenId;

    private List<OrderLevel> bids;
    private List<OrderLevel> asks;

    @Data
    @Builder
    public static class OrderLevel {
        private BigDecimal price;
        private BigDecimal size;
    }

    // Levels arrive unsorted from the CLOB, so scan for the extreme price every time.
    public Optional<OrderLevel> bestAskLevel() {
        return asks == null ? Optional.empty() : asks.stream().min(Comparator.comparing(OrderLevel::getPrice));
    }

    public Optional<OrderLevel> bestBidLevel() {
        return bids == null ? Optional.empty() : bids.stream().max(Comparator.comparing(OrderLevel::getPrice));
    }

    public Optional<BigDecimal> bestAsk() {
        return bestAskLevel().map(OrderLevel::getPrice);
    }

    public Optional<BigDecimal> bestBid() {
        return bestBidLevel().map(OrderLevel::getPrice);
    }

    public Optional<BigDecimal> mid() {
        Optional<BigDecimal> ask = bestAsk();
        Optional<BigDecimal> bid = bestBid();
        if (ask.isPresent() && bid.isPresent()) {
            return Optional.of(ask.get().add(bid.get()).divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP));
        }
        return ask.isPresent() ? ask : bid;
    }
}
