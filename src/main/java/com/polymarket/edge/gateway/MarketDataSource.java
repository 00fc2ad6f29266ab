package com.polymarket.edge.gateway;

import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.OrderBook;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the venue: tradeable binary markets and per-token order books.
 */
public interface MarketDataSource {

    List<Market> getBinaryMarkets();

    Optional<OrderBook> getOrderBook(String tokenId);

    default Optional<BigDecimal> getBestAsk(String tokenId) {
        return getOrderBook(tokenId).flatMap(OrderBook::bestAsk);
    }

    default Optional<BigDecimal> getBestBid(String tokenId) {
        return getOrderBook(tokenId).flatMap(OrderBook::bestBid);
    }

    default Optional<BigDecimal> getMidPrice(String tokenId) {
        return getOrderBook(tokenId).flatMap(OrderBook::mid);
    }
}
