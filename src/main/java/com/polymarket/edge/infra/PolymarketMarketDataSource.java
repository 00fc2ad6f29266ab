package com.polymarket.edge.infra;

import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.exception.PolymarketApiException;
import com.polymarket.edge.gateway.MarketDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Markets come from the ingested snapshot; order books are always fetched live so that
 * pre-execution revalidation sees current prices.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolymarketMarketDataSource implements MarketDataSource {

    private final MarketSnapshotCache cache;
    private final PolymarketApiClient apiClient;

    @Override
    public List<Market> getBinaryMarkets() {
        return cache.getBinaryMarkets();
    }

    @Override
    public Optional<OrderBook> getOrderBook(String tokenId) {
        try {
            return Optional.of(apiClient.getOrderBook(tokenId));
        } catch (PolymarketApiException e) {
            log.warn("[MarketData] Order book unavailable for {}: {}", tokenId, e.getMessage());
            return Optional.empty();
        }
    }
}
