package com.polymarket.edge.infra;

import com.polymarket.edge.domain.Market;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Latest ingested snapshot of every market, books included, keyed by market id.
 */
@Component
public class MarketSnapshotCache {

    private final ConcurrentHashMap<String, Market> markets = new ConcurrentHashMap<>();
    private volatile Instant lastRefresh;

    public void updateMarket(Market market) {
        markets.put(market.getMarketId(), market);
    }

    public Optional<Market> getMarket(String marketId) {
        return Optional.ofNullable(markets.get(marketId));
    }

    public Collection<Market> getAllMarkets() {
        return List.copyOf(markets.values());
    }

    public List<Market> getBinaryMarkets() {
        return markets.values().stream()
                .filter(Market::isBinary)
                .collect(Collectors.toList());
    }

    /** Drops markets that were not seen in the refresh that started at {@code refreshStart}. */
    public int retainSince(Instant refreshStart) {
        int before = markets.size();
        markets.values().removeIf(m -> m.getLastUpdated() == null || m.getLastUpdated().isBefore(refreshStart));
        lastRefresh = refreshStart;
        return before - markets.size();
    }

    public Optional<Instant> getLastRefresh() {
        return Optional.ofNullable(lastRefresh);
    }

    public int size() {
        return markets.size();
    }

    public void clear() {
        markets.clear();
    }
}
