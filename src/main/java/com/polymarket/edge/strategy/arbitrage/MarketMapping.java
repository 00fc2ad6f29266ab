package com.polymarket.edge.strategy.arbitrage;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Pins a Polymarket market to a reference event when team-name matching is not reliable.
 * {@code marketId} matches either the market id or its condition id.
 */
@Value
@Builder
public class MarketMapping {
    @NonNull
    String marketId;
    @NonNull
    String oddsEventId;
    String sportKey;
}
