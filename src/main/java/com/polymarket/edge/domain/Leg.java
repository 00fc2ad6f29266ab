package com.polymarket.edge.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One side of a trade: an intent to buy or sell {@code size} shares of a single
 * outcome token at {@code price}.
 */
@Value
@Builder
public class Leg {
    @NonNull
    String marketId;
    @NonNull
    String tokenId;
    @NonNull
    Side side;
    @NonNull
    BigDecimal price;
    @NonNull
    BigDecimal size;

    public BigDecimal notional() {
        return price.multiply(size);
    }
}
