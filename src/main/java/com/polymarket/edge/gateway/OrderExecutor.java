package com.polymarket.edge.gateway;

import com.polymarket.edge.domain.OrderResult;
import com.polymarket.edge.domain.Side;

import java.math.BigDecimal;

/**
 * Places and cancels limit orders. Venue rejections come back as a failed
 * {@link OrderResult}; implementations do not throw for them.
 */
public interface OrderExecutor {

    OrderResult placeLimitOrder(String tokenId, BigDecimal price, BigDecimal size, Side side);

    boolean cancelOrder(String orderId);
}
