package com.polymarket.edge.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Venue response to a limit order. A rejected order is a normal result, not an exception.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderResult {
    boolean success;
    String orderId;
    String errorMsg;

    public static OrderResult accepted(String orderId) {
        return new OrderResult(true, orderId, null);
    }

    public static OrderResult rejected(String errorMsg) {
        return new OrderResult(false, null, errorMsg);
    }
}
