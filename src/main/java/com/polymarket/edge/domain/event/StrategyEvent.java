package com.polymarket.edge.domain.event;

import com.polymarket.edge.domain.Opportunity;
import lombok.Value;

import java.time.Instant;

/**
 * Lifecycle notification from a single strategy.
 * <p>
 * Payload by type: {@link com.polymarket.edge.domain.Opportunity} for OPPORTUNITY_FOUND,
 * {@link com.polymarket.edge.domain.TradeResult} for TRADE_EXECUTED, {@link Rejection} for
 * TRADE_FAILED, {@link Failure} for ERROR and {@code null} for STARTED / STOPPED.
 */
@Value
public class StrategyEvent {
    StrategyEventType type;
    String strategyName;
    Object payload;
    Instant timestamp;

    public static StrategyEvent of(StrategyEventType type, String strategyName, Object payload) {
        return new StrategyEvent(type, strategyName, payload, Instant.now());
    }

    /**
     * Error payload. {@code opportunity} is null when the failure happened outside the
     * per-opportunity loop (e.g. during scan).
     */
    @Value
    public static class Failure {
        Opportunity opportunity;
        Throwable error;

        public String describe() {
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            return opportunity == null ? message : opportunity.getId() + ": " + message;
        }
    }

    /** An execution the venue or the strategy turned down. */
    @Value
    public static class Rejection {
        Opportunity opportunity;
        String reason;

        public String describe() {
            return opportunity.getId() + ": " + (reason != null ? reason : "no result");
        }
    }
}
