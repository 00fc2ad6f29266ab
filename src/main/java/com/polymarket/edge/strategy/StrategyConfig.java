package com.polymarket.edge.strategy;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Read-only view of a strategy's configuration. {@code maxConcurrentTrades} caps the
 * executions of a single run, {@code maxDailyTrades} the executions per calendar day;
 * null means unlimited.
 */
@Value
@Builder
public class StrategyConfig {
    boolean enabled;
    Integer maxConcurrentTrades;
    Integer maxDailyTrades;
    Map<String, Object> params;

    /** Partial update. Null fields are left alone; params are merged key by key. */
    @Value
    @Builder
    public static class Update {
        Boolean enabled;
        Integer maxConcurrentTrades;
        Integer maxDailyTrades;
        @Singular
        Map<String, Object> params;

        public static Update enabled(boolean enabled) {
            return Update.builder().enabled(enabled).build();
        }
    }
}
