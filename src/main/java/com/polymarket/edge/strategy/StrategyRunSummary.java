package com.polymarket.edge.strategy;

import lombok.Value;

/**
 * Result of one strategy in {@link StrategyContext#runAll()}: counts on success, the
 * error message otherwise.
 */
@Value
public class StrategyRunSummary {
    String strategy;
    Integer opportunities;
    Integer executed;
    String error;

    public static StrategyRunSummary completed(String strategy, int opportunities, int executed) {
        return new StrategyRunSummary(strategy, opportunities, executed, null);
    }

    public static StrategyRunSummary failed(String strategy, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new StrategyRunSummary(strategy, null, null, message);
    }

    public static StrategyRunSummary busy(String strategy) {
        return new StrategyRunSummary(strategy, null, null, "run already in progress");
    }

    public boolean isFailed() {
        return error != null;
    }
}
