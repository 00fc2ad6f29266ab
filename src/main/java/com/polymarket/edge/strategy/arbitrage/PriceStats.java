package com.polymarket.edge.strategy.arbitrage;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling price window of one token with population mean and standard deviation.
 * Not thread-safe; {@link DeviationStrategy} synchronizes on the instance.
 */
public class PriceStats {

    private final String tokenId;
    private final String marketId;
    private final Deque<Double> window = new ArrayDeque<>();
    private double lastPrice = Double.NaN;
    private Instant lastUpdated;

    public PriceStats(String tokenId, String marketId) {
        this.tokenId = tokenId;
        this.marketId = marketId;
    }

    /** Appends a sample and drops the oldest ones beyond {@code lookback}. */
    public void add(double price, int lookback, Instant at) {
        window.addLast(price);
        while (window.size() > Math.max(1, lookback)) {
            window.removeFirst();
        }
        lastPrice = price;
        lastUpdated = at;
    }

    public int getSampleSize() {
        return window.size();
    }

    public double getMean() {
        if (window.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0;
        for (double p : window) {
            sum += p;
        }
        return sum / window.size();
    }

    public double getStdDev() {
        if (window.isEmpty()) {
            return Double.NaN;
        }
        double mean = getMean();
        double squares = 0;
        for (double p : window) {
            squares += (p - mean) * (p - mean);
        }
        return Math.sqrt(squares / window.size());
    }

    /** z-score of the latest sample; 0 for a flat window. */
    public double getZScore() {
        double stdDev = getStdDev();
        if (window.isEmpty() || !(stdDev > 0)) {
            return 0;
        }
        return (lastPrice - getMean()) / stdDev;
    }

    public String getTokenId() {
        return tokenId;
    }

    public String getMarketId() {
        return marketId;
    }

    public double getLastPrice() {
        return lastPrice;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }
}
