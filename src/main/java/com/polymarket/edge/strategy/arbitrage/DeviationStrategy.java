package com.polymarket.edge.strategy.arbitrage;

import com.polymarket.edge.domain.Leg;
import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityType;
import com.polymarket.edge.domain.OrderResult;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.gateway.OrderExecutor;
import com.polymarket.edge.strategy.StrategyLogic;
import com.polymarket.edge.strategy.StrategyParams;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mean reversion on watched tokens. Every scan samples the mid price of each watched
 * token into a rolling window; once the window holds {@code minSampleSize} prices a
 * z-score beyond {@code entryZScore} is traded back toward the mean (BUY below, SELL
 * above). {@link #shouldExit(String)} reports when |z| has fallen under
 * {@code exitZScore}, which must stay strictly below the entry threshold.
 */
@Slf4j
public class DeviationStrategy implements StrategyLogic {

    public static final String NAME = "price-deviation";
    public static final String TYPE = "mean-reversion";

    public static final String ENTRY_Z_SCORE = "entryZScore";
    public static final String EXIT_Z_SCORE = "exitZScore";
    public static final String LOOKBACK_PERIOD = "lookbackPeriod";
    public static final String MIN_SAMPLE_SIZE = "minSampleSize";
    public static final String MAX_POSITIONS = "maxPositions";
    public static final String TTL_SECONDS = "ttlSeconds";

    private final MarketDataSource marketData;
    private final OrderExecutor orderExecutor;
    private final Clock clock;
    private final Map<String, PriceStats> stats = new ConcurrentHashMap<>();
    private final StrategyParams params = new StrategyParams(Map.of(
            ENTRY_Z_SCORE, 2.0,
            EXIT_Z_SCORE, 0.5,
            LOOKBACK_PERIOD, 100,
            MIN_SAMPLE_SIZE, 20,
            MAX_POSITIONS, 5,
            TTL_SECONDS, 60,
            StrategyParams.AVAILABLE_CAPITAL, 100));

    public DeviationStrategy(MarketDataSource marketData, OrderExecutor orderExecutor) {
        this(marketData, orderExecutor, Clock.systemUTC());
    }

    public DeviationStrategy(MarketDataSource marketData, OrderExecutor orderExecutor, Clock clock) {
        this.marketData = marketData;
        this.orderExecutor = orderExecutor;
        this.clock = clock;
        checkParams(params);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public StrategyParams params() {
        return params;
    }

    public void watchToken(String tokenId, String marketId) {
        stats.computeIfAbsent(tokenId, id -> new PriceStats(id, marketId));
    }

    public void unwatchToken(String tokenId) {
        stats.remove(tokenId);
    }

    public boolean isWatching(String tokenId) {
        return stats.containsKey(tokenId);
    }

    /** Adds one sample, watching the token first if needed. */
    public void updatePrice(String tokenId, String marketId, double price) {
        PriceStats s = stats.computeIfAbsent(tokenId, id -> new PriceStats(id, marketId));
        synchronized (s) {
            s.add(price, params.getInt(LOOKBACK_PERIOD, 100), clock.instant());
        }
    }

    public Optional<PriceStats> getPriceStats(String tokenId) {
        return Optional.ofNullable(stats.get(tokenId));
    }

    @Override
    public List<Opportunity> scan() {
        sampleWatchedTokens();

        double entry = params.getDouble(ENTRY_Z_SCORE, 2.0);
        int minSamples = params.getInt(MIN_SAMPLE_SIZE, 20);
        int maxPositions = params.getInt(MAX_POSITIONS, 5);
        BigDecimal capital = params.getDecimal(StrategyParams.AVAILABLE_CAPITAL, BigDecimal.valueOf(100));
        Duration ttl = Duration.ofSeconds(params.getInt(TTL_SECONDS, 60));

        List<Opportunity> opportunities = new ArrayList<>();
        for (PriceStats s : stats.values()) {
            if (opportunities.size() >= maxPositions) {
                break;
            }
            double price;
            double mean;
            double stdDev;
            double z;
            synchronized (s) {
                if (s.getSampleSize() < minSamples) {
                    continue;
                }
                price = s.getLastPrice();
                mean = s.getMean();
                stdDev = s.getStdDev();
                z = s.getZScore();
            }
            if (Math.abs(z) < entry || !(price > 0)) {
                continue;
            }

            BigDecimal currentPrice = BigDecimal.valueOf(price);
            BigDecimal size = capital.divide(currentPrice, 0, RoundingMode.FLOOR);
            if (size.signum() <= 0) {
                continue;
            }
            Opportunity opportunity = Opportunity.deviation(s.getMarketId(), s.getTokenId(), currentPrice, mean,
                    stdDev, z, size, ttl);
            opportunities.add(opportunity);
            log.info("[{}] Found deviation: token={} z={} price={} mean={} side={}", NAME, abbreviate(s.getTokenId()),
                    String.format("%.2f", z), String.format("%.4f", price), String.format("%.4f", mean),
                    opportunity.getLegs().get(0).getSide());
        }
        return opportunities;
    }

    private void sampleWatchedTokens() {
        for (PriceStats s : stats.values()) {
            try {
                marketData.getMidPrice(s.getTokenId())
                        .ifPresent(mid -> updatePrice(s.getTokenId(), s.getMarketId(), mid.doubleValue()));
            } catch (RuntimeException e) {
                log.error("[{}] Failed to sample price of {}", NAME, abbreviate(s.getTokenId()), e);
            }
        }
    }

    @Override
    public TradeResult execute(Opportunity opportunity) {
        if (opportunity.getType() != OpportunityType.DEVIATION) {
            return TradeResult.failure("Invalid opportunity type for this strategy: " + opportunity.getType());
        }
        if (opportunity.getLegs().size() != 1) {
            return TradeResult.failure("Deviation strategy requires exactly 1 leg");
        }

        opportunity.markExecuting();
        Leg leg = opportunity.getLegs().get(0);
        try {
            log.info("[{}] Placing {} order: {} @ {}", NAME, leg.getSide(), leg.getSize(), leg.getPrice());
            OrderResult order = orderExecutor.placeLimitOrder(leg.getTokenId(), leg.getPrice(), leg.getSize(),
                    leg.getSide());
            if (!order.isSuccess()) {
                opportunity.markFailed();
                return TradeResult.failure("Failed to place order: " + order.getErrorMsg());
            }
            opportunity.markExecuted();
            log.info("[{}] Deviation trade executed, expected profit ${}", NAME,
                    opportunity.getExpectedProfit().setScale(2, RoundingMode.HALF_UP));
            return TradeResult.builder()
                    .success(true)
                    .fill(TradeResult.Fill.builder()
                            .orderId(order.getOrderId())
                            .marketId(leg.getMarketId())
                            .tokenId(leg.getTokenId())
                            .side(leg.getSide())
                            .price(leg.getPrice())
                            .size(leg.getSize())
                            .build())
                    .totalProfit(opportunity.getExpectedProfit())
                    .build();
        } catch (RuntimeException e) {
            opportunity.markFailed();
            log.error("[{}] Execution failed for {}", NAME, opportunity.getId(), e);
            return TradeResult.failure(e.getMessage());
        }
    }

    /** The deviation must still be at or beyond the entry threshold. */
    @Override
    public boolean validateOpportunity(Opportunity opportunity, Instant now) {
        if (!opportunity.isValidAt(now)) {
            return false;
        }
        PriceStats s = stats.get(opportunity.getLegs().get(0).getTokenId());
        if (s == null) {
            return false;
        }
        double z;
        synchronized (s) {
            z = s.getZScore();
        }
        return Math.abs(z) >= params.getDouble(ENTRY_Z_SCORE, 2.0);
    }

    /** True once the price has reverted to within {@code exitZScore} of the mean. */
    public boolean shouldExit(String tokenId) {
        PriceStats s = stats.get(tokenId);
        if (s == null) {
            return false;
        }
        synchronized (s) {
            if (s.getSampleSize() < params.getInt(MIN_SAMPLE_SIZE, 20)) {
                return false;
            }
            return Math.abs(s.getZScore()) < params.getDouble(EXIT_Z_SCORE, 0.5);
        }
    }

    @Override
    public void checkParams(StrategyParams candidate) {
        double entry = candidate.getDouble(ENTRY_Z_SCORE, 2.0);
        double exit = candidate.getDouble(EXIT_Z_SCORE, 0.5);
        if (!(entry > 0) || exit < 0) {
            throw new IllegalArgumentException("z-score thresholds must be positive: entry=" + entry + " exit=" + exit);
        }
        if (exit >= entry) {
            throw new IllegalArgumentException(
                    "exitZScore " + exit + " must be strictly below entryZScore " + entry);
        }
        if (candidate.getInt(LOOKBACK_PERIOD, 100) < candidate.getInt(MIN_SAMPLE_SIZE, 20)) {
            throw new IllegalArgumentException("lookbackPeriod must be at least minSampleSize");
        }
    }

    private static String abbreviate(String tokenId) {
        return tokenId.length() > 8 ? tokenId.substring(0, 8) + "..." : tokenId;
    }
}
