package com.polymarket.edge.domain;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A detected, time-boxed trading signal made of one or more {@link Leg legs}.
 * <p>
 * Status moves PENDING → EXECUTING → EXECUTED | FAILED, or PENDING → EXPIRED | SKIPPED.
 * The transition methods only set the status; stats and notifications are driven by
 * the strategy runner. Instances are never purged here, see {@code OpportunityBook}.
 */
@Getter
public class Opportunity {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String id;
    private final OpportunityType type;
    private final List<Leg> legs;
    private final BigDecimal expectedProfit;
    private final double expectedProfitPercent;
    private final double confidence;
    private final Instant expiresAt;
    private final Instant createdAt;
    private final Map<String, Object> metadata;

    private volatile OpportunityStatus status;

    public Opportunity(String id, OpportunityType type, List<Leg> legs, BigDecimal expectedProfit,
            double expectedProfitPercent, double confidence, OpportunityStatus status, Instant expiresAt,
            Instant createdAt, Map<String, Object> metadata) {
        if (legs == null || legs.isEmpty()) {
            throw new IllegalArgumentException("Opportunity " + id + " must have at least one leg");
        }
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.legs = List.copyOf(legs);
        this.expectedProfit = Objects.requireNonNull(expectedProfit, "expectedProfit");
        this.expectedProfitPercent = expectedProfitPercent;
        this.confidence = clamp(confidence);
        this.status = status == null ? OpportunityStatus.PENDING : status;
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.metadata = metadata == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Buy both outcomes of a binary market whose prices sum below 1. Exactly one
     * outcome pays 1 per share, so profit per share is {@code 1 - (yes + no)}.
     */
    public static Opportunity crossMarket(String marketId, String yesTokenId, String noTokenId,
            BigDecimal yesPrice, BigDecimal noPrice, BigDecimal size, Duration ttl) {
        BigDecimal sumPrice = yesPrice.add(noPrice);
        BigDecimal totalCost = size.multiply(sumPrice);
        BigDecimal profit = size.subtract(totalCost);
        double profitPercent = totalCost.signum() == 0 ? 0
                : profit.doubleValue() / totalCost.doubleValue() * 100;

        List<Leg> legs = List.of(
                Leg.builder().marketId(marketId).tokenId(yesTokenId).side(Side.BUY).price(yesPrice).size(size).build(),
                Leg.builder().marketId(marketId).tokenId(noTokenId).side(Side.BUY).price(noPrice).size(size).build());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("yesPrice", yesPrice);
        metadata.put("noPrice", noPrice);
        metadata.put("sumPrice", sumPrice);
        metadata.put("spread", BigDecimal.ONE.subtract(sumPrice));

        Instant now = Instant.now();
        return new Opportunity(newId(), OpportunityType.CROSS_MARKET, legs, profit, profitPercent,
                Math.min(1, Math.abs(profitPercent) / 10), OpportunityStatus.PENDING, now.plus(ttl), now, metadata);
    }

    /**
     * Single-leg mean reversion bet: buy below the mean, sell above it. Expected
     * profit assumes the price fully reverts to the mean.
     */
    public static Opportunity deviation(String marketId, String tokenId, BigDecimal currentPrice, double meanPrice,
            double stdDev, double zScore, BigDecimal size, Duration ttl) {
        Side side = zScore < 0 ? Side.BUY : Side.SELL;
        BigDecimal expectedMove = BigDecimal.valueOf(Math.abs(currentPrice.doubleValue() - meanPrice));
        BigDecimal profit = size.multiply(expectedMove).setScale(6, RoundingMode.HALF_UP);
        BigDecimal cost = size.multiply(currentPrice);
        double profitPercent = cost.signum() == 0 ? 0 : profit.doubleValue() / cost.doubleValue() * 100;

        Leg leg = Leg.builder().marketId(marketId).tokenId(tokenId).side(side).price(currentPrice).size(size).build();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("meanPrice", meanPrice);
        metadata.put("stdDev", stdDev);
        metadata.put("zScore", zScore);
        metadata.put("expectedReversion", meanPrice);

        Instant now = Instant.now();
        return new Opportunity(newId(), OpportunityType.DEVIATION, List.of(leg), profit, profitPercent,
                Math.min(1, Math.abs(zScore) / 3), OpportunityStatus.PENDING, now.plus(ttl), now, metadata);
    }

    /**
     * Value bet against a reference bookmaker: buy an outcome priced below its
     * vig-free fair probability. {@code stake} is the currency amount committed.
     */
    public static Opportunity eventArbitrage(String marketId, String tokenId, BigDecimal marketPrice,
            double fairProbability, double edge, double expectedValue, double confidence, BigDecimal stake,
            Duration ttl, Map<String, Object> extra) {
        BigDecimal shares = stake.divide(marketPrice, 0, RoundingMode.FLOOR);
        BigDecimal profit = stake.multiply(BigDecimal.valueOf(expectedValue)).setScale(6, RoundingMode.HALF_UP);

        Leg leg = Leg.builder().marketId(marketId).tokenId(tokenId).side(Side.BUY).price(marketPrice).size(shares)
                .build();

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (extra != null) {
            metadata.putAll(extra);
        }
        metadata.put("fairProbability", fairProbability);
        metadata.put("marketPrice", marketPrice);
        metadata.put("edge", edge);
        metadata.put("expectedValue", expectedValue);

        Instant now = Instant.now();
        return new Opportunity(newId(), OpportunityType.EVENT_ARBITRAGE, List.of(leg), profit, expectedValue * 100,
                confidence, OpportunityStatus.PENDING, now.plus(ttl), now, metadata);
    }

    public boolean isValid() {
        return isValidAt(Instant.now());
    }

    public boolean isValidAt(Instant now) {
        return status == OpportunityStatus.PENDING && expiresAt.isAfter(now);
    }

    /** Time-based only; an executed opportunity still reports expired once it ages out. */
    public boolean isExpired() {
        return isExpiredAt(Instant.now());
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isProfitable(BigDecimal minProfit, double minProfitPercent) {
        return expectedProfit.compareTo(minProfit) >= 0 && expectedProfitPercent >= minProfitPercent;
    }

    public List<String> getMarketIds() {
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        legs.forEach(l -> ids.add(l.getMarketId()));
        return List.copyOf(ids);
    }

    public List<String> getTokenIds() {
        return legs.stream().map(Leg::getTokenId).toList();
    }

    /** Cash outlay of the BUY legs. */
    public BigDecimal getTotalCost() {
        return legs.stream()
                .filter(l -> l.getSide().isBuy())
                .map(Leg::notional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Price of one unit of the whole position: the sum of BUY leg prices, or the
     * first leg's price when the opportunity only sells.
     */
    public BigDecimal getUnitPrice() {
        BigDecimal buyPrice = legs.stream()
                .filter(l -> l.getSide().isBuy())
                .map(Leg::getPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return buyPrice.signum() > 0 ? buyPrice : legs.get(0).getPrice();
    }

    public void markExecuting() {
        status = OpportunityStatus.EXECUTING;
    }

    public void markExecuted() {
        status = OpportunityStatus.EXECUTED;
    }

    public void markFailed() {
        status = OpportunityStatus.FAILED;
    }

    public void markExpired() {
        status = OpportunityStatus.EXPIRED;
    }

    public void markSkipped() {
        status = OpportunityStatus.SKIPPED;
    }

    @Override
    public String toString() {
        return "Opportunity{" + id + ", " + type + ", " + status + ", profit=" + expectedProfit
                + ", confidence=" + String.format("%.2f", confidence) + ", legs=" + legs.size() + "}";
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0;
        }
        return Math.max(0, Math.min(1, confidence));
    }

    private static String newId() {
        return "opp_" + UUID.randomUUID();
    }
}
