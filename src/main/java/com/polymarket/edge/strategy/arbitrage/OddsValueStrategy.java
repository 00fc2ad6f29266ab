package com.polymarket.edge.strategy.arbitrage;

import com.polymarket.edge.domain.Leg;
import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityType;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.domain.OrderResult;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.domain.odds.OddsEvent;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.gateway.OddsReferenceSource;
import com.polymarket.edge.gateway.OrderExecutor;
import com.polymarket.edge.sizing.SizingRequest;
import com.polymarket.edge.strategy.StrategyLogic;
import com.polymarket.edge.strategy.StrategyParams;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Value betting against a sharp reference bookmaker. The reference h2h odds are turned
 * into fair probabilities; a Polymarket outcome priced at least {@code minEdge} below its
 * fair probability is bought.
 * <p>
 * YES is compared with the home team, NO with the away team. Markets are paired with
 * reference events through explicit {@link MarketMapping}s first, then by team names in
 * the market question.
 */
@Slf4j
public class OddsValueStrategy implements StrategyLogic {

    public static final String NAME = "odds-value";
    public static final String TYPE = "value";

    public static final String MIN_EDGE = "minEdge";
    public static final String CONFIDENCE_THRESHOLD = "confidenceThreshold";
    public static final String MAX_POSITION_SIZE = "maxPositionSize";
    public static final String TTL_SECONDS = "ttlSeconds";

    static final Duration CACHE_TTL = Duration.ofMinutes(5);
    static final Duration EMPTY_CACHE_TTL = Duration.ofMinutes(30);

    private final MarketDataSource marketData;
    private final OddsReferenceSource oddsSource;
    private final OrderExecutor orderExecutor;
    private final List<String> sportKeys;
    private final Clock clock;

    private final List<MarketMapping> mappings = new CopyOnWriteArrayList<>();
    private final Map<String, CachedOdds> oddsCache = new ConcurrentHashMap<>();
    private final StrategyParams params = new StrategyParams(Map.of(
            MIN_EDGE, 0.02,
            CONFIDENCE_THRESHOLD, 0.6,
            MAX_POSITION_SIZE, 100,
            TTL_SECONDS, 300,
            StrategyParams.AVAILABLE_CAPITAL, 100));

    public OddsValueStrategy(MarketDataSource marketData, OddsReferenceSource oddsSource,
            OrderExecutor orderExecutor, List<String> sportKeys) {
        this(marketData, oddsSource, orderExecutor, sportKeys, Clock.systemUTC());
    }

    public OddsValueStrategy(MarketDataSource marketData, OddsReferenceSource oddsSource,
            OrderExecutor orderExecutor, List<String> sportKeys, Clock clock) {
        this.marketData = marketData;
        this.oddsSource = oddsSource;
        this.orderExecutor = orderExecutor;
        this.sportKeys = List.copyOf(sportKeys);
        this.clock = clock;
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

    @Override
    public List<Opportunity> scan() {
        List<Market> markets;
        try {
            markets = marketData.getBinaryMarkets().stream()
                    .filter(m -> m.isBinary() && m.isTradeable() && m.getQuestion() != null)
                    .toList();
        } catch (RuntimeException e) {
            log.error("[{}] Failed to load markets", NAME, e);
            return List.of();
        }
        if (markets.isEmpty()) {
            log.debug("[{}] No tradeable markets", NAME);
            return List.of();
        }

        List<Opportunity> opportunities = new ArrayList<>();
        for (String sportKey : sportKeys) {
            List<OddsEvent> events;
            try {
                events = cachedEvents(sportKey);
            } catch (RuntimeException e) {
                log.error("[{}] Failed to fetch reference odds for {}", NAME, sportKey, e);
                continue;
            }

            int matched = 0;
            for (OddsEvent event : events) {
                List<FairProbability> fair = FairProbabilityCalculator.calculate(event.getOutcomes());
                if (fair.size() < 2) {
                    continue;
                }
                Optional<Market> market = findMatchingMarket(event, markets);
                if (market.isEmpty()) {
                    continue;
                }
                matched++;
                findValue(market.get(), event, fair).ifPresent(opportunities::add);
            }
            log.debug("[{}] [{}] matched {}/{} reference events", NAME, sportKey, matched, events.size());
        }

        if (!opportunities.isEmpty()) {
            log.info("[{}] Found {} value opportunities", NAME, opportunities.size());
        }
        return opportunities;
    }

    List<OddsEvent> cachedEvents(String sportKey) {
        Instant now = clock.instant();
        CachedOdds cached = oddsCache.get(sportKey);
        if (cached != null) {
            Duration ttl = cached.events.isEmpty() ? EMPTY_CACHE_TTL : CACHE_TTL;
            if (cached.fetchedAt.plus(ttl).isAfter(now)) {
                return cached.events;
            }
        }
        List<OddsEvent> events = List.copyOf(oddsSource.getEvents(sportKey));
        oddsCache.put(sportKey, new CachedOdds(events, now));
        return events;
    }

    /**
     * An explicit mapping always wins, even when its market is not in the current list.
     * Otherwise the market whose question names a team outright beats one that only
     * shares a word of a team name; the first such market is taken.
     */
    Optional<Market> findMatchingMarket(OddsEvent event, List<Market> markets) {
        for (MarketMapping mapping : mappings) {
            if (mapping.getOddsEventId().equals(event.getId())) {
                return markets.stream()
                        .filter(m -> mapping.getMarketId().equals(m.getMarketId())
                                || mapping.getMarketId().equals(m.getConditionId()))
                        .findFirst();
            }
        }

        List<String> teams = new ArrayList<>(2);
        if (event.getHomeTeam() != null) {
            teams.add(event.getHomeTeam().toLowerCase(Locale.ROOT));
        }
        if (event.getAwayTeam() != null) {
            teams.add(event.getAwayTeam().toLowerCase(Locale.ROOT));
        }

        Market best = null;
        int bestScore = 0;
        for (Market market : markets) {
            String question = market.getQuestion().toLowerCase(Locale.ROOT);
            int score = 0;
            for (String team : teams) {
                if (question.contains(team)) {
                    score = 2;
                    break;
                }
                if (fuzzyMatch(question, team)) {
                    score = 1;
                }
            }
            if (score > bestScore) {
                best = market;
                bestScore = score;
            }
        }
        if (best == null) {
            log.debug("[{}] Unmatched: {} vs {}", NAME, event.getHomeTeam(), event.getAwayTeam());
        }
        return Optional.ofNullable(best);
    }

    // Matches on any word of the team name longer than three letters ("lakers" in "los angeles lakers").
    private static boolean fuzzyMatch(String text, String team) {
        for (String part : team.split(" ")) {
            if (part.length() > 3 && text.contains(part)) {
                return true;
            }
        }
        return false;
    }

    private Optional<Opportunity> findValue(Market market, OddsEvent event, List<FairProbability> fair) {
        FairProbability home = outcomeFor(fair, event.getHomeTeam()).orElse(fair.get(0));
        FairProbability away = outcomeFor(fair, event.getAwayTeam()).orElse(fair.get(1));
        double minEdge = params.getDouble(MIN_EDGE, 0.02);

        Optional<BigDecimal> yesPrice = ask(market.getYesOrderBook(), market.getYesTokenId());
        if (yesPrice.isPresent()) {
            double edge = home.getFairProbability() - yesPrice.get().doubleValue();
            if (edge >= minEdge) {
                return createOpportunity(market, market.getYesTokenId(), "Yes", yesPrice.get(), home, edge, event);
            }
        }

        Optional<BigDecimal> noPrice = ask(market.getNoOrderBook(), market.getNoTokenId());
        if (noPrice.isPresent()) {
            double edge = away.getFairProbability() - noPrice.get().doubleValue();
            if (edge >= minEdge) {
                return createOpportunity(market, market.getNoTokenId(), "No", noPrice.get(), away, edge, event);
            }
        }
        return Optional.empty();
    }

    private static Optional<FairProbability> outcomeFor(List<FairProbability> fair, String team) {
        if (team == null) {
            return Optional.empty();
        }
        String needle = team.toLowerCase(Locale.ROOT);
        return fair.stream()
                .filter(p -> p.getOutcome() != null && p.getOutcome().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    private Optional<BigDecimal> ask(OrderBook book, String tokenId) {
        if (book != null) {
            Optional<BigDecimal> ask = book.bestAsk();
            if (ask.isPresent()) {
                return ask;
            }
        }
        return marketData.getBestAsk(tokenId);
    }

    private Optional<Opportunity> createOpportunity(Market market, String tokenId, String outcome, BigDecimal price,
            FairProbability fair, double edge, OddsEvent event) {
        if (price.signum() <= 0 || price.compareTo(BigDecimal.ONE) >= 0) {
            return Optional.empty();
        }
        BigDecimal maxPosition = params.getDecimal(MAX_POSITION_SIZE, BigDecimal.valueOf(100));
        BigDecimal stake = maxPosition.multiply(BigDecimal.valueOf(edge * 10)).min(maxPosition);
        if (stake.divide(price, 0, RoundingMode.FLOOR).signum() <= 0) {
            log.debug("[{}] Stake {} too small for one share at {}", NAME, stake, price);
            return Optional.empty();
        }

        double expectedValue = fair.getFairProbability() / price.doubleValue() - 1;
        double confidence = FairProbabilityCalculator.confidence(edge, fair.getOverround());

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("outcome", outcome);
        extra.put("oddsEventId", event.getId());
        extra.put("homeTeam", event.getHomeTeam());
        extra.put("awayTeam", event.getAwayTeam());
        extra.put("sport", event.getSportKey());
        extra.put("overround", fair.getOverround());

        Opportunity opportunity = Opportunity.eventArbitrage(market.getMarketId(), tokenId, price,
                fair.getFairProbability(), edge, expectedValue, confidence, stake,
                Duration.ofSeconds(params.getInt(TTL_SECONDS, 300)), extra);
        log.info("[{}] Value on {} {}: price={} fair={} edge={}%", NAME, event.getHomeTeam() + " vs "
                + event.getAwayTeam(), outcome, price, String.format("%.4f", fair.getFairProbability()),
                String.format("%.2f", edge * 100));
        return Optional.of(opportunity);
    }

    /** Kelly is fed the fair probability rather than the blended confidence. */
    @Override
    public SizingRequest sizingRequest(Opportunity opportunity) {
        Object fair = opportunity.getMetadata().get("fairProbability");
        SizingRequest base = StrategyLogic.super.sizingRequest(opportunity);
        if (fair instanceof Number) {
            return base.toBuilder().winProbability(((Number) fair).doubleValue()).build();
        }
        return base;
    }

    @Override
    public TradeResult execute(Opportunity opportunity) {
        if (opportunity.getType() != OpportunityType.EVENT_ARBITRAGE) {
            return TradeResult.failure("Invalid opportunity type for this strategy: " + opportunity.getType());
        }
        if (opportunity.isExpiredAt(clock.instant())) {
            opportunity.markExpired();
            return TradeResult.failure("Opportunity expired");
        }
        double threshold = params.getDouble(CONFIDENCE_THRESHOLD, 0.6);
        if (opportunity.getConfidence() < threshold) {
            opportunity.markSkipped();
            return TradeResult.failure(String.format(Locale.ROOT, "Confidence %.2f below threshold %s",
                    opportunity.getConfidence(), threshold));
        }

        Leg leg = opportunity.getLegs().get(0);
        opportunity.markExecuting();
        try {
            log.info("[{}] Buying {} @ {} (edge {})", NAME, leg.getSize(), leg.getPrice(),
                    opportunity.getMetadata().get("edge"));
            OrderResult order = orderExecutor.placeLimitOrder(leg.getTokenId(), leg.getPrice(), leg.getSize(),
                    leg.getSide());
            if (!order.isSuccess()) {
                opportunity.markFailed();
                return TradeResult.failure("Failed to place order: " + order.getErrorMsg());
            }
            opportunity.markExecuted();
            return TradeResult.builder()
                    .success(true)
                    .fill(TradeResult.Fill.builder()
                            .orderId(order.getOrderId())
                            .marketId(leg.getMarketId())
                            .tokenId(leg.getTokenId())
                            .side(leg.getSide())
                            .price(leg.getPrice())
                            .size(leg.getSize())
                            .outcome(String.valueOf(opportunity.getMetadata().get("outcome")))
                            .build())
                    .totalProfit(opportunity.getExpectedProfit())
                    .build();
        } catch (RuntimeException e) {
            opportunity.markFailed();
            log.error("[{}] Execution failed for {}", NAME, opportunity.getId(), e);
            return TradeResult.failure(e.getMessage());
        }
    }

    @Override
    public void checkParams(StrategyParams candidate) {
        double threshold = candidate.getDouble(CONFIDENCE_THRESHOLD, 0.6);
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]: " + threshold);
        }
        if (candidate.getDouble(MIN_EDGE, 0.02) <= 0) {
            throw new IllegalArgumentException("minEdge must be positive");
        }
    }

    public void addMarketMapping(MarketMapping mapping) {
        mappings.add(mapping);
        log.info("[{}] Added mapping {} -> {}", NAME, mapping.getMarketId(), mapping.getOddsEventId());
    }

    public void removeMarketMapping(String marketId) {
        mappings.removeIf(m -> m.getMarketId().equals(marketId));
    }

    public List<MarketMapping> getMarketMappings() {
        return List.copyOf(mappings);
    }

    public Set<String> getCachedSports() {
        return Set.copyOf(oddsCache.keySet());
    }

    public List<String> getSportKeys() {
        return sportKeys;
    }

    private static final class CachedOdds {
        private final List<OddsEvent> events;
        private final Instant fetchedAt;

        private CachedOdds(List<OddsEvent> events, Instant fetchedAt) {
            this.events = events;
            this.fetchedAt = fetchedAt;
        }
    }
}
