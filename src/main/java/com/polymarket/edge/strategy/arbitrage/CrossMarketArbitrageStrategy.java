package com.polymarket.edge.strategy.arbitrage;

import com.polymarket.edge.domain.Leg;
import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityType;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.domain.OrderResult;
import com.polymarket.edge.domain.Side;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.gateway.OrderExecutor;
import com.polymarket.edge.strategy.StrategyLogic;
import com.polymarket.edge.strategy.StrategyParams;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Buys both outcomes of a binary market when the two best asks sum below 1. One of
 * the two always settles at 1, so every share pair locks in {@code 1 - (yes + no)}.
 * <p>
 * The legs are placed one after the other. If NO is rejected after YES went through,
 * the YES order is cancelled on a best-effort basis; a failed cancel leaves an
 * unhedged YES leg, which is logged.
 */
@Slf4j
public class CrossMarketArbitrageStrategy implements StrategyLogic {

    public static final String NAME = "cross-market-arbitrage";
    public static final String TYPE = "arbitrage";

    public static final String MIN_SPREAD = "minSpread";
    public static final String MIN_PROFIT = "minProfit";
    public static final String MAX_TRADES_PER_RUN = "maxTradesPerRun";
    public static final String TTL_SECONDS = "ttlSeconds";

    private final MarketDataSource marketData;
    private final OrderExecutor orderExecutor;
    private final StrategyParams params = new StrategyParams(Map.of(
            MIN_SPREAD, 0.005,
            MIN_PROFIT, 0.01,
            MAX_TRADES_PER_RUN, 5,
            TTL_SECONDS, 30,
            StrategyParams.AVAILABLE_CAPITAL, 100));

    public CrossMarketArbitrageStrategy(MarketDataSource marketData, OrderExecutor orderExecutor) {
        this.marketData = marketData;
        this.orderExecutor = orderExecutor;
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
            markets = marketData.getBinaryMarkets();
        } catch (RuntimeException e) {
            log.error("[{}] Failed to load markets", NAME, e);
            return List.of();
        }

        BigDecimal minSpread = params.getDecimal(MIN_SPREAD, new BigDecimal("0.005"));
        BigDecimal minProfit = params.getDecimal(MIN_PROFIT, new BigDecimal("0.01"));
        BigDecimal capital = params.getDecimal(StrategyParams.AVAILABLE_CAPITAL, BigDecimal.valueOf(100));
        int maxTrades = params.getInt(MAX_TRADES_PER_RUN, 5);
        Duration ttl = Duration.ofSeconds(params.getInt(TTL_SECONDS, 30));

        log.debug("[{}] Scanning {} binary markets", NAME, markets.size());
        List<Opportunity> opportunities = new ArrayList<>();
        for (Market market : markets) {
            if (opportunities.size() >= maxTrades) {
                break;
            }
            if (!market.isBinary() || !market.isTradeable()) {
                continue;
            }

            Optional<BigDecimal> yesAsk = ask(market.getYesOrderBook(), market.getYesTokenId());
            Optional<BigDecimal> noAsk = ask(market.getNoOrderBook(), market.getNoTokenId());
            if (yesAsk.isEmpty() || noAsk.isEmpty()) {
                continue;
            }

            BigDecimal sum = yesAsk.get().add(noAsk.get());
            if (sum.signum() <= 0 || sum.compareTo(BigDecimal.ONE) >= 0) {
                continue;
            }
            BigDecimal spread = BigDecimal.ONE.subtract(sum);
            if (spread.compareTo(minSpread) < 0) {
                continue;
            }

            BigDecimal size = capital.divide(sum, 0, RoundingMode.FLOOR);
            BigDecimal profit = size.multiply(spread);
            if (size.signum() <= 0 || profit.compareTo(minProfit) < 0) {
                continue;
            }

            opportunities.add(Opportunity.crossMarket(market.getMarketId(), market.getYesTokenId(),
                    market.getNoTokenId(), yesAsk.get(), noAsk.get(), size, ttl));
            log.info("[{}] Found opportunity: {} spread={}% profit=${}", NAME, abbreviate(market.getQuestion()),
                    spread.movePointRight(2).stripTrailingZeros().toPlainString(), profit.setScale(2, RoundingMode.HALF_UP));
        }
        return opportunities;
    }

    // The snapshot's book is preferred; fall back to asking the source directly.
    private Optional<BigDecimal> ask(OrderBook book, String tokenId) {
        if (book != null) {
            Optional<BigDecimal> ask = book.bestAsk();
            if (ask.isPresent()) {
                return ask;
            }
        }
        return marketData.getBestAsk(tokenId);
    }

    @Override
    public TradeResult execute(Opportunity opportunity) {
        if (opportunity.getType() != OpportunityType.CROSS_MARKET) {
            return TradeResult.failure("Invalid opportunity type for this strategy: " + opportunity.getType());
        }
        if (opportunity.getLegs().size() != 2) {
            return TradeResult.failure("Cross-market arbitrage requires exactly 2 legs");
        }

        opportunity.markExecuting();
        Leg yesLeg = opportunity.getLegs().get(0);
        Leg noLeg = opportunity.getLegs().get(1);

        try {
            log.info("[{}] Placing YES order: {} @ {}", NAME, yesLeg.getSize(), yesLeg.getPrice());
            OrderResult yes = place(yesLeg);
            if (!yes.isSuccess()) {
                opportunity.markFailed();
                return TradeResult.failure("Failed to place YES order: " + yes.getErrorMsg());
            }

            log.info("[{}] Placing NO order: {} @ {}", NAME, noLeg.getSize(), noLeg.getPrice());
            OrderResult no = place(noLeg);
            if (!no.isSuccess()) {
                unwind(opportunity, yes);
                opportunity.markFailed();
                return TradeResult.failure("Failed to place NO order: " + no.getErrorMsg());
            }

            opportunity.markExecuted();
            log.info("[{}] Arbitrage executed, expected profit ${}", NAME, opportunity.getExpectedProfit());
            return TradeResult.builder()
                    .success(true)
                    .fill(fill(yes, yesLeg, "Yes"))
                    .fill(fill(no, noLeg, "No"))
                    .totalProfit(opportunity.getExpectedProfit())
                    .build();
        } catch (RuntimeException e) {
            opportunity.markFailed();
            log.error("[{}] Execution failed for {}", NAME, opportunity.getId(), e);
            return TradeResult.failure(e.getMessage());
        }
    }

    private OrderResult place(Leg leg) {
        return orderExecutor.placeLimitOrder(leg.getTokenId(), leg.getPrice(), leg.getSize(), Side.BUY);
    }

    private void unwind(Opportunity opportunity, OrderResult yes) {
        if (yes.getOrderId() == null) {
            log.warn("[{}] NO leg failed for {} and YES order id is unknown; YES leg is unhedged", NAME,
                    opportunity.getId());
            return;
        }
        boolean cancelled;
        try {
            cancelled = orderExecutor.cancelOrder(yes.getOrderId());
        } catch (RuntimeException e) {
            log.error("[{}] Cancel of YES order {} threw", NAME, yes.getOrderId(), e);
            cancelled = false;
        }
        if (cancelled) {
            log.info("[{}] Cancelled YES order {} after NO leg failed", NAME, yes.getOrderId());
        } else {
            log.warn("[{}] Could not cancel YES order {} for {}; YES leg is unhedged", NAME, yes.getOrderId(),
                    opportunity.getId());
        }
    }

    private static TradeResult.Fill fill(OrderResult order, Leg leg, String outcome) {
        return TradeResult.Fill.builder()
                .orderId(order.getOrderId())
                .marketId(leg.getMarketId())
                .tokenId(leg.getTokenId())
                .side(leg.getSide())
                .price(leg.getPrice())
                .size(leg.getSize())
                .outcome(outcome)
                .build();
    }

    /** Re-reads both best asks; the spread must still clear {@code minSpread}. */
    @Override
    public boolean validateOpportunity(Opportunity opportunity, Instant now) {
        if (!opportunity.isValidAt(now) || opportunity.getLegs().size() != 2) {
            return false;
        }
        try {
            Optional<BigDecimal> yesAsk = marketData.getBestAsk(opportunity.getLegs().get(0).getTokenId());
            Optional<BigDecimal> noAsk = marketData.getBestAsk(opportunity.getLegs().get(1).getTokenId());
            if (yesAsk.isEmpty() || noAsk.isEmpty()) {
                return false;
            }
            BigDecimal spread = BigDecimal.ONE.subtract(yesAsk.get().add(noAsk.get()));
            return spread.compareTo(params.getDecimal(MIN_SPREAD, new BigDecimal("0.005"))) >= 0;
        } catch (RuntimeException e) {
            log.error("[{}] Failed to revalidate {}", NAME, opportunity.getId(), e);
            return false;
        }
    }

    private static String abbreviate(String question) {
        if (question == null) {
            return "";
        }
        return question.length() > 50 ? question.substring(0, 50) + "..." : question;
    }
}
