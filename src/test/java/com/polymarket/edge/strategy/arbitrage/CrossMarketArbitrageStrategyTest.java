package com.polymarket.edge.strategy.arbitrage;

import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityStatus;
import com.polymarket.edge.domain.OpportunityType;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.domain.OrderResult;
import com.polymarket.edge.domain.Side;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.gateway.OrderExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CrossMarketArbitrageStrategyTest {

    private MarketDataSource marketData;
    private OrderExecutor orderExecutor;
    private CrossMarketArbitrageStrategy strategy;

    @BeforeEach
    void setUp() {
        marketData = mock(MarketDataSource.class);
        orderExecutor = mock(OrderExecutor.class);
        strategy = new CrossMarketArbitrageStrategy(marketData, orderExecutor);
    }

    @Test
    void testDetectsUnderpricedPair() {
        when(marketData.getBinaryMarkets()).thenReturn(List.of(market("m1", "0.45", "0.50")));

        List<Opportunity> opportunities = strategy.scan();

        assertEquals(1, opportunities.size());
        Opportunity opportunity = opportunities.get(0);
        assertEquals(OpportunityType.CROSS_MARKET, opportunity.getType());
        assertEquals(0, new BigDecimal("105").compareTo(opportunity.getLegs().get(0).getSize()));
        assertEquals(0, new BigDecimal("5.25").compareTo(opportunity.getExpectedProfit()));
        assertEquals("yes-m1", opportunity.getLegs().get(0).getTokenId());
        assertEquals("no-m1", opportunity.getLegs().get(1).getTokenId());
    }

    @Test
    void testIgnoresFairlyPricedAndThinSpreads() {
        when(marketData.getBinaryMarkets()).thenReturn(List.of(
                market("fair", "0.50", "0.50"),
                market("over", "0.55", "0.50"),
                market("thin", "0.498", "0.499")));

        assertTrue(strategy.scan().isEmpty());
    }

    @Test
    void testSkipsClosedMarkets() {
        Market closed = market("m1", "0.40", "0.40");
        closed.setClosed(true);
        when(marketData.getBinaryMarkets()).thenReturn(List.of(closed));

        assertTrue(strategy.scan().isEmpty());
    }

    @Test
    void testFallsBackToSourceWhenSnapshotHasNoBook() {
        Market bare = market("m1", "0.45", "0.50");
        bare.setYesOrderBook(null);
        when(marketData.getBinaryMarkets()).thenReturn(List.of(bare));
        when(marketData.getBestAsk("yes-m1")).thenReturn(Optional.of(new BigDecimal("0.40")));

        List<Opportunity> opportunities = strategy.scan();

        assertEquals(1, opportunities.size());
        assertEquals(0, new BigDecimal("0.40").compareTo(opportunities.get(0).getLegs().get(0).getPrice()));
    }

    @Test
    void testRespectsMaxTradesPerRun() {
        strategy.params().put(CrossMarketArbitrageStrategy.MAX_TRADES_PER_RUN, 2);
        when(marketData.getBinaryMarkets()).thenReturn(List.of(
                market("a", "0.45", "0.50"), market("b", "0.45", "0.50"), market("c", "0.45", "0.50")));

        assertEquals(2, strategy.scan().size());
    }

    @Test
    void testMarketLoadFailureYieldsNothing() {
        when(marketData.getBinaryMarkets()).thenThrow(new IllegalStateException("gamma down"));

        assertTrue(strategy.scan().isEmpty());
    }

    @Test
    void testExecutesBothLegs() {
        Opportunity opportunity = opportunity();
        when(orderExecutor.placeLimitOrder(eq("yes-m1"), any(), any(), eq(Side.BUY)))
                .thenReturn(OrderResult.accepted("o-yes"));
        when(orderExecutor.placeLimitOrder(eq("no-m1"), any(), any(), eq(Side.BUY)))
                .thenReturn(OrderResult.accepted("o-no"));

        TradeResult result = strategy.execute(opportunity);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getFills().size());
        assertEquals("Yes", result.getFills().get(0).getOutcome());
        assertEquals("o-no", result.getFills().get(1).getOrderId());
        assertEquals(0, new BigDecimal("5.25").compareTo(result.getTotalProfit()));
        assertEquals(OpportunityStatus.EXECUTED, opportunity.getStatus());
    }

    @Test
    void testCancelsYesWhenNoFails() {
        Opportunity opportunity = opportunity();
        when(orderExecutor.placeLimitOrder(eq("yes-m1"), any(), any(), eq(Side.BUY)))
                .thenReturn(OrderResult.accepted("o-yes"));
        when(orderExecutor.placeLimitOrder(eq("no-m1"), any(), any(), eq(Side.BUY)))
                .thenReturn(OrderResult.rejected("not enough balance"));
        when(orderExecutor.cancelOrder("o-yes")).thenReturn(true);

        TradeResult result = strategy.execute(opportunity);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("NO order"));
        verify(orderExecutor).cancelOrder("o-yes");
        assertEquals(OpportunityStatus.FAILED, opportunity.getStatus());
    }

    @Test
    void testYesFailureSkipsNoLeg() {
        Opportunity opportunity = opportunity();
        when(orderExecutor.placeLimitOrder(eq("yes-m1"), any(), any(), eq(Side.BUY)))
                .thenReturn(OrderResult.rejected("price moved"));

        TradeResult result = strategy.execute(opportunity);

        assertFalse(result.isSuccess());
        verify(orderExecutor, times(1)).placeLimitOrder(any(), any(), any(), any());
        verify(orderExecutor, never()).cancelOrder(any());
    }

    @Test
    void testRejectsForeignOpportunityType() {
        Opportunity deviation = Opportunity.deviation("m1", "t1", new BigDecimal("0.3"), 0.5, 0.05, -4,
                BigDecimal.TEN, Duration.ofMinutes(1));

        TradeResult result = strategy.execute(deviation);

        assertFalse(result.isSuccess());
        verifyNoInteractions(orderExecutor);
    }

    @Test
    void testRevalidationReadsLiveAsks() {
        Opportunity opportunity = opportunity();
        when(marketData.getBestAsk("yes-m1")).thenReturn(Optional.of(new BigDecimal("0.45")));
        when(marketData.getBestAsk("no-m1")).thenReturn(Optional.of(new BigDecimal("0.50")));
        assertTrue(strategy.validateOpportunity(opportunity, Instant.now()));

        when(marketData.getBestAsk("no-m1")).thenReturn(Optional.of(new BigDecimal("0.56")));
        assertFalse(strategy.validateOpportunity(opportunity, Instant.now()));

        when(marketData.getBestAsk("no-m1")).thenReturn(Optional.empty());
        assertFalse(strategy.validateOpportunity(opportunity, Instant.now()));
    }

    private static Opportunity opportunity() {
        return Opportunity.crossMarket("m1", "yes-m1", "no-m1", new BigDecimal("0.45"), new BigDecimal("0.50"),
                new BigDecimal("105"), Duration.ofSeconds(30));
    }

    private static Market market(String id, String yesAsk, String noAsk) {
        return Market.builder()
                .marketId(id)
                .question("Will " + id + " happen?")
                .outcomeIds(List.of("yes-" + id, "no-" + id))
                .active(true)
                .acceptingOrders(true)
                .yesOrderBook(book("yes-" + id, yesAsk))
                .noOrderBook(book("no-" + id, noAsk))
                .build();
    }

    private static OrderBook book(String tokenId, String ask) {
        return OrderBook.builder()
                .tokenId(tokenId)
                .bids(List.of())
                .asks(List.of(OrderBook.OrderLevel.builder().price(new BigDecimal(ask)).size(new BigDecimal("500"))
                        .build()))
                .build();
    }
}
