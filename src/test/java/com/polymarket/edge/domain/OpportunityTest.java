package com.polymarket.edge.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpportunityTest {

    private static Opportunity crossMarket(Duration ttl) {
        return Opportunity.crossMarket("m1", "yes", "no", new BigDecimal("0.45"), new BigDecimal("0.50"),
                new BigDecimal("105"), ttl);
    }

    @Test
    void testCrossMarketFactory() {
        Opportunity opp = crossMarket(Duration.ofSeconds(30));

        assertEquals(OpportunityType.CROSS_MARKET, opp.getType());
        assertEquals(0, new BigDecimal("5.25").compareTo(opp.getExpectedProfit()));
        assertEquals(0, new BigDecimal("99.75").compareTo(opp.getTotalCost()));
        assertEquals(0, new BigDecimal("0.95").compareTo(opp.getUnitPrice()));
        assertEquals(5.263, opp.getExpectedProfitPercent(), 0.001);
        assertEquals(0.526, opp.getConfidence(), 0.001);
        assertEquals(0, new BigDecimal("0.05").compareTo((BigDecimal) opp.getMetadata().get("spread")));
        assertEquals(List.of("yes", "no"), opp.getTokenIds());
        assertEquals(List.of("m1"), opp.getMarketIds());
    }

    @Test
    void testDeviationSideFollowsZScore() {
        Opportunity below = Opportunity.deviation("m", "t", new BigDecimal("0.40"), 0.50, 0.04, -2.5,
                new BigDecimal("250"), Duration.ofMinutes(1));
        Opportunity above = Opportunity.deviation("m", "t", new BigDecimal("0.60"), 0.50, 0.04, 2.5,
                new BigDecimal("166"), Duration.ofMinutes(1));

        assertEquals(Side.BUY, below.getLegs().get(0).getSide());
        assertEquals(Side.SELL, above.getLegs().get(0).getSide());
        // 250 * |0.40 - 0.50|
        assertEquals(0, new BigDecimal("25").compareTo(below.getExpectedProfit()));
        assertEquals(2.5 / 3, below.getConfidence(), 1e-9);
        // sell-only: unit price falls back to the leg price
        assertEquals(0, new BigDecimal("0.60").compareTo(above.getUnitPrice()));
    }

    @Test
    void testEventArbitrageFactory() {
        Opportunity opp = Opportunity.eventArbitrage("m", "t", new BigDecimal("0.40"), 0.5, 0.1, 0.25, 0.7,
                new BigDecimal("100"), Duration.ofMinutes(5), null);

        assertEquals(OpportunityType.EVENT_ARBITRAGE, opp.getType());
        assertEquals(0, new BigDecimal("250").compareTo(opp.getLegs().get(0).getSize()));
        assertEquals(0, new BigDecimal("25").compareTo(opp.getExpectedProfit()));
        assertEquals(25.0, opp.getExpectedProfitPercent(), 1e-9);
        assertEquals(0.5, opp.getMetadata().get("fairProbability"));
    }

    @Test
    void testEmptyLegsRejected() {
        Instant now = Instant.now();
        assertThrows(IllegalArgumentException.class, () -> new Opportunity("x", OpportunityType.DEVIATION,
                List.of(), BigDecimal.ONE, 1, 0.5, null, now.plusSeconds(5), now, null));
    }

    @Test
    void testConfidenceClamped() {
        Instant now = Instant.now();
        Leg leg = Leg.builder().marketId("m").tokenId("t").side(Side.BUY).price(BigDecimal.ONE)
                .size(BigDecimal.ONE).build();
        Opportunity high = new Opportunity("a", OpportunityType.DEVIATION, List.of(leg), BigDecimal.ONE, 1, 3.0,
                null, now.plusSeconds(5), now, null);
        Opportunity low = new Opportunity("b", OpportunityType.DEVIATION, List.of(leg), BigDecimal.ONE, 1, -1,
                null, now.plusSeconds(5), now, null);

        assertEquals(1.0, high.getConfidence());
        assertEquals(0.0, low.getConfidence());
        assertEquals(OpportunityStatus.PENDING, high.getStatus());
    }

    @Test
    void testValidityRequiresPendingAndUnexpired() {
        Opportunity opp = crossMarket(Duration.ofSeconds(30));
        Instant now = Instant.now();

        assertTrue(opp.isValidAt(now));
        assertFalse(opp.isValidAt(opp.getExpiresAt()));
        assertTrue(opp.isExpiredAt(opp.getExpiresAt().plusMillis(1)));

        opp.markExecuting();
        assertFalse(opp.isValidAt(now));
    }

    @Test
    void testTerminalStatesAreNeverValidAgain() {
        for (OpportunityStatus terminal : List.of(OpportunityStatus.EXECUTED, OpportunityStatus.FAILED,
                OpportunityStatus.EXPIRED, OpportunityStatus.SKIPPED)) {
            Opportunity opp = crossMarket(Duration.ofHours(1));
            switch (terminal) {
                case EXECUTED -> opp.markExecuted();
                case FAILED -> opp.markFailed();
                case EXPIRED -> opp.markExpired();
                default -> opp.markSkipped();
            }
            assertTrue(opp.getStatus().isTerminal());
            assertFalse(opp.isValid(), terminal + " must not be valid");
        }
    }
}
