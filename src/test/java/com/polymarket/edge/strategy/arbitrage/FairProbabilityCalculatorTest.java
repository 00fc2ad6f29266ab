package com.polymarket.edge.strategy.arbitrage;

import com.polymarket.edge.domain.odds.OddsOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FairProbabilityCalculatorTest {

    @Test
    void testEvenMarketNormalizesToHalf() {
        List<FairProbability> fair = FairProbabilityCalculator.calculate(List.of(
                new OddsOutcome("Home", 1.91), new OddsOutcome("Away", 1.91)));

        assertEquals(2, fair.size());
        for (FairProbability p : fair) {
            assertEquals(0.5236, p.getImpliedProbability(), 1e-4);
            assertEquals(0.5, p.getFairProbability(), 1e-9);
            assertEquals(4.71, p.getOverround(), 0.01);
        }
        assertEquals("Home", fair.get(0).getOutcome());
        assertEquals(1.91, fair.get(0).getDecimalOdds());
    }

    @Test
    void testFairProbabilitiesSumToOne() {
        List<FairProbability> fair = FairProbabilityCalculator.calculate(List.of(
                new OddsOutcome("Lakers", 1.80), new OddsOutcome("Celtics", 2.10), new OddsOutcome("Draw", 15.0)));

        double sum = fair.stream().mapToDouble(FairProbability::getFairProbability).sum();
        assertEquals(1.0, sum, 1e-12);
        assertTrue(fair.get(0).getFairProbability() > fair.get(1).getFairProbability());
    }

    @Test
    void testUnusablePricesYieldEmpty() {
        assertTrue(FairProbabilityCalculator.calculate(List.of()).isEmpty());
        assertTrue(FairProbabilityCalculator.calculate(List.of(
                new OddsOutcome("Home", 1.5), new OddsOutcome("Away", 0))).isEmpty());
        assertTrue(FairProbabilityCalculator.calculate(List.of(
                new OddsOutcome("Home", -2.0), new OddsOutcome("Away", 2.0))).isEmpty());
    }

    @Test
    void testConfidenceBlend() {
        // 0.25 from the edge plus 0.5 * (5 - 2) / 5 from price quality
        assertEquals(0.55, FairProbabilityCalculator.confidence(0.05, 2.0), 1e-9);
        assertEquals(0.5, FairProbabilityCalculator.confidence(0.2, 6.0), 1e-9);
        assertEquals(1.0, FairProbabilityCalculator.confidence(0.3, 0.0), 1e-9);
    }
}
