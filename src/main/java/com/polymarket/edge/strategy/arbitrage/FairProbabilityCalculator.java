package com.polymarket.edge.strategy.arbitrage;

import com.polymarket.edge.domain.odds.OddsOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Multiplicative vig removal: {@code implied = 1 / odds}, {@code fair = implied / Σimplied}.
 */
public final class FairProbabilityCalculator {

    private FairProbabilityCalculator() {
    }

    /**
     * @return one entry per outcome in input order, or an empty list if any price is not
     *         a usable decimal odd
     */
    public static List<FairProbability> calculate(List<OddsOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return List.of();
        }
        double totalImplied = 0;
        for (OddsOutcome outcome : outcomes) {
            if (!(outcome.getPrice() > 0) || Double.isInfinite(outcome.getPrice())) {
                return List.of();
            }
            totalImplied += 1 / outcome.getPrice();
        }
        double overround = (totalImplied - 1) * 100;

        List<FairProbability> result = new ArrayList<>(outcomes.size());
        for (OddsOutcome outcome : outcomes) {
            double implied = 1 / outcome.getPrice();
            result.add(new FairProbability(outcome.getName(), outcome.getPrice(), implied, implied / totalImplied,
                    overround));
        }
        return result;
    }

    /**
     * Blends the size of the edge (up to 0.5) with the quality of the reference price:
     * the closer the overround is to zero, the more the fair price is trusted (up to 0.5).
     */
    public static double confidence(double edge, double overround) {
        double edgeConfidence = Math.min(edge * 5, 0.5);
        double qualityFactor = Math.max(0, (5 - overround) / 5) * 0.5;
        return Math.min(edgeConfidence + qualityFactor, 1);
    }
}
