package com.polymarket.edge.sizing;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Fractional Kelly criterion sizing.
 * <p>
 * {@code f* = (b·p − q) / b} with {@code q = 1 − p}. On a binary market bought at price
 * {@code P} the net odds are {@code b = (1 − P) / P}. A non-positive {@code f*} means the
 * computed edge is negative and nothing is bet. Otherwise {@code f*} is scaled by the
 * configured Kelly multiplier (0.5 = half Kelly) and clamped to
 * {@code [minBetFraction, maxFraction]} of capital before converting to shares.
 */
@Slf4j
@Getter
public class KellyPositionSizer extends AbstractPositionSizer {

    private final double kellyMultiplier;
    private final double maxBetFraction;
    private final double minBetFraction;

    public KellyPositionSizer() {
        this(0.5, 0.25, 0.01);
    }

    public KellyPositionSizer(double kellyMultiplier, double maxBetFraction, double minBetFraction) {
        if (kellyMultiplier <= 0 || kellyMultiplier > 1) {
            throw new IllegalArgumentException("kellyMultiplier must be in (0, 1]: " + kellyMultiplier);
        }
        if (minBetFraction < 0 || minBetFraction > maxBetFraction || maxBetFraction > 1) {
            throw new IllegalArgumentException(
                    "Expected 0 <= minBetFraction <= maxBetFraction <= 1, got " + minBetFraction + "/" + maxBetFraction);
        }
        this.kellyMultiplier = kellyMultiplier;
        this.maxBetFraction = maxBetFraction;
        this.minBetFraction = minBetFraction;
    }

    @Override
    public long calculate(SizingRequest request) {
        BigDecimal capital = request.getCapital();
        BigDecimal price = request.getPrice();
        double p = request.getWinProbability();

        if (!hasCapital(capital) || !isTradablePrice(price) || p <= 0 || p >= 1) {
            return 0;
        }

        BigDecimal b = request.getOdds() > 0
                ? BigDecimal.valueOf(request.getOdds())
                : BigDecimal.ONE.subtract(price).divide(price, MC);
        BigDecimal winP = BigDecimal.valueOf(p);
        BigDecimal loseP = BigDecimal.ONE.subtract(winP);

        BigDecimal fullKelly = b.multiply(winP, MC).subtract(loseP, MC).divide(b, MC);
        if (fullKelly.signum() <= 0) {
            return 0;
        }

        double maxFraction = request.getMaxFraction() != null ? request.getMaxFraction() : maxBetFraction;
        BigDecimal fraction = clamp(fullKelly.multiply(BigDecimal.valueOf(kellyMultiplier), MC),
                BigDecimal.valueOf(minBetFraction), BigDecimal.valueOf(maxFraction));

        long shares = floorShares(capital.multiply(fraction, MC), price);
        double minSize = request.getMinSize() != null ? request.getMinSize() : 1;
        if (shares < minSize) {
            log.debug("[Kelly] {} shares below minimum {}", shares, minSize);
            return 0;
        }
        return shares;
    }

    /** Unscaled Kelly fraction, floored at zero. */
    public static double kellyFraction(double winProbability, double odds) {
        if (winProbability <= 0 || winProbability >= 1 || odds <= 0) {
            return 0;
        }
        return Math.max(0, (odds * winProbability - (1 - winProbability)) / odds);
    }

    /** Expected value per unit staked: {@code p·b − q}. */
    public static double edge(double winProbability, double odds) {
        if (odds <= 0) {
            return -1;
        }
        return winProbability * odds - (1 - winProbability);
    }

    public static boolean hasPositiveEdge(double winProbability, double odds) {
        return edge(winProbability, odds) > 0;
    }
}
