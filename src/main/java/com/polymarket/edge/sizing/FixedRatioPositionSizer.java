package com.polymarket.edge.sizing;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Commits a fixed fraction of capital per trade, capped at {@code maxPositionSize}
 * shares. Ignores win probability; a conservative fallback when no edge estimate
 * is trustworthy.
 */
@Getter
public class FixedRatioPositionSizer extends AbstractPositionSizer {

    private final double fraction;
    private final long maxPositionSize;
    private final double minPositionSize;

    public FixedRatioPositionSizer() {
        this(0.1, 1000, 1);
    }

    public FixedRatioPositionSizer(double fraction, long maxPositionSize, double minPositionSize) {
        if (fraction <= 0 || fraction > 1) {
            throw new IllegalArgumentException("fraction must be in (0, 1]: " + fraction);
        }
        this.fraction = fraction;
        this.maxPositionSize = maxPositionSize;
        this.minPositionSize = minPositionSize;
    }

    @Override
    public long calculate(SizingRequest request) {
        BigDecimal capital = request.getCapital();
        BigDecimal price = request.getPrice();
        if (!hasCapital(capital) || !isTradablePrice(price)) {
            return 0;
        }

        double effectiveFraction = request.getMaxFraction() != null
                ? Math.min(fraction, request.getMaxFraction())
                : fraction;
        long shares = Math.min(floorShares(capital.multiply(BigDecimal.valueOf(effectiveFraction), MC), price),
                maxPositionSize);

        double minSize = request.getMinSize() != null ? request.getMinSize() : minPositionSize;
        return shares < minSize ? 0 : shares;
    }
}
