package com.polymarket.edge.sizing;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

abstract class AbstractPositionSizer implements PositionSizer {

    static final MathContext MC = MathContext.DECIMAL64;

    static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }

    /** Whole shares affordable with {@code amount} at {@code price}, rounded down. */
    static long floorShares(BigDecimal amount, BigDecimal price) {
        return amount.divide(price, 0, RoundingMode.FLOOR).longValueExact();
    }

    /** Binary outcome prices live strictly between 0 and 1. */
    static boolean isTradablePrice(BigDecimal price) {
        return price != null && price.signum() > 0 && price.compareTo(BigDecimal.ONE) < 0;
    }

    static boolean hasCapital(BigDecimal capital) {
        return capital != null && capital.signum() > 0;
    }
}
