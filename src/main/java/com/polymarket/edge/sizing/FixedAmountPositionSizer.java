package com.polymarket.edge.sizing;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Spends the same currency amount on every trade, never more than the capital on hand.
 */
@Getter
public class FixedAmountPositionSizer extends AbstractPositionSizer {

    private final BigDecimal amount;
    private final double minPositionSize;

    public FixedAmountPositionSizer(BigDecimal amount, double minPositionSize) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
        this.amount = amount;
        this.minPositionSize = minPositionSize;
    }

    @Override
    public long calculate(SizingRequest request) {
        BigDecimal capital = request.getCapital();
        BigDecimal price = request.getPrice();
        if (!hasCapital(capital) || !isTradablePrice(price)) {
            return 0;
        }

        long shares = floorShares(amount.min(capital), price);
        double minSize = request.getMinSize() != null ? request.getMinSize() : minPositionSize;
        return shares < minSize ? 0 : shares;
    }
}
