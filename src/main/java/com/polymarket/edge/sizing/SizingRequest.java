package com.polymarket.edge.sizing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Inputs to a position sizing decision. {@code odds} is the net payout per unit
 * staked; pass 0 to let the sizer derive it from a binary-outcome {@code price}.
 * {@code maxFraction} and {@code minSize} fall back to the sizer's own defaults when null.
 */
@Value
@Builder(toBuilder = true)
public class SizingRequest {
    BigDecimal capital;
    double winProbability;
    double odds;
    BigDecimal price;
    Double maxFraction;
    Double minSize;
}
