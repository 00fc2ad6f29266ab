package com.polymarket.edge.strategy.arbitrage;

import lombok.Value;

/**
 * Vig-free probability of one outcome. {@code overround} is the bookmaker margin of the
 * whole market in percent and is the same for every outcome of one event.
 */
@Value
public class FairProbability {
    String outcome;
    double decimalOdds;
    double impliedProbability;
    double fairProbability;
    double overround;
}
