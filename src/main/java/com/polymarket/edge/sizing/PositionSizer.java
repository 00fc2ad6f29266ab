package com.polymarket.edge.sizing;

/**
 * Turns capital and edge into a whole number of shares. Zero means "do not trade".
 */
public interface PositionSizer {

    long calculate(SizingRequest request);
}
