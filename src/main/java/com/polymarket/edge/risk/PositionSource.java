package com.polymarket.edge.risk;

import com.polymarket.edge.domain.Position;

import java.util.List;

/**
 * Supplies the live position snapshot the risk cycle evaluates.
 */
public interface PositionSource {

    List<Position> getOpenPositions();
}
