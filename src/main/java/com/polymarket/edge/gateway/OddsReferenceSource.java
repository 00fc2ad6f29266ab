package com.polymarket.edge.gateway;

import com.polymarket.edge.domain.odds.OddsEvent;

import java.util.List;

/**
 * Head-to-head decimal odds from the reference bookmaker, per sport key
 * (e.g. {@code basketball_nba}). Events the reference book does not price are omitted.
 */
public interface OddsReferenceSource {

    List<OddsEvent> getEvents(String sportKey);
}
