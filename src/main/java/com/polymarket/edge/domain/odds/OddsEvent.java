package com.polymarket.edge.domain.odds;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One fixture as priced by the reference bookmaker's head-to-head market.
 */
@Value
@Builder
public class OddsEvent {
    String id;
    String sportKey;
    String homeTeam;
    String awayTeam;
    Instant commenceTime;
    String bookmaker;
    @Singular
    List<OddsOutcome> outcomes;
}
