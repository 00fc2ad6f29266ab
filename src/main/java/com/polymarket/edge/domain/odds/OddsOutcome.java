package com.polymarket.edge.domain.odds;

import lombok.Value;

@Value
public class OddsOutcome {
    String name;
    double price; // decimal odds
}
