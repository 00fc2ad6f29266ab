package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityStatus;
import com.polymarket.edge.domain.OpportunityType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpportunityBookTest {

    @Test
    void testPurgeDropsTerminalAndExpired() {
        OpportunityBook book = new OpportunityBook(Clock.systemUTC());
        List<Opportunity> opportunities = ScriptedStrategyLogic.opportunities(4);
        opportunities.forEach(book::record);
        opportunities.get(0).markExecuted();
        opportunities.get(1).markExecuting();

        Opportunity stale = Opportunity.deviation("m9", "t9", new BigDecimal("0.30"), 0.5, 0.05, -4.0,
                BigDecimal.TEN, Duration.ofSeconds(-1));
        book.record(stale);

        assertEquals(5, book.size());
        assertEquals(2, book.getActive().size());

        int removed = book.purge();

        assertEquals(2, removed);
        assertEquals(OpportunityStatus.EXPIRED, stale.getStatus());
        assertTrue(book.get(opportunities.get(1).getId()).isPresent());
        assertTrue(book.get(stale.getId()).isEmpty());
        assertEquals(3, book.size());
    }

    @Test
    void testPurgeUsesInjectedClock() {
        Opportunity opportunity = ScriptedStrategyLogic.opportunities(1).get(0);
        OpportunityBook later = new OpportunityBook(
                Clock.fixed(Instant.now().plus(Duration.ofHours(1)), ZoneOffset.UTC));
        later.record(opportunity);

        assertTrue(later.getActive().isEmpty());
        assertEquals(1, later.purge());
    }

    @Test
    void testRecordIsIdempotentAndCounts() {
        OpportunityBook book = new OpportunityBook(Clock.systemUTC());
        Opportunity opportunity = ScriptedStrategyLogic.opportunities(1).get(0);

        book.record(opportunity);
        book.record(opportunity);

        assertEquals(1, book.size());
        assertEquals(1, book.getByType(OpportunityType.CROSS_MARKET).size());
        assertTrue(book.getByType(OpportunityType.DEVIATION).isEmpty());
        assertEquals(Map.of(OpportunityStatus.PENDING, 1L), book.countByStatus());
    }
}
