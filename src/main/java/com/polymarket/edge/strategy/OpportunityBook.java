package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityStatus;
import com.polymarket.edge.domain.OpportunityType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Holds opportunities that reached execution so callers can inspect them, and purges
 * the ones that are terminal or aged out. Opportunities never remove themselves.
 */
@Slf4j
public class OpportunityBook {

    private final Map<String, Opportunity> opportunities = new ConcurrentHashMap<>();
    private final Clock clock;

    public OpportunityBook(Clock clock) {
        this.clock = clock;
    }

    public void record(Opportunity opportunity) {
        opportunities.putIfAbsent(opportunity.getId(), opportunity);
    }

    public Optional<Opportunity> get(String id) {
        return Optional.ofNullable(opportunities.get(id));
    }

    public List<Opportunity> getActive() {
        Instant now = clock.instant();
        return opportunities.values().stream()
                .filter(o -> o.isValidAt(now))
                .collect(Collectors.toList());
    }

    public List<Opportunity> getByType(OpportunityType type) {
        return opportunities.values().stream()
                .filter(o -> o.getType() == type)
                .collect(Collectors.toList());
    }

    public Collection<Opportunity> getAll() {
        return new ArrayList<>(opportunities.values());
    }

    public int size() {
        return opportunities.size();
    }

    /**
     * Marks aged-out PENDING opportunities EXPIRED, then drops every terminal one.
     * EXECUTING entries are kept. Returns the number removed.
     */
    public int purge() {
        Instant now = clock.instant();
        int removed = 0;
        for (Opportunity o : opportunities.values()) {
            if (o.getStatus() == OpportunityStatus.PENDING && o.isExpiredAt(now)) {
                o.markExpired();
            }
            if (o.getStatus().isTerminal() && opportunities.remove(o.getId(), o)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[OpportunityBook] Purged {} opportunities, {} left", removed, opportunities.size());
        }
        return removed;
    }

    public Map<OpportunityStatus, Long> countByStatus() {
        Map<OpportunityStatus, Long> counts = new EnumMap<>(OpportunityStatus.class);
        opportunities.values().forEach(o -> counts.merge(o.getStatus(), 1L, Long::sum));
        return counts;
    }
}
