package com.polymarket.edge.domain.event;

import com.polymarket.edge.domain.Position;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Emitted by the risk manager when a limit is approached or a per-position exit
 * condition fires. Alerts never act on positions themselves.
 */
@Value
public class RiskAlertEvent {
    String eventId;
    RiskAlertType alertType;
    RiskAlertLevel level;
    String message;
    Position position; // null for portfolio-level alerts
    Map<String, Object> metrics;
    Instant occurredAt;

    public static RiskAlertEvent portfolio(RiskAlertType type, RiskAlertLevel level, String message,
            Map<String, Object> metrics) {
        return new RiskAlertEvent(newId(), type, level, message, null, Map.copyOf(metrics), Instant.now());
    }

    public static RiskAlertEvent forPosition(RiskAlertType type, RiskAlertLevel level, String message,
            Position position, Map<String, Object> metrics) {
        return new RiskAlertEvent(newId(), type, level, message, position, Map.copyOf(metrics), Instant.now());
    }

    public boolean isCritical() {
        return level == RiskAlertLevel.CRITICAL;
    }

    private static String newId() {
        return "evt_" + UUID.randomUUID().toString().substring(0, 10);
    }
}
