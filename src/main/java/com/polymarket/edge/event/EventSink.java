package com.polymarket.edge.event;

import com.polymarket.edge.domain.event.RiskAlertEvent;
import com.polymarket.edge.domain.event.StrategyEvent;

/**
 * Outbound channel for lifecycle and risk events (notification / audit). Delivery
 * is best effort; implementations must not throw back into the engine.
 */
public interface EventSink {

    void publish(StrategyEvent event);

    void publish(RiskAlertEvent event);
}
