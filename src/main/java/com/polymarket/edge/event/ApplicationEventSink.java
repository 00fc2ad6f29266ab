package com.polymarket.edge.event;

import com.polymarket.edge.domain.event.RiskAlertEvent;
import com.polymarket.edge.domain.event.StrategyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Forwards engine events onto the Spring application event bus, where
 * {@code @EventListener} beans such as {@link AlertNotificationListener} pick them up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventSink implements EventSink {

    private final ApplicationEventPublisher publisher;

    @Override
    public void publish(StrategyEvent event) {
        deliver(event);
    }

    @Override
    public void publish(RiskAlertEvent event) {
        deliver(event);
    }

    private void deliver(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("[EventSink] Failed to deliver {}", event, e);
        }
    }
}
