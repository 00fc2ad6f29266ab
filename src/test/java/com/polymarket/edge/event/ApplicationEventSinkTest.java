package com.polymarket.edge.event;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.domain.event.RiskAlertEvent;
import com.polymarket.edge.domain.event.RiskAlertLevel;
import com.polymarket.edge.domain.event.RiskAlertType;
import com.polymarket.edge.domain.event.StrategyEvent;
import com.polymarket.edge.domain.event.StrategyEventType;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ApplicationEventSinkTest {

    @Test
    void testForwardsToPublisher() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        ApplicationEventSink sink = new ApplicationEventSink(publisher);
        StrategyEvent event = StrategyEvent.of(StrategyEventType.STARTED, "alpha", null);

        sink.publish(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void testPublisherFailureIsContained() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        doThrow(new IllegalStateException("context closed")).when(publisher).publishEvent(any(Object.class));
        ApplicationEventSink sink = new ApplicationEventSink(publisher);
        RiskAlertEvent alert = RiskAlertEvent.portfolio(RiskAlertType.DRAWDOWN_WARNING, RiskAlertLevel.WARNING,
                "drawdown", Map.of());

        assertDoesNotThrow(() -> sink.publish(alert));
    }

    @Test
    void testNotificationFormatting() {
        Opportunity opportunity = Opportunity.crossMarket("m1", "yes", "no", new BigDecimal("0.45"),
                new BigDecimal("0.50"), new BigDecimal("105"), Duration.ofSeconds(30));

        String line = AlertNotificationListener.formatOpportunity(opportunity);
        assertTrue(line.startsWith("CROSS_MARKET opportunity"));
        assertTrue(line.contains("BUY 105 @ 0.45"));
        assertTrue(line.contains("BUY 105 @ 0.50"));

        String trade = AlertNotificationListener.formatTrade(TradeResult.success(List.of(), new BigDecimal("5.25")));
        assertEquals("Trade executed with 0 fill(s), expected profit 5.25", trade);
    }

    @Test
    void testListenerHandlesEveryEventType() {
        AlertNotificationListener listener = new AlertNotificationListener();
        Opportunity opportunity = Opportunity.crossMarket("m1", "yes", "no", new BigDecimal("0.45"),
                new BigDecimal("0.50"), new BigDecimal("105"), Duration.ofSeconds(30));

        assertDoesNotThrow(() -> {
            listener.onStrategyEvent(StrategyEvent.of(StrategyEventType.OPPORTUNITY_FOUND, "alpha", opportunity));
            listener.onStrategyEvent(StrategyEvent.of(StrategyEventType.TRADE_EXECUTED, "alpha",
                    TradeResult.success(List.of(), BigDecimal.ONE)));
            listener.onStrategyEvent(StrategyEvent.of(StrategyEventType.ERROR, "alpha",
                    new StrategyEvent.Failure(null, new IllegalStateException("boom"))));
            listener.onStrategyEvent(StrategyEvent.of(StrategyEventType.TRADE_FAILED, "alpha",
                    new StrategyEvent.Rejection(opportunity, "not enough balance")));
            listener.onStrategyEvent(StrategyEvent.of(StrategyEventType.STOPPED, "alpha", null));
            listener.onRiskAlert(RiskAlertEvent.portfolio(RiskAlertType.EXPOSURE_LIMIT_WARNING,
                    RiskAlertLevel.CRITICAL, "exposure", Map.of()));
        });
    }
}
