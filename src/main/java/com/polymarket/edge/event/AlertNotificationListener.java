package com.polymarket.edge.event;

import com.polymarket.edge.domain.Leg;
import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.domain.event.RiskAlertEvent;
import com.polymarket.edge.domain.event.StrategyEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Renders engine events as operator-facing notification lines. Chat delivery is
 * not wired; the log is the notification channel.
 */
@Slf4j
@Component
public class AlertNotificationListener {

    @EventListener
    public void onStrategyEvent(StrategyEvent event) {
        switch (event.getType()) {
            case OPPORTUNITY_FOUND -> log.info("🎯 [{}] {}", event.getStrategyName(),
                    formatOpportunity((Opportunity) event.getPayload()));
            case TRADE_EXECUTED -> log.info("✅ [{}] {}", event.getStrategyName(),
                    formatTrade((TradeResult) event.getPayload()));
            case TRADE_FAILED -> log.warn("❌ [{}] Trade failed: {}", event.getStrategyName(),
                    ((StrategyEvent.Rejection) event.getPayload()).describe());
            case ERROR -> log.warn("⚠️ [{}] Strategy error: {}", event.getStrategyName(),
                    ((StrategyEvent.Failure) event.getPayload()).describe());
            default -> log.info("[{}] {}", event.getStrategyName(), event.getType());
        }
    }

    @EventListener
    public void onRiskAlert(RiskAlertEvent alert) {
        String line = "[" + alert.getLevel() + "] " + alert.getAlertType() + " - " + alert.getMessage();
        if (alert.isCritical()) {
            log.error("🚨 {}", line);
        } else {
            log.warn("{}", line);
        }
    }

    static String formatOpportunity(Opportunity opp) {
        String legs = opp.getLegs().stream().map(AlertNotificationListener::formatLeg)
                .collect(Collectors.joining(", "));
        return String.format("%s opportunity %s | profit %s (%.2f%%) | confidence %.0f%% | %s",
                opp.getType(), opp.getId(), opp.getExpectedProfit().toPlainString(),
                opp.getExpectedProfitPercent(), opp.getConfidence() * 100, legs);
    }

    static String formatTrade(TradeResult result) {
        return String.format("Trade executed with %d fill(s), expected profit %s",
                result.getFills().size(), result.profitOrZero().toPlainString());
    }

    private static String formatLeg(Leg leg) {
        return leg.getSide() + " " + leg.getSize().toPlainString() + " @ " + leg.getPrice().toPlainString();
    }
}
