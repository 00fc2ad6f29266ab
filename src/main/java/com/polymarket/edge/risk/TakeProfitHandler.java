package com.polymarket.edge.risk;

import com.polymarket.edge.domain.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Take-profit trigger math, mirrored by side: a long takes profit at or above the
 * trigger, a short at or below it.
 */
@Slf4j
public class TakeProfitHandler {

    public boolean evaluate(Position position, TakeProfitConfig config) {
        if (!config.isActivated()) {
            return false;
        }
        BigDecimal trigger = config.getTriggerPrice() != null
                ? config.getTriggerPrice()
                : calculateTriggerPrice(position, config);
        BigDecimal current = position.getCurrentPrice();

        boolean triggered = position.isLong()
                ? current.compareTo(trigger) >= 0
                : current.compareTo(trigger) <= 0;
        if (triggered) {
            log.info("[TakeProfit] {} position {} triggered: current={} trigger={}",
                    position.isLong() ? "LONG" : "SHORT", position.getId(), current, trigger);
        }
        return triggered;
    }

    public BigDecimal calculateTriggerPrice(Position position, TakeProfitConfig config) {
        switch (config.getKind()) {
            case FIXED:
                return config.getTriggerPrice() != null ? config.getTriggerPrice() : BigDecimal.valueOf(config.getValue());
            case PERCENTAGE:
            case PARTIAL:
                return StopLossHandler.offset(position.getAvgEntryPrice(), config.getValue(), !position.isLong());
            default:
                throw new IllegalStateException("Unknown take-profit kind " + config.getKind());
        }
    }

    /** Shares to close when the rule fires; the whole position unless it is a partial rule. */
    public BigDecimal calculatePartialSize(Position position, TakeProfitConfig config) {
        if (config.getKind() != TakeProfitConfig.Kind.PARTIAL || config.getPartialPercent() == null
                || config.getPartialPercent() <= 0) {
            return position.getSize();
        }
        return position.getSize()
                .multiply(BigDecimal.valueOf(config.getPartialPercent()).movePointLeft(2))
                .setScale(0, RoundingMode.FLOOR);
    }
}
