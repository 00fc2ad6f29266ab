package com.polymarket.edge.risk;

import com.polymarket.edge.domain.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Stop-loss trigger math. A long stop fires when the price falls to the trigger, a
 * short stop when it rises to it.
 */
@Slf4j
public class StopLossHandler {

    private static final MathContext MC = MathContext.DECIMAL64;

    public boolean evaluate(Position position, StopLossConfig config) {
        if (!config.isActivated()) {
            return false;
        }
        BigDecimal trigger = config.getTriggerPrice() != null
                ? config.getTriggerPrice()
                : calculateTriggerPrice(position, config);
        BigDecimal current = position.getCurrentPrice();

        boolean triggered = position.isLong()
                ? current.compareTo(trigger) <= 0
                : current.compareTo(trigger) >= 0;
        if (triggered) {
            log.info("[StopLoss] {} position {} triggered: current={} trigger={}",
                    position.isLong() ? "LONG" : "SHORT", position.getId(), current, trigger);
        }
        return triggered;
    }

    public BigDecimal calculateTriggerPrice(Position position, StopLossConfig config) {
        switch (config.getKind()) {
            case FIXED:
                return config.getTriggerPrice() != null ? config.getTriggerPrice() : BigDecimal.valueOf(config.getValue());
            case PERCENTAGE:
                return offset(position.getAvgEntryPrice(), config.getValue(), position.isLong());
            case TRAILING:
                if (config.getTriggerPrice() != null) {
                    return config.getTriggerPrice();
                }
                return offset(position.getCurrentPrice(), config.effectiveTrailingOffset(), position.isLong());
            default:
                throw new IllegalStateException("Unknown stop-loss kind " + config.getKind());
        }
    }

    /**
     * Ratchets a trailing stop towards the current price. The stored trigger only ever
     * tightens: up for a long, down for a short. Returns {@code config} itself when
     * nothing moved.
     */
    public StopLossConfig updateTrailingStop(Position position, StopLossConfig config) {
        if (config.getKind() != StopLossConfig.Kind.TRAILING || !config.isActivated()) {
            return config;
        }

        BigDecimal current = config.getTriggerPrice();
        BigDecimal candidate = offset(position.getCurrentPrice(), config.effectiveTrailingOffset(), position.isLong());
        boolean tighter = position.isLong()
                ? current == null || candidate.compareTo(current) > 0
                : current == null || candidate.compareTo(current) < 0;
        if (!tighter) {
            return config;
        }
        log.debug("[StopLoss] Trailing stop for {} moved {} -> {}", position.getId(), current, candidate);
        return config.withTriggerPrice(candidate);
    }

    // long: base * (1 - pct/100), short: base * (1 + pct/100)
    static BigDecimal offset(BigDecimal base, double percent, boolean below) {
        BigDecimal ratio = BigDecimal.valueOf(percent).movePointLeft(2);
        BigDecimal multiplier = below ? BigDecimal.ONE.subtract(ratio) : BigDecimal.ONE.add(ratio);
        return base.multiply(multiplier, MC);
    }
}
