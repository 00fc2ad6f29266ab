package com.polymarket.edge.domain.event;

public enum RiskAlertType {
    STOP_LOSS_TRIGGERED,
    TAKE_PROFIT_TRIGGERED,
    DRAWDOWN_WARNING,
    POSITION_LIMIT_WARNING,
    EXPOSURE_LIMIT_WARNING,
    DAILY_LOSS_WARNING
}
