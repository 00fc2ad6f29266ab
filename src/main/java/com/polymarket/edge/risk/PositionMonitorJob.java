package com.polymarket.edge.risk;

import com.polymarket.edge.domain.Position;
import com.polymarket.edge.domain.event.RiskAlertEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Risk cadence: the only caller that mutates {@link RiskManager} aggregates in a
 * running application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionMonitorJob {

    private final RiskManager riskManager;
    private final PositionSource positionSource;

    @Scheduled(fixedDelayString = "${edge.risk.monitor-interval-ms:10000}",
            initialDelayString = "${edge.risk.monitor-interval-ms:10000}")
    public void monitor() {
        try {
            List<Position> positions = positionSource.getOpenPositions();
            if (positions.isEmpty()) {
                log.debug("[PositionMonitor] No open positions to monitor");
                return;
            }

            List<RiskAlertEvent> alerts = riskManager.evaluateAllPositions(positions);
            alerts.forEach(a -> log.info("[PositionMonitor] Risk alert: {} - {}", a.getAlertType(), a.getMessage()));

            riskManager.getLastMetrics().ifPresent(m -> log.debug(
                    "[PositionMonitor] Positions: {}, Exposure: ${}, Drawdown: {}%, Risk Score: {}",
                    m.getPositionCount(), m.getTotalExposure(), String.format("%.2f", m.getDrawdownPercent()),
                    m.getRiskScore()));
        } catch (RuntimeException e) {
            log.error("[PositionMonitor] Position check failed", e);
        }
    }
}
