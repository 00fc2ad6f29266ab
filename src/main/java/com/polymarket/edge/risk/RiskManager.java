package com.polymarket.edge.risk;

import com.polymarket.edge.domain.Position;
import com.polymarket.edge.domain.event.RiskAlertEvent;
import com.polymarket.edge.domain.event.RiskAlertLevel;
import com.polymarket.edge.domain.event.RiskAlertType;
import com.polymarket.edge.event.EventSink;
import com.polymarket.edge.event.ListenerRegistry;
import com.polymarket.edge.event.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Portfolio risk engine: limit gates, drawdown and daily P&amp;L tracking, per-position
 * stop-loss / take-profit rules and risk alerts.
 * <p>
 * Running aggregates (high-water mark, drawdown, daily P&amp;L) are guarded by this
 * instance's monitor. Alert listeners are invoked after the monitor is released.
 * Gates report breaches through {@link RiskCheckResult}; nothing here throws for a
 * breached limit or touches a position.
 */
@Slf4j
public class RiskManager {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;
    private final EventSink eventSink;
    private final StopLossHandler stopLossHandler = new StopLossHandler();
    private final TakeProfitHandler takeProfitHandler = new TakeProfitHandler();
    private final ListenerRegistry<RiskAlertEvent> alertListeners = new ListenerRegistry<>("RiskManager");
    private final Map<String, PositionRiskSettings> positionSettings = new LinkedHashMap<>();

    private RiskLimits limits;

    private BigDecimal peakPortfolioValue = BigDecimal.ZERO;
    private BigDecimal currentDrawdown = BigDecimal.ZERO;
    private BigDecimal maxDrawdown = BigDecimal.ZERO;
    private BigDecimal lastTotalExposure = BigDecimal.ZERO;
    private BigDecimal dailyPnl = BigDecimal.ZERO;
    private LocalDate lastDailyReset;
    private RiskMetrics lastMetrics;

    public RiskManager() {
        this(RiskLimits.defaults(), Clock.systemDefaultZone(), null);
    }

    public RiskManager(RiskLimits limits, Clock clock, EventSink eventSink) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventSink = eventSink;
        this.lastDailyReset = LocalDate.now(clock);
    }

    // ---- Limit gates ----

    public synchronized RiskCheckResult checkPositionLimit(BigDecimal size, BigDecimal price) {
        BigDecimal positionValue = size.multiply(price);
        if (positionValue.compareTo(limits.getMaxPositionSize()) > 0) {
            return RiskCheckResult.failed(
                    String.format("Position value $%.2f exceeds limit $%s", positionValue,
                            plain(limits.getMaxPositionSize())),
                    Map.of("positionValue", positionValue));
        }
        return RiskCheckResult.passed();
    }

    /**
     * Checks the exposure last seen by {@link #evaluateRisk} plus {@code additionalExposure}
     * against the total exposure limit.
     */
    public synchronized RiskCheckResult checkExposureLimit(BigDecimal additionalExposure) {
        BigDecimal projected = lastTotalExposure.add(additionalExposure);
        if (projected.compareTo(limits.getMaxTotalExposure()) > 0) {
            return RiskCheckResult.failed(
                    String.format("Total exposure $%.2f exceeds limit $%s", projected,
                            plain(limits.getMaxTotalExposure())),
                    Map.of("currentExposure", lastTotalExposure, "additionalExposure", additionalExposure));
        }
        return RiskCheckResult.passed(Map.of("projectedExposure", projected));
    }

    public synchronized RiskCheckResult checkDrawdown() {
        double drawdownPercent = drawdownPercent();
        if (drawdownPercent > limits.getMaxDrawdownPercent()) {
            return RiskCheckResult.failed(
                    String.format("Drawdown %.2f%% exceeds limit %s%%", drawdownPercent,
                            plain(limits.getMaxDrawdownPercent())),
                    Map.of("drawdownPercent", drawdownPercent, "currentDrawdown", currentDrawdown));
        }
        return RiskCheckResult.passed(Map.of("drawdownPercent", drawdownPercent));
    }

    public synchronized RiskCheckResult checkDailyLoss() {
        resetDailyIfNeeded();
        if (dailyPnl.compareTo(limits.getDailyLossLimit().negate()) < 0) {
            return RiskCheckResult.failed(
                    String.format("Daily loss $%.2f exceeds limit $%s", dailyPnl.abs(),
                            plain(limits.getDailyLossLimit())),
                    Map.of("dailyPnl", dailyPnl));
        }
        return RiskCheckResult.passed(Map.of("dailyPnl", dailyPnl));
    }

    /** First failing gate wins. */
    public synchronized RiskCheckResult checkAllLimits(BigDecimal size, BigDecimal price) {
        List<RiskCheckResult> checks = List.of(
                checkPositionLimit(size, price),
                checkExposureLimit(size.multiply(price)),
                checkDrawdown(),
                checkDailyLoss());
        return checks.stream().filter(RiskCheckResult::isFailed).findFirst().orElse(RiskCheckResult.passed());
    }

    public synchronized RiskCheckResult checkMarketExposure(String marketId, BigDecimal additionalExposure,
            Collection<Position> positions) {
        BigDecimal marketExposure = positions.stream()
                .filter(p -> marketId.equals(p.getMarketId()))
                .map(Position::getCurrentValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal projected = marketExposure.add(additionalExposure);
        if (projected.compareTo(limits.getMaxPerMarketExposure()) > 0) {
            return RiskCheckResult.failed(
                    String.format("Market %s exposure $%.2f exceeds limit $%s", marketId, projected,
                            plain(limits.getMaxPerMarketExposure())),
                    Map.of("marketId", marketId, "marketExposure", marketExposure,
                            "additionalExposure", additionalExposure));
        }
        return RiskCheckResult.passed(Map.of("marketExposure", projected));
    }

    public synchronized RiskCheckResult checkPositionCount(Collection<Position> positions) {
        long open = positions.stream().filter(Position::isOpen).count();
        if (open >= limits.getMaxPositions()) {
            return RiskCheckResult.failed(
                    String.format("Position count %d at limit %d, another position would exceed it", open,
                            limits.getMaxPositions()),
                    Map.of("positionCount", open));
        }
        return RiskCheckResult.passed(Map.of("positionCount", open));
    }

    // ---- Risk evaluation ----

    public synchronized RiskMetrics evaluateRisk(Collection<Position> positions) {
        BigDecimal totalExposure = BigDecimal.ZERO;
        BigDecimal largest = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal entryValue = BigDecimal.ZERO;

        for (Position position : positions) {
            BigDecimal value = position.getCurrentValue();
            totalExposure = totalExposure.add(value);
            largest = largest.max(value);
            entryValue = entryValue.add(position.getEntryValue());
            unrealized = unrealized.add(position.getUnrealizedPnl());
            realized = realized.add(position.realizedPnlOrZero());
        }

        // Equity is cost plus signed P&L, so a short loses value as its price rises.
        BigDecimal portfolioValue = entryValue.add(unrealized).add(realized);
        if (portfolioValue.compareTo(peakPortfolioValue) > 0) {
            peakPortfolioValue = portfolioValue;
        }
        currentDrawdown = peakPortfolioValue.subtract(portfolioValue);
        maxDrawdown = maxDrawdown.max(currentDrawdown);
        lastTotalExposure = totalExposure;

        double drawdownPercent = drawdownPercent();
        resetDailyIfNeeded();
        int score = riskScore(totalExposure, largest, drawdownPercent, positions.size(), dailyPnl);

        lastMetrics = RiskMetrics.builder()
                .totalExposure(totalExposure)
                .maxPositionSize(largest)
                .currentDrawdown(currentDrawdown)
                .maxDrawdown(maxDrawdown)
                .drawdownPercent(drawdownPercent)
                .positionCount(positions.size())
                .unrealizedPnl(unrealized)
                .realizedPnl(realized)
                .totalPnl(unrealized.add(realized))
                .riskScore(score)
                .timestamp(clock.instant())
                .build();
        return lastMetrics;
    }

    public synchronized RiskCheckResult evaluatePosition(Position position) {
        BigDecimal value = position.getCurrentValue();
        if (value.compareTo(limits.getMaxPositionSize()) > 0) {
            return RiskCheckResult.failed(
                    String.format("Position value $%.2f exceeds size limit $%s", value,
                            plain(limits.getMaxPositionSize())),
                    Map.of("positionValue", value));
        }
        double lossPercent = position.getUnrealizedPnlPercent();
        if (lossPercent < -limits.getMaxDrawdownPercent()) {
            return RiskCheckResult.failed(
                    String.format("Position loss %.2f%% exceeds drawdown limit %s%%", Math.abs(lossPercent),
                            plain(limits.getMaxDrawdownPercent())),
                    Map.of("lossPercent", lossPercent));
        }
        return RiskCheckResult.passed();
    }

    // ---- Stop-loss / take-profit ----

    public synchronized void setStopLoss(String positionId, StopLossConfig config) {
        settingsFor(positionId).setStopLoss(config);
        log.info("[RiskManager] Stop-loss set for position {}: {} @ {}", positionId, config.getKind(),
                config.getValue());
    }

    public synchronized void setTakeProfit(String positionId, TakeProfitConfig config) {
        settingsFor(positionId).setTakeProfit(config);
        log.info("[RiskManager] Take-profit set for position {}: {} @ {}", positionId, config.getKind(),
                config.getValue());
    }

    /** Detached copy of the current settings. */
    public synchronized Optional<PositionRiskSettings> getPositionRiskSettings(String positionId) {
        return Optional.ofNullable(positionSettings.get(positionId)).map(PositionRiskSettings::copy);
    }

    public synchronized void removePositionRiskSettings(String positionId) {
        positionSettings.remove(positionId);
    }

    /**
     * Ratchets a trailing stop first, then evaluates. False when the position has no stop-loss.
     */
    public synchronized boolean checkStopLoss(Position position) {
        PositionRiskSettings settings = positionSettings.get(position.getId());
        if (settings == null || settings.getStopLoss() == null) {
            return false;
        }
        StopLossConfig current = settings.getStopLoss();
        if (current.getKind() == StopLossConfig.Kind.TRAILING) {
            StopLossConfig updated = stopLossHandler.updateTrailingStop(position, current);
            if (updated != current) {
                settings.setStopLoss(updated);
                settings.setUpdatedAt(clock.instant());
                current = updated;
            }
        }
        return stopLossHandler.evaluate(position, current);
    }

    public synchronized boolean checkTakeProfit(Position position) {
        PositionRiskSettings settings = positionSettings.get(position.getId());
        if (settings == null || settings.getTakeProfit() == null) {
            return false;
        }
        return takeProfitHandler.evaluate(position, settings.getTakeProfit());
    }

    /** Shares to close once take-profit fires; the full size without a partial rule. */
    public synchronized BigDecimal partialCloseSize(Position position) {
        PositionRiskSettings settings = positionSettings.get(position.getId());
        if (settings == null || settings.getTakeProfit() == null) {
            return position.getSize();
        }
        return takeProfitHandler.calculatePartialSize(position, settings.getTakeProfit());
    }

    /**
     * One risk cycle: recompute metrics, raise portfolio-level alerts, then check each
     * open position's stop-loss and take-profit. Returns the alerts it emitted.
     */
    public List<RiskAlertEvent> evaluateAllPositions(Collection<Position> positions) {
        List<RiskAlertEvent> alerts;
        synchronized (this) {
            alerts = collectAlerts(positions);
        }
        alerts.forEach(this::emitAlert);
        return alerts;
    }

    private List<RiskAlertEvent> collectAlerts(Collection<Position> positions) {
        List<RiskAlertEvent> alerts = new ArrayList<>();
        RiskMetrics metrics = evaluateRisk(positions);
        double maxDd = limits.getMaxDrawdownPercent();

        if (metrics.getDrawdownPercent() >= maxDd) {
            alerts.add(RiskAlertEvent.portfolio(RiskAlertType.DRAWDOWN_WARNING, RiskAlertLevel.CRITICAL,
                    String.format("Portfolio drawdown %.2f%% exceeds limit %s%%", metrics.getDrawdownPercent(),
                            plain(maxDd)),
                    Map.of("drawdownPercent", metrics.getDrawdownPercent(), "maxDrawdownPercent", maxDd)));
        } else if (metrics.getDrawdownPercent() >= maxDd * 0.8) {
            alerts.add(RiskAlertEvent.portfolio(RiskAlertType.DRAWDOWN_WARNING, RiskAlertLevel.WARNING,
                    String.format("Portfolio drawdown %.2f%% approaching limit %s%%", metrics.getDrawdownPercent(),
                            plain(maxDd)),
                    Map.of("drawdownPercent", metrics.getDrawdownPercent())));
        }

        if (metrics.getPositionCount() >= limits.getMaxPositions()) {
            alerts.add(RiskAlertEvent.portfolio(RiskAlertType.POSITION_LIMIT_WARNING, RiskAlertLevel.WARNING,
                    String.format("Position count %d at limit %d", metrics.getPositionCount(),
                            limits.getMaxPositions()),
                    Map.of("positionCount", metrics.getPositionCount())));
        }

        BigDecimal exposureWarning = limits.getMaxTotalExposure().multiply(new BigDecimal("0.9"));
        if (metrics.getTotalExposure().compareTo(exposureWarning) >= 0) {
            alerts.add(RiskAlertEvent.portfolio(RiskAlertType.EXPOSURE_LIMIT_WARNING, RiskAlertLevel.WARNING,
                    String.format("Total exposure $%.2f approaching limit $%s", metrics.getTotalExposure(),
                            plain(limits.getMaxTotalExposure())),
                    Map.of("totalExposure", metrics.getTotalExposure())));
        }

        for (Position position : positions) {
            if (!position.isOpen()) {
                continue;
            }
            Map<String, Object> positionMetrics = Map.of(
                    "currentPrice", position.getCurrentPrice(),
                    "unrealizedPnl", position.getUnrealizedPnl());
            if (checkStopLoss(position)) {
                alerts.add(RiskAlertEvent.forPosition(RiskAlertType.STOP_LOSS_TRIGGERED, RiskAlertLevel.CRITICAL,
                        String.format("Stop-loss triggered for position %s at price %.4f", shortId(position),
                                position.getCurrentPrice()),
                        position, positionMetrics));
            }
            if (checkTakeProfit(position)) {
                alerts.add(RiskAlertEvent.forPosition(RiskAlertType.TAKE_PROFIT_TRIGGERED, RiskAlertLevel.INFO,
                        String.format("Take-profit triggered for position %s at price %.4f", shortId(position),
                                position.getCurrentPrice()),
                        position, positionMetrics));
            }
        }
        return alerts;
    }

    // ---- Daily P&L ----

    public synchronized void updateDailyPnL(BigDecimal pnl) {
        resetDailyIfNeeded();
        dailyPnl = dailyPnl.add(pnl);
    }

    public synchronized BigDecimal getDailyPnl() {
        resetDailyIfNeeded();
        return dailyPnl;
    }

    // ---- Limits ----

    public synchronized void setLimits(RiskLimits newLimits) {
        this.limits = Objects.requireNonNull(newLimits, "limits");
        log.info("[RiskManager] Risk limits replaced: {}", limits);
    }

    public synchronized void setLimits(RiskLimits.Patch patch) {
        this.limits = limits.merge(patch);
        log.info("[RiskManager] Risk limits updated: {}", limits);
    }

    public synchronized RiskLimits getLimits() {
        return limits;
    }

    /** Snapshot from the most recent {@link #evaluateRisk} call, if any. */
    public synchronized Optional<RiskMetrics> getLastMetrics() {
        return Optional.ofNullable(lastMetrics);
    }

    public synchronized BigDecimal getPeakPortfolioValue() {
        return peakPortfolioValue;
    }

    // ---- Alerts ----

    public Subscription onRiskAlert(Consumer<RiskAlertEvent> listener) {
        return alertListeners.subscribe(listener);
    }

    private void emitAlert(RiskAlertEvent alert) {
        log.warn("[RiskManager] {}: {}", alert.getLevel(), alert.getMessage());
        alertListeners.publish(alert);
        if (eventSink != null) {
            eventSink.publish(alert);
        }
    }

    // ---- Internals ----

    private PositionRiskSettings settingsFor(String positionId) {
        PositionRiskSettings settings = positionSettings.computeIfAbsent(positionId,
                id -> PositionRiskSettings.create(id, clock.instant()));
        settings.setUpdatedAt(clock.instant());
        return settings;
    }

    private double drawdownPercent() {
        if (peakPortfolioValue.signum() <= 0) {
            return 0;
        }
        return currentDrawdown.multiply(HUNDRED).divide(peakPortfolioValue, 8, RoundingMode.HALF_UP).doubleValue();
    }

    private int riskScore(BigDecimal totalExposure, BigDecimal largest, double drawdownPercent, int positionCount,
            BigDecimal pnlToday) {
        double score = 0;

        double exposureUtil = ratio(totalExposure, limits.getMaxTotalExposure());
        score += Math.min(30, exposureUtil * 30);

        double concentration = ratio(largest, totalExposure);
        score += Math.min(20, concentration * 20);

        double drawdownSeverity = limits.getMaxDrawdownPercent() > 0
                ? drawdownPercent / limits.getMaxDrawdownPercent() : 0;
        score += Math.min(30, drawdownSeverity * 30);

        double positionUtil = limits.getMaxPositions() > 0 ? (double) positionCount / limits.getMaxPositions() : 0;
        score += Math.min(10, positionUtil * 10);

        if (pnlToday.signum() < 0) {
            score += Math.min(10, ratio(pnlToday.abs(), limits.getDailyLossLimit()) * 10);
        }

        return (int) Math.round(Math.min(100, score));
    }

    private void resetDailyIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(lastDailyReset)) {
            dailyPnl = BigDecimal.ZERO;
            lastDailyReset = today;
            log.info("[RiskManager] Daily PnL reset for {}", today);
        }
    }

    private static double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return 0;
        }
        return numerator.divide(denominator, 8, RoundingMode.HALF_UP).doubleValue();
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static String plain(double value) {
        return plain(BigDecimal.valueOf(value));
    }

    private static String shortId(Position position) {
        String id = position.getId();
        return id.length() > 8 ? id.substring(0, 8) + "..." : id;
    }
}
