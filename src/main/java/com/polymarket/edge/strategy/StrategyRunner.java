package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.OpportunityStatus;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.domain.event.StrategyEvent;
import com.polymarket.edge.domain.event.StrategyEventType;
import com.polymarket.edge.event.EventSink;
import com.polymarket.edge.event.ListenerRegistry;
import com.polymarket.edge.event.Subscription;
import com.polymarket.edge.sizing.PositionSizer;
import com.polymarket.edge.sizing.SizingRequest;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The shared orchestration every strategy runs through. Wraps a {@link StrategyLogic}
 * and owns lifecycle, stats and events.
 * <p>
 * At most one {@link #run()} per runner is in flight; an overlapping call returns
 * immediately. Opportunities within a run are handled one after another.
 */
@Slf4j
public class StrategyRunner implements Strategy {

    private final StrategyLogic logic;
    private final PositionSizer positionSizer;
    private final EventSink eventSink;
    private final Clock clock;
    private final ListenerRegistry<StrategyEvent> listeners;

    private volatile boolean enabled = true;
    private volatile boolean running;
    private volatile Integer maxConcurrentTrades;
    private volatile Integer maxDailyTrades;
    private final Object runLock = new Object();
    private boolean inFlight;

    // guarded by "this"
    private long opportunitiesFound;
    private long opportunitiesExecuted;
    private BigDecimal totalPnl = BigDecimal.ZERO;
    private double winRate;
    private BigDecimal avgProfit = BigDecimal.ZERO;
    private Instant lastRunAt;
    private long runCount;
    private LocalDate tradeDay;
    private int tradesToday;

    public StrategyRunner(StrategyLogic logic) {
        this(logic, null, null, Clock.systemDefaultZone());
    }

    public StrategyRunner(StrategyLogic logic, PositionSizer positionSizer, EventSink eventSink, Clock clock) {
        this.logic = Objects.requireNonNull(logic, "logic");
        this.positionSizer = positionSizer;
        this.eventSink = eventSink;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listeners = new ListenerRegistry<>(logic.name());
    }

    @Override
    public String getName() {
        return logic.name();
    }

    @Override
    public String getType() {
        return logic.type();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public StrategyLogic getLogic() {
        return logic;
    }

    @Override
    public synchronized void start() {
        if (running) {
            log.warn("[{}] Strategy already running", getName());
            return;
        }
        running = true;
        emit(StrategyEventType.STARTED, null);
        log.info("[{}] Strategy started", getName());
        logic.onStart();
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            log.warn("[{}] Strategy not running", getName());
            return;
        }
        try {
            logic.onStop();
        } finally {
            running = false;
            emit(StrategyEventType.STOPPED, null);
            log.info("[{}] Strategy stopped", getName());
        }
    }

    @Override
    public List<Opportunity> scan() {
        return logic.scan();
    }

    @Override
    public TradeResult execute(Opportunity opportunity) {
        return logic.execute(opportunity);
    }

    @Override
    public void run() {
        if (!enabled) {
            log.debug("[{}] Strategy disabled, skipping run", getName());
            return;
        }
        if (!running) {
            log.debug("[{}] Strategy not started, skipping run", getName());
            return;
        }
        if (!enterRun()) {
            log.warn("[{}] Previous run still in flight, skipping", getName());
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("[{}] Error during strategy run", getName(), e);
            emit(StrategyEventType.ERROR, new StrategyEvent.Failure(null, e));
        } finally {
            exitRun();
        }
    }

    @Override
    public StrategyRunSummary runDirect() {
        if (!enterRun()) {
            log.warn("[{}] Run in flight, direct run skipped", getName());
            return StrategyRunSummary.busy(getName());
        }
        try {
            List<Opportunity> opportunities = logic.scan();
            int executed = 0;
            for (Opportunity opportunity : opportunities) {
                TradeResult result = logic.execute(opportunity);
                if (result != null && result.isSuccess()) {
                    executed++;
                }
            }
            return StrategyRunSummary.completed(getName(), opportunities.size(), executed);
        } catch (RuntimeException e) {
            log.error("[{}] Error during direct run", getName(), e);
            return StrategyRunSummary.failed(getName(), e);
        } finally {
            exitRun();
        }
    }

    private boolean enterRun() {
        synchronized (runLock) {
            if (inFlight) {
                return false;
            }
            inFlight = true;
            return true;
        }
    }

    private void exitRun() {
        synchronized (runLock) {
            inFlight = false;
        }
    }

    private void runCycle() {
        synchronized (this) {
            runCount++;
            lastRunAt = clock.instant();
        }

        List<Opportunity> opportunities = logic.scan();
        if (opportunities == null || opportunities.isEmpty()) {
            log.debug("[{}] No opportunities found", getName());
            return;
        }
        synchronized (this) {
            opportunitiesFound += opportunities.size();
        }
        log.info("[{}] Found {} opportunities", getName(), opportunities.size());

        List<Opportunity> candidates = logic.filterOpportunities(opportunities, clock.instant());
        int executedThisRun = 0;

        for (Opportunity opportunity : candidates) {
            if (!running) {
                log.info("[{}] Stopped mid-run, {} candidates left unprocessed", getName(),
                        candidates.size() - candidates.indexOf(opportunity));
                break;
            }
            if (tradeCapReached(executedThisRun)) {
                log.info("[{}] Trade cap reached, deferring remaining opportunities", getName());
                break;
            }
            try {
                if (process(opportunity)) {
                    executedThisRun++;
                }
            } catch (RuntimeException e) {
                log.error("[{}] Error executing opportunity {}", getName(), opportunity.getId(), e);
                emit(StrategyEventType.ERROR, new StrategyEvent.Failure(opportunity, e));
            }
        }
    }

    // true when the trade went through
    private boolean process(Opportunity opportunity) {
        if (!logic.validateOpportunity(opportunity, clock.instant())) {
            log.debug("[{}] Opportunity {} no longer valid", getName(), opportunity.getId());
            retire(opportunity);
            return false;
        }

        long size = calculatePositionSize(opportunity);
        if (size <= 0) {
            log.debug("[{}] Position size too small for opportunity {}", getName(), opportunity.getId());
            retire(opportunity);
            return false;
        }

        emit(StrategyEventType.OPPORTUNITY_FOUND, opportunity);
        TradeResult result = logic.execute(opportunity);
        if (result == null || !result.isSuccess()) {
            String reason = result == null ? null : result.getError();
            log.info("[{}] Opportunity {} not executed: {}", getName(), opportunity.getId(),
                    reason == null ? "no result" : reason);
            if (!opportunity.getStatus().isTerminal()) {
                opportunity.markFailed();
            }
            emit(StrategyEventType.TRADE_FAILED, new StrategyEvent.Rejection(opportunity, reason));
            return false;
        }

        recordExecution(result.profitOrZero());
        emit(StrategyEventType.TRADE_EXECUTED, result);
        return true;
    }

    /**
     * Shares the sizer allows for {@code opportunity}. Without a sizer a fixed
     * fraction of available capital is spent.
     */
    long calculatePositionSize(Opportunity opportunity) {
        SizingRequest request = logic.sizingRequest(opportunity);
        if (positionSizer != null) {
            return positionSizer.calculate(request);
        }
        BigDecimal price = request.getPrice();
        if (price == null || price.signum() <= 0) {
            return 0;
        }
        double fraction = logic.params().getDouble(StrategyParams.DEFAULT_POSITION_FRACTION, 0.1);
        return request.getCapital()
                .multiply(BigDecimal.valueOf(fraction))
                .divide(price, 0, RoundingMode.FLOOR)
                .longValue();
    }

    private void retire(Opportunity opportunity) {
        if (opportunity.getStatus() != OpportunityStatus.PENDING) {
            return;
        }
        if (opportunity.isExpiredAt(clock.instant())) {
            opportunity.markExpired();
        } else {
            opportunity.markSkipped();
        }
    }

    private synchronized boolean tradeCapReached(int executedThisRun) {
        Integer perRun = maxConcurrentTrades;
        if (perRun != null && executedThisRun >= perRun) {
            return true;
        }
        Integer perDay = maxDailyTrades;
        rollTradeDay();
        return perDay != null && tradesToday >= perDay;
    }

    private synchronized void recordExecution(BigDecimal profit) {
        opportunitiesExecuted++;
        totalPnl = totalPnl.add(profit);
        rollTradeDay();
        tradesToday++;

        long n = opportunitiesExecuted;
        boolean isWin = profit.signum() > 0;
        long priorWins = Math.round(winRate * (n - 1));
        long wins = isWin ? priorWins + 1 : priorWins;
        winRate = (double) wins / n;
        avgProfit = totalPnl.divide(BigDecimal.valueOf(n), 6, RoundingMode.HALF_UP);
    }

    private void rollTradeDay() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(tradeDay)) {
            tradeDay = today;
            tradesToday = 0;
        }
    }

    @Override
    public StrategyConfig getConfig() {
        return StrategyConfig.builder()
                .enabled(enabled)
                .maxConcurrentTrades(maxConcurrentTrades)
                .maxDailyTrades(maxDailyTrades)
                .params(logic.params().snapshot())
                .build();
    }

    @Override
    public void updateConfig(StrategyConfig.Update update) {
        if (!update.getParams().isEmpty()) {
            StrategyParams candidate = new StrategyParams(logic.params().snapshot());
            candidate.merge(update.getParams());
            logic.checkParams(candidate);
        }
        if (update.getEnabled() != null) {
            enabled = update.getEnabled();
        }
        if (update.getMaxConcurrentTrades() != null) {
            maxConcurrentTrades = update.getMaxConcurrentTrades();
        }
        if (update.getMaxDailyTrades() != null) {
            maxDailyTrades = update.getMaxDailyTrades();
        }
        logic.params().merge(update.getParams());
        log.info("[{}] Config updated: {}", getName(), update);
    }

    @Override
    public synchronized StrategyStats getStats() {
        return StrategyStats.builder()
                .opportunitiesFound(opportunitiesFound)
                .opportunitiesExecuted(opportunitiesExecuted)
                .totalPnl(totalPnl)
                .winRate(winRate)
                .avgProfit(avgProfit)
                .lastRunAt(lastRunAt)
                .runCount(runCount)
                .build();
    }

    @Override
    public Subscription onEvent(Consumer<StrategyEvent> listener) {
        return listeners.subscribe(listener);
    }

    private void emit(StrategyEventType type, Object payload) {
        StrategyEvent event = StrategyEvent.of(type, getName(), payload);
        listeners.publish(event);
        if (eventSink != null) {
            eventSink.publish(event);
        }
    }

    @Override
    public String toString() {
        return "StrategyRunner{" + getName() + ", enabled=" + enabled + ", running=" + running + "}";
    }
}
