package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.TradeResult;
import com.polymarket.edge.domain.event.StrategyEvent;
import com.polymarket.edge.event.Subscription;

import java.util.List;
import java.util.function.Consumer;

/**
 * A named, independently controllable trading strategy as seen by
 * {@link StrategyContext}.
 */
public interface Strategy {

    String getName();

    String getType();

    boolean isEnabled();

    void start();

    void stop();

    boolean isRunning();

    List<Opportunity> scan();

    TradeResult execute(Opportunity opportunity);

    /**
     * One scan / filter / validate / size / execute cycle. Never throws; failures are
     * reported as ERROR events.
     */
    void run();

    /**
     * Scans and executes every opportunity without filtering or sizing. Shares the
     * run-lock with {@link #run()}: while a run is in flight nothing is scanned and a
     * failed summary comes back. Never throws.
     */
    StrategyRunSummary runDirect();

    StrategyConfig getConfig();

    void updateConfig(StrategyConfig.Update update);

    StrategyStats getStats();

    Subscription onEvent(Consumer<StrategyEvent> listener);
}
