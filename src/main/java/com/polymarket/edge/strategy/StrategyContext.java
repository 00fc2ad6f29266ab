package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.event.StrategyEvent;
import com.polymarket.edge.event.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Registry of named strategies plus the recurring scan trigger.
 * <p>
 * {@link #runOnce()} fans out to every enabled, running strategy on the injected
 * executor and waits for all of them; a failing strategy is logged and does not affect
 * its siblings.
 */
@Slf4j
public class StrategyContext {

    private final Map<String, Strategy> strategies = new LinkedHashMap<>();
    private final Executor executor;
    private final TaskScheduler scheduler;

    private volatile Duration scanInterval;
    private volatile boolean running;
    private ScheduledFuture<?> scanTask;

    /**
     * @param scheduler drives the recurring trigger; null when an external job calls
     *                  {@link #runOnce()} or {@link #runAll()} instead
     */
    public StrategyContext(Executor executor, TaskScheduler scheduler, Duration scanInterval) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = scheduler;
        this.scanInterval = Objects.requireNonNull(scanInterval, "scanInterval");
    }

    // ---- Registry ----

    public synchronized void register(Strategy strategy) {
        if (strategies.containsKey(strategy.getName())) {
            log.warn("[StrategyContext] Strategy {} already registered", strategy.getName());
            return;
        }
        strategies.put(strategy.getName(), strategy);
        log.info("[StrategyContext] Registered strategy: {}", strategy.getName());
    }

    public boolean unregister(String name) {
        Strategy strategy;
        synchronized (this) {
            strategy = strategies.remove(name);
        }
        if (strategy == null) {
            return false;
        }
        if (strategy.isRunning()) {
            strategy.stop();
        }
        log.info("[StrategyContext] Unregistered strategy: {}", name);
        return true;
    }

    public synchronized Optional<Strategy> get(String name) {
        return Optional.ofNullable(strategies.get(name));
    }

    public synchronized List<Strategy> getAll() {
        return new ArrayList<>(strategies.values());
    }

    public List<Strategy> getEnabled() {
        return getAll().stream().filter(Strategy::isEnabled).collect(Collectors.toList());
    }

    // ---- Lifecycle ----

    public void startAll() {
        synchronized (this) {
            if (running) {
                log.warn("[StrategyContext] Already running");
                return;
            }
            running = true;
        }
        List<Strategy> enabled = getEnabled();
        enabled.forEach(Strategy::start);
        startScanTrigger();
        log.info("[StrategyContext] Started {} strategies", enabled.size());
    }

    public void stopAll() {
        synchronized (this) {
            if (!running) {
                log.warn("[StrategyContext] Not running");
                return;
            }
            running = false;
        }
        stopScanTrigger();
        getAll().stream().filter(Strategy::isRunning).forEach(Strategy::stop);
        log.info("[StrategyContext] All strategies stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public boolean start(String name) {
        return withStrategy(name, Strategy::start);
    }

    public boolean stop(String name) {
        return withStrategy(name, Strategy::stop);
    }

    public boolean enable(String name) {
        return withStrategy(name, s -> s.updateConfig(StrategyConfig.Update.enabled(true)));
    }

    public boolean disable(String name) {
        return withStrategy(name, s -> s.updateConfig(StrategyConfig.Update.enabled(false)));
    }

    private boolean withStrategy(String name, Consumer<Strategy> action) {
        Optional<Strategy> strategy = get(name);
        if (strategy.isEmpty()) {
            log.warn("[StrategyContext] Strategy {} not found", name);
            return false;
        }
        action.accept(strategy.get());
        return true;
    }

    // ---- Execution ----

    private List<Strategy> active() {
        return getAll().stream().filter(s -> s.isEnabled() && s.isRunning()).collect(Collectors.toList());
    }

    /** Runs every active strategy concurrently and returns once all have finished. */
    public void runOnce() {
        List<Strategy> active = active();
        log.debug("[StrategyContext] Running {} strategies", active.size());

        CompletableFuture<?>[] runs = active.stream()
                .map(s -> CompletableFuture.runAsync(s::run, executor)
                        .exceptionally(e -> {
                            log.error("[StrategyContext] Error running strategy {}", s.getName(), e);
                            return null;
                        }))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(runs).join();
    }

    /**
     * Scans and executes every active strategy directly, bypassing the runner's
     * filtering and sizing. A strategy that is mid-run reports a busy summary instead.
     * Never throws; a failed strategy is reported in its summary.
     */
    public List<StrategyRunSummary> runAll() {
        List<Strategy> active = active();
        log.debug("[StrategyContext] Running {} strategies", active.size());

        List<CompletableFuture<StrategyRunSummary>> runs = active.stream()
                .map(s -> CompletableFuture.supplyAsync(() -> scanAndExecute(s), executor)
                        .exceptionally(e -> {
                            log.error("[StrategyContext] Error running strategy {}", s.getName(), e);
                            return StrategyRunSummary.failed(s.getName(), e);
                        }))
                .collect(Collectors.toList());
        return runs.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private StrategyRunSummary scanAndExecute(Strategy strategy) {
        try {
            return strategy.runDirect();
        } catch (RuntimeException e) {
            log.error("[StrategyContext] Error running strategy {}", strategy.getName(), e);
            return StrategyRunSummary.failed(strategy.getName(), e);
        }
    }

    // ---- Stats & events ----

    public StrategyContextStats getStats() {
        List<Strategy> all = getAll();
        List<StrategyContextStats.Entry> entries = all.stream()
                .map(s -> new StrategyContextStats.Entry(s.getName(), s.getType(), s.isEnabled(), s.isRunning(),
                        s.getStats()))
                .collect(Collectors.toList());

        return StrategyContextStats.builder()
                .strategies(entries)
                .strategiesCount(all.size())
                .enabledCount((int) entries.stream().filter(StrategyContextStats.Entry::isEnabled).count())
                .runningCount((int) entries.stream().filter(StrategyContextStats.Entry::isRunning).count())
                .totalOpportunitiesFound(entries.stream().mapToLong(e -> e.getStats().getOpportunitiesFound()).sum())
                .totalOpportunitiesExecuted(
                        entries.stream().mapToLong(e -> e.getStats().getOpportunitiesExecuted()).sum())
                .totalPnl(entries.stream().map(e -> e.getStats().getTotalPnl()).reduce(BigDecimal.ZERO, BigDecimal::add))
                .avgWinRate(entries.stream().mapToDouble(e -> e.getStats().getWinRate()).average().orElse(0))
                .build();
    }

    /** Subscribes {@code listener} to every strategy registered at call time. */
    public Subscription onStrategyEvent(Consumer<StrategyEvent> listener) {
        List<Subscription> subscriptions = getAll().stream()
                .map(s -> s.onEvent(listener))
                .collect(Collectors.toList());
        return () -> subscriptions.forEach(Subscription::unsubscribe);
    }

    // ---- Trigger ----

    public void setScanInterval(Duration interval) {
        this.scanInterval = Objects.requireNonNull(interval, "interval");
        if (running) {
            stopScanTrigger();
            startScanTrigger();
        }
    }

    public Duration getScanInterval() {
        return scanInterval;
    }

    private synchronized void startScanTrigger() {
        if (scheduler == null) {
            log.info("[StrategyContext] No scheduler configured, waiting for external trigger");
            return;
        }
        if (scanTask != null) {
            scanTask.cancel(false);
        }
        scanTask = scheduler.scheduleWithFixedDelay(this::tick, scanInterval);
        log.info("[StrategyContext] Scan interval started: {} ms", scanInterval.toMillis());
    }

    private synchronized void stopScanTrigger() {
        if (scanTask != null) {
            scanTask.cancel(false);
            scanTask = null;
            log.info("[StrategyContext] Scan interval stopped");
        }
    }

    private void tick() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("[StrategyContext] Error in scan interval", e);
        }
    }
}
