package com.polymarket.edge.strategy;

import com.polymarket.edge.domain.event.StrategyEvent;
import com.polymarket.edge.domain.event.StrategyEventType;
import com.polymarket.edge.event.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StrategyContextTest {

    private ExecutorService executor;
    private StrategyContext context;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        context = new StrategyContext(executor, null, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (context.isRunning()) {
            context.stopAll();
        }
        executor.shutdownNow();
    }

    @Test
    void testDuplicateRegistrationIgnored() {
        StrategyRunner first = new StrategyRunner(new ScriptedStrategyLogic("alpha"));
        StrategyRunner second = new StrategyRunner(new ScriptedStrategyLogic("alpha"));

        context.register(first);
        context.register(second);

        assertEquals(1, context.getAll().size());
        assertSame(first, context.get("alpha").orElseThrow());
    }

    @Test
    void testStartAllOnlyStartsEnabled() {
        StrategyRunner enabled = new StrategyRunner(new ScriptedStrategyLogic("alpha"));
        StrategyRunner disabled = new StrategyRunner(new ScriptedStrategyLogic("beta"));
        disabled.updateConfig(StrategyConfig.Update.enabled(false));
        context.register(enabled);
        context.register(disabled);

        context.startAll();

        assertTrue(context.isRunning());
        assertTrue(enabled.isRunning());
        assertFalse(disabled.isRunning());
        assertEquals(List.of(enabled), context.getEnabled());

        context.stopAll();
        assertFalse(enabled.isRunning());
    }

    @Test
    void testRunOnceIsolatesFailingStrategy() {
        Strategy broken = mock(Strategy.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.isEnabled()).thenReturn(true);
        when(broken.isRunning()).thenReturn(true);
        doThrow(new IllegalStateException("boom")).when(broken).run();

        ScriptedStrategyLogic logic = new ScriptedStrategyLogic("healthy");
        logic.scanner = () -> ScriptedStrategyLogic.opportunities(2);
        StrategyRunner healthy = new StrategyRunner(logic);
        healthy.start();

        context.register(broken);
        context.register(healthy);

        assertDoesNotThrow(context::runOnce);

        verify(broken).run();
        assertEquals(1, healthy.getStats().getRunCount());
        assertEquals(2, logic.executed.size());
    }

    @Test
    void testRunAllBypassesFilteringAndReportsFailures() {
        Strategy broken = mock(Strategy.class);
        when(broken.getName()).thenReturn("broken");
        when(broken.isEnabled()).thenReturn(true);
        when(broken.isRunning()).thenReturn(true);
        when(broken.runDirect()).thenThrow(new IllegalStateException("scan failed"));

        ScriptedStrategyLogic logic = new ScriptedStrategyLogic("healthy");
        logic.scanner = () -> ScriptedStrategyLogic.opportunities(3);
        StrategyRunner healthy = new StrategyRunner(logic);
        healthy.start();

        context.register(broken);
        context.register(healthy);

        List<StrategyRunSummary> summaries = context.runAll();

        assertEquals(2, summaries.size());
        StrategyRunSummary failed = summaries.get(0);
        assertEquals("broken", failed.getStrategy());
        assertTrue(failed.isFailed());
        assertEquals("scan failed", failed.getError());

        StrategyRunSummary ok = summaries.get(1);
        assertFalse(ok.isFailed());
        assertEquals(Integer.valueOf(3), ok.getOpportunities());
        assertEquals(Integer.valueOf(3), ok.getExecuted());
        // runner bookkeeping is not involved
        assertEquals(0, healthy.getStats().getRunCount());
    }

    @Test
    void testEnableDisableAndUnknownNames() {
        StrategyRunner runner = new StrategyRunner(new ScriptedStrategyLogic("alpha"));
        context.register(runner);

        assertTrue(context.disable("alpha"));
        assertFalse(runner.isEnabled());
        assertTrue(context.enable("alpha"));
        assertTrue(runner.isEnabled());

        assertFalse(context.enable("missing"));
        assertFalse(context.start("missing"));
        assertFalse(context.unregister("missing"));
    }

    @Test
    void testUnregisterStopsRunningStrategy() {
        StrategyRunner runner = new StrategyRunner(new ScriptedStrategyLogic("alpha"));
        context.register(runner);
        assertTrue(context.start("alpha"));

        assertTrue(context.unregister("alpha"));

        assertFalse(runner.isRunning());
        assertTrue(context.get("alpha").isEmpty());
    }

    @Test
    void testAggregatedStats() {
        ScriptedStrategyLogic a = new ScriptedStrategyLogic("alpha");
        a.scanner = () -> ScriptedStrategyLogic.opportunities(2);
        ScriptedStrategyLogic b = new ScriptedStrategyLogic("beta");
        b.scanner = () -> ScriptedStrategyLogic.opportunities(1);
        context.register(new StrategyRunner(a));
        context.register(new StrategyRunner(b));
        context.startAll();

        context.runOnce();

        StrategyContextStats stats = context.getStats();
        assertEquals(2, stats.getStrategiesCount());
        assertEquals(2, stats.getRunningCount());
        assertEquals(3, stats.getTotalOpportunitiesFound());
        assertEquals(3, stats.getTotalOpportunitiesExecuted());
        // 10 + 5 from alpha, 5 from beta
        assertEquals(0, new BigDecimal("20").compareTo(stats.getTotalPnl()));
        assertEquals(1.0, stats.getAvgWinRate());
    }

    @Test
    void testStrategyEventSubscription() {
        StrategyRunner alpha = new StrategyRunner(new ScriptedStrategyLogic("alpha"));
        StrategyRunner beta = new StrategyRunner(new ScriptedStrategyLogic("beta"));
        context.register(alpha);
        context.register(beta);
        List<StrategyEvent> events = new ArrayList<>();

        Subscription subscription = context.onStrategyEvent(events::add);
        alpha.start();
        beta.start();
        subscription.unsubscribe();
        alpha.stop();

        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.getType() == StrategyEventType.STARTED));
    }

    @Test
    void testScanIntervalCanChange() {
        context.setScanInterval(Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(30), context.getScanInterval());
    }
}
