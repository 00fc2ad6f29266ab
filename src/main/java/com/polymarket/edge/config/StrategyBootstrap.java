package com.polymarket.edge.config;

import com.polymarket.edge.domain.Opportunity;
import com.polymarket.edge.domain.event.StrategyEventType;
import com.polymarket.edge.event.EventSink;
import com.polymarket.edge.event.Subscription;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.gateway.OrderExecutor;
import com.polymarket.edge.infra.OddsApiClient;
import com.polymarket.edge.sizing.FixedRatioPositionSizer;
import com.polymarket.edge.sizing.KellyPositionSizer;
import com.polymarket.edge.sizing.PositionSizer;
import com.polymarket.edge.strategy.OpportunityBook;
import com.polymarket.edge.strategy.StrategyConfig;
import com.polymarket.edge.strategy.StrategyContext;
import com.polymarket.edge.strategy.StrategyLogic;
import com.polymarket.edge.strategy.StrategyRunner;
import com.polymarket.edge.strategy.arbitrage.CrossMarketArbitrageStrategy;
import com.polymarket.edge.strategy.arbitrage.DeviationStrategy;
import com.polymarket.edge.strategy.arbitrage.OddsValueStrategy;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the configured strategies, registers them with the {@link StrategyContext} and
 * starts scanning once the application is ready.
 */
@Slf4j
@Component
public class StrategyBootstrap {

    private final StrategyContext context;
    private final OpportunityBook opportunityBook;
    private final EdgeProperties properties;
    private final MarketDataSource marketData;
    private final OrderExecutor orderExecutor;
    private final OddsApiClient oddsApiClient;
    private final EventSink eventSink;
    private final Clock clock;

    private Subscription bookSubscription;

    public StrategyBootstrap(StrategyContext context, OpportunityBook opportunityBook, EdgeProperties properties,
            MarketDataSource marketData, OrderExecutor orderExecutor, OddsApiClient oddsApiClient,
            EventSink eventSink, Clock clock) {
        this.context = context;
        this.opportunityBook = opportunityBook;
        this.properties = properties;
        this.marketData = marketData;
        this.orderExecutor = orderExecutor;
        this.oddsApiClient = oddsApiClient;
        this.eventSink = eventSink;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        EdgeProperties.Sizing sizing = properties.getSizing();
        EdgeProperties.Strategies settings = properties.getStrategies();

        register(new CrossMarketArbitrageStrategy(marketData, orderExecutor), settings.getCrossMarket(),
                new FixedRatioPositionSizer(sizing.getFixedRatio(), (long) sizing.getFixedRatioMaxPositionSize(), 1));

        if (oddsApiClient.isConfigured() && !properties.getOdds().getSportKeys().isEmpty()) {
            register(new OddsValueStrategy(marketData, oddsApiClient, orderExecutor,
                            properties.getOdds().getSportKeys(), clock), settings.getOddsValue(),
                    new KellyPositionSizer(sizing.getKellyMultiplier(), sizing.getMaxBetFraction(),
                            sizing.getMinBetFraction()));
        } else {
            log.info("[Bootstrap] Odds value strategy not registered: no Odds API key or sport keys configured");
        }

        EdgeProperties.DeviationSettings deviationSettings = settings.getDeviation();
        DeviationStrategy deviation = new DeviationStrategy(marketData, orderExecutor, clock);
        deviationSettings.getWatchTokens().forEach(deviation::watchToken);
        register(deviation, deviationSettings, new KellyPositionSizer(deviationSettings.getKellyMultiplier(),
                sizing.getMaxBetFraction(), sizing.getMinBetFraction()));

        bookSubscription = context.onStrategyEvent(event -> {
            if (event.getType() == StrategyEventType.OPPORTUNITY_FOUND) {
                opportunityBook.record((Opportunity) event.getPayload());
            }
        });

        context.startAll();
    }

    private void register(StrategyLogic logic, EdgeProperties.StrategySettings settings, PositionSizer sizer) {
        StrategyRunner runner = new StrategyRunner(logic, sizer, eventSink, clock);
        runner.updateConfig(StrategyConfig.Update.builder()
                .enabled(settings.isEnabled())
                .maxConcurrentTrades(settings.getMaxConcurrentTrades())
                .maxDailyTrades(settings.getMaxDailyTrades())
                .params(settings.getParams())
                .build());
        context.register(runner);
    }

    @Scheduled(fixedDelayString = "${edge.opportunity-purge-interval:PT1M}")
    public void purgeOpportunities() {
        int purged = opportunityBook.purge();
        if (purged > 0) {
            log.debug("[Bootstrap] Purged {} finished opportunities", purged);
        }
    }

    @PreDestroy
    public void stop() {
        if (bookSubscription != null) {
            bookSubscription.unsubscribe();
        }
        if (context.isRunning()) {
            context.stopAll();
        }
    }
}
