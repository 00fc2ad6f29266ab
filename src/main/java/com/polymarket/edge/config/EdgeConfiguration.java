package com.polymarket.edge.config;

import com.polymarket.edge.event.EventSink;
import com.polymarket.edge.gateway.MarketDataSource;
import com.polymarket.edge.infra.InMemoryPositionBook;
import com.polymarket.edge.risk.RiskLimits;
import com.polymarket.edge.risk.RiskManager;
import com.polymarket.edge.strategy.OpportunityBook;
import com.polymarket.edge.strategy.StrategyContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class EdgeConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RiskManager riskManager(EdgeProperties properties, Clock clock, EventSink eventSink) {
        EdgeProperties.Risk risk = properties.getRisk();
        RiskLimits limits = RiskLimits.builder()
                .maxPositionSize(risk.getMaxPositionSize())
                .maxTotalExposure(risk.getMaxTotalExposure())
                .maxDrawdownPercent(risk.getMaxDrawdownPercent())
                .maxPositions(risk.getMaxPositions())
                .maxPerMarketExposure(risk.getMaxPerMarketExposure())
                .dailyLossLimit(risk.getDailyLossLimit())
                .build();
        return new RiskManager(limits, clock, eventSink);
    }

    @Bean
    public InMemoryPositionBook positionBook(MarketDataSource marketData, RiskManager riskManager,
            EdgeProperties properties) {
        return new InMemoryPositionBook(marketData, riskManager, properties.getRisk().getDefaultStopLossPercent(),
                properties.getRisk().getDefaultTakeProfitPercent());
    }

    @Bean
    public ThreadPoolTaskExecutor strategyExecutor(EdgeProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getRunnerPoolSize());
        executor.setMaxPoolSize(properties.getRunnerPoolSize());
        executor.setThreadNamePrefix("strategy-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public StrategyContext strategyContext(@Qualifier("strategyExecutor") ThreadPoolTaskExecutor strategyExecutor,
            TaskScheduler taskScheduler, EdgeProperties properties) {
        return new StrategyContext(strategyExecutor, taskScheduler, properties.getScanInterval());
    }

    @Bean
    public OpportunityBook opportunityBook(Clock clock) {
        return new OpportunityBook(clock);
    }
}
