package com.polymarket.edge.config;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "edge")
@Data
public class EdgeProperties {

    private Duration scanInterval = Duration.ofSeconds(30);
    private int runnerPoolSize = 4;
    private Duration opportunityPurgeInterval = Duration.ofMinutes(1);

    private Polymarket polymarket = new Polymarket();
    private Odds odds = new Odds();
    private Risk risk = new Risk();
    private Sizing sizing = new Sizing();
    private Strategies strategies = new Strategies();

    @Data
    public static class Polymarket {
        private String gammaUrl = "https://gamma-api.polymarket.com";
        private String clobUrl = "https://clob.polymarket.com";
        /** Hex private key; blank keeps the executor in watch-only mode. */
        private String privateKey = "";
        private double requestsPerSecond = 4.0;
        /** Requests an idle client may send back to back before pacing kicks in. */
        private int requestBurst = 1;
        private int maxRetries = 3;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(60);
        private int marketPageSize = 100;
        private int maxMarkets = 1000;
        private int ingestThreads = 4;
        private long ingestIntervalMs = 10000;
        private long orderExpirySeconds = 300;
    }

    @Data
    public static class Odds {
        private String baseUrl = "https://api.the-odds-api.com/v4";
        private List<String> apiKeys = new ArrayList<>();
        private String bookmaker = "pinnacle";
        private String regions = "us,eu";
        private List<String> sportKeys = new ArrayList<>();
    }

    @Data
    public static class Risk {
        private BigDecimal maxPositionSize = new BigDecimal("1000");
        private BigDecimal maxTotalExposure = new BigDecimal("10000");
        private double maxDrawdownPercent = 10;
        private int maxPositions = 10;
        private BigDecimal maxPerMarketExposure = new BigDecimal("2000");
        private BigDecimal dailyLossLimit = new BigDecimal("500");
        private long monitorIntervalMs = 10000;
        /** Applied to every newly opened position; 0 disables. */
        private double defaultStopLossPercent = 0;
        private double defaultTakeProfitPercent = 0;
    }

    @Data
    public static class Sizing {
        private double kellyMultiplier = 0.5;
        private double maxBetFraction = 0.25;
        private double minBetFraction = 0.01;
        private double fixedRatio = 0.1;
        private double fixedRatioMaxPositionSize = 1000;
    }

    @Data
    public static class Strategies {
        private StrategySettings crossMarket = new StrategySettings();
        private StrategySettings oddsValue = new StrategySettings();
        private DeviationSettings deviation = new DeviationSettings();
    }

    @Data
    public static class StrategySettings {
        private boolean enabled = true;
        private Integer maxConcurrentTrades;
        private Integer maxDailyTrades;
        /** Merged over the strategy's built-in parameter defaults. */
        private Map<String, Object> params = new LinkedHashMap<>();
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    public static class DeviationSettings extends StrategySettings {
        /** tokenId to marketId. */
        private Map<String, String> watchTokens = new LinkedHashMap<>();
        private double kellyMultiplier = 0.3;

        public DeviationSettings() {
            setEnabled(false); // needs watch tokens before it can do anything
        }
    }
}
