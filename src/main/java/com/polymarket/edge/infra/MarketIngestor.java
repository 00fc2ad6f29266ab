package com.polymarket.edge.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.edge.config.EdgeProperties;
import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.exception.PolymarketApiException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Periodically pages through the Gamma catalogue and refreshes {@link MarketSnapshotCache}
 * with every binary market and both of its order books. Book fetches run on a small
 * fixed pool; the client's rate limiter bounds the request rate.
 */
@Slf4j
@Component
public class MarketIngestor {

    private final PolymarketApiClient apiClient;
    private final MarketSnapshotCache cache;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int pageSize;
    private final int maxMarkets;
    private final ExecutorService bookFetchers;

    public MarketIngestor(PolymarketApiClient apiClient, MarketSnapshotCache cache, ObjectMapper objectMapper,
            EdgeProperties properties, Clock clock) {
        this.apiClient = apiClient;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pageSize = properties.getPolymarket().getMarketPageSize();
        this.maxMarkets = properties.getPolymarket().getMaxMarkets();
        this.bookFetchers = Executors.newFixedThreadPool(Math.max(1, properties.getPolymarket().getIngestThreads()));
    }

    @Scheduled(fixedDelayString = "${edge.polymarket.ingest-interval-ms:10000}")
    public void ingestMarkets() {
        Instant started = clock.instant();
        log.info("[MarketIngestor] Starting market ingestion...");
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int offset = 0; offset < maxMarkets; offset += pageSize) {
                JsonNode page = apiClient.getMarkets(pageSize, offset);
                if (page == null || !page.isArray() || page.isEmpty()) {
                    break;
                }
                for (JsonNode node : page) {
                    parseMarket(node).ifPresent(m -> tasks.add(() -> refresh(m)));
                }
                if (page.size() < pageSize) {
                    break;
                }
            }

            int refreshed = 0;
            for (var future : bookFetchers.invokeAll(tasks)) {
                if (future.get()) {
                    refreshed++;
                }
            }
            int dropped = cache.retainSince(started);
            log.info("[MarketIngestor] Ingestion complete: {} markets refreshed, {} dropped, {} cached", refreshed,
                    dropped, cache.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[MarketIngestor] Ingestion interrupted");
        } catch (Exception e) {
            log.error("[MarketIngestor] Error during ingestion", e);
        }
    }

    /**
     * Binary markets only. Gamma encodes {@code clobTokenIds} as a JSON string inside the
     * JSON document, so it is parsed twice.
     */
    Optional<Market> parseMarket(JsonNode node) {
        String tokenIds = node.path("clobTokenIds").asText("");
        if (tokenIds.isEmpty() || "null".equals(tokenIds)) {
            return Optional.empty();
        }
        JsonNode ids;
        try {
            ids = objectMapper.readTree(tokenIds);
        } catch (JsonProcessingException e) {
            log.warn("[MarketIngestor] Market {} has malformed clobTokenIds: {}", node.path("id").asText(),
                    e.getOriginalMessage());
            return Optional.empty();
        }
        if (!ids.isArray() || ids.size() != 2) {
            return Optional.empty();
        }

        return Optional.of(Market.builder()
                .marketId(node.path("id").asText())
                .conditionId(node.path("conditionId").asText(null))
                .question(node.path("question").asText(""))
                .outcomeIds(List.of(ids.get(0).asText(), ids.get(1).asText()))
                .active(node.path("active").asBoolean(false))
                .closed(node.path("closed").asBoolean(false))
                .acceptingOrders(node.path("acceptingOrders").asBoolean(true))
                .liquidity(decimal(node.path("liquidityNum")))
                .volume(decimal(node.path("volumeNum")))
                .build());
    }

    private boolean refresh(Market market) {
        try {
            OrderBook yes = apiClient.getOrderBook(market.getYesTokenId());
            OrderBook no = apiClient.getOrderBook(market.getNoTokenId());
            market.setYesOrderBook(yes);
            market.setNoOrderBook(no);
            market.setLastUpdated(clock.instant());
            cache.updateMarket(market);
            return true;
        } catch (PolymarketApiException e) {
            log.warn("[MarketIngestor] Failed to refresh market {}: {}", market.getMarketId(), e.getMessage());
            return false;
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        return node.isNumber() ? node.decimalValue() : null;
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        bookFetchers.shutdownNow();
        if (!bookFetchers.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("[MarketIngestor] Book fetchers did not stop in time");
        }
    }
}
