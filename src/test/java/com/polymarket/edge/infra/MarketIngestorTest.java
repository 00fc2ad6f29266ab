package com.polymarket.edge.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.edge.config.EdgeProperties;
import com.polymarket.edge.domain.Market;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.exception.PolymarketApiException;
import com.polymarket.edge.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MarketIngestorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private PolymarketApiClient apiClient;
    private MarketSnapshotCache cache;
    private MutableClock clock;
    private MarketIngestor ingestor;

    @BeforeEach
    void setUp() {
        apiClient = mock(PolymarketApiClient.class);
        cache = new MarketSnapshotCache();
        clock = MutableClock.startingNow();
        EdgeProperties properties = new EdgeProperties();
        properties.getPolymarket().setMarketPageSize(2);
        properties.getPolymarket().setMaxMarkets(10);
        properties.getPolymarket().setIngestThreads(2);
        ingestor = new MarketIngestor(apiClient, cache, mapper, properties, clock);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        ingestor.shutdown();
    }

    @Test
    void testParsesBinaryMarket() throws Exception {
        JsonNode node = mapper.readTree("{\"id\":\"512\",\"conditionId\":\"0xc0nd\",\"question\":\"Will it rain?\","
                + "\"clobTokenIds\":\"[\\\"111\\\", \\\"222\\\"]\",\"active\":true,\"closed\":false,"
                + "\"acceptingOrders\":true,\"liquidityNum\":1520.5,\"volumeNum\":98000}");

        Market market = ingestor.parseMarket(node).orElseThrow();

        assertEquals("512", market.getMarketId());
        assertEquals("0xc0nd", market.getConditionId());
        assertEquals("111", market.getYesTokenId());
        assertEquals("222", market.getNoTokenId());
        assertTrue(market.isTradeable());
        assertEquals(0, new BigDecimal("1520.5").compareTo(market.getLiquidity()));
    }

    @Test
    void testRejectsNonBinaryOrMalformed() throws Exception {
        assertTrue(ingestor.parseMarket(mapper.readTree("{\"id\":\"1\"}")).isEmpty());
        assertTrue(ingestor.parseMarket(mapper.readTree("{\"id\":\"2\",\"clobTokenIds\":\"[oops\"}")).isEmpty());
        assertTrue(ingestor.parseMarket(mapper.readTree(
                "{\"id\":\"3\",\"clobTokenIds\":\"[\\\"1\\\",\\\"2\\\",\\\"3\\\"]\"}")).isEmpty());
    }

    @Test
    void testIngestRefreshesAndDropsStale() throws Exception {
        Market stale = Market.builder().marketId("old").outcomeIds(List.of("8", "9"))
                .lastUpdated(clock.instant().minus(Duration.ofMinutes(5))).build();
        cache.updateMarket(stale);

        when(apiClient.getMarkets(2, 0)).thenReturn(mapper.readTree("["
                + "{\"id\":\"a\",\"clobTokenIds\":\"[\\\"1\\\",\\\"2\\\"]\",\"active\":true},"
                + "{\"id\":\"b\",\"clobTokenIds\":\"[\\\"3\\\",\\\"4\\\"]\",\"active\":true}]"));
        when(apiClient.getMarkets(2, 2)).thenReturn(mapper.readTree("["
                + "{\"id\":\"c\",\"clobTokenIds\":\"[\\\"5\\\",\\\"6\\\"]\",\"active\":true}]"));
        when(apiClient.getOrderBook(anyString())).thenAnswer(inv -> OrderBook.builder()
                .tokenId(inv.getArgument(0))
                .bids(List.of())
                .asks(List.of(OrderBook.OrderLevel.builder().price(new BigDecimal("0.5")).size(BigDecimal.TEN)
                        .build()))
                .build());
        when(apiClient.getOrderBook("3")).thenThrow(new PolymarketApiException("book 404", 404));

        ingestor.ingestMarkets();

        assertEquals(2, cache.size());
        assertTrue(cache.getMarket("a").isPresent());
        assertTrue(cache.getMarket("c").isPresent());
        assertTrue(cache.getMarket("b").isEmpty());
        assertTrue(cache.getMarket("old").isEmpty());
        assertEquals("1", cache.getMarket("a").orElseThrow().getYesOrderBook().getTokenId());
        assertTrue(cache.getLastRefresh().isPresent());
        verify(apiClient, never()).getMarkets(2, 4);
    }

    @Test
    void testCatalogueFailureKeepsSnapshot() {
        Market kept = Market.builder().marketId("kept").outcomeIds(List.of("1", "2")).lastUpdated(clock.instant())
                .build();
        cache.updateMarket(kept);
        when(apiClient.getMarkets(anyInt(), anyInt())).thenThrow(new PolymarketApiException("gamma down", 502));

        assertDoesNotThrow(ingestor::ingestMarkets);

        assertEquals(1, cache.size());
    }
}
