package com.polymarket.edge.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.edge.domain.odds.OddsEvent;
import com.polymarket.edge.exception.OddsApiException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OddsApiClientTest {

    private static final String EVENTS = "[{"
            + "\"id\":\"evt-1\",\"sport_key\":\"basketball_nba\",\"commence_time\":\"2026-03-03T00:30:00Z\","
            + "\"home_team\":\"Los Angeles Lakers\",\"away_team\":\"Boston Celtics\","
            + "\"bookmakers\":["
            + "{\"key\":\"draftkings\",\"markets\":[{\"key\":\"h2h\",\"outcomes\":["
            + "{\"name\":\"Los Angeles Lakers\",\"price\":1.70},{\"name\":\"Boston Celtics\",\"price\":2.20}]}]},"
            + "{\"key\":\"pinnacle\",\"markets\":["
            + "{\"key\":\"spreads\",\"outcomes\":[{\"name\":\"Los Angeles Lakers\",\"price\":1.91}]},"
            + "{\"key\":\"h2h\",\"outcomes\":["
            + "{\"name\":\"Los Angeles Lakers\",\"price\":1.80},{\"name\":\"Boston Celtics\",\"price\":2.10}]}]}"
            + "]},{"
            + "\"id\":\"evt-2\",\"sport_key\":\"basketball_nba\",\"home_team\":\"Miami Heat\","
            + "\"away_team\":\"Chicago Bulls\",\"bookmakers\":[]}]";

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private OddsApiClient client(List<String> keys) {
        return new OddsApiClient(new OkHttpClient(), new ObjectMapper(), server.url("/v4").toString(), keys,
                "pinnacle", "us,eu");
    }

    @Test
    void testKeepsOnlyReferenceBookmakerH2h() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(EVENTS));

        List<OddsEvent> events = client(List.of("key-1")).getEvents("basketball_nba");

        assertEquals(1, events.size());
        OddsEvent event = events.get(0);
        assertEquals("evt-1", event.getId());
        assertEquals("pinnacle", event.getBookmaker());
        assertEquals(Instant.parse("2026-03-03T00:30:00Z"), event.getCommenceTime());
        assertEquals(2, event.getOutcomes().size());
        assertEquals(1.80, event.getOutcomes().get(0).getPrice());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/v4/sports/basketball_nba/odds", request.getRequestUrl().encodedPath());
        assertEquals("h2h", request.getRequestUrl().queryParameter("markets"));
        assertEquals("decimal", request.getRequestUrl().queryParameter("oddsFormat"));
        assertEquals("pinnacle", request.getRequestUrl().queryParameter("bookmakers"));
    }

    @Test
    void testRotatesToKeyWithMostQuota() throws Exception {
        OddsApiClient client = client(List.of("key-1", "key-2"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]")
                .addHeader("x-requests-remaining", "10").addHeader("x-requests-used", "490"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]")
                .addHeader("x-requests-remaining", "300"));

        client.getEvents("basketball_nba");
        client.getEvents("basketball_nba");

        assertEquals("key-1", server.takeRequest(1, TimeUnit.SECONDS).getRequestUrl().queryParameter("apiKey"));
        assertEquals("key-2", server.takeRequest(1, TimeUnit.SECONDS).getRequestUrl().queryParameter("apiKey"));

        List<OddsApiClient.ApiKeyState> quota = client.getQuota();
        assertEquals(10, quota.get(0).getRemaining());
        assertEquals(490, quota.get(0).getUsed());
        assertEquals(300, quota.get(1).getRemaining());
    }

    @Test
    void testErrorStatusRaises() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"message\":\"Invalid key\"}")
                .addHeader("x-requests-remaining", "0"));
        OddsApiClient client = client(List.of("bad-key"));

        OddsApiException e = assertThrows(OddsApiException.class, () -> client.getEvents("soccer_epl"));

        assertEquals(401, e.getStatusCode());
        assertEquals(0, client.getQuota().get(0).getRemaining());
    }

    @Test
    void testUnconfiguredClient() {
        OddsApiClient client = client(List.of(" ", ""));

        assertFalse(client.isConfigured());
        assertThrows(OddsApiException.class, () -> client.getEvents("basketball_nba"));
        assertEquals(0, server.getRequestCount());
    }
}
