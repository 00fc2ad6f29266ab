package com.polymarket.edge.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.edge.config.EdgeProperties;
import com.polymarket.edge.domain.odds.OddsEvent;
import com.polymarket.edge.domain.odds.OddsOutcome;
import com.polymarket.edge.exception.OddsApiException;
import com.polymarket.edge.gateway.OddsReferenceSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * The Odds API v4 client returning the reference bookmaker's h2h decimal odds.
 * <p>
 * Several API keys may be configured; each request uses the key with the most remaining
 * quota, as last reported by the {@code x-requests-remaining} response header.
 */
@Slf4j
@Component
public class OddsApiClient implements OddsReferenceSource {

    static final int ASSUMED_QUOTA = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String bookmaker;
    private final String regions;
    private final List<ApiKeyState> keys = new ArrayList<>();

    @Autowired
    public OddsApiClient(ObjectMapper objectMapper, EdgeProperties properties) {
        this(new OkHttpClient.Builder()
                        .connectTimeout(10, TimeUnit.SECONDS)
                        .readTimeout(30, TimeUnit.SECONDS)
                        .build(),
                objectMapper, properties.getOdds().getBaseUrl(), properties.getOdds().getApiKeys(),
                properties.getOdds().getBookmaker(), properties.getOdds().getRegions());
    }

    public OddsApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, List<String> apiKeys,
            String bookmaker, String regions) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.bookmaker = bookmaker;
        this.regions = regions;
        for (String key : apiKeys) {
            if (key != null && !key.isBlank()) {
                keys.add(new ApiKeyState(key.trim()));
            }
        }
        if (keys.isEmpty()) {
            log.warn("[OddsApi] No API key configured; reference odds are unavailable");
        } else {
            log.info("[OddsApi] Initialized with {} API key(s)", keys.size());
        }
    }

    public boolean isConfigured() {
        return !keys.isEmpty();
    }

    @Override
    public List<OddsEvent> getEvents(String sportKey) {
        ApiKeyState key = bestKey();
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegment("sports")
                .addPathSegment(sportKey)
                .addPathSegment("odds")
                .addQueryParameter("apiKey", key.getKey())
                .addQueryParameter("regions", regions)
                .addQueryParameter("markets", "h2h")
                .addQueryParameter("oddsFormat", "decimal")
                .addQueryParameter("bookmakers", bookmaker)
                .build();
        Request request = new Request.Builder().url(url).header("Accept", "application/json").build();

        try (Response response = httpClient.newCall(request).execute()) {
            updateQuota(key, response);
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new OddsApiException("Odds request for " + sportKey + " failed: " + response.code() + " "
                        + text, response.code());
            }
            return parseEvents(objectMapper.readTree(text));
        } catch (IOException e) {
            throw new OddsApiException("Failed to fetch odds for " + sportKey, e);
        }
    }

    /** Events the configured bookmaker prices in its h2h market. */
    List<OddsEvent> parseEvents(JsonNode root) {
        List<OddsEvent> events = new ArrayList<>();
        if (!root.isArray()) {
            return events;
        }
        for (JsonNode event : root) {
            for (JsonNode book : event.path("bookmakers")) {
                if (!bookmaker.equals(book.path("key").asText())) {
                    continue;
                }
                for (JsonNode market : book.path("markets")) {
                    if (!"h2h".equals(market.path("key").asText())) {
                        continue;
                    }
                    OddsEvent.OddsEventBuilder builder = OddsEvent.builder()
                            .id(event.path("id").asText())
                            .sportKey(event.path("sport_key").asText())
                            .homeTeam(event.path("home_team").asText(null))
                            .awayTeam(event.path("away_team").asText(null))
                            .commenceTime(instant(event.path("commence_time").asText(null)))
                            .bookmaker(bookmaker);
                    for (JsonNode outcome : market.path("outcomes")) {
                        builder.outcome(new OddsOutcome(outcome.path("name").asText(),
                                outcome.path("price").asDouble()));
                    }
                    events.add(builder.build());
                }
            }
        }
        return events;
    }

    private static Instant instant(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("[OddsApi] Unparseable commence_time {}", text);
            return null;
        }
    }

    synchronized ApiKeyState bestKey() {
        if (keys.isEmpty()) {
            throw new OddsApiException("No Odds API key configured", 0);
        }
        ApiKeyState best = keys.stream().max(Comparator.comparingInt(ApiKeyState::getRemaining)).orElseThrow();
        if (best.getRemaining() <= 0) {
            log.warn("[OddsApi] All API keys are out of quota, continuing with the first one");
        }
        return best;
    }

    private synchronized void updateQuota(ApiKeyState key, Response response) {
        String remaining = response.header("x-requests-remaining");
        String used = response.header("x-requests-used");
        try {
            if (remaining != null) {
                key.remaining = (int) Double.parseDouble(remaining);
            }
            if (used != null) {
                key.used = (int) Double.parseDouble(used);
            }
        } catch (NumberFormatException e) {
            log.debug("[OddsApi] Unparseable quota headers remaining={} used={}", remaining, used);
        }
        log.debug("[OddsApi] Key #{} quota - remaining: {}, used: {}", keys.indexOf(key) + 1, key.remaining,
                key.used);
    }

    public synchronized List<ApiKeyState> getQuota() {
        return keys.stream().map(ApiKeyState::copy).toList();
    }

    @Getter
    public static final class ApiKeyState {
        private final String key;
        private int remaining = ASSUMED_QUOTA;
        private int used;

        private ApiKeyState(String key) {
            this.key = key;
        }

        private ApiKeyState copy() {
            ApiKeyState copy = new ApiKeyState(key);
            copy.remaining = remaining;
            copy.used = used;
            return copy;
        }

        @Override
        public String toString() {
            return "ApiKeyState{remaining=" + remaining + ", used=" + used + "}";
        }
    }
}
