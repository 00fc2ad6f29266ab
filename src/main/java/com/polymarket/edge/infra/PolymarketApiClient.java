package com.polymarket.edge.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polymarket.edge.config.EdgeProperties;
import com.polymarket.edge.domain.OrderBook;
import com.polymarket.edge.exception.PolymarketApiException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionSpec;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * REST access to the Gamma market catalogue and the CLOB order book / order endpoints.
 * <p>
 * All requests share one rate limiter. 429 responses are retried with linear backoff and
 * I/O errors with a fixed pause; anything else non-2xx is a {@link PolymarketApiException}.
 */
@Slf4j
@Component
public class PolymarketApiClient {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl gammaUrl;
    private final HttpUrl clobUrl;
    private final RateLimiter rateLimiter;
    private final int maxRetries;
    private final long backoffMillis;

    @Autowired
    public PolymarketApiClient(ObjectMapper objectMapper, EdgeProperties properties) {
        this(buildHttpClient(properties.getPolymarket()), objectMapper, properties.getPolymarket().getGammaUrl(),
                properties.getPolymarket().getClobUrl(),
                new RateLimiter(properties.getPolymarket().getRequestsPerSecond(),
                        properties.getPolymarket().getRequestBurst()),
                properties.getPolymarket().getMaxRetries(), 1000);
    }

    public PolymarketApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, String gammaUrl, String clobUrl,
            double requestsPerSecond, int maxRetries, long backoffMillis) {
        this(httpClient, objectMapper, gammaUrl, clobUrl, new RateLimiter(requestsPerSecond, 1), maxRetries,
                backoffMillis);
    }

    PolymarketApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, String gammaUrl, String clobUrl,
            RateLimiter rateLimiter, int maxRetries, long backoffMillis) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.gammaUrl = HttpUrl.get(gammaUrl);
        this.clobUrl = HttpUrl.get(clobUrl);
        this.rateLimiter = rateLimiter;
        this.maxRetries = Math.max(1, maxRetries);
        this.backoffMillis = backoffMillis;
    }

    private static OkHttpClient buildHttpClient(EdgeProperties.Polymarket config) {
        // Some edge servers are picky about the TLS handshake; offer everything MODERN_TLS can.
        ConnectionSpec spec = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();
        return new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(spec, ConnectionSpec.CLEARTEXT))
                .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    /** One page of active, open markets. */
    public JsonNode getMarkets(int limit, int offset) {
        HttpUrl url = gammaUrl.newBuilder()
                .addPathSegment("markets")
                .addQueryParameter("limit", String.valueOf(limit))
                .addQueryParameter("offset", String.valueOf(offset))
                .addQueryParameter("active", "true")
                .addQueryParameter("closed", "false")
                .build();
        return execute(get(url));
    }

    public OrderBook getOrderBook(String tokenId) {
        HttpUrl url = clobUrl.newBuilder()
                .addPathSegment("book")
                .addQueryParameter("token_id", tokenId)
                .build();
        JsonNode book = execute(get(url));
        return OrderBook.builder()
                .tokenId(tokenId)
                .bids(parseLevels(book.path("bids")))
                .asks(parseLevels(book.path("asks")))
                .build();
    }

    /**
     * Submits a signed GTC order.
     *
     * @return the CLOB response body, e.g. {@code {"success":true,"orderID":"0x..."}}
     */
    public JsonNode postOrder(OrderSigner.SignedOrder signed) {
        OrderSigner.ClobOrder order = signed.getOrder();
        ObjectNode orderNode = objectMapper.createObjectNode();
        orderNode.put("salt", order.getSalt().toString());
        orderNode.put("maker", order.getMaker());
        orderNode.put("signer", order.getSigner());
        orderNode.put("taker", order.getTaker());
        orderNode.put("tokenId", order.getTokenId().toString());
        orderNode.put("makerAmount", order.getMakerAmount().toString());
        orderNode.put("takerAmount", order.getTakerAmount().toString());
        orderNode.put("expiration", order.getExpiration().toString());
        orderNode.put("nonce", order.getNonce().toString());
        orderNode.put("feeRateBps", order.getFeeRateBps().toString());
        orderNode.put("side", order.getSide() == 0 ? "BUY" : "SELL");
        orderNode.put("signatureType", order.getSignatureType());
        orderNode.put("signature", signed.getSignature());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("order", orderNode);
        payload.put("owner", order.getMaker());
        payload.put("orderType", "GTC");

        Request request = new Request.Builder()
                .url(clobUrl.newBuilder().addPathSegment("order").build())
                .post(RequestBody.create(write(payload), JSON))
                .header("User-Agent", USER_AGENT)
                .header("Origin", "https://polymarket.com")
                .build();
        return execute(request);
    }

    public JsonNode cancelOrder(String orderId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("orderID", orderId);
        Request request = new Request.Builder()
                .url(clobUrl.newBuilder().addPathSegment("order").build())
                .delete(RequestBody.create(write(payload), JSON))
                .header("User-Agent", USER_AGENT)
                .header("Origin", "https://polymarket.com")
                .build();
        return execute(request);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new PolymarketApiException("Failed to serialize request", e);
        }
    }

    private static Request get(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .header("Origin", "https://polymarket.com")
                .header("Referer", "https://polymarket.com/")
                .build();
    }

    private JsonNode execute(Request request) {
        for (int attempt = 1; ; attempt++) {
            try {
                rateLimiter.acquire();
                try (Response response = httpClient.newCall(request).execute()) {
                    if (response.code() == 429 && attempt < maxRetries) {
                        log.warn("[PolymarketApi] Rate limited on {}, retry {}/{}", request.url().encodedPath(),
                                attempt, maxRetries - 1);
                        TimeUnit.MILLISECONDS.sleep(backoffMillis * attempt);
                        continue;
                    }
                    ResponseBody body = response.body();
                    String text = body == null ? "" : body.string();
                    if (!response.isSuccessful()) {
                        throw new PolymarketApiException(request.method() + " " + request.url().encodedPath()
                                + " failed: " + response.code() + " " + text, response.code());
                    }
                    return text.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
                }
            } catch (IOException e) {
                if (attempt >= maxRetries) {
                    throw new PolymarketApiException("Failed to call " + request.url() + " after " + attempt
                            + " attempts", e);
                }
                log.debug("[PolymarketApi] Transient error on {}: {}", request.url().encodedPath(), e.getMessage());
                pause(backoffMillis / 2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PolymarketApiException("Interrupted calling " + request.url(), e);
            }
        }
    }

    private static void pause(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PolymarketApiException("Interrupted during retry backoff", e);
        }
    }

    private static List<OrderBook.OrderLevel> parseLevels(JsonNode levels) {
        List<OrderBook.OrderLevel> list = new ArrayList<>();
        if (levels.isArray()) {
            for (JsonNode level : levels) {
                list.add(OrderBook.OrderLevel.builder()
                        .price(new BigDecimal(level.path("price").asText("0")))
                        .size(new BigDecimal(level.path("size").asText("0")))
                        .build());
            }
        }
        return list;
    }
}
