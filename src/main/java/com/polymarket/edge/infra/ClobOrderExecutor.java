package com.polymarket.edge.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.polymarket.edge.config.EdgeProperties;
import com.polymarket.edge.domain.OrderResult;
import com.polymarket.edge.domain.Side;
import com.polymarket.edge.exception.PolymarketApiException;
import com.polymarket.edge.gateway.OrderExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link OrderExecutor} backed by the CLOB. Without a private key it runs watch-only:
 * orders are logged and acknowledged with a synthetic id, nothing is sent.
 */
@Slf4j
@Component
public class ClobOrderExecutor implements OrderExecutor {

    static final String WATCH_ONLY_PREFIX = "watch-";

    private final PolymarketApiClient apiClient;
    private final OrderSigner orderSigner;
    private final Credentials credentials;
    private final Clock clock;
    private final long orderExpirySeconds;
    private final AtomicLong salt;

    @Autowired
    public ClobOrderExecutor(PolymarketApiClient apiClient, OrderSigner orderSigner, EdgeProperties properties,
            Clock clock) {
        this(apiClient, orderSigner, properties.getPolymarket().getPrivateKey(), clock,
                properties.getPolymarket().getOrderExpirySeconds());
    }

    public ClobOrderExecutor(PolymarketApiClient apiClient, OrderSigner orderSigner, String privateKey, Clock clock,
            long orderExpirySeconds) {
        this.apiClient = apiClient;
        this.orderSigner = orderSigner;
        this.clock = clock;
        this.orderExpirySeconds = orderExpirySeconds;
        this.salt = new AtomicLong(clock.millis());
        if (privateKey != null && !privateKey.isBlank()) {
            this.credentials = Credentials.create(privateKey.trim());
            log.info("[ClobExecutor] Wallet loaded: {}", credentials.getAddress());
        } else {
            this.credentials = null;
            log.warn("[ClobExecutor] No private key provided. Execution will be in WATCH-ONLY mode.");
        }
    }

    public boolean isWatchOnly() {
        return credentials == null;
    }

    @Override
    public OrderResult placeLimitOrder(String tokenId, BigDecimal price, BigDecimal size, Side side) {
        if (isWatchOnly()) {
            log.info("[WATCH-ONLY] Would {} {} of token {} @ {}", side, size, tokenId, price);
            return OrderResult.accepted(WATCH_ONLY_PREFIX + UUID.randomUUID());
        }

        try {
            OrderSigner.ClobOrder order = orderSigner.buildOrder(tokenId, price, size, side,
                    credentials.getAddress(), clock.instant().getEpochSecond() + orderExpirySeconds,
                    salt.incrementAndGet());
            OrderSigner.SignedOrder signed = orderSigner.sign(order, credentials);

            log.info("[ClobExecutor] Submitting {} order: {} @ {} (total {})", side, size, price,
                    size.multiply(price));
            JsonNode response = apiClient.postOrder(signed);
            if (response.path("success").asBoolean(false)) {
                String orderId = response.path("orderID").asText(null);
                log.info("[ClobExecutor] Order accepted: {}", orderId);
                return OrderResult.accepted(orderId);
            }
            String error = response.path("errorMsg").asText("Order rejected");
            log.warn("[ClobExecutor] Order rejected: {}", error);
            return OrderResult.rejected(error);
        } catch (PolymarketApiException | IllegalArgumentException e) {
            log.error("[ClobExecutor] Failed to place {} order for token {}", side, tokenId, e);
            return OrderResult.rejected(e.getMessage());
        }
    }

    @Override
    public boolean cancelOrder(String orderId) {
        if (isWatchOnly() || orderId.startsWith(WATCH_ONLY_PREFIX)) {
            log.info("[WATCH-ONLY] Would cancel order {}", orderId);
            return true;
        }
        try {
            JsonNode response = apiClient.cancelOrder(orderId);
            boolean ok = false;
            for (JsonNode id : response.path("canceled")) {
                ok |= orderId.equals(id.asText());
            }
            if (!ok) {
                log.warn("[ClobExecutor] Cancel of {} not confirmed: {}", orderId, response.path("not_canceled"));
            }
            return ok;
        } catch (PolymarketApiException e) {
            log.error("[ClobExecutor] Failed to cancel order {}", orderId, e);
            return false;
        }
    }
}
