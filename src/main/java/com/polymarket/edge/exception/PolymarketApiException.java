package com.polymarket.edge.exception;

import lombok.Getter;

/**
 * Failure talking to the Polymarket Gamma or CLOB REST API. {@code statusCode} is 0
 * when no HTTP response was received.
 */
@Getter
public class PolymarketApiException extends RuntimeException {

    private final int statusCode;

    public PolymarketApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PolymarketApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
