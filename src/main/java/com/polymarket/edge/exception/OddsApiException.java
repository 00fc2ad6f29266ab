package com.polymarket.edge.exception;

import lombok.Getter;

@Getter
public class OddsApiException extends RuntimeException {

    private final int statusCode;

    public OddsApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public OddsApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
