package com.kalshi.bot.error;

/**
 * The exchange refused a request for business reasons (insufficient balance,
 * market closed, invalid price). Terminal, never retried.
 */
public class ExchangeRejectionException extends TradingException {

    private final int statusCode;

    public ExchangeRejectionException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
