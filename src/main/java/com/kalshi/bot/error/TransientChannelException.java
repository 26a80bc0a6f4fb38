package com.kalshi.bot.error;

/**
 * Network, timeout, throttling or auth failure on an exchange call. Retried by
 * {@link com.kalshi.bot.core.ExchangeChannel} up to a bounded count.
 */
public class TransientChannelException extends TradingException {

    private final int statusCode;

    public TransientChannelException(String message) {
        this(message, -1, null);
    }

    public TransientChannelException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TransientChannelException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status that caused the failure, or -1 for I/O errors. */
    public int getStatusCode() {
        return statusCode;
    }
}
