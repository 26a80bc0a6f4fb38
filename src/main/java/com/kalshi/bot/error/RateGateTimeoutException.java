package com.kalshi.bot.error;

/**
 * A rate permit could not be obtained within the configured wait ceiling. The
 * guarded exchange call was not attempted.
 */
public class RateGateTimeoutException extends TradingException {

    public RateGateTimeoutException(String message) {
        super(message);
    }
}
