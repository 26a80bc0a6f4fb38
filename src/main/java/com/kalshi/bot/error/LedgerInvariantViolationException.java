package com.kalshi.bot.error;

/**
 * Portfolio bookkeeping reached an impossible state. Fatal: the ledger halts
 * and no further orders are placed.
 */
public class LedgerInvariantViolationException extends TradingException {

    public LedgerInvariantViolationException(String message) {
        super(message);
    }
}
