package com.mod98.alpaca.earningsbot.Exception;

/**
 * Thrown when no source yields a positive price for a symbol.
 */
public class PriceUnavailableException extends DataUnavailableException {

    public PriceUnavailableException(String symbol) {
        super(symbol, "No positive price from live quote or daily close");
    }
}
