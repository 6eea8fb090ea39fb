package com.mod98.alpaca.earningsbot.Exception;

/**
 * Thrown when market data for a symbol is missing or unusable (no history, no price, no earnings date).
 */
public class DataUnavailableException extends RuntimeException {

    private final String symbol;

    public DataUnavailableException(String symbol, String message) {
        super(symbol == null ? message : String.format("[%s] %s", symbol, message));
        this.symbol = symbol;
    }

    public DataUnavailableException(String symbol, String message, Throwable cause) {
        super(symbol == null ? message : String.format("[%s] %s", symbol, message), cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
