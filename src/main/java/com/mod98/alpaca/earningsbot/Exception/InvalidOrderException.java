package com.mod98.alpaca.earningsbot.Exception;

/**
 * Thrown for orders that must not reach the broker: malformed symbol, NaN, zero or negative quantity.
 */
public class InvalidOrderException extends RuntimeException {

    public InvalidOrderException(String symbol, String message) {
        super(String.format("Invalid order for %s: %s", symbol, message));
    }
}
