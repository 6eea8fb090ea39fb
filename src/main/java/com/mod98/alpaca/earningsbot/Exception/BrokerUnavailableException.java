package com.mod98.alpaca.earningsbot.Exception;

/**
 * Thrown when the broker cannot be reached or answers with an error.
 */
public class BrokerUnavailableException extends RuntimeException {

    private final String operation;

    public BrokerUnavailableException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public BrokerUnavailableException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
