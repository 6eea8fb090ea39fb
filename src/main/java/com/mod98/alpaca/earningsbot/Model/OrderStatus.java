package com.mod98.alpaca.earningsbot.Model;

/**
 * Order lifecycle: CREATED → SUBMITTED → one of the fill/terminal states.
 * PARTIALLY_FILLED is not terminal while the broker keeps working the rest of the order.
 */
public enum OrderStatus {
    CREATED,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    API_CANCELLED,
    INACTIVE;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == API_CANCELLED || this == INACTIVE;
    }
}
