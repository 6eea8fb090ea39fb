package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;

/**
 * Outcome of one placeOrder call. {@code success} is true for a full fill or any partial fill.
 */
public record OrderResult(
        String symbol,
        TradeAction action,
        int requestedQuantity,
        String reason,
        OrderType type,
        String orderId,
        OrderStatus status,
        int filledQuantity,
        BigDecimal avgFillPrice,
        BigDecimal referencePrice,
        boolean success,
        String message
) {

    public static OrderResult rejected(String symbol, TradeAction action, int quantity, String reason, String message) {
        return new OrderResult(symbol, action, quantity, reason, null, null, OrderStatus.CREATED,
                0, null, null, false, message);
    }

    /** Average fill price when the broker reported one, otherwise the reference price. */
    public BigDecimal executionPrice() {
        if (avgFillPrice != null && avgFillPrice.signum() > 0) {
            return avgFillPrice;
        }
        return referencePrice;
    }

    /** Filled quantity when known, otherwise the requested quantity. */
    public int executedQuantity() {
        return filledQuantity > 0 ? filledQuantity : requestedQuantity;
    }
}
