package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;

/**
 * Status snapshot of a placed order.
 */
public record OrderFill(OrderStatus status, int filledQuantity, BigDecimal avgFillPrice) {

    public static OrderFill submitted() {
        return new OrderFill(OrderStatus.SUBMITTED, 0, BigDecimal.ZERO);
    }

    public boolean hasFill() {
        return filledQuantity > 0;
    }
}
