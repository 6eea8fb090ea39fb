package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;

public record OrderRequest(
        String symbol,
        TradeAction action,
        int quantity,
        OrderType type,
        BigDecimal limitPrice,
        boolean extendedHours,
        TimeInForce timeInForce
) {

    public static OrderRequest market(String symbol, TradeAction action, int quantity) {
        return new OrderRequest(symbol, action, quantity, OrderType.MARKET, null, true, TimeInForce.DAY);
    }

    public static OrderRequest limit(String symbol, TradeAction action, int quantity, BigDecimal limitPrice) {
        return new OrderRequest(symbol, action, quantity, OrderType.LIMIT, limitPrice, true, TimeInForce.DAY);
    }
}
