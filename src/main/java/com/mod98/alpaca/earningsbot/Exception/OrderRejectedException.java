package com.mod98.alpaca.earningsbot.Exception;

import com.mod98.alpaca.earningsbot.Model.OrderRequest;

/**
 * Thrown when the broker refuses an order at submission.
 */
public class OrderRejectedException extends RuntimeException {

    private final OrderRequest orderRequest;

    public OrderRejectedException(OrderRequest orderRequest, String message) {
        super(String.format("Order rejected for %s: %s", orderRequest.symbol(), message));
        this.orderRequest = orderRequest;
    }

    public OrderRejectedException(OrderRequest orderRequest, String message, Throwable cause) {
        super(String.format("Order rejected for %s: %s", orderRequest.symbol(), message), cause);
        this.orderRequest = orderRequest;
    }

    public OrderRequest getOrderRequest() {
        return orderRequest;
    }
}
