package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;
import java.time.Instant;

public record Execution(Instant time, String symbol, String side, BigDecimal shares, BigDecimal price, String exchange) {

    public BigDecimal value() {
        return shares.multiply(price);
    }
}
