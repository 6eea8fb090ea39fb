package com.mod98.alpaca.earningsbot.Model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * One row of the daily trade log. Never mutated after creation.
 */
@JsonPropertyOrder({"date", "time", "symbol", "action", "quantity", "price", "value"})
public record TradeRecord(
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate date,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm:ss") LocalTime time,
        String symbol,
        TradeAction action,
        int quantity,
        BigDecimal price,
        BigDecimal value
) {

    public static TradeRecord of(LocalDateTime at, String symbol, TradeAction action, int quantity, BigDecimal price) {
        BigDecimal value = price.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
        return new TradeRecord(at.toLocalDate(), at.toLocalTime().truncatedTo(ChronoUnit.SECONDS),
                symbol, action, quantity, price, value);
    }

    public LocalDateTime dateTime() {
        return date.atTime(time == null ? LocalTime.MIDNIGHT : time);
    }
}
