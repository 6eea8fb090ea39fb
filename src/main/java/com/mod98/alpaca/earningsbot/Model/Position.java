package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Live position as seen by the ledger. Quantity comes from the broker; stop-loss, entry time and
 * earnings date are engine-local and may be {@code null}.
 */
public record Position(
        String symbol,
        long quantity,
        BigDecimal stopLossPrice,
        Instant entryTimestamp,
        LocalDate earningsDate
) {

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean isShort() {
        return quantity < 0;
    }

    public long absQuantity() {
        return Math.abs(quantity);
    }

    public boolean hasStopLoss() {
        return stopLossPrice != null && stopLossPrice.signum() > 0;
    }
}
