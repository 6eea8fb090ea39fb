package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One upcoming earnings announcement. Optional figures are {@code null} when the source did not report them.
 */
public record EarningsEvent(
        String symbol,
        String companyName,
        LocalDateTime earningsDate,
        EarningsTiming timing,
        BigDecimal estimatedEps,
        BigDecimal marketCap,
        BigDecimal price,
        Long volume
) {

    public EarningsEvent {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(earningsDate, "earningsDate");
        if (timing == null) {
            timing = EarningsTiming.fromTime(earningsDate.toLocalTime());
        }
    }

    public LocalDate earningsDay() {
        return earningsDate.toLocalDate();
    }

    public boolean hasMarketCap() {
        return marketCap != null && marketCap.signum() > 0;
    }
}
