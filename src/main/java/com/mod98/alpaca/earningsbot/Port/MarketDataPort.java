package com.mod98.alpaca.earningsbot.Port;

import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.Model.PriceBar;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only market data source. Failures surface as {@link DataUnavailableException}.
 */
public interface MarketDataPort {

    /** Announcements dated within {@code [from, to]}, both inclusive. */
    List<EarningsEvent> getUpcomingEarnings(LocalDate from, LocalDate to);

    /** The most recent {@code lookbackSessions} daily closes, oldest first. */
    List<PriceBar> getHistory(String symbol, int lookbackSessions);

    Optional<BigDecimal> getMarketCap(String symbol);
}
