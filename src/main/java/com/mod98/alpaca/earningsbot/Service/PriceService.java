package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Cache.HourlyPriceCache;
import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.PriceUnavailableException;
import com.mod98.alpaca.earningsbot.Model.PriceBar;
import com.mod98.alpaca.earningsbot.Model.Quote;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Reference price lookup: hourly cache, then live last, close, bid/ask midpoint, then the last daily close
 * from market data. Only positive prices are returned or cached.
 */
@RequiredArgsConstructor
@Service
public class PriceService {

    private static final Logger log = LoggerFactory.getLogger(PriceService.class);

    private final BrokerPort broker;
    private final MarketDataPort marketData;
    private final HourlyPriceCache cache;

    public BigDecimal getLatestPrice(String symbol) {
        Optional<BigDecimal> cached = cache.get(symbol);
        if (cached.isPresent()) return cached.get();

        BigDecimal price = null;
        try {
            price = fromQuote(broker.getQuote(symbol));
        } catch (RuntimeException e) {
            log.warn("Live quote for {} failed → {}, trying daily close", symbol, e.getMessage());
        }

        if (!isPositive(price)) {
            price = lastDailyClose(symbol);
            if (isPositive(price)) {
                log.info("Using last daily close for {}: {}", symbol, price);
            }
        }

        if (!isPositive(price)) {
            throw new PriceUnavailableException(symbol);
        }
        cache.put(symbol, price);
        return price;
    }

    static BigDecimal fromQuote(Quote q) {
        if (q == null) return null;
        if (isPositive(q.last())) return q.last();
        if (isPositive(q.close())) return q.close();
        if (isPositive(q.bid()) && isPositive(q.ask())) {
            return q.bid().add(q.ask()).divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP);
        }
        return null;
    }

    private BigDecimal lastDailyClose(String symbol) {
        try {
            List<PriceBar> bars = marketData.getHistory(symbol, 1);
            if (bars.isEmpty()) return null;
            return bars.get(bars.size() - 1).close();
        } catch (DataUnavailableException e) {
            log.error("Daily close for {} also failed → {}", symbol, e.getMessage());
            return null;
        }
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }
}
