package com.mod98.alpaca.earningsbot.Cache;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price cache keyed by (symbol, date, hour) of the market clock. A price stays valid for the rest of the
 * wall-clock hour in which it was captured, even if the market has moved since.
 */
@Component
public class HourlyPriceCache {

    private final Clock clock;
    private final Map<Key, BigDecimal> prices = new ConcurrentHashMap<>();

    public HourlyPriceCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<BigDecimal> get(String symbol) {
        return Optional.ofNullable(prices.get(currentKey(symbol)));
    }

    public void put(String symbol, BigDecimal price) {
        Key key = currentKey(symbol);
        prices.keySet().removeIf(k -> k.isOlderThan(key));
        prices.put(key, price);
    }

    int size() {
        return prices.size();
    }

    private Key currentKey(String symbol) {
        LocalDateTime now = LocalDateTime.now(clock);
        return new Key(symbol, now.toLocalDate(), now.getHour());
    }

    private record Key(String symbol, LocalDate date, int hour) {
        boolean isOlderThan(Key other) {
            return date.isBefore(other.date) || (date.equals(other.date) && hour < other.hour);
        }
    }
}
