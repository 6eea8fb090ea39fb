package com.mod98.alpaca.earningsbot.Cache;

import com.mod98.alpaca.earningsbot.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class HourlyPriceCacheTest {

    private MutableClock clock;
    private HourlyPriceCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2025, 3, 10, 10, 5));
        cache = new HourlyPriceCache(clock);
    }

    @Test
    void priceStaysValidForTheRestOfTheHour() {
        cache.put("AAPL", new BigDecimal("180.00"));

        clock.set(LocalDateTime.of(2025, 3, 10, 10, 59, 59));
        assertThat(cache.get("AAPL")).contains(new BigDecimal("180.00"));
    }

    @Test
    void priceExpiresAtTheNextHour() {
        cache.put("AAPL", new BigDecimal("180.00"));

        clock.advance(Duration.ofMinutes(55));
        assertThat(cache.get("AAPL")).isEmpty();
    }

    @Test
    void olderHoursAreEvictedOnPut() {
        cache.put("AAPL", new BigDecimal("180.00"));
        cache.put("MSFT", new BigDecimal("400.00"));

        clock.advance(Duration.ofHours(1));
        cache.put("AAPL", new BigDecimal("181.00"));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("AAPL")).contains(new BigDecimal("181.00"));
        assertThat(cache.get("MSFT")).isEmpty();
    }
}
