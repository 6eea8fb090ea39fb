package com.mod98.alpaca.earningsbot.Service;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradeRecord;
import com.mod98.alpaca.earningsbot.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TradeHistoryServiceTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private StrategyProperties props;
    private TradeHistoryService history;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2025, 3, 10, 10, 15, 30));
        props = new StrategyProperties();
        props.setTradeHistoryDir(dir.toString());
        history = newService();
    }

    private TradeHistoryService newService() {
        CsvMapper mapper = new CsvMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new TradeHistoryService(mapper, props, clock);
    }

    @Test
    void recordedTradeIsTradedTodayForItsAction() {
        history.recordTrade("AAPL", TradeAction.BUY, 10, new BigDecimal("180.25"));

        assertThat(history.isTradedToday("AAPL", TradeAction.BUY)).isTrue();
        assertThat(history.isTradedToday("AAPL", null)).isTrue();
        assertThat(history.isTradedToday("AAPL", TradeAction.SELL)).isFalse();
        assertThat(history.isTradedToday("MSFT", null)).isFalse();
    }

    @Test
    void yesterdaysTradeDoesNotCountToday() {
        history.recordTrade("AAPL", TradeAction.BUY, 10, new BigDecimal("180"));

        clock.set(LocalDateTime.of(2025, 3, 11, 9, 0));

        assertThat(history.isTradedToday("AAPL", TradeAction.BUY)).isFalse();
        assertThat(history.todaysTrades()).isEmpty();
    }

    @Test
    void dayFileHasHeaderAndOneRowPerTrade() throws Exception {
        history.recordTrade("AAPL", TradeAction.BUY, 10, new BigDecimal("180.25"));
        history.recordTrade("TSLA", TradeAction.SELL, 3, new BigDecimal("250"));

        List<String> lines = Files.readAllLines(dir.resolve("trades_2025-03-10.csv"), StandardCharsets.UTF_8);

        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("date,time,symbol,action,quantity,price,value");
        assertThat(lines.get(1)).isEqualTo("2025-03-10,10:15:30,AAPL,BUY,10,180.25,1802.50");
    }

    @Test
    void restartWithinTheDayReproducesDedupAnswers() {
        history.recordTrade("AAPL", TradeAction.BUY, 10, new BigDecimal("180.25"));
        history.recordTrade("TSLA", TradeAction.SELL, 3, new BigDecimal("250"));

        TradeHistoryService reloaded = newService();

        assertThat(reloaded.isTradedToday("AAPL", TradeAction.BUY)).isTrue();
        assertThat(reloaded.isTradedToday("TSLA", TradeAction.SELL)).isTrue();
        assertThat(reloaded.isTradedToday("TSLA", TradeAction.BUY)).isFalse();
        TradeRecord first = reloaded.todaysTrades().get(0);
        assertThat(first.time()).isEqualTo(LocalTime.of(10, 15, 30));
        assertThat(first.quantity()).isEqualTo(10);
        assertThat(first.value()).isEqualByComparingTo("1802.50");
    }

    @Test
    void loadRangeSpansDayFiles() {
        history.recordTrade("AAPL", TradeAction.BUY, 1, new BigDecimal("10"));
        clock.set(LocalDateTime.of(2025, 3, 12, 11, 0));
        history.recordTrade("MSFT", TradeAction.BUY, 2, new BigDecimal("20"));

        List<TradeRecord> all = history.loadRange(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 12));

        assertThat(all).extracting(TradeRecord::symbol).containsExactly("AAPL", "MSFT");
        assertThat(history.loadRange(LocalDate.of(2025, 3, 11), LocalDate.of(2025, 3, 11))).isEmpty();
    }
}
