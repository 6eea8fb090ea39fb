package com.mod98.alpaca.earningsbot.Service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Daily trade log, one CSV file per calendar day ({@code trades_YYYY-MM-DD.csv}). Each append rewrites the whole
 * day file so a restart within the day reads back exactly what is in memory.
 */
@Service
public class TradeHistoryService {

    private static final Logger log = LoggerFactory.getLogger(TradeHistoryService.class);
    private static final Logger tradeLog = LoggerFactory.getLogger("trade");

    private final CsvMapper csv;
    private final CsvSchema schema;
    private final Path dir;
    private final Clock clock;

    private final List<TradeRecord> today = new CopyOnWriteArrayList<>();
    private volatile LocalDate loadedDay;

    public TradeHistoryService(CsvMapper tradeLogCsvMapper, StrategyProperties props, Clock clock) {
        this.csv = tradeLogCsvMapper;
        this.schema = tradeLogCsvMapper.schemaFor(TradeRecord.class).withHeader();
        this.dir = Paths.get(props.getTradeHistoryDir());
        this.clock = clock;
    }

    public synchronized TradeRecord recordTrade(String symbol, TradeAction action, int quantity, BigDecimal price) {
        ensureCurrentDay();
        TradeRecord rec = TradeRecord.of(LocalDateTime.now(clock), symbol, action, quantity, price);
        today.add(rec);
        try {
            writeDay(loadedDay, today);
        } catch (IOException e) {
            // The order already executed; keep the in-memory record so the day's dedup still holds.
            log.error("Failed to persist trade log for {} → {}", loadedDay, e.getMessage(), e);
        }
        tradeLog.info("📝 Trade recorded: {} {} {} @ {} (value {})", action, quantity, symbol, price, rec.value());
        return rec;
    }

    /** True iff today's log holds a record for {@code symbol}, and for {@code action} when it is not null. */
    public boolean isTradedToday(String symbol, TradeAction action) {
        ensureCurrentDay();
        return today.stream().anyMatch(r -> r.symbol().equals(symbol) && (action == null || r.action() == action));
    }

    public List<TradeRecord> todaysTrades() {
        ensureCurrentDay();
        return List.copyOf(today);
    }

    /** All logged trades dated within {@code [from, to]}, oldest day first. Missing day files are skipped. */
    public List<TradeRecord> loadRange(LocalDate from, LocalDate to) {
        List<TradeRecord> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            out.addAll(readDay(d));
        }
        return out;
    }

    Path fileFor(LocalDate day) {
        return dir.resolve("trades_" + day + ".csv");
    }

    // Reloads from disk on first use and on day rollover.
    private synchronized void ensureCurrentDay() {
        LocalDate now = LocalDate.now(clock);
        if (now.equals(loadedDay)) return;
        today.clear();
        today.addAll(readDay(now));
        loadedDay = now;
        if (!today.isEmpty()) {
            log.info("Loaded {} trades for {}", today.size(), now);
        }
    }

    private List<TradeRecord> readDay(LocalDate day) {
        Path file = fileFor(day);
        if (!Files.isRegularFile(file)) return List.of();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<TradeRecord> it = csv.readerFor(TradeRecord.class)
                     .with(CsvSchema.emptySchema().withHeader())
                     .readValues(reader)) {
            return it.readAll();
        } catch (IOException e) {
            log.error("Failed to read trade log {} → {}", file, e.getMessage());
            return List.of();
        }
    }

    private void writeDay(LocalDate day, List<TradeRecord> records) throws IOException {
        Files.createDirectories(dir);
        Path target = fileFor(day);
        Path tmp = Files.createTempFile(dir, "trades_" + day, ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            csv.writer(schema).writeValue(w, records);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
