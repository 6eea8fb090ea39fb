package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.Position;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradeRecord;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single owner of position state. Quantities always come from the broker; stop-loss levels, entry times and
 * earnings dates are kept here and survive refreshes while the symbol is still held. Cooldowns outlive positions.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);
    private static final Logger tradeLog = LoggerFactory.getLogger("trade");

    private final BrokerPort broker;
    private final StrategyProperties props;
    private final Clock clock;

    private volatile Map<String, Long> quantities = Map.of();
    private final Map<String, BigDecimal> stopLossPrices = new ConcurrentHashMap<>();
    private final Map<String, Instant> entryTimes = new ConcurrentHashMap<>();
    private final Map<String, LocalDate> earningsDates = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastBuyTimes = new ConcurrentHashMap<>();

    public PositionLedger(BrokerPort broker, StrategyProperties props, Clock clock) {
        this.broker = broker;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Replaces quantities with the broker snapshot and forgets local state of symbols no longer held.
     * Broker failures propagate to the caller.
     */
    public Map<String, Long> refreshPositions() {
        Map<String, Long> snapshot = Map.copyOf(broker.getPositions());
        quantities = snapshot;
        stopLossPrices.keySet().retainAll(snapshot.keySet());
        entryTimes.keySet().retainAll(snapshot.keySet());
        earningsDates.keySet().retainAll(snapshot.keySet());
        log.info("Positions refreshed: {} held", snapshot.size());
        return snapshot;
    }

    public long quantity(String symbol) {
        return quantities.getOrDefault(symbol, 0L);
    }

    public boolean isLong(String symbol) {
        return quantity(symbol) > 0;
    }

    public boolean isShort(String symbol) {
        return quantity(symbol) < 0;
    }

    public List<Position> positions() {
        List<Position> out = new ArrayList<>();
        quantities.forEach((symbol, qty) -> out.add(new Position(
                symbol, qty, stopLossPrices.get(symbol), entryTimes.get(symbol), earningsDates.get(symbol))));
        out.sort(Comparator.comparing(Position::symbol));
        return out;
    }

    // ---- Cooldown ----
    public boolean canBuyAgain(String symbol) {
        Instant last = lastBuyTimes.get(symbol);
        if (last == null) return true;
        Duration elapsed = Duration.between(last, clock.instant());
        return elapsed.getSeconds() >= props.cooldownSeconds();
    }

    public Map<String, Instant> cooldowns() {
        return Collections.unmodifiableMap(lastBuyTimes);
    }

    // ---- Fills ----
    /** Starts the cooldown and sets the stop-loss level after a BUY fill. */
    public void recordBuyFill(String symbol, BigDecimal executionPrice) {
        Instant now = clock.instant();
        lastBuyTimes.put(symbol, now);
        entryTimes.put(symbol, now);
        if (executionPrice != null && executionPrice.signum() > 0) {
            BigDecimal stop = stopLossFor(executionPrice);
            stopLossPrices.put(symbol, stop);
            tradeLog.info("{} stop-loss set at {}", symbol, stop);
        }
    }

    public Optional<BigDecimal> stopLossPrice(String symbol) {
        return Optional.ofNullable(stopLossPrices.get(symbol));
    }

    /** True when a stop-loss level exists for the symbol and {@code currentPrice} is at or below it. */
    public boolean checkStopLoss(String symbol, BigDecimal currentPrice) {
        BigDecimal stop = stopLossPrices.get(symbol);
        return stop != null && currentPrice != null && currentPrice.compareTo(stop) <= 0;
    }

    BigDecimal stopLossFor(BigDecimal price) {
        return price.multiply(BigDecimal.ONE.subtract(props.getStopLossPercent()))
                .setScale(4, RoundingMode.DOWN);
    }

    // ---- Earnings dates ----
    public void rememberEarningsDate(String symbol, LocalDate date) {
        if (date != null) earningsDates.put(symbol, date);
    }

    public Optional<LocalDate> earningsDate(String symbol) {
        return Optional.ofNullable(earningsDates.get(symbol));
    }

    // ---- Restore ----
    /**
     * Rebuilds cooldowns and stop-loss levels from logged BUY trades, oldest first. Stop-loss levels are only
     * used while the broker still reports the symbol long.
     */
    public void restoreFromHistory(List<TradeRecord> records) {
        int restored = 0;
        List<TradeRecord> buys = records.stream()
                .filter(r -> r.action() == TradeAction.BUY)
                .sorted(Comparator.comparing(TradeRecord::dateTime))
                .toList();
        for (TradeRecord r : buys) {
            Instant at = r.dateTime().atZone(clock.getZone()).toInstant();
            lastBuyTimes.merge(r.symbol(), at, (a, b) -> b.isAfter(a) ? b : a);
            entryTimes.put(r.symbol(), at);
            if (r.price() != null && r.price().signum() > 0) {
                stopLossPrices.put(r.symbol(), stopLossFor(r.price()));
            }
            restored++;
        }
        if (restored > 0) {
            log.info("♻️ Restored cooldown and stop-loss state from {} logged buys ({} symbols)",
                    restored, lastBuyTimes.size());
        }
    }
}
