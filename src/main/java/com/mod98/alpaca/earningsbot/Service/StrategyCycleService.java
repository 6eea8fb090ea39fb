package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.AccountSummary;
import com.mod98.alpaca.earningsbot.Model.CandidateSet;
import com.mod98.alpaca.earningsbot.Model.CycleReport;
import com.mod98.alpaca.earningsbot.Model.CycleReport.Outcome;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.Model.OrderResult;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradingSession;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One synchronous strategy cycle: session check, position refresh, selection, allocation, entries, then the
 * stop-loss and holding-period passes. Per-symbol failures are logged and skipped.
 */
@RequiredArgsConstructor
@Service
public class StrategyCycleService {

    private static final Logger log = LoggerFactory.getLogger(StrategyCycleService.class);

    static final String LONG_REASON = "earnings reversal long";
    static final String SHORT_REASON = "earnings reversal short";

    private final BrokerPort broker;
    private final MarketDataPort marketData;
    private final MarketCalendar calendar;
    private final CandidateSelector selector;
    private final CapitalAllocator allocator;
    private final PositionLedger ledger;
    private final TradeHistoryService history;
    private final PriceService prices;
    private final OrderExecutorService executor;
    private final RiskMonitorService risk;
    private final StrategyProperties props;
    private final Clock clock;

    private volatile CycleReport lastReport;
    private volatile CandidateSet lastSelection = CandidateSet.empty();

    public synchronized CycleReport runCycle() {
        Instant started = clock.instant();
        TradingSession session = calendar.currentSession();
        if (!session.isTradable()) {
            log.info("Trading not permitted: {}, skipping cycle", session.description());
            return remember(CycleReport.skipped(started, session, session.description()));
        }
        log.info("🚀 Strategy cycle started ({})", session.description());

        try {
            ledger.refreshPositions();
        } catch (RuntimeException e) {
            log.error("Position refresh failed, aborting cycle → {}", e.getMessage());
            return remember(new CycleReport(started, clock.instant(), session, Outcome.ABORTED,
                    List.of(), List.of(), 0, 0, "position refresh failed: " + e.getMessage()));
        }

        LocalDate today = calendar.today();
        List<EarningsEvent> events = fetchCalendar(today);
        CandidateSet candidates;
        try {
            candidates = selector.select(events, today);
        } catch (RuntimeException e) {
            log.error("Candidate selection failed → {}", e.getMessage(), e);
            candidates = CandidateSet.empty();
        }
        lastSelection = candidates;

        int filled = 0;
        String message = "completed";
        if (candidates.isEmpty()) {
            log.info("No trades to place this cycle");
        } else {
            Optional<CapitalAllocator.Allocation> allocation = allocate(candidates);
            if (allocation.isEmpty()) {
                message = "account unavailable, entries skipped";
            } else {
                Map<String, LocalDate> entryDates = earliestDates(events.stream()
                        .filter(e -> !e.earningsDay().isBefore(today))
                        .toList());
                boolean useLimit = session != TradingSession.REGULAR;
                filled += enter(candidates.longSymbols(), TradeAction.BUY, allocation.get().perLong(), useLimit, entryDates);
                filled += enter(candidates.shortSymbols(), TradeAction.SELL, allocation.get().perShort(), useLimit, entryDates);
            }
        }

        int exits = 0;
        try {
            ledger.refreshPositions();
            exits += risk.runStopLossPass();
            exits += risk.runHoldingPeriodPass(earliestDates(events));
        } catch (RuntimeException e) {
            log.error("Position monitoring failed → {}", e.getMessage());
        }

        CycleReport report = new CycleReport(started, clock.instant(), session, Outcome.COMPLETED,
                candidates.longSymbols(), candidates.shortSymbols(), filled, exits, message);
        log.info("🏁 Cycle finished: {} entries filled, {} exits, long={} short={}",
                filled, exits, candidates.longSymbols(), candidates.shortSymbols());
        return remember(report);
    }

    /**
     * Rebuilds cooldowns and stop-loss levels from the trade logs of the last {@code cooldownDays} days, then
     * drops state of symbols the broker no longer holds.
     */
    public synchronized void restoreState() {
        LocalDate today = calendar.today();
        ledger.restoreFromHistory(history.loadRange(today.minusDays(props.getCooldownDays()), today));
        try {
            ledger.refreshPositions();
        } catch (RuntimeException e) {
            log.warn("Initial position refresh failed → {}", e.getMessage());
        }
    }

    /** Stop-loss pass on its own, for the fast monitoring schedule. */
    public synchronized int checkStopLosses() {
        if (!calendar.currentSession().isTradable()) return 0;
        ledger.refreshPositions();
        return risk.runStopLossPass();
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public CandidateSet lastSelection() {
        return lastSelection;
    }

    private List<EarningsEvent> fetchCalendar(LocalDate today) {
        LocalDate from = today.minusDays(props.getEarningsLookbackDays());
        LocalDate to = today.plusDays(props.getDaysRange());
        try {
            return marketData.getUpcomingEarnings(from, to);
        } catch (RuntimeException e) {
            log.error("Earnings calendar unavailable → {}", e.getMessage());
            return List.of();
        }
    }

    private Optional<CapitalAllocator.Allocation> allocate(CandidateSet candidates) {
        AccountSummary account;
        try {
            account = broker.getAccountSummary();
        } catch (RuntimeException e) {
            log.error("Account summary unavailable, skipping entries → {}", e.getMessage());
            return Optional.empty();
        }
        CapitalAllocator.Allocation a = allocator.allocate(account.netLiquidation(),
                candidates.longSymbols().size(), candidates.shortSymbols().size());
        return a.isEmpty() ? Optional.empty() : Optional.of(a);
    }

    private int enter(List<String> symbols, TradeAction action, BigDecimal perSymbol, boolean useLimit,
                      Map<String, LocalDate> earningsDates) {
        int filled = 0;
        for (String symbol : symbols) {
            try {
                if (action == TradeAction.BUY && ledger.isLong(symbol)) {
                    log.info("Already long {} ({} shares), skipping", symbol, ledger.quantity(symbol));
                    continue;
                }
                if (action == TradeAction.SELL && ledger.isShort(symbol)) {
                    log.info("Already short {} ({} shares), skipping", symbol, Math.abs(ledger.quantity(symbol)));
                    continue;
                }
                if (history.isTradedToday(symbol, action)) {
                    log.info("{} already traded {} today, skipping", symbol, action);
                    continue;
                }
                if (!ledger.canBuyAgain(symbol)) {
                    log.info("{} is in cooldown, skipping", symbol);
                    continue;
                }

                BigDecimal price = prices.getLatestPrice(symbol);
                int qty = CapitalAllocator.quantityFor(perSymbol, price);
                if (qty <= 0) {
                    log.info("{} sizes to 0 shares at {}, skipping", symbol, price);
                    continue;
                }

                String reason = action == TradeAction.BUY ? LONG_REASON : SHORT_REASON;
                OrderResult result = executor.execute(symbol, action, qty, reason, useLimit);
                if (result.success()) {
                    filled++;
                    history.recordTrade(symbol, action, result.executedQuantity(), result.executionPrice());
                    ledger.rememberEarningsDate(symbol, earningsDates.get(symbol));
                }
            } catch (RuntimeException e) {
                log.error("{} entry for {} failed → {}", action, symbol, e.getMessage());
            }
        }
        log.info("{} entries: {}/{} filled", action, filled, symbols.size());
        return filled;
    }

    static Map<String, LocalDate> earliestDates(List<EarningsEvent> events) {
        Map<String, LocalDate> dates = new HashMap<>();
        for (EarningsEvent e : events) {
            dates.merge(e.symbol(), e.earningsDay(), (a, b) -> b.isBefore(a) ? b : a);
        }
        return dates;
    }

    private CycleReport remember(CycleReport report) {
        lastReport = report;
        return report;
    }
}
