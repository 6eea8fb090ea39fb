package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import com.mod98.alpaca.earningsbot.Model.AccountSummary;
import com.mod98.alpaca.earningsbot.Model.CandidateSet;
import com.mod98.alpaca.earningsbot.Model.CycleReport;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.Model.OrderResult;
import com.mod98.alpaca.earningsbot.Model.OrderStatus;
import com.mod98.alpaca.earningsbot.Model.OrderType;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradeRecord;
import com.mod98.alpaca.earningsbot.MutableClock;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StrategyCycleServiceTest {

    private static final LocalDate EARNINGS = LocalDate.of(2025, 3, 12);

    private MutableClock clock;
    private BrokerPort broker;
    private MarketDataPort marketData;
    private CandidateSelector selector;
    private PositionLedger ledger;
    private TradeHistoryService history;
    private PriceService prices;
    private OrderExecutorService executor;
    private RiskMonitorService risk;
    private StrategyCycleService cycle;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2025, 3, 10, 10, 0));
        broker = mock(BrokerPort.class);
        marketData = mock(MarketDataPort.class);
        selector = mock(CandidateSelector.class);
        history = mock(TradeHistoryService.class);
        prices = mock(PriceService.class);
        executor = mock(OrderExecutorService.class);
        risk = mock(RiskMonitorService.class);
        StrategyProperties props = new StrategyProperties();
        MarketCalendar calendar = new MarketCalendar(clock);
        ledger = new PositionLedger(broker, props, clock);
        cycle = new StrategyCycleService(broker, marketData, calendar, selector, new CapitalAllocator(props),
                ledger, history, prices, executor, risk, props, clock);

        when(broker.getPositions()).thenReturn(Map.of());
        when(broker.getAccountSummary()).thenReturn(account("100000"));
        when(marketData.getUpcomingEarnings(any(), any())).thenReturn(List.of(
                event("AAPL", EARNINGS), event("TSLA", EARNINGS)));
        when(selector.select(any(), any())).thenReturn(
                new CandidateSet(List.of("AAPL"), List.of("TSLA"), List.of()));
        when(prices.getLatestPrice(anyString())).thenReturn(new BigDecimal("100"));
        when(executor.execute(anyString(), any(), anyDouble(), anyString(), anyBoolean()))
                .thenAnswer(inv -> filled(inv.getArgument(0), inv.getArgument(1), inv.<Double>getArgument(2).intValue()));
    }

    private static AccountSummary account(String netLiq) {
        return new AccountSummary(new BigDecimal(netLiq), null, null, null, null, null);
    }

    private static EarningsEvent event(String symbol, LocalDate day) {
        return new EarningsEvent(symbol, symbol + " Inc", day.atTime(16, 30), null, null,
                new BigDecimal("1000000000"), new BigDecimal("100"), 1_000_000L);
    }

    private static OrderResult filled(String symbol, TradeAction action, int qty) {
        return new OrderResult(symbol, action, qty, "test", OrderType.MARKET, "ord-" + symbol,
                OrderStatus.FILLED, qty, new BigDecimal("100.10"), new BigDecimal("100"), true, "filled");
    }

    @Nested
    @DisplayName("cycle gating")
    class Gating {

        @Test
        void weekendCycleIsSkippedWithoutBrokerCalls() {
            clock.set(LocalDateTime.of(2025, 3, 8, 11, 0));

            CycleReport report = cycle.runCycle();

            assertThat(report.outcome()).isEqualTo(CycleReport.Outcome.SKIPPED);
            verify(broker, never()).getPositions();
            verify(selector, never()).select(any(), any());
        }

        @Test
        void positionRefreshFailureAbortsTheCycle() {
            when(broker.getPositions()).thenThrow(new BrokerUnavailableException("positions", "down"));

            CycleReport report = cycle.runCycle();

            assertThat(report.outcome()).isEqualTo(CycleReport.Outcome.ABORTED);
            verify(selector, never()).select(any(), any());
            verify(executor, never()).execute(anyString(), any(), anyDouble(), anyString(), anyBoolean());
            assertThat(cycle.lastReport()).contains(report);
        }

        @Test
        void calendarFailureMeansNoCandidatesButMonitoringStillRuns() {
            when(marketData.getUpcomingEarnings(any(), any())).thenThrow(new DataUnavailableException(null, "down"));
            when(selector.select(eq(List.of()), any())).thenReturn(CandidateSet.empty());

            CycleReport report = cycle.runCycle();

            assertThat(report.outcome()).isEqualTo(CycleReport.Outcome.COMPLETED);
            assertThat(report.entriesFilled()).isZero();
            verify(risk).runStopLossPass();
            verify(risk).runHoldingPeriodPass(anyMap());
        }

        @Test
        void accountFailureSkipsEntriesButMonitoringStillRuns() {
            when(broker.getAccountSummary()).thenThrow(new BrokerUnavailableException("account", "down"));
            when(risk.runStopLossPass()).thenReturn(1);

            CycleReport report = cycle.runCycle();

            assertThat(report.outcome()).isEqualTo(CycleReport.Outcome.COMPLETED);
            assertThat(report.message()).isEqualTo("account unavailable, entries skipped");
            assertThat(report.exitsSubmitted()).isEqualTo(1);
            verify(executor, never()).execute(anyString(), any(), anyDouble(), anyString(), anyBoolean());
        }
    }

    @Nested
    @DisplayName("entries")
    class Entries {

        @Test
        void buysLongsAndSellsShortsWithEqualCapital() {
            when(broker.getPositions()).thenReturn(Map.of(), Map.of("AAPL", 150L, "TSLA", -150L));

            CycleReport report = cycle.runCycle();

            // 100k * 0.3 * 0.5 = 15k per side, one symbol each, at 100
            verify(executor).execute("AAPL", TradeAction.BUY, 150, StrategyCycleService.LONG_REASON, false);
            verify(executor).execute("TSLA", TradeAction.SELL, 150, StrategyCycleService.SHORT_REASON, false);
            verify(history).recordTrade("AAPL", TradeAction.BUY, 150, new BigDecimal("100.10"));
            verify(history).recordTrade("TSLA", TradeAction.SELL, 150, new BigDecimal("100.10"));
            assertThat(report.entriesFilled()).isEqualTo(2);
            assertThat(report.longCandidates()).containsExactly("AAPL");
            assertThat(ledger.earningsDate("AAPL")).contains(EARNINGS);
            assertThat(cycle.lastSelection().shortSymbols()).containsExactly("TSLA");
        }

        @Test
        void extendedHoursEntriesUseLimitOrders() {
            clock.set(LocalDateTime.of(2025, 3, 10, 7, 0));

            cycle.runCycle();

            verify(executor).execute("AAPL", TradeAction.BUY, 150, StrategyCycleService.LONG_REASON, true);
        }

        @Test
        void heldSymbolsAreNotEnteredAgain() {
            when(broker.getPositions()).thenReturn(Map.of("AAPL", 10L, "TSLA", -5L));

            CycleReport report = cycle.runCycle();

            verify(executor, never()).execute(anyString(), any(), anyDouble(), anyString(), anyBoolean());
            assertThat(report.entriesFilled()).isZero();
        }

        @Test
        void symbolTradedTodayIsSkipped() {
            when(history.isTradedToday("AAPL", TradeAction.BUY)).thenReturn(true);

            cycle.runCycle();

            verify(executor, never()).execute(eq("AAPL"), any(), anyDouble(), anyString(), anyBoolean());
            verify(executor).execute(eq("TSLA"), eq(TradeAction.SELL), anyDouble(), anyString(), anyBoolean());
        }

        @Test
        void symbolInCooldownIsSkipped() {
            ledger.recordBuyFill("AAPL", new BigDecimal("90"));
            clock.advance(Duration.ofDays(3));

            cycle.runCycle();

            verify(executor, never()).execute(eq("AAPL"), any(), anyDouble(), anyString(), anyBoolean());
        }

        @Test
        void priceAboveBudgetSizesToZeroAndIsSkipped() {
            when(prices.getLatestPrice("AAPL")).thenReturn(new BigDecimal("20000"));

            cycle.runCycle();

            verify(executor, never()).execute(eq("AAPL"), any(), anyDouble(), anyString(), anyBoolean());
        }

        @Test
        void unfilledOrderIsNotLogged() {
            when(executor.execute(eq("AAPL"), any(), anyDouble(), anyString(), anyBoolean()))
                    .thenReturn(OrderResult.rejected("AAPL", TradeAction.BUY, 150, "test", "rejected"));

            CycleReport report = cycle.runCycle();

            verify(history, never()).recordTrade(eq("AAPL"), any(), anyInt(), any());
            assertThat(report.entriesFilled()).isEqualTo(1);
        }

        @Test
        void oneFailingSymbolDoesNotStopTheOthers() {
            when(broker.getAccountSummary()).thenReturn(account("200000"));
            when(selector.select(any(), any())).thenReturn(
                    new CandidateSet(List.of("AAPL", "MSFT"), List.of(), List.of()));
            when(prices.getLatestPrice("AAPL")).thenThrow(new DataUnavailableException("AAPL", "no price"));

            cycle.runCycle();

            // 200k * 0.3 * 0.5 / 2 = 15k for MSFT
            verify(executor).execute("MSFT", TradeAction.BUY, 150, StrategyCycleService.LONG_REASON, false);
        }
    }

    @Test
    void restoreRebuildsCooldownsFromRecentTrades() {
        when(history.loadRange(LocalDate.of(2025, 2, 28), LocalDate.of(2025, 3, 10))).thenReturn(List.of(
                TradeRecord.of(LocalDateTime.of(2025, 3, 7, 10, 0), "AAPL", TradeAction.BUY, 10, new BigDecimal("100"))));
        when(broker.getPositions()).thenReturn(Map.of("AAPL", 10L));

        cycle.restoreState();

        assertThat(ledger.canBuyAgain("AAPL")).isFalse();
        assertThat(ledger.stopLossPrice("AAPL")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("95"));
    }

    @Test
    void earliestDatePerSymbolWins() {
        Map<String, LocalDate> dates = StrategyCycleService.earliestDates(List.of(
                event("AAPL", LocalDate.of(2025, 3, 12)),
                event("AAPL", LocalDate.of(2025, 3, 5)),
                event("MSFT", LocalDate.of(2025, 3, 11))));

        assertThat(dates).containsEntry("AAPL", LocalDate.of(2025, 3, 5)).containsEntry("MSFT", LocalDate.of(2025, 3, 11));
    }
}
