package com.mod98.alpaca.earningsbot.Controller;

import com.mod98.alpaca.earningsbot.DTO.StrategyStatusDTO;
import com.mod98.alpaca.earningsbot.Model.AccountSummary;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.Model.Execution;
import com.mod98.alpaca.earningsbot.Model.OrderEvent;
import com.mod98.alpaca.earningsbot.Model.TradeRecord;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import com.mod98.alpaca.earningsbot.Service.MarketCalendar;
import com.mod98.alpaca.earningsbot.Service.OrderAuditService;
import com.mod98.alpaca.earningsbot.Service.PositionLedger;
import com.mod98.alpaca.earningsbot.Service.StrategyCycleService;
import com.mod98.alpaca.earningsbot.Service.StrategyLoopService;
import com.mod98.alpaca.earningsbot.Service.TradeHistoryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/strategy")
@Validated
public class StrategyController {

    private final StrategyCycleService cycle;
    private final StrategyLoopService loop;
    private final PositionLedger ledger;
    private final TradeHistoryService history;
    private final OrderAuditService audit;
    private final BrokerPort broker;
    private final MarketDataPort marketData;
    private final MarketCalendar calendar;
    private final Clock clock;

    public StrategyController(StrategyCycleService cycle, StrategyLoopService loop, PositionLedger ledger,
                              TradeHistoryService history, OrderAuditService audit, BrokerPort broker,
                              MarketDataPort marketData, MarketCalendar calendar, Clock clock) {
        this.cycle = cycle;
        this.loop = loop;
        this.ledger = ledger;
        this.history = history;
        this.audit = audit;
        this.broker = broker;
        this.marketData = marketData;
        this.calendar = calendar;
        this.clock = clock;
    }

    // Dashboard: session, positions, cooldowns and the last cycle
    @GetMapping("/status")
    public StrategyStatusDTO status() {
        return new StrategyStatusDTO(
                clock.instant(),
                calendar.currentSession(),
                broker.isConnected(),
                ledger.positions(),
                Map.copyOf(ledger.cooldowns()),
                cycle.lastSelection(),
                cycle.lastReport().orElse(null)
        );
    }

    @GetMapping("/trades")
    public List<TradeRecord> trades(@RequestParam(defaultValue = "3") @Min(1) @Max(90) int days) {
        LocalDate today = calendar.today();
        return history.loadRange(today.minusDays(days - 1L), today);
    }

    @GetMapping("/earnings")
    public List<EarningsEvent> earnings(@RequestParam(defaultValue = "7") @Min(0) @Max(30) int days) {
        LocalDate today = calendar.today();
        return marketData.getUpcomingEarnings(today, today.plusDays(days)).stream()
                .sorted(Comparator.comparing(EarningsEvent::earningsDate).thenComparing(EarningsEvent::symbol))
                .toList();
    }

    @GetMapping("/account")
    public AccountSummary account() {
        return broker.getAccountSummary();
    }

    @GetMapping("/executions")
    public List<Execution> executions() {
        return broker.getExecutions();
    }

    @GetMapping("/orders")
    public List<OrderEvent> orders() {
        return audit.latest();
    }

    // Queued behind any running cycle on the strategy thread
    @PostMapping("/run")
    public ResponseEntity<Map<String, String>> run() {
        loop.triggerNow();
        return ResponseEntity.accepted().body(Map.of("status", "queued"));
    }
}
