package com.mod98.alpaca.earningsbot.Controller;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import com.mod98.alpaca.earningsbot.Model.CandidateSet;
import com.mod98.alpaca.earningsbot.Model.EarningsEvent;
import com.mod98.alpaca.earningsbot.MutableClock;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import com.mod98.alpaca.earningsbot.Port.MarketDataPort;
import com.mod98.alpaca.earningsbot.Service.MarketCalendar;
import com.mod98.alpaca.earningsbot.Service.OrderAuditService;
import com.mod98.alpaca.earningsbot.Service.PositionLedger;
import com.mod98.alpaca.earningsbot.Service.StrategyCycleService;
import com.mod98.alpaca.earningsbot.Service.StrategyLoopService;
import com.mod98.alpaca.earningsbot.Service.TradeHistoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StrategyControllerTest {

    private BrokerPort broker;
    private MarketDataPort marketData;
    private StrategyLoopService loop;
    private TradeHistoryService history;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at(LocalDateTime.of(2025, 3, 10, 10, 0));
        broker = mock(BrokerPort.class);
        marketData = mock(MarketDataPort.class);
        loop = mock(StrategyLoopService.class);
        history = mock(TradeHistoryService.class);
        StrategyCycleService cycle = mock(StrategyCycleService.class);
        when(cycle.lastSelection()).thenReturn(CandidateSet.empty());
        when(cycle.lastReport()).thenReturn(Optional.empty());
        when(broker.getPositions()).thenReturn(Map.of("AAPL", 10L));
        when(broker.isConnected()).thenReturn(true);

        PositionLedger ledger = new PositionLedger(broker, new StrategyProperties(), clock);
        ledger.refreshPositions();

        StrategyController controller = new StrategyController(cycle, loop, ledger, history,
                mock(OrderAuditService.class), broker, marketData, new MarketCalendar(clock), clock);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler(clock))
                .build();
    }

    @Test
    void statusShowsSessionAndPositions() throws Exception {
        mvc.perform(get("/api/strategy/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session").value("REGULAR"))
                .andExpect(jsonPath("$.brokerConnected").value(true))
                .andExpect(jsonPath("$.positions[0].symbol").value("AAPL"))
                .andExpect(jsonPath("$.positions[0].quantity").value(10));
    }

    @Test
    void runIsQueued() throws Exception {
        mvc.perform(post("/api/strategy/run"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"));

        verify(loop).triggerNow();
    }

    @Test
    void tradesCoverTheRequestedDays() throws Exception {
        when(history.loadRange(any(), any())).thenReturn(List.of());

        mvc.perform(get("/api/strategy/trades").param("days", "3"))
                .andExpect(status().isOk());

        verify(history).loadRange(LocalDate.of(2025, 3, 8), LocalDate.of(2025, 3, 10));
    }

    @Test
    void earningsAreSortedByDate() throws Exception {
        when(marketData.getUpcomingEarnings(any(), any())).thenReturn(List.of(
                new EarningsEvent("ORCL", "Oracle", LocalDateTime.of(2025, 3, 12, 16, 30), null, null,
                        new BigDecimal("400000000000"), null, null),
                new EarningsEvent("DKS", "Dick's", LocalDateTime.of(2025, 3, 11, 8, 0), null, null,
                        null, null, null)));

        mvc.perform(get("/api/strategy/earnings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].symbol").value("DKS"))
                .andExpect(jsonPath("$[1].timing").value("AFTER_CLOSE"));
    }

    @Test
    void brokerOutageMapsTo503() throws Exception {
        when(broker.getAccountSummary()).thenThrow(new BrokerUnavailableException("account", "connection refused"));

        mvc.perform(get("/api/strategy/account"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    void marketDataOutageMapsTo502() throws Exception {
        when(marketData.getUpcomingEarnings(any(), any())).thenThrow(new DataUnavailableException(null, "down"));

        mvc.perform(get("/api/strategy/earnings"))
                .andExpect(status().isBadGateway());
    }
}
