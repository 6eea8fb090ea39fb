package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Model.Position;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradeRecord;
import com.mod98.alpaca.earningsbot.MutableClock;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PositionLedgerTest {

    private MutableClock clock;
    private BrokerPort broker;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2025, 3, 10, 10, 0));
        broker = mock(BrokerPort.class);
        ledger = new PositionLedger(broker, new StrategyProperties(), clock);
    }

    @Test
    void cooldownEndsExactlyAfterTenDays() {
        assertThat(ledger.canBuyAgain("AAPL")).isTrue();

        ledger.recordBuyFill("AAPL", new BigDecimal("100"));
        assertThat(ledger.canBuyAgain("AAPL")).isFalse();

        clock.advance(Duration.ofDays(10).minusSeconds(1));
        assertThat(ledger.canBuyAgain("AAPL")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(ledger.canBuyAgain("AAPL")).isTrue();
    }

    @Test
    void buyFillSetsStopLossFivePercentBelowFill() {
        ledger.recordBuyFill("AAPL", new BigDecimal("200"));

        assertThat(ledger.stopLossPrice("AAPL")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("190"));
        assertThat(ledger.checkStopLoss("AAPL", new BigDecimal("190"))).isTrue();
        assertThat(ledger.checkStopLoss("AAPL", new BigDecimal("190.01"))).isFalse();
        assertThat(ledger.checkStopLoss("MSFT", new BigDecimal("1"))).isFalse();
    }

    @Test
    void stopLossNeverRoundsAboveExactLevel() {
        // 100.0001 * 0.95 = 95.000095
        ledger.recordBuyFill("AAPL", new BigDecimal("100.0001"));

        assertThat(ledger.stopLossPrice("AAPL")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("95.0000"));
        assertThat(ledger.checkStopLoss("AAPL", new BigDecimal("95.0001"))).isFalse();
        assertThat(ledger.checkStopLoss("AAPL", new BigDecimal("95.0000"))).isTrue();
    }

    @Test
    void refreshTakesQuantitiesFromBrokerAndKeepsLocalStateOfHeldSymbols() {
        ledger.recordBuyFill("AAPL", new BigDecimal("200"));
        ledger.recordBuyFill("GONE", new BigDecimal("50"));
        ledger.rememberEarningsDate("AAPL", LocalDate.of(2025, 3, 11));
        when(broker.getPositions()).thenReturn(Map.of("AAPL", 10L, "TSLA", -5L));

        ledger.refreshPositions();

        assertThat(ledger.positions()).extracting(Position::symbol).containsExactly("AAPL", "TSLA");
        Position aapl = ledger.positions().get(0);
        assertThat(aapl.quantity()).isEqualTo(10);
        assertThat(aapl.stopLossPrice()).isEqualByComparingTo("190");
        assertThat(aapl.earningsDate()).isEqualTo(LocalDate.of(2025, 3, 11));
        assertThat(ledger.isShort("TSLA")).isTrue();
        assertThat(ledger.stopLossPrice("GONE")).isEmpty();
        // cooldown survives closing the position
        assertThat(ledger.canBuyAgain("GONE")).isFalse();
    }

    @Test
    void refreshNeverInventsPositions() {
        ledger.recordBuyFill("AAPL", new BigDecimal("200"));
        when(broker.getPositions()).thenReturn(Map.of());

        ledger.refreshPositions();

        assertThat(ledger.positions()).isEmpty();
        assertThat(ledger.quantity("AAPL")).isZero();
    }

    @Test
    void refreshFailurePropagates() {
        when(broker.getPositions()).thenThrow(new BrokerUnavailableException("getPositions", "down"));

        assertThatThrownBy(() -> ledger.refreshPositions()).isInstanceOf(BrokerUnavailableException.class);
    }

    @Test
    void restoresCooldownAndStopFromLoggedBuys() {
        List<TradeRecord> records = List.of(
                TradeRecord.of(LocalDateTime.of(2025, 3, 10, 8, 0), "AAPL", TradeAction.BUY, 10, new BigDecimal("100")),
                TradeRecord.of(LocalDateTime.of(2025, 3, 12, 10, 0), "AAPL", TradeAction.BUY, 5, new BigDecimal("120")),
                TradeRecord.of(LocalDateTime.of(2025, 3, 12, 11, 0), "TSLA", TradeAction.SELL, 3, new BigDecimal("300")));

        ledger.restoreFromHistory(records);

        assertThat(ledger.cooldowns()).containsOnlyKeys("AAPL");
        assertThat(ledger.stopLossPrice("AAPL")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("114"));

        clock.set(LocalDateTime.of(2025, 3, 22, 9, 59, 59));
        assertThat(ledger.canBuyAgain("AAPL")).isFalse();
        clock.set(LocalDateTime.of(2025, 3, 22, 10, 0));
        assertThat(ledger.canBuyAgain("AAPL")).isTrue();
    }
}
