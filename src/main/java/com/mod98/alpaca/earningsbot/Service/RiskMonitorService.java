package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Model.Position;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Exit passes over live positions: stop-loss for longs, and closing any position once its holding period
 * after earnings has passed. A failure on one symbol never stops the scan.
 */
@RequiredArgsConstructor
@Service
public class RiskMonitorService {

    private static final Logger log = LoggerFactory.getLogger(RiskMonitorService.class);

    static final String STOP_LOSS = "stop-loss";
    static final String HOLDING_PERIOD_END = "holding period end";

    private final PositionLedger ledger;
    private final PriceService prices;
    private final OrderExecutorService executor;
    private final MarketCalendar calendar;
    private final StrategyProperties props;

    /**
     * Sells long positions trading at or below their stop-loss level. Short positions are not checked.
     *
     * @return number of exit orders that filled at least partially
     */
    public int runStopLossPass() {
        int exits = 0;
        for (Position p : ledger.positions()) {
            if (!p.isLong() || !p.hasStopLoss()) continue;
            try {
                BigDecimal price = prices.getLatestPrice(p.symbol());
                if (ledger.checkStopLoss(p.symbol(), price)) {
                    log.warn("🛑 Stop-loss hit for {}: price {} ≤ stop {}", p.symbol(), price, p.stopLossPrice());
                    if (executor.placeOrder(p.symbol(), TradeAction.SELL, p.absQuantity(), STOP_LOSS, true)) {
                        exits++;
                    }
                }
            } catch (RuntimeException e) {
                log.error("Stop-loss check for {} failed → {}", p.symbol(), e.getMessage());
            }
        }
        return exits;
    }

    /**
     * Closes positions whose earnings date lies at least {@code holdingDays} in the past. The date remembered at
     * entry wins over {@code calendarDates}.
     *
     * @return number of exit orders that filled at least partially
     */
    public int runHoldingPeriodPass(Map<String, LocalDate> calendarDates) {
        LocalDate today = calendar.today();
        int exits = 0;
        for (Position p : ledger.positions()) {
            if (p.quantity() == 0) continue;
            try {
                LocalDate earnings = p.earningsDate() != null ? p.earningsDate() : calendarDates.get(p.symbol());
                if (earnings == null) {
                    log.debug("No earnings date for {}, holding", p.symbol());
                    continue;
                }
                if (today.isBefore(earnings.plusDays(props.getHoldingDays()))) continue;

                TradeAction action = p.isLong() ? TradeAction.SELL : TradeAction.BUY;
                log.info("⏰ Holding period over for {} (earnings {}), closing {} {}",
                        p.symbol(), earnings, action, p.absQuantity());
                if (executor.placeOrder(p.symbol(), action, p.absQuantity(), HOLDING_PERIOD_END, true)) {
                    exits++;
                }
            } catch (RuntimeException e) {
                log.error("Holding-period check for {} failed → {}", p.symbol(), e.getMessage());
            }
        }
        return exits;
    }
}
