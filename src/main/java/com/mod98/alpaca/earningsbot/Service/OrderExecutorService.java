package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Exception.BrokerUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.DataUnavailableException;
import com.mod98.alpaca.earningsbot.Exception.InvalidOrderException;
import com.mod98.alpaca.earningsbot.Exception.OrderRejectedException;
import com.mod98.alpaca.earningsbot.Model.OrderFill;
import com.mod98.alpaca.earningsbot.Model.OrderHandle;
import com.mod98.alpaca.earningsbot.Model.OrderRequest;
import com.mod98.alpaca.earningsbot.Model.OrderResult;
import com.mod98.alpaca.earningsbot.Model.OrderStatus;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Model.TradingSession;
import com.mod98.alpaca.earningsbot.Port.BrokerPort;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Places one order and waits a bounded time for it to settle. Partial fills count as success.
 */
@RequiredArgsConstructor
@Service
public class OrderExecutorService {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutorService.class);
    private static final Logger tradeLog = LoggerFactory.getLogger("trade");

    private final BrokerPort broker;
    private final PriceService prices;
    private final MarketCalendar calendar;
    private final PositionLedger ledger;
    private final OrderAuditService audit;
    private final StrategyProperties props;

    public boolean placeOrder(String symbol, TradeAction action, double quantity, String reason, boolean useLimitPrice) {
        return execute(symbol, action, quantity, reason, useLimitPrice).success();
    }

    public OrderResult execute(String symbol, TradeAction action, double quantity, String reason, boolean useLimitPrice) {
        int qty;
        try {
            qty = validate(symbol, quantity);
        } catch (InvalidOrderException e) {
            log.error(e.getMessage());
            audit.rejected(symbol, action, null, reason, e.getMessage());
            return OrderResult.rejected(symbol, action, 0, reason, e.getMessage());
        }

        tradeLog.info("Preparing order: {} {} {} (reason: {})", action, qty, symbol, reason);

        // Qualify
        try {
            if (!broker.qualify(symbol)) {
                return reject(symbol, action, qty, reason, "symbol does not qualify at the broker");
            }
        } catch (BrokerUnavailableException e) {
            return reject(symbol, action, qty, reason, "qualification failed: " + e.getMessage());
        }

        // Reference price
        BigDecimal reference;
        try {
            reference = prices.getLatestPrice(symbol);
        } catch (DataUnavailableException e) {
            return reject(symbol, action, qty, reason, e.getMessage());
        }

        TradingSession session = calendar.currentSession();
        OrderRequest request = buildRequest(symbol, action, qty, reference, useLimitPrice, session);
        if (request.limitPrice() != null) {
            tradeLog.info("Using LIMIT order at {} ({})", request.limitPrice(), session.description());
        } else {
            tradeLog.info("Using MARKET order ({})", session.description());
        }

        // Submit
        OrderHandle handle;
        try {
            handle = broker.placeOrder(request);
        } catch (OrderRejectedException e) {
            return reject(symbol, action, qty, reason, e.getMessage());
        } catch (BrokerUnavailableException e) {
            log.error("Order submission for {} failed → {}", symbol, e.getMessage());
            audit.error(symbol, action, reason, e.getMessage());
            return OrderResult.rejected(symbol, action, qty, reason, e.getMessage());
        }
        audit.submitted(request, handle.orderId(), reason, reference);

        OrderFill fill = awaitTerminal(handle);
        boolean abandoned = Thread.currentThread().isInterrupted() && !fill.status().isTerminal();
        if (abandoned) {
            tradeLog.warn("⚠️ Stopped waiting for open order {} ({} {} {}), it may still fill; reconcile at the broker",
                    handle.orderId(), action, qty, symbol);
        }
        tradeLog.info("Order status: {}, filled: {}, remaining: {}, avg fill price: {}",
                fill.status(), fill.filledQuantity(), Math.max(0, qty - fill.filledQuantity()), fill.avgFillPrice());

        boolean success = fill.status() == OrderStatus.FILLED || fill.hasFill();
        String message;
        if (fill.status() == OrderStatus.FILLED) {
            message = "filled";
            tradeLog.info("✅ {} {} order fully filled", symbol, action);
        } else if (fill.hasFill()) {
            message = "partially filled " + fill.filledQuantity() + "/" + qty;
            tradeLog.info("{} {} order partially filled: {}/{}", symbol, action, fill.filledQuantity(), qty);
        } else if (abandoned) {
            message = "interrupted while order " + handle.orderId() + " was open";
        } else {
            message = "not filled (" + fill.status() + ")";
            tradeLog.info("❌ {} {} order not filled", symbol, action);
        }

        OrderResult result = new OrderResult(symbol, action, qty, reason, request.type(), handle.orderId(),
                fill.status(), fill.filledQuantity(), fill.avgFillPrice(), reference, success, message);

        if (action == TradeAction.BUY && fill.hasFill()) {
            ledger.recordBuyFill(symbol, result.executionPrice());
        }
        audit.completed(result);
        return result;
    }

    static int validate(String symbol, double quantity) {
        if (!CandidateSelector.isValidSymbol(symbol)) {
            throw new InvalidOrderException(symbol, "malformed symbol");
        }
        if (Double.isNaN(quantity) || Double.isInfinite(quantity) || quantity <= 0) {
            throw new InvalidOrderException(symbol, "quantity " + quantity);
        }
        int qty = (int) quantity;
        if (qty <= 0) {
            throw new InvalidOrderException(symbol, "quantity " + quantity + " truncates to zero");
        }
        return qty;
    }

    OrderRequest buildRequest(String symbol, TradeAction action, int qty, BigDecimal reference,
                              boolean useLimitPrice, TradingSession session) {
        if (useLimitPrice || session != TradingSession.REGULAR) {
            return OrderRequest.limit(symbol, action, qty, limitPrice(action, reference));
        }
        return OrderRequest.market(symbol, action, qty);
    }

    // Marketable limit: above the reference for buys, below for sells.
    BigDecimal limitPrice(TradeAction action, BigDecimal reference) {
        BigDecimal offset = props.getLimitOffsetPercent();
        BigDecimal factor = action == TradeAction.BUY ? BigDecimal.ONE.add(offset) : BigDecimal.ONE.subtract(offset);
        BigDecimal px = reference.multiply(factor);
        return px.compareTo(BigDecimal.ONE) >= 0
                ? px.setScale(2, RoundingMode.HALF_UP)
                : px.setScale(4, RoundingMode.HALF_UP);
    }

    private OrderFill awaitTerminal(OrderHandle handle) {
        OrderFill last = OrderFill.submitted();
        Duration interval = props.getOrderPollInterval();
        for (int attempt = 0; attempt < props.getOrderPollAttempts(); attempt++) {
            if (!interval.isZero()) {
                try {
                    Thread.sleep(interval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            try {
                last = broker.pollStatus(handle);
            } catch (BrokerUnavailableException e) {
                log.warn("Status poll {} for order {} failed → {}", attempt + 1, handle.orderId(), e.getMessage());
                continue;
            }
            if (last.status().isTerminal()) break;
        }
        return last;
    }

    private OrderResult reject(String symbol, TradeAction action, int qty, String reason, String message) {
        log.error("Order {} {} {} not submitted → {}", action, qty, symbol, message);
        audit.rejected(symbol, action, qty, reason, message);
        return OrderResult.rejected(symbol, action, qty, reason, message);
    }
}
