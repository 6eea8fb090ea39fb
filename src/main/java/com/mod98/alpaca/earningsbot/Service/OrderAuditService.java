package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Model.OrderEvent;
import com.mod98.alpaca.earningsbot.Model.OrderEvent.EventType;
import com.mod98.alpaca.earningsbot.Model.OrderRequest;
import com.mod98.alpaca.earningsbot.Model.OrderResult;
import com.mod98.alpaca.earningsbot.Model.OrderStatus;
import com.mod98.alpaca.earningsbot.Model.TradeAction;
import com.mod98.alpaca.earningsbot.Repository.OrderEventRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Order audit trail. Persistence failures are logged and never reach the trading path.
 */
@RequiredArgsConstructor
@Service
public class OrderAuditService {

    private static final Logger log = LoggerFactory.getLogger(OrderAuditService.class);

    private final OrderEventRepository repo;
    private final Clock clock;

    public OrderEvent rejected(String symbol, TradeAction action, Integer quantity, String reason, String message) {
        OrderEvent ev = base(symbol, EventType.REJECTED, reason, message);
        ev.setAction(action);
        ev.setQuantity(quantity);
        return save(ev);
    }

    public OrderEvent submitted(OrderRequest request, String orderId, String reason, BigDecimal referencePrice) {
        OrderEvent ev = base(request.symbol(), EventType.SUBMITTED, reason, null);
        ev.setAction(request.action());
        ev.setQuantity(request.quantity());
        ev.setOrderType(request.type());
        ev.setLimitPrice(request.limitPrice());
        ev.setReferencePrice(referencePrice);
        ev.setOrderId(orderId);
        return save(ev);
    }

    public OrderEvent completed(OrderResult result) {
        EventType type;
        if (result.status() == OrderStatus.FILLED) {
            type = EventType.FILLED;
        } else if (result.filledQuantity() > 0) {
            type = EventType.PARTIALLY_FILLED;
        } else {
            type = EventType.NOT_FILLED;
        }
        OrderEvent ev = base(result.symbol(), type, result.reason(), result.message());
        ev.setAction(result.action());
        ev.setQuantity(result.requestedQuantity());
        ev.setOrderType(result.type());
        ev.setReferencePrice(result.referencePrice());
        ev.setStatus(result.status());
        ev.setFilledQuantity(result.filledQuantity());
        ev.setAvgFillPrice(result.avgFillPrice());
        ev.setOrderId(result.orderId());
        return save(ev);
    }

    public OrderEvent error(String symbol, TradeAction action, String reason, String message) {
        OrderEvent ev = base(symbol, EventType.ERROR, reason, message);
        ev.setAction(action);
        return save(ev);
    }

    public List<OrderEvent> latest() {
        return repo.findTop50ByOrderByCreatedAtDesc();
    }

    private OrderEvent base(String symbol, EventType type, String reason, String message) {
        OrderEvent ev = new OrderEvent();
        ev.setSymbol(symbol == null ? "" : truncate(symbol, 20));
        ev.setEventType(type);
        ev.setReason(truncate(reason, 60));
        ev.setMessage(truncate(message, 255));
        ev.setCreatedAt(clock.instant());
        return ev;
    }

    private OrderEvent save(OrderEvent ev) {
        try {
            OrderEvent saved = repo.save(ev);
            log.info("[AUDIT:{}] symbol={} orderId={} msg={}", ev.getEventType(), ev.getSymbol(), ev.getOrderId(), ev.getMessage());
            return saved;
        } catch (Exception e) {
            log.error("[AUDIT:ERROR] Failed to persist order event: {}", e.getMessage(), e);
            return null;
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
